package it.piero.remoteforms.utils;

import it.piero.remoteforms.exception.LayoutConfigurationException;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.LinkedHashMap;
import java.util.Map;

public final class FlatAttributesParser {

    private FlatAttributesParser() {}

    public static Map<String, Object> parse(String flatAttrs) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        if (flatAttrs == null || flatAttrs.isBlank()) {
            return attrs;
        }

        Element element;
        try {
            DocumentBuilder builder = newFactory().newDocumentBuilder();
            builder.setErrorHandler(new DefaultHandler());
            element = builder.parse(new InputSource(new StringReader("<element " + flatAttrs + " />")))
                    .getDocumentElement();
        } catch (SAXException | IOException | ParserConfigurationException e) {
            throw new LayoutConfigurationException("Malformed layout attributes: " + flatAttrs, e);
        }

        NamedNodeMap nodes = element.getAttributes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            attrs.put(node.getNodeName(), node.getNodeValue());
        }
        return attrs;
    }

    // factories are not thread safe, one per parse
    private static DocumentBuilderFactory newFactory() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setExpandEntityReferences(false);
        return factory;
    }
}
