package it.piero.remoteforms.service.implementation;

import it.piero.remoteforms.exception.LayoutConfigurationException;
import it.piero.remoteforms.model.layout.Div;
import it.piero.remoteforms.model.layout.Layout;
import it.piero.remoteforms.model.layout.LayoutContainer;
import it.piero.remoteforms.model.layout.LayoutField;
import it.piero.remoteforms.model.layout.LayoutObject;
import it.piero.remoteforms.model.layout.RawLayoutNode;
import it.piero.remoteforms.utils.FlatAttributesParser;
import it.piero.remoteforms.utils.SlugUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class LayoutParser {

    public static final String TYPE = "type";
    public static final String ATTRS = "attrs";
    public static final String CHILDREN = "children";
    public static final String FIELD_TYPE = "field";

    public Map<String, Object> parse(LayoutObject item) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put(CHILDREN, new ArrayList<>());
        node.putAll(parseLayoutClass(item));

        if (item instanceof LayoutContainer container && !FIELD_TYPE.equals(node.get(TYPE))) {
            List<Object> children = new ArrayList<>();
            for (LayoutObject child : container.getFields()) {
                children.add(parse(child));
            }
            node.put(CHILDREN, children);
        }
        return node;
    }

    public Map<String, Object> parseFlatAttributes(String flatAttrs) {
        return FlatAttributesParser.parse(flatAttrs);
    }

    private Map<String, Object> parseLayoutClass(LayoutObject item) {
        if (item == null) {
            throw new LayoutConfigurationException("Unknown layout object: null");
        }

        Map<String, Object> res = new LinkedHashMap<>();
        res.put(TYPE, SlugUtils.slugify(item.getTypeName()));

        Map<?, ?> attrs;
        if (item instanceof Div div) {
            Map<String, Object> divAttrs = parseFlatAttributes(div.getFlatAttrs());
            divAttrs.put("class", div.getCssClass());
            attrs = divAttrs;

        } else if (item instanceof LayoutField field) {
            if (field.getFields().size() != 1) {
                throw new LayoutConfigurationException(
                        "Layout field must reference exactly one field, got " + field.getFields());
            }
            res.put("name", field.getFields().get(0));
            attrs = field.getAttrs();

        } else if (item instanceof RawLayoutNode raw) {
            res.putAll(raw.getEntries());
            Object rawAttrs = res.get(ATTRS);
            if (rawAttrs != null && !(rawAttrs instanceof Map)) {
                throw new LayoutConfigurationException("Layout node attrs must be a mapping: " + raw);
            }
            attrs = rawAttrs == null ? Map.of() : (Map<?, ?>) rawAttrs;

        } else if (item instanceof Layout) {
            attrs = Map.of();

        } else {
            throw new LayoutConfigurationException(
                    "Unknown layout object " + item.getClass().getSimpleName() + ": " + item);
        }

        res.put(ATTRS, normalizeKeys(attrs));
        return res;
    }

    private static Map<String, Object> normalizeKeys(Map<?, ?> attrs) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        attrs.forEach((key, value) -> normalized.put(String.valueOf(key).replace('-', '_'), value));
        return normalized;
    }
}
