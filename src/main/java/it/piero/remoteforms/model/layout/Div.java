package it.piero.remoteforms.model.layout;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

// flatAttrs holds html attributes, e.g. id="main" data-step="1"
@Getter
@ToString
@EqualsAndHashCode
public class Div implements LayoutContainer {

    private final List<LayoutObject> fields;
    private String cssClass;
    private String flatAttrs = "";

    public Div(LayoutObject... fields) {
        this.fields = List.of(fields);
    }

    public Div cssClass(String cssClass) {
        this.cssClass = cssClass;
        return this;
    }

    public Div flatAttrs(String flatAttrs) {
        this.flatAttrs = flatAttrs == null ? "" : flatAttrs;
        return this;
    }
}
