package it.piero.remoteforms.model.layout;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Getter
@ToString
@EqualsAndHashCode
public class LayoutField implements LayoutObject {

    private final List<String> fields;
    private final Map<String, Object> attrs = new LinkedHashMap<>();

    public LayoutField(String... fields) {
        this.fields = List.of(fields);
    }

    public static LayoutField of(String field) {
        return new LayoutField(field);
    }

    public LayoutField attr(String key, Object value) {
        attrs.put(key, value);
        return this;
    }

    @Override
    public String getTypeName() {
        return "Field";
    }
}
