package it.piero.remoteforms.model.layout;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@ToString
@EqualsAndHashCode
public class RawLayoutNode implements LayoutObject {

    private final Map<String, Object> entries;

    public RawLayoutNode(Map<String, Object> entries) {
        this.entries = new LinkedHashMap<>(entries);
    }

    @Override
    public String getTypeName() {
        return "dict";
    }
}
