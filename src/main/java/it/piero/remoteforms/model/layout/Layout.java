package it.piero.remoteforms.model.layout;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Getter
@ToString
@EqualsAndHashCode
public class Layout implements LayoutContainer {

    private final List<LayoutObject> fields;

    public Layout(LayoutObject... fields) {
        this.fields = List.of(fields);
    }
}
