package it.piero.remoteforms.model;

import lombok.*;

import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Widget {

    private WidgetType type;

    @Singular
    private Map<String, Object> attrs;

    // empty means the field's own choices
    @Singular
    private List<Choice> choices;

    private boolean localized;
    private boolean required;

    public static Widget of(WidgetType type) {
        return Widget.builder().type(type).build();
    }
}
