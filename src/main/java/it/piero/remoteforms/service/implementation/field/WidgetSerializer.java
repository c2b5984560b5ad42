package it.piero.remoteforms.service.implementation.field;

import it.piero.remoteforms.model.Choice;
import it.piero.remoteforms.model.FormField;
import it.piero.remoteforms.model.Widget;
import it.piero.remoteforms.model.WidgetType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class WidgetSerializer {

    public Map<String, Object> serialize(Widget widget, FormField field) {
        WidgetType type = widget.getType();
        if (type == null) {
            throw new IllegalArgumentException("widget has no type");
        }

        Map<String, Object> dict = new LinkedHashMap<>();
        dict.put("title", type.getTitle());
        dict.put("is_hidden", type.isHidden());
        dict.put("needs_multipart_form", type.needsMultipartForm());
        dict.put("is_localized", widget.isLocalized() || field.isLocalize());
        dict.put("is_required", widget.isRequired() || field.isRequired());
        dict.put("attrs", widget.getAttrs() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(widget.getAttrs()));

        if (type.isInput()) {
            dict.put("input_type", type.getInputType());
        }
        if (type.isSelect()) {
            List<Choice> choices = widget.getChoices() == null || widget.getChoices().isEmpty()
                    ? field.getChoices()
                    : widget.getChoices();
            dict.put("choices", toMaps(choices));
            dict.put("allow_multiple_selected", type.allowsMultipleSelected());
        }
        return dict;
    }

    static List<Map<String, Object>> toMaps(List<Choice> choices) {
        List<Map<String, Object>> out = new ArrayList<>();
        if (choices != null) {
            choices.forEach(choice -> out.add(choice.toMap()));
        }
        return out;
    }
}
