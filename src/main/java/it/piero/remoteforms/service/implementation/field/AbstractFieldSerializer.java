package it.piero.remoteforms.service.implementation.field;

import it.piero.remoteforms.model.FormField;
import it.piero.remoteforms.service.definition.FieldSerializer;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

@Slf4j
public abstract class AbstractFieldSerializer implements FieldSerializer {

    private final WidgetSerializer widgetSerializer;

    protected AbstractFieldSerializer(WidgetSerializer widgetSerializer) {
        this.widgetSerializer = widgetSerializer;
    }

    @Override
    public Map<String, Object> serialize(FormField field, Object initialOverride, String fieldName) {
        Map<String, Object> dict = new LinkedHashMap<>();
        dict.put("title", field.getTitle());
        dict.put("required", field.isRequired());
        dict.put("label", field.getLabel());
        dict.put("initial", initialValue(field, initialOverride));
        dict.put("help_text", field.getHelpText() == null ? "" : field.getHelpText());
        dict.put("error_messages", field.getErrorMessages() == null
                ? new LinkedHashMap<>()
                : new LinkedHashMap<>(field.getErrorMessages()));
        dict.put("errors", field.getErrors() == null ? List.of() : List.copyOf(field.getErrors()));
        dict.put("widget", widget(field, fieldName));

        describe(field, dict);
        return dict;
    }

    protected abstract void describe(FormField field, Map<String, Object> dict);

    private Object initialValue(FormField field, Object initialOverride) {
        Object initial = initialOverride != null ? initialOverride : field.getInitial();
        if (initial instanceof Supplier<?> supplier) {
            return supplier.get();
        }
        return initial;
    }

    private Map<String, Object> widget(FormField field, String fieldName) {
        try {
            return widgetSerializer.serialize(field.getEffectiveWidget(), field);
        } catch (RuntimeException e) {
            log.warn("Error serializing widget of field {}: {}", fieldName, e.getMessage());
            return new LinkedHashMap<>();
        }
    }
}
