package it.piero.remoteforms.service.implementation.field;

import it.piero.remoteforms.model.FieldType;
import it.piero.remoteforms.model.FormField;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

@Component
public class ChoiceFieldSerializer extends AbstractFieldSerializer {

    private static final Set<FieldType> TYPED = EnumSet.of(FieldType.TYPED_CHOICE, FieldType.TYPED_MULTIPLE_CHOICE);

    public ChoiceFieldSerializer(WidgetSerializer widgetSerializer) {
        super(widgetSerializer);
    }

    @Override
    public Set<FieldType> supportedTypes() {
        return EnumSet.of(FieldType.CHOICE, FieldType.TYPED_CHOICE, FieldType.MULTIPLE_CHOICE,
                FieldType.TYPED_MULTIPLE_CHOICE, FieldType.MODEL_CHOICE, FieldType.MODEL_MULTIPLE_CHOICE);
    }

    @Override
    protected void describe(FormField field, Map<String, Object> dict) {
        dict.put("choices", WidgetSerializer.toMaps(field.getChoices()));

        if (TYPED.contains(field.getType())) {
            dict.put("empty_value", field.getEmptyValue());
        }
    }
}
