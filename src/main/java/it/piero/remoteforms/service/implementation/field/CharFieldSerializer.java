package it.piero.remoteforms.service.implementation.field;

import it.piero.remoteforms.model.FieldType;
import it.piero.remoteforms.model.FormField;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

@Component
public class CharFieldSerializer extends AbstractFieldSerializer {

    public CharFieldSerializer(WidgetSerializer widgetSerializer) {
        super(widgetSerializer);
    }

    @Override
    public Set<FieldType> supportedTypes() {
        return EnumSet.of(FieldType.CHAR, FieldType.EMAIL, FieldType.URL, FieldType.SLUG,
                FieldType.IP_ADDRESS, FieldType.REGEX);
    }

    @Override
    protected void describe(FormField field, Map<String, Object> dict) {
        dict.put("max_length", field.getMaxLength());
        dict.put("min_length", field.getMinLength());

        if (field.getType() == FieldType.REGEX) {
            if (field.getRegex() == null) {
                throw new IllegalStateException("regex field declares no pattern");
            }
            dict.put("regex", field.getRegex());
        }
    }
}
