package it.piero.remoteforms.service.implementation.field;

import it.piero.remoteforms.model.FieldType;
import it.piero.remoteforms.model.FormField;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

@Component
public class NumberFieldSerializer extends AbstractFieldSerializer {

    public NumberFieldSerializer(WidgetSerializer widgetSerializer) {
        super(widgetSerializer);
    }

    @Override
    public Set<FieldType> supportedTypes() {
        return EnumSet.of(FieldType.INTEGER, FieldType.FLOAT, FieldType.DECIMAL);
    }

    @Override
    protected void describe(FormField field, Map<String, Object> dict) {
        dict.put("max_value", field.getMaxValue());
        dict.put("min_value", field.getMinValue());

        if (field.getType() == FieldType.DECIMAL) {
            dict.put("max_digits", field.getMaxDigits());
            dict.put("decimal_places", field.getDecimalPlaces());
        }
    }
}
