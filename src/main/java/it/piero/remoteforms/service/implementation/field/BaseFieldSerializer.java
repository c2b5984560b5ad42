package it.piero.remoteforms.service.implementation.field;

import it.piero.remoteforms.model.FieldType;
import it.piero.remoteforms.model.FormField;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

@Component
public class BaseFieldSerializer extends AbstractFieldSerializer {

    public BaseFieldSerializer(WidgetSerializer widgetSerializer) {
        super(widgetSerializer);
    }

    @Override
    public Set<FieldType> supportedTypes() {
        return EnumSet.of(FieldType.BOOLEAN, FieldType.NULL_BOOLEAN, FieldType.GENERIC);
    }

    @Override
    protected void describe(FormField field, Map<String, Object> dict) {
    }
}
