package it.piero.remoteforms.service.implementation.field;

import it.piero.remoteforms.model.FieldType;
import it.piero.remoteforms.model.FormField;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

@Component
public class FileFieldSerializer extends AbstractFieldSerializer {

    public FileFieldSerializer(WidgetSerializer widgetSerializer) {
        super(widgetSerializer);
    }

    @Override
    public Set<FieldType> supportedTypes() {
        return EnumSet.of(FieldType.FILE, FieldType.IMAGE);
    }

    @Override
    protected void describe(FormField field, Map<String, Object> dict) {
        dict.put("max_length", field.getMaxLength());
        dict.put("allow_empty_file", Boolean.TRUE.equals(field.getAllowEmptyFile()));
    }
}
