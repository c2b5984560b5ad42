package it.piero.remoteforms.service.implementation.field;

import it.piero.remoteforms.model.FieldType;
import it.piero.remoteforms.model.FormField;
import lombok.extern.slf4j.Slf4j;

import java.time.DateTimeException;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
public class TemporalFieldSerializer extends AbstractFieldSerializer {

    private final List<String> dateInputFormats;
    private final List<String> timeInputFormats;
    private final List<String> dateTimeInputFormats;

    public TemporalFieldSerializer(WidgetSerializer widgetSerializer,
                                   List<String> dateInputFormats,
                                   List<String> timeInputFormats,
                                   List<String> dateTimeInputFormats) {
        super(widgetSerializer);
        this.dateInputFormats = List.copyOf(dateInputFormats);
        this.timeInputFormats = List.copyOf(timeInputFormats);
        this.dateTimeInputFormats = List.copyOf(dateTimeInputFormats);
    }

    @Override
    public Set<FieldType> supportedTypes() {
        return EnumSet.of(FieldType.DATE, FieldType.TIME, FieldType.DATE_TIME);
    }

    @Override
    protected void describe(FormField field, Map<String, Object> dict) {
        List<String> formats = field.getInputFormats() == null || field.getInputFormats().isEmpty()
                ? defaultFormats(field.getType())
                : List.copyOf(field.getInputFormats());
        dict.put("input_formats", formats);

        Object initial = dict.get("initial");
        if (initial instanceof TemporalAccessor temporal) {
            String formatted = format(temporal, formats);
            if (formatted != null) {
                dict.put("initial", formatted);
            }
        }
    }

    // first format the value can fill, null when none fits
    private static String format(TemporalAccessor temporal, List<String> formats) {
        for (String pattern : formats) {
            try {
                return DateTimeFormatter.ofPattern(pattern).format(temporal);
            } catch (DateTimeException | IllegalArgumentException e) {
                log.debug("Initial {} does not fit input format {}: {}", temporal, pattern, e.getMessage());
            }
        }
        return null;
    }

    private List<String> defaultFormats(FieldType type) {
        switch (type) {
            case DATE:
                return dateInputFormats;
            case TIME:
                return timeInputFormats;
            default:
                return dateTimeInputFormats;
        }
    }
}
