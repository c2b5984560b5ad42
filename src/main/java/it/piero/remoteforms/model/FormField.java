package it.piero.remoteforms.model;

import lombok.*;

import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class FormField {

    private FieldType type;

    private String typeName;

    private CharSequence label;
    private CharSequence helpText;

    @Builder.Default
    private boolean required = true;

    // may be a Supplier, evaluated at export
    private Object initial;

    @Singular
    private Map<String, CharSequence> errorMessages;

    @Singular
    private List<CharSequence> errors;

    private Widget widget;

    private Integer maxLength;
    private Integer minLength;
    private Number maxValue;
    private Number minValue;
    private Integer maxDigits;
    private Integer decimalPlaces;
    private String regex;

    @Singular
    private List<Choice> choices;

    @Singular
    private List<String> inputFormats;

    private Object emptyValue;
    private Boolean allowEmptyFile;
    private boolean localize;

    public String getTitle() {
        if (typeName != null && !typeName.isBlank()) return typeName;
        return type == null ? FieldType.GENERIC.getTitle() : type.getTitle();
    }

    public Widget getEffectiveWidget() {
        if (widget != null) return widget;
        return Widget.of(type == null ? FieldType.GENERIC.getDefaultWidget() : type.getDefaultWidget());
    }
}
