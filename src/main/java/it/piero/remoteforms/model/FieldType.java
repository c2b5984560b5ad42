package it.piero.remoteforms.model;

import lombok.Getter;

@Getter
public enum FieldType {

    CHAR("CharField", WidgetType.TEXT_INPUT),
    EMAIL("EmailField", WidgetType.EMAIL_INPUT),
    URL("URLField", WidgetType.URL_INPUT),
    SLUG("SlugField", WidgetType.TEXT_INPUT),
    IP_ADDRESS("GenericIPAddressField", WidgetType.TEXT_INPUT),
    REGEX("RegexField", WidgetType.TEXT_INPUT),
    INTEGER("IntegerField", WidgetType.NUMBER_INPUT),
    FLOAT("FloatField", WidgetType.NUMBER_INPUT),
    DECIMAL("DecimalField", WidgetType.NUMBER_INPUT),
    BOOLEAN("BooleanField", WidgetType.CHECKBOX_INPUT),
    NULL_BOOLEAN("NullBooleanField", WidgetType.NULL_BOOLEAN_SELECT),
    DATE("DateField", WidgetType.DATE_INPUT),
    TIME("TimeField", WidgetType.TIME_INPUT),
    DATE_TIME("DateTimeField", WidgetType.DATE_TIME_INPUT),
    CHOICE("ChoiceField", WidgetType.SELECT),
    TYPED_CHOICE("TypedChoiceField", WidgetType.SELECT),
    MULTIPLE_CHOICE("MultipleChoiceField", WidgetType.SELECT_MULTIPLE),
    TYPED_MULTIPLE_CHOICE("TypedMultipleChoiceField", WidgetType.SELECT_MULTIPLE),
    MODEL_CHOICE("ModelChoiceField", WidgetType.SELECT),
    MODEL_MULTIPLE_CHOICE("ModelMultipleChoiceField", WidgetType.SELECT_MULTIPLE),
    FILE("FileField", WidgetType.CLEARABLE_FILE_INPUT),
    IMAGE("ImageField", WidgetType.CLEARABLE_FILE_INPUT),
    GENERIC("Field", WidgetType.TEXT_INPUT),

    // application defined, no built-in serializer
    CUSTOM("CustomField", WidgetType.TEXT_INPUT);

    private final String title;
    private final WidgetType defaultWidget;

    FieldType(String title, WidgetType defaultWidget) {
        this.title = title;
        this.defaultWidget = defaultWidget;
    }
}
