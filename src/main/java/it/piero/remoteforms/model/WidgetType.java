package it.piero.remoteforms.model;

import lombok.Getter;

@Getter
public enum WidgetType {

    TEXT_INPUT("TextInput", "text"),
    EMAIL_INPUT("EmailInput", "email"),
    URL_INPUT("URLInput", "url"),
    NUMBER_INPUT("NumberInput", "number"),
    PASSWORD_INPUT("PasswordInput", "password"),
    HIDDEN_INPUT("HiddenInput", "hidden"),
    DATE_INPUT("DateInput", "text"),
    TIME_INPUT("TimeInput", "text"),
    DATE_TIME_INPUT("DateTimeInput", "text"),
    CHECKBOX_INPUT("CheckboxInput", "checkbox"),
    FILE_INPUT("FileInput", "file"),
    CLEARABLE_FILE_INPUT("ClearableFileInput", "file"),
    TEXTAREA("Textarea", null),
    SELECT("Select", null),
    NULL_BOOLEAN_SELECT("NullBooleanSelect", null),
    SELECT_MULTIPLE("SelectMultiple", null),
    RADIO_SELECT("RadioSelect", null),
    CHECKBOX_SELECT_MULTIPLE("CheckboxSelectMultiple", null);

    private final String title;

    private final String inputType;

    WidgetType(String title, String inputType) {
        this.title = title;
        this.inputType = inputType;
    }

    public boolean isInput() {
        return inputType != null;
    }

    public boolean isSelect() {
        return this == SELECT || this == NULL_BOOLEAN_SELECT || this == SELECT_MULTIPLE
                || this == RADIO_SELECT || this == CHECKBOX_SELECT_MULTIPLE;
    }

    public boolean allowsMultipleSelected() {
        return this == SELECT_MULTIPLE || this == CHECKBOX_SELECT_MULTIPLE;
    }

    public boolean isHidden() {
        return this == HIDDEN_INPUT;
    }

    public boolean needsMultipartForm() {
        return this == FILE_INPUT || this == CLEARABLE_FILE_INPUT;
    }
}
