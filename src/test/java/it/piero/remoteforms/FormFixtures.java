package it.piero.remoteforms;

import it.piero.remoteforms.model.Choice;
import it.piero.remoteforms.model.FieldType;
import it.piero.remoteforms.model.Form;
import it.piero.remoteforms.model.FormField;
import it.piero.remoteforms.service.implementation.FieldSerializerRegistry;
import it.piero.remoteforms.service.implementation.field.BaseFieldSerializer;
import it.piero.remoteforms.service.implementation.field.CharFieldSerializer;
import it.piero.remoteforms.service.implementation.field.ChoiceFieldSerializer;
import it.piero.remoteforms.service.implementation.field.FileFieldSerializer;
import it.piero.remoteforms.service.implementation.field.NumberFieldSerializer;
import it.piero.remoteforms.service.implementation.field.TemporalFieldSerializer;
import it.piero.remoteforms.service.implementation.field.WidgetSerializer;

import java.util.List;

public final class FormFixtures {

    private FormFixtures() {}

    public static TemporalFieldSerializer temporalSerializer() {
        return new TemporalFieldSerializer(new WidgetSerializer(),
                List.of("yyyy-MM-dd", "MM/dd/yyyy"),
                List.of("HH:mm:ss", "HH:mm"),
                List.of("yyyy-MM-dd HH:mm:ss", "yyyy-MM-dd HH:mm"));
    }

    public static FieldSerializerRegistry registry() {
        WidgetSerializer widgets = new WidgetSerializer();
        return new FieldSerializerRegistry(List.of(
                new BaseFieldSerializer(widgets),
                new CharFieldSerializer(widgets),
                new NumberFieldSerializer(widgets),
                new ChoiceFieldSerializer(widgets),
                new FileFieldSerializer(widgets),
                temporalSerializer()));
    }

    public static FormField name() {
        return FormField.builder()
                .type(FieldType.CHAR)
                .label("Name")
                .maxLength(100)
                .initial("Ada")
                .build();
    }

    public static FormField age() {
        return FormField.builder()
                .type(FieldType.INTEGER)
                .label("Age")
                .required(false)
                .minValue(0)
                .initial(36)
                .build();
    }

    public static FormField country() {
        return FormField.builder()
                .type(FieldType.CHOICE)
                .label("Country")
                .choice(Choice.of("it", "Italy"))
                .choice(Choice.of("fr", "France"))
                .build();
    }

    /** Fields {@code name} and {@code age}, in this order. */
    public static Form person() {
        return Form.builder()
                .title("PersonForm")
                .field("name", name())
                .field("age", age())
                .build();
    }

    /** Fields {@code name}, {@code age} and {@code country}, in this order. */
    public static Form profile() {
        return Form.builder()
                .title("ProfileForm")
                .field("name", name())
                .field("age", age())
                .field("country", country())
                .build();
    }
}
