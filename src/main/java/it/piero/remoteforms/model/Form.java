package it.piero.remoteforms.model;

import it.piero.remoteforms.model.layout.Layout;
import lombok.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Form {

    public static final String NON_FIELD_ERRORS = "__all__";

    private String title;

    @Singular
    private Map<String, FormField> fields;

    private List<String> keyOrder;

    private String labelSuffix;
    private String prefix;

    @Singular
    private List<CharSequence> nonFieldErrors;

    /** Submitted data, {@code null} for an unbound form. */
    private Map<String, Object> data;

    @Singular("initialValue")
    private Map<String, Object> initial;

    @Singular
    private List<Fieldset> fieldsets;

    private Layout layout;

    private List<String> metaFields;

    private List<String> metaExclude;

    public boolean isBound() {
        return data != null;
    }

    public List<String> getFieldOrder() {
        if (keyOrder != null && !keyOrder.isEmpty()) {
            return List.copyOf(keyOrder);
        }
        return fields == null ? List.of() : new ArrayList<>(fields.keySet());
    }

    public Map<String, List<CharSequence>> getErrors() {
        Map<String, List<CharSequence>> errors = new LinkedHashMap<>();
        if (fields != null) {
            fields.forEach((name, field) -> {
                if (field.getErrors() != null && !field.getErrors().isEmpty()) {
                    errors.put(name, List.copyOf(field.getErrors()));
                }
            });
        }
        if (nonFieldErrors != null && !nonFieldErrors.isEmpty()) {
            errors.put(NON_FIELD_ERRORS, List.copyOf(nonFieldErrors));
        }
        return errors;
    }
}
