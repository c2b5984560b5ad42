package it.piero.remoteforms.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Set;

@Getter
@ToString
public final class RemoteForm {

    private final Form form;
    private final Set<String> exclude;
    private final Set<String> include;
    private final Set<String> readonly;
    private final List<String> ordering;
    private final List<String> fields;
    private final List<Fieldset> fieldsets;

    @Builder
    private RemoteForm(Form form, Set<String> exclude, Set<String> include, Set<String> readonly,
                       List<String> ordering, List<String> fields, List<Fieldset> fieldsets) {
        this.form = form;
        this.exclude = exclude == null ? Set.of() : Set.copyOf(exclude);
        this.include = include == null ? Set.of() : Set.copyOf(include);
        this.readonly = readonly == null ? Set.of() : Set.copyOf(readonly);
        this.ordering = ordering == null ? List.of() : List.copyOf(ordering);
        this.fields = fields == null ? List.of() : List.copyOf(fields);
        this.fieldsets = fieldsets == null ? List.of() : List.copyOf(fieldsets);
    }

    public boolean isReadonly(String fieldName) {
        return readonly.contains(fieldName);
    }
}
