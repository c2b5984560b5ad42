package it.piero.remoteforms.model;

import java.util.List;
import java.util.Set;

public record FieldSelection(Set<String> exclude,
                             Set<String> include,
                             Set<String> readonly,
                             List<String> ordering,
                             List<String> fields) {

    public FieldSelection {
        exclude = Set.copyOf(exclude);
        include = Set.copyOf(include);
        readonly = Set.copyOf(readonly);
        ordering = List.copyOf(ordering);
        fields = List.copyOf(fields);
    }
}
