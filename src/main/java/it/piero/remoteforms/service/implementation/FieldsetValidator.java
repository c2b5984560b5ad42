package it.piero.remoteforms.service.implementation;

import it.piero.remoteforms.model.Fieldset;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Slf4j
@Component
public class FieldsetValidator {

    public List<Fieldset> validate(List<Fieldset> fieldsets, Set<String> all, Collection<String> exported) {
        if (fieldsets == null || fieldsets.isEmpty()) {
            return List.of();
        }

        Set<String> grouped = new LinkedHashSet<>();
        for (Fieldset fieldset : fieldsets) {
            if (fieldset.getFields() != null) {
                grouped.addAll(fieldset.getFields());
            }
        }

        if (!all.containsAll(grouped)) {
            log.warn("Following fieldset fields are invalid {}", missing(grouped, all));
            return List.of();
        }
        if (!exported.containsAll(grouped)) {
            log.warn("Following fieldset fields are excluded {}", missing(grouped, exported));
            return List.of();
        }
        return List.copyOf(fieldsets);
    }

    private static Set<String> missing(Set<String> grouped, Collection<String> available) {
        Set<String> missing = new LinkedHashSet<>(grouped);
        missing.removeAll(available);
        return missing;
    }
}
