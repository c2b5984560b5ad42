package it.piero.remoteforms.service.implementation;

import it.piero.remoteforms.model.ExportOptions;
import it.piero.remoteforms.model.FieldSelection;
import it.piero.remoteforms.model.Form;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Works out which fields of a form are exported and in which order.
 * A valid include does not remove the fields it leaves out.
 */
@Slf4j
@Component
public class FieldSelector {

    public FieldSelection select(Form form, ExportOptions options) {
        Set<String> all = form.getFields() == null
                ? new LinkedHashSet<>()
                : new LinkedHashSet<>(form.getFields().keySet());

        Set<String> exclude = copy(options.getExclude());
        Set<String> include = copy(options.getInclude());
        Set<String> readonly = copy(options.getReadonly());
        List<String> ordering = options.getOrdering() == null
                ? new ArrayList<>()
                : new ArrayList<>(options.getOrdering());

        if (include.isEmpty() && form.getMetaFields() != null) {
            include.addAll(form.getMetaFields());
        }
        if (exclude.isEmpty() && form.getMetaExclude() != null) {
            exclude.addAll(form.getMetaExclude());
        }

        exclude = known("Excluded", exclude, all);
        include = known("Included", include, all);
        readonly = known("Readonly", readonly, all);
        if (!ordering.isEmpty() && !all.containsAll(ordering)) {
            log.warn("Ordered fields {} are not present in form fields", unknown(ordering, all));
            ordering = new ArrayList<>();
        }

        if (!include.isEmpty() && !exclude.isEmpty()) {
            Set<String> common = new LinkedHashSet<>(include);
            common.retainAll(exclude);
            log.warn("Both included {} and excluded {} fields given (common: {}), ignoring both",
                    include, exclude, common);
            include = new LinkedHashSet<>();
            exclude = new LinkedHashSet<>();
        }

        exclude.addAll(unknown(include, all));

        List<String> order = ordering.isEmpty() ? form.getFieldOrder() : ordering;
        Set<String> fields = new LinkedHashSet<>();
        for (String name : order) {
            if (all.contains(name) && !exclude.contains(name)) {
                fields.add(name);
            }
        }

        log.debug("form {} exports fields {}", form.getTitle(), fields);
        return new FieldSelection(exclude, include, readonly, ordering, new ArrayList<>(fields));
    }

    private static Set<String> known(String directive, Set<String> names, Set<String> all) {
        if (names.isEmpty() || all.containsAll(names)) {
            return names;
        }
        log.warn("{} fields {} are not present in form fields", directive, unknown(names, all));
        return new LinkedHashSet<>();
    }

    private static Set<String> unknown(Collection<String> names, Set<String> all) {
        Set<String> unknown = new LinkedHashSet<>(names);
        unknown.removeAll(all);
        return unknown;
    }

    private static Set<String> copy(Collection<String> names) {
        return names == null ? new LinkedHashSet<>() : new LinkedHashSet<>(names);
    }
}
