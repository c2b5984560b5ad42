package it.piero.remoteforms.service.implementation;

import it.piero.remoteforms.model.Fieldset;
import it.piero.remoteforms.model.Form;
import it.piero.remoteforms.model.FormField;
import it.piero.remoteforms.model.RemoteForm;
import it.piero.remoteforms.utils.TextResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class FormSerializer {

    private final FieldSerializerRegistry registry;
    private final ObjectProvider<LayoutParser> layoutParser;
    private final TextResolver textResolver;
    private final String defaultLabelSuffix;

    public FormSerializer(FieldSerializerRegistry registry,
                          ObjectProvider<LayoutParser> layoutParser,
                          TextResolver textResolver,
                          @Value("${remoteforms.default-label-suffix::}") String defaultLabelSuffix) {
        this.registry = registry;
        this.layoutParser = layoutParser;
        this.textResolver = textResolver;
        this.defaultLabelSuffix = defaultLabelSuffix;
    }

    public Map<String, Object> serialize(RemoteForm remoteForm) {
        Form form = remoteForm.getForm();

        Map<String, Object> formDict = new LinkedHashMap<>();
        formDict.put("title", form.getTitle());
        formDict.put("non_field_errors", form.getNonFieldErrors() == null
                ? new ArrayList<>()
                : new ArrayList<>(form.getNonFieldErrors()));
        formDict.put("label_suffix", form.getLabelSuffix() == null ? defaultLabelSuffix : form.getLabelSuffix());
        formDict.put("is_bound", form.isBound());
        formDict.put("prefix", form.getPrefix());
        Map<String, Object> fields = new LinkedHashMap<>();
        formDict.put("fields", fields);
        formDict.put("errors", form.getErrors());
        formDict.put("fieldsets", fieldsets(remoteForm.getFieldsets()));
        formDict.put("ordered_fields", new ArrayList<>(remoteForm.getFields()));

        if (form.getLayout() != null) {
            LayoutParser parser = layoutParser.getIfAvailable();
            if (parser != null) {
                formDict.put("layout", parser.parse(form.getLayout()));
            } else {
                log.debug("layouts disabled, skipping layout of form {}", form.getTitle());
            }
        }

        Map<String, Object> initialData = new LinkedHashMap<>();
        Map<String, Object> formInitial = form.getInitial() == null ? Map.of() : form.getInitial();

        for (String name : remoteForm.getFields()) {
            FormField field = form.getFields().get(name);
            Map<String, Object> fieldDict = registry.serialize(name, field, formInitial.get(name));

            if (remoteForm.isReadonly(name)) {
                fieldDict.put("readonly", true);
            }
            fieldDict.putIfAbsent("initial", null);

            fields.put(name, fieldDict);
            initialData.put(name, fieldDict.get("initial"));
        }

        formDict.put("data", form.isBound() ? form.getData() : initialData);

        return textResolver.resolveMap(formDict);
    }

    private static List<Object> fieldsets(List<Fieldset> fieldsets) {
        List<Object> pairs = new ArrayList<>(fieldsets.size());
        for (Fieldset fieldset : fieldsets) {
            pairs.add(fieldset.toPair());
        }
        return pairs;
    }
}
