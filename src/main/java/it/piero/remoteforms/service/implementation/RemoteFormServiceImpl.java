package it.piero.remoteforms.service.implementation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.piero.remoteforms.exception.FormExportException;
import it.piero.remoteforms.model.ExportOptions;
import it.piero.remoteforms.model.FieldSelection;
import it.piero.remoteforms.model.Fieldset;
import it.piero.remoteforms.model.Form;
import it.piero.remoteforms.model.RemoteForm;
import it.piero.remoteforms.service.definition.RemoteFormService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class RemoteFormServiceImpl implements RemoteFormService {

    private final FieldSelector fieldSelector;
    private final FieldsetValidator fieldsetValidator;
    private final FormSerializer formSerializer;
    private final ObjectMapper mapper;

    @Override
    public RemoteForm prepare(Form form, ExportOptions options) {
        Objects.requireNonNull(form, "form");
        ExportOptions directives = options == null ? ExportOptions.none() : options;

        FieldSelection selection = fieldSelector.select(form, directives);

        Set<String> all = form.getFields() == null ? Set.of() : new LinkedHashSet<>(form.getFields().keySet());
        List<Fieldset> declared = directives.getFieldsets() != null ? directives.getFieldsets() : form.getFieldsets();

        return RemoteForm.builder()
                .form(form)
                .exclude(selection.exclude())
                .include(selection.include())
                .readonly(selection.readonly())
                .ordering(selection.ordering())
                .fields(selection.fields())
                .fieldsets(fieldsetValidator.validate(declared, all, selection.fields()))
                .build();
    }

    @Override
    public Map<String, Object> export(RemoteForm remoteForm) {
        log.debug("exporting form {} ({} fields)", remoteForm.getForm().getTitle(), remoteForm.getFields().size());
        return formSerializer.serialize(remoteForm);
    }

    @Override
    public Map<String, Object> export(Form form, ExportOptions options) {
        return export(prepare(form, options));
    }

    @Override
    public String exportJson(Form form, ExportOptions options) {
        Map<String, Object> export = export(form, options);
        try {
            return mapper.writeValueAsString(export);
        } catch (JsonProcessingException e) {
            throw new FormExportException("JSON serialization of form " + form.getTitle() + " failed", e);
        }
    }
}
