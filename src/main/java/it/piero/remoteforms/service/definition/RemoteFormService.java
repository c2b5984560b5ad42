package it.piero.remoteforms.service.definition;

import it.piero.remoteforms.model.ExportOptions;
import it.piero.remoteforms.model.Form;
import it.piero.remoteforms.model.RemoteForm;

import java.util.Map;

public interface RemoteFormService {

    RemoteForm prepare(Form form, ExportOptions options);

    Map<String, Object> export(RemoteForm remoteForm);

    Map<String, Object> export(Form form, ExportOptions options);

    String exportJson(Form form, ExportOptions options);

}
