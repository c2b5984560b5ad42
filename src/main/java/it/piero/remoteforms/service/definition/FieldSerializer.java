package it.piero.remoteforms.service.definition;

import it.piero.remoteforms.model.FieldType;
import it.piero.remoteforms.model.FormField;

import java.util.Map;
import java.util.Set;

/**
 * Describes fields of some {@link FieldType}s as an ordered map for a remote renderer.
 */
public interface FieldSerializer {

    Set<FieldType> supportedTypes();

    /**
     * @param field           field to describe
     * @param initialOverride initial value set on the form for this field, {@code null} when none
     * @param fieldName       name of the field in its form
     */
    Map<String, Object> serialize(FormField field, Object initialOverride, String fieldName);
}
