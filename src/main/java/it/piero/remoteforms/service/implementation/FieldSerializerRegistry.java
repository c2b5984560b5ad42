package it.piero.remoteforms.service.implementation;

import it.piero.remoteforms.model.FieldType;
import it.piero.remoteforms.model.FormField;
import it.piero.remoteforms.service.definition.FieldSerializer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Component
public class FieldSerializerRegistry {

    private final Map<FieldType, FieldSerializer> serializers = new EnumMap<>(FieldType.class);

    public FieldSerializerRegistry(List<FieldSerializer> fieldSerializers) {
        for (FieldSerializer serializer : fieldSerializers) {
            for (FieldType type : serializer.supportedTypes()) {
                FieldSerializer previous = serializers.putIfAbsent(type, serializer);
                if (previous != null) {
                    log.warn("Field type {} already handled by {}, ignoring {}",
                            type, previous.getClass().getSimpleName(), serializer.getClass().getSimpleName());
                }
            }
        }
        log.debug("registered field serializers for {}", serializers.keySet());
    }

    public Optional<FieldSerializer> find(FieldType type) {
        return type == null ? Optional.empty() : Optional.ofNullable(serializers.get(type));
    }

    // never fails: unsupported types and serializer errors yield an empty map
    public Map<String, Object> serialize(String fieldName, FormField field, Object initialOverride) {
        if (field == null) {
            log.warn("Error serializing field {}: no such field", fieldName);
            return new LinkedHashMap<>();
        }

        Optional<FieldSerializer> serializer = find(field.getType());
        if (serializer.isEmpty()) {
            log.warn("Error serializing field {}: no serializer for {}", fieldName, field.getTitle());
            return new LinkedHashMap<>();
        }

        try {
            return new LinkedHashMap<>(serializer.get().serialize(field, initialOverride, fieldName));
        } catch (RuntimeException e) {
            log.warn("Error serializing field {}: {}", fieldName, e.toString());
            return new LinkedHashMap<>();
        }
    }
}
