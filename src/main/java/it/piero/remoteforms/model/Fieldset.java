package it.piero.remoteforms.model;

import lombok.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Fieldset {

    private String name;

    private List<String> fields;

    @Singular
    private Map<String, Object> attrs;

    public static Fieldset of(String name, String... fields) {
        return Fieldset.builder().name(name).fields(List.of(fields)).build();
    }

    public List<Object> toPair() {
        Map<String, Object> data = new LinkedHashMap<>();
        if (fields != null) {
            data.put("fields", new ArrayList<>(fields));
        }
        if (attrs != null) {
            attrs.forEach(data::putIfAbsent);
        }
        List<Object> pair = new ArrayList<>(2);
        pair.add(name);
        pair.add(data);
        return pair;
    }
}
