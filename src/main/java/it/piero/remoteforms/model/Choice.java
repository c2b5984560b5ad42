package it.piero.remoteforms.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.util.LinkedHashMap;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Choice {
    private Object value;
    private CharSequence display;

    public static Choice of(Object value, CharSequence display) {
        return new Choice(value, display);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("value", value);
        map.put("display", display);
        return map;
    }
}
