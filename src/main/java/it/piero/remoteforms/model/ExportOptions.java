package it.piero.remoteforms.model;

import lombok.*;

import java.util.List;
import java.util.Set;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExportOptions {

    @Singular("excludeField")
    private Set<String> exclude;

    @Singular("includeField")
    private Set<String> include;

    @Singular("readonlyField")
    private Set<String> readonly;

    @Singular("orderBy")
    private List<String> ordering;

    private List<Fieldset> fieldsets;

    public static ExportOptions none() {
        return ExportOptions.builder().build();
    }
}
