package it.piero.remoteforms.utils;

import it.piero.remoteforms.model.LazyText;
import org.junit.jupiter.api.Test;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.context.support.StaticMessageSource;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TextResolverTest {

    private final StaticMessageSource messages = new StaticMessageSource();
    private final TextResolver resolver = new TextResolver(messages);

    @Test
    void resolvesNestedDeferredText() {
        messages.addMessage("label.name", Locale.getDefault(), "Name");

        Map<String, Object> input = new LinkedHashMap<>();
        input.put("label", LazyText.message("label.name", null));
        input.put("nested", Map.of("help", LazyText.of(() -> "Help")));
        input.put("list", List.of(LazyText.of(() -> "a"), 1));
        input.put("set", new LinkedHashSet<>(List.of("x")));
        input.put("array", new Object[]{LazyText.of(() -> "b"), null});
        input.put("resolvable", new DefaultMessageSourceResolvable(new String[]{"missing"}, "fallback"));
        input.put("builder", new StringBuilder("sb"));
        input.put("number", 3);

        Map<String, Object> out = resolver.resolveMap(input);

        assertThat(List.copyOf(out.keySet())).containsExactlyElementsOf(input.keySet());
        assertThat(out).containsEntry("label", "Name")
                .containsEntry("nested", Map.of("help", "Help"))
                .containsEntry("list", List.of("a", 1))
                .containsEntry("set", List.of("x"))
                .containsEntry("resolvable", "fallback")
                .containsEntry("builder", "sb")
                .containsEntry("number", 3);
        assertThat(out.get("array")).isEqualTo(Arrays.asList("b", null));
    }

    @Test
    void unknownMessageKeysFallBackToDefaultOrCode() {
        Map<String, Object> out = resolver.resolveMap(Map.of(
                "lazy", LazyText.message("label.unknown", null),
                "lazyDefault", LazyText.message("label.unknown", "Unknown"),
                "resolvable", new DefaultMessageSourceResolvable("label.other")));

        assertThat(out).containsEntry("lazy", "label.unknown")
                .containsEntry("lazyDefault", "Unknown")
                .containsEntry("resolvable", "label.other");
    }

    @Test
    void messageTextFallsBackWithoutMessageSource() {
        TextResolver bare = new TextResolver(null);

        assertThat(bare.resolve(LazyText.message("code.only", null))).isEqualTo("code.only");
        assertThat(bare.resolve(LazyText.message("code", "Default"))).isEqualTo("Default");
        assertThat(bare.resolve(null)).isNull();
    }
}
