package it.piero.remoteforms.utils;

import it.piero.remoteforms.model.LazyText;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.MessageSource;
import org.springframework.context.MessageSourceResolvable;
import org.springframework.context.NoSuchMessageException;
import org.springframework.context.i18n.LocaleContextHolder;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

// Maps keep their order, collections and arrays become lists.
@Slf4j
@Component
public class TextResolver {

    private final MessageSource messageSource;

    public TextResolver(MessageSource messageSource) {
        this.messageSource = messageSource;
    }

    public Object resolve(Object value) {
        return resolve(value, LocaleContextHolder.getLocale());
    }

    public Map<String, Object> resolveMap(Map<String, ?> map) {
        if (map == null) return null;
        Locale locale = LocaleContextHolder.getLocale();
        Map<String, Object> out = new LinkedHashMap<>();
        map.forEach((k, v) -> out.put(k, resolve(v, locale)));
        return out;
    }

    private Object resolve(Object value, Locale locale) {
        if (value == null) return null;

        if (value instanceof LazyText text) {
            return text.resolve(messageSource, locale);
        }
        if (value instanceof MessageSourceResolvable resolvable) {
            return resolveMessage(resolvable, locale);
        }
        if (value instanceof String) {
            return value;
        }
        if (value instanceof CharSequence text) {
            return text.toString();
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> out = new LinkedHashMap<>();
            map.forEach((k, v) -> out.put(resolve(k, locale), resolve(v, locale)));
            return out;
        }
        if (value instanceof Collection<?> items) {
            List<Object> out = new ArrayList<>(items.size());
            for (Object item : items) {
                out.add(resolve(item, locale));
            }
            return out;
        }
        if (value instanceof Object[] items) {
            List<Object> out = new ArrayList<>(items.length);
            for (Object item : items) {
                out.add(resolve(item, locale));
            }
            return out;
        }
        return value;
    }

    private String resolveMessage(MessageSourceResolvable resolvable, Locale locale) {
        String[] codes = resolvable.getCodes();
        String fallback = resolvable.getDefaultMessage();
        if (fallback == null && codes != null && codes.length > 0) {
            fallback = codes[0];
        }
        if (messageSource == null || codes == null || codes.length == 0) {
            return fallback;
        }
        try {
            return messageSource.getMessage(resolvable, locale);
        } catch (NoSuchMessageException e) {
            log.warn("No message for codes {}, using {}", List.of(codes), fallback);
            return fallback;
        }
    }
}
