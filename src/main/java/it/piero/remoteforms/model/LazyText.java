package it.piero.remoteforms.model;

import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.context.MessageSource;
import org.springframework.context.MessageSourceResolvable;
import org.springframework.context.support.DefaultMessageSourceResolvable;

import java.util.Locale;
import java.util.Objects;
import java.util.function.Supplier;

// An unknown message key renders as its default message, or as the key itself.
public final class LazyText implements CharSequence {

    private final Supplier<String> supplier;
    private final MessageSourceResolvable message;

    private LazyText(Supplier<String> supplier, MessageSourceResolvable message) {
        this.supplier = supplier;
        this.message = message;
    }

    public static LazyText of(Supplier<String> supplier) {
        return new LazyText(Objects.requireNonNull(supplier, "supplier"), null);
    }

    public static LazyText message(String code, String defaultMessage, Object... args) {
        Objects.requireNonNull(code, "code");
        return new LazyText(null, new DefaultMessageSourceResolvable(new String[]{code}, args, defaultMessage));
    }

    public boolean isMessage() {
        return message != null;
    }

    public String resolve(MessageSource messageSource, Locale locale) {
        if (message == null) {
            return supplier.get();
        }
        if (messageSource == null) {
            return fallback();
        }
        return messageSource.getMessage(message.getCodes()[0], message.getArguments(), fallback(), locale);
    }

    private String fallback() {
        String defaultMessage = message.getDefaultMessage();
        if (defaultMessage != null) return defaultMessage;
        String[] codes = message.getCodes();
        return codes == null || codes.length == 0 ? "" : codes[0];
    }

    @JsonValue
    @Override
    public String toString() {
        return message == null ? supplier.get() : fallback();
    }

    @Override
    public int length() {
        return toString().length();
    }

    @Override
    public char charAt(int index) {
        return toString().charAt(index);
    }

    @Override
    public CharSequence subSequence(int start, int end) {
        return toString().subSequence(start, end);
    }
}
