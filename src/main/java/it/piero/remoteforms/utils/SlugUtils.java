package it.piero.remoteforms.utils;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

public final class SlugUtils {

    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s-]");
    private static final Pattern SEPARATORS = Pattern.compile("[-\\s]+");

    private SlugUtils() {}

    /**
     * Lowercase ascii slug: accents dropped, anything but letters, digits, underscores and hyphens
     * removed, whitespace and hyphen runs collapsed into a single hyphen.
     */
    public static String slugify(String value) {
        if (value == null) return "";
        String ascii = Normalizer.normalize(value, Normalizer.Form.NFKD)
                .replaceAll("[^\\p{ASCII}]", "");
        String cleaned = NON_WORD.matcher(ascii.toLowerCase(Locale.ROOT)).replaceAll("").strip();
        return SEPARATORS.matcher(cleaned).replaceAll("-");
    }
}
