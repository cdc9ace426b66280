package io.hearthwarrio.formweaver.core.match;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Text folding shared by the field scorer and the anchor auto-matcher.
 */
public final class TextNormalizer {

    private static final Pattern SEPARATORS = Pattern.compile("[：:\\s\\-_]+");
    private static final Pattern TOKEN_SPLIT = Pattern.compile("[\\s\\-_:：/.,()（）]+");
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("(?<=[a-z0-9])(?=[A-Z])");

    private TextNormalizer() {
        // utility class
    }

    /**
     * Lowercases and strips whitespace, dashes, underscores and colons (ASCII and full-width).
     */
    public static String normalize(String s) {
        if (s == null) {
            return "";
        }
        return SEPARATORS.matcher(s).replaceAll("").toLowerCase(Locale.ROOT);
    }

    /**
     * Splits on whitespace, punctuation and camel-case boundaries; tokens are lowercased.
     */
    public static List<String> tokens(String s) {
        List<String> out = new ArrayList<>();
        if (s == null || s.isBlank()) {
            return out;
        }
        for (String part : TOKEN_SPLIT.split(s.trim())) {
            for (String token : CAMEL_BOUNDARY.split(part)) {
                if (!token.isBlank()) {
                    out.add(token.toLowerCase(Locale.ROOT));
                }
            }
        }
        return out;
    }

    /**
     * First letter of every token, or an empty string for fewer than two tokens.
     */
    public static String initials(List<String> tokens) {
        if (tokens.size() < 2) {
            return "";
        }
        StringBuilder sb = new StringBuilder(tokens.size());
        for (String t : tokens) {
            sb.append(t.charAt(0));
        }
        return sb.toString();
    }
}
