package ru.javaboys.huntymatch.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.text.Normalizer;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

public final class TextUtils {

    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");

    private TextUtils() {
    }

    public static String safeTrim(String s, int max) {
        if (s == null) return "";
        return s.length() <= max ? s : s.substring(0, max);
    }

    public static String safe(String s) {
        return s == null ? "" : s;
    }

    public static String nullIfBlank(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }

    public static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }

    public static String lower(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }

    /**
     * Lower case without diacritics: "Ponctualité" -> "ponctualite".
     */
    public static String fold(String s) {
        if (s == null) return "";
        String decomposed = Normalizer.normalize(s, Normalizer.Form.NFD);
        return DIACRITICS.matcher(decomposed).replaceAll("").toLowerCase(Locale.ROOT);
    }

    /**
     * Case-insensitive occurrence of {@code term} not glued to other letters or digits.
     * Works for terms with symbols such as "c++", "node.js" or "ci/cd".
     */
    public static boolean containsTerm(String text, String term) {
        if (text == null || term == null || term.isBlank()) return false;
        Pattern p = Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(term.toLowerCase(Locale.ROOT)) + "(?![\\p{L}\\p{N}])");
        return p.matcher(text.toLowerCase(Locale.ROOT)).find();
    }

    public static String sha256(String s) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(safe(s).getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not supported", e);
        }
    }

    /**
     * Joins non-blank parts with a separator.
     */
    public static String join(String separator, String... parts) {
        StringBuilder sb = new StringBuilder();
        for (String part : parts) {
            if (notBlank(part)) {
                if (sb.length() > 0) sb.append(separator);
                sb.append(part.trim());
            }
        }
        return sb.toString();
    }
}
