package ru.javaboys.huntymatch.ai;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for the line-oriented answers of the model:
 * {@code SCORE: 12/15}, {@code EXPLANATION: ...}, {@code RELEVANT_YEARS: 4}, {@code MATCHED: [a, b]}.
 * Pure and stateless.
 */
public final class ScoreResponseParser {

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(?:[.,]\\d+)?");

    private ScoreResponseParser() {
    }

    /**
     * Extracts a score clamped to {@code [0, max]} and its explanation.
     * Without a usable {@code SCORE:} line the first number anywhere in the text is taken, else 0.
     * Without an {@code EXPLANATION:} line the whole response is the explanation.
     */
    public static ParsedScore parseScore(String response, double max) {
        if (response == null || response.isBlank()) {
            return new ParsedScore(0.0, "", false);
        }
        boolean salvaged = false;
        OptionalDouble score = labeledValue(response, "SCORE")
                .map(v -> v.split("/", 2)[0])
                .map(ScoreResponseParser::parseNumber)
                .orElse(OptionalDouble.empty());
        if (score.isEmpty()) {
            score = parseNumber(response);
            salvaged = true;
        }
        double value = score.orElse(0.0);
        String explanation = labeledValue(response, "EXPLANATION").orElse(response.trim());
        return new ParsedScore(clamp(value, max), explanation, salvaged);
    }

    /**
     * Remainder of the first line starting with {@code label:}, case-insensitive; leading markdown
     * emphasis is ignored.
     */
    public static Optional<String> labeledValue(String response, String label) {
        if (response == null) {
            return Optional.empty();
        }
        String prefix = label.toUpperCase(Locale.ROOT) + ":";
        for (String raw : response.split("\\R")) {
            String line = raw.strip().replaceFirst("^[*#\\s]+", "");
            if (line.toUpperCase(Locale.ROOT).startsWith(prefix)) {
                return Optional.of(line.substring(prefix.length()).replace("**", "").strip());
            }
        }
        return Optional.empty();
    }

    /**
     * Items of a {@code MATCHED: [a, b]} line; empty optional when the line is absent.
     */
    public static Optional<List<String>> matchedList(String response) {
        Optional<String> value = labeledValue(response, "MATCHED");
        if (value.isEmpty()) {
            return Optional.empty();
        }
        String body = value.get().strip();
        if (body.startsWith("[")) {
            body = body.substring(1);
        }
        if (body.endsWith("]")) {
            body = body.substring(0, body.length() - 1);
        }
        if (body.isBlank()) {
            return Optional.of(Collections.emptyList());
        }
        List<String> items = new ArrayList<>();
        for (String part : body.split(",")) {
            String item = part.strip().replaceAll("^[\"']|[\"']$", "").strip();
            if (!item.isEmpty()) {
                items.add(item);
            }
        }
        return Optional.of(items);
    }

    /**
     * First number in the text; comma decimals are accepted.
     */
    public static OptionalDouble parseNumber(String text) {
        if (text == null) {
            return OptionalDouble.empty();
        }
        Matcher m = NUMBER.matcher(text);
        if (!m.find()) {
            return OptionalDouble.empty();
        }
        try {
            return OptionalDouble.of(Double.parseDouble(m.group().replace(',', '.')));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    private static double clamp(double value, double max) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(max, value));
    }
}
