package ru.javaboys.huntymatch.scoring;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fuzzy check whether a requirement phrase is covered by a text.
 * <p>
 * Tried in order, first hit wins:
 * <ol>
 *     <li>the whole requirement as a case-insensitive substring;</li>
 *     <li>every significant word of the requirement (stop words dropped) as a substring;</li>
 *     <li>for licences ("Permis C", "License B") the category code as a standalone token,
 *     so that "Permis C" is found in "Permis B, C, CE";</li>
 *     <li>acronym form without spaces, hyphens and slashes ("CI/CD" vs "ci-cd").</li>
 * </ol>
 * Stateless and thread-safe.
 */
@Component
public class SkillMatcher {

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "the", "of", "and", "or", "in", "on", "at", "to", "for",
            "de", "des", "et", "ou", "à");

    private static final Pattern WORD = Pattern.compile("\\w+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern LICENCE_CODE = Pattern.compile("\\b([A-Z]+\\d*)\\b");
    private static final Pattern ACRONYM_SEPARATORS = Pattern.compile("[/\\-\\s]+");
    private static final String[] LICENCE_KEYWORDS = {"permis", "license", "licence"};
    private static final int MAX_ACRONYM_LENGTH = 10;

    public boolean matches(String requirement, String text) {
        if (requirement == null || requirement.isBlank() || text == null || text.isBlank()) {
            return false;
        }
        String req = requirement.trim().toLowerCase(Locale.ROOT);
        String txt = text.toLowerCase(Locale.ROOT);

        if (txt.contains(req)) {
            return true;
        }

        List<String> words = significantWords(req);
        if (!words.isEmpty() && words.stream().allMatch(txt::contains)) {
            return true;
        }

        if (matchesLicenceCode(requirement.trim(), req, text)) {
            return true;
        }

        String reqCompact = ACRONYM_SEPARATORS.matcher(req).replaceAll("");
        String txtCompact = ACRONYM_SEPARATORS.matcher(txt).replaceAll("");
        return !reqCompact.isEmpty() && reqCompact.length() <= MAX_ACRONYM_LENGTH && txtCompact.contains(reqCompact);
    }

    static List<String> significantWords(String lowerRequirement) {
        List<String> words = new ArrayList<>();
        Matcher m = WORD.matcher(lowerRequirement);
        while (m.find()) {
            String w = m.group();
            if (!STOP_WORDS.contains(w)) {
                words.add(w);
            }
        }
        return words;
    }

    private static boolean matchesLicenceCode(String original, String lower, String text) {
        int keywordEnd = -1;
        for (String keyword : LICENCE_KEYWORDS) {
            int idx = lower.indexOf(keyword);
            if (idx >= 0) {
                keywordEnd = idx + keyword.length();
                break;
            }
        }
        if (keywordEnd < 0) {
            return false;
        }
        Matcher code = LICENCE_CODE.matcher(original.substring(keywordEnd));
        if (!code.find()) {
            return false;
        }
        // "C" отдельно, ", C", "C," или "/ C"
        Pattern standalone = Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(code.group(1)) + "(?![\\p{L}\\p{N}])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        return standalone.matcher(text).find();
    }
}
