package ru.javaboys.huntymatch.triage;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import ru.javaboys.huntymatch.model.JobRecord;
import ru.javaboys.huntymatch.scoring.SkillMatcher;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Cheap local pre-score (0..100) used to decide which jobs deserve a full match:
 * 50 base, up to 30 for requirements found in the resume, up to 20 for shared description words.
 */
@Component
@RequiredArgsConstructor
public class QuickScorer {

    private final SkillMatcher skillMatcher;

    public double score(String resumeText, JobRecord job) {
        double score = 50.0;

        List<String> requirements = job.getRequirements();
        if (requirements != null && !requirements.isEmpty()) {
            long matched = requirements.stream().filter(r -> skillMatcher.matches(r, resumeText)).count();
            score += (double) matched / requirements.size() * 30.0;
        }

        Set<String> common = words(job.getDescription());
        common.retainAll(words(resumeText));
        score += Math.min(20.0, common.size() * 0.5);

        return Math.min(100.0, score);
    }

    private static Set<String> words(String text) {
        Set<String> words = new HashSet<>();
        if (text == null || text.isBlank()) {
            return words;
        }
        for (String w : text.toLowerCase(Locale.ROOT).trim().split("\\s+")) {
            if (!w.isEmpty()) {
                words.add(w);
            }
        }
        return words;
    }
}
