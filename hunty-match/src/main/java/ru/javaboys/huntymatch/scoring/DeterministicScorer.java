package ru.javaboys.huntymatch.scoring;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.javaboys.huntymatch.model.CandidateContext;
import ru.javaboys.huntymatch.model.DeterministicScore;
import ru.javaboys.huntymatch.model.JobRecord;
import ru.javaboys.huntymatch.model.RelevantExperience;
import ru.javaboys.huntymatch.model.ScoreDetail;
import ru.javaboys.huntymatch.model.ScoreDimension;
import ru.javaboys.huntymatch.util.TextUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Rule-based part of the match (0..40): skills, experience, education, salary, location.
 * Only skills (soft skills) and experience may consult the model, both with local fallbacks.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeterministicScorer {

    static final List<String> TECH_VOCABULARY = List.of(
            "python", "java", "javascript", "typescript", "c++", "c#", "go", "rust",
            "react", "vue", "angular", "node.js", "django", "flask", "fastapi",
            "postgresql", "mysql", "mongodb", "redis", "elasticsearch",
            "docker", "kubernetes", "aws", "gcp", "azure", "terraform",
            "git", "ci/cd", "jenkins", "github actions", "gitlab",
            "machine learning", "deep learning", "nlp", "computer vision",
            "data science", "data engineering", "etl", "spark", "hadoop",
            "agile", "scrum", "rest api", "graphql", "microservices");

    // без диакритики, сравниваются с TextUtils.fold(requirement)
    static final List<String> SOFT_SKILL_KEYWORDS = List.of(
            "ponctualite", "punctuality", "autonomie", "autonomous", "autonomy",
            "leadership", "lead", "communication", "communicat",
            "esprit", "equipe", "team", "teamwork", "collaboration",
            "rigueur", "rigor", "rigorous", "organisation", "organiz",
            "adaptabilite", "adaptability", "flexible", "flexibility",
            "proactivite", "proactive", "motivation", "motivated",
            "relationnel", "interpersonal", "creativity", "creative",
            "problem solving", "critical thinking", "initiative");

    private static final Map<String, Integer> EDUCATION_LEVELS = new LinkedHashMap<>();

    static {
        EDUCATION_LEVELS.put("phd", 5);
        EDUCATION_LEVELS.put("doctorate", 5);
        EDUCATION_LEVELS.put("doctorat", 5);
        EDUCATION_LEVELS.put("master", 4);
        EDUCATION_LEVELS.put("msc", 4);
        EDUCATION_LEVELS.put("mba", 4);
        EDUCATION_LEVELS.put("bachelor", 3);
        EDUCATION_LEVELS.put("licence", 3);
        EDUCATION_LEVELS.put("degree", 3);
        EDUCATION_LEVELS.put("diploma", 2);
        EDUCATION_LEVELS.put("diplôme", 2);
    }

    private static final int DEFAULT_REQUIRED_EDUCATION = 3;

    static final List<String> REGIONS = List.of(
            "france", "paris", "lyon", "marseille", "toulouse", "bordeaux",
            "lille", "nantes", "nice", "strasbourg", "montpellier", "rennes");

    private final SkillMatcher skillMatcher;
    private final SoftSkillEvaluator softSkillEvaluator;
    private final ExperienceExtractor experienceExtractor;

    public DeterministicScore score(String conversationId, JobRecord job, CandidateContext candidate) {
        if (job == null) {
            throw new IllegalArgumentException("job is required");
        }
        String resume = TextUtils.safe(candidate == null ? null : candidate.getResumeText());
        String description = TextUtils.safe(job.getDescription());
        List<String> requirements = job.getRequirements() == null ? List.of() : job.getRequirements();

        ScoreDetail skills = scoreSkills(conversationId + "-soft", resume, requirements, description);
        ScoreDetail experience = scoreExperience(conversationId + "-years", resume, description, job.getTitle());
        ScoreDetail education = scoreEducation(resume, requirements, description);
        ScoreDetail salary = scoreSalary(job.getSalary(), candidate == null ? null : candidate.getSalaryExpectation());
        ScoreDetail location = scoreLocation(job.getLocation(), candidate == null ? null : candidate.getLocation());

        DeterministicScore result = new DeterministicScore(skills, experience, education, salary, location);
        log.debug("Deterministic score for '{}': {}/40", job.getTitle(), result.getTotal());
        return result;
    }

    // -------- skills --------

    ScoreDetail scoreSkills(String conversationId, String resume, List<String> requirements, String description) {
        List<String> softSkills = new ArrayList<>();
        Set<String> hardSkills = new LinkedHashSet<>();
        for (String req : requirements) {
            if (!TextUtils.notBlank(req)) continue;
            if (isSoftSkill(req)) {
                softSkills.add(req.trim());
            } else {
                hardSkills.add(req.trim().toLowerCase(Locale.ROOT));
            }
        }
        for (String term : TECH_VOCABULARY) {
            if (TextUtils.containsTerm(description, term)) {
                hardSkills.add(term);
            }
        }

        List<String> matchedHard = new ArrayList<>();
        List<String> missingHard = new ArrayList<>();
        for (String skill : hardSkills) {
            if (skillMatcher.matches(skill, resume)) {
                matchedHard.add(skill);
            } else {
                missingHard.add(skill);
            }
        }

        SoftSkillMatch soft = softSkillEvaluator.evaluate(conversationId, resume, softSkills, description);

        int total = hardSkills.size() + softSkills.size();
        int matched = matchedHard.size() + soft.getMatched().size();

        List<String> bonusSkills = new ArrayList<>();
        for (String term : TECH_VOCABULARY) {
            if (!hardSkills.contains(term) && TextUtils.containsTerm(resume, term)) {
                bonusSkills.add(term);
            }
        }

        double score;
        double ratio;
        if (total > 0) {
            ratio = (double) matched / total;
            double bonus = Math.min(2.0, bonusSkills.size() * 0.2);
            score = Math.min(15.0, ratio * 15.0 + bonus);
        } else {
            score = 10.0;
            ratio = 0.67;
        }

        List<String> allMatched = new ArrayList<>(matchedHard);
        allMatched.addAll(soft.getMatched());
        List<String> allMissing = new ArrayList<>(missingHard);
        allMissing.addAll(soft.getMissing());

        StringBuilder expl = new StringBuilder();
        expl.append(matched).append('/').append(total).append(" competences requises maitrisees");
        if (!allMatched.isEmpty()) {
            expl.append(". Matchees: ").append(String.join(", ", head(allMatched, 5)));
        }
        if (!allMissing.isEmpty()) {
            expl.append(". Manquantes: ").append(String.join(", ", head(allMissing, 3)));
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("matched_skills", head(allMatched, 10));
        metadata.put("missing_skills", head(allMissing, 10));
        metadata.put("match_ratio", Math.round(ratio * 100.0) / 100.0);
        metadata.put("hard_skills_matched", matchedHard.size());
        metadata.put("soft_skills_matched", soft.getMatched().size());
        metadata.put("semantic_soft_skills", soft.isSemantic());
        metadata.put("bonus_skills", bonusSkills);
        return ScoreDetail.of(ScoreDimension.SKILLS_MATCHING, score, expl.toString(), metadata);
    }

    static boolean isSoftSkill(String requirement) {
        String folded = TextUtils.fold(requirement);
        for (String keyword : SOFT_SKILL_KEYWORDS) {
            if (folded.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    // -------- experience --------

    ScoreDetail scoreExperience(String conversationId, String resume, String description, String jobTitle) {
        int resumeYears;
        boolean usingSemantic = false;
        String semanticExplanation = null;
        if (TextUtils.notBlank(jobTitle) && experienceExtractor.isOracleAvailable()) {
            RelevantExperience relevant = experienceExtractor.extractRelevantYears(conversationId, resume, jobTitle, description);
            resumeYears = relevant.getYears();
            usingSemantic = relevant.isFromOracle();
            semanticExplanation = relevant.getExplanation();
        } else {
            resumeYears = experienceExtractor.estimateTotalYears(resume);
        }

        int requiredYears = experienceExtractor.requiredYears(description);
        if (requiredYears == 0) {
            String lower = description.toLowerCase(Locale.ROOT);
            if (lower.contains("senior") || lower.contains("lead")) {
                requiredYears = 5;
            } else if (lower.contains("junior") || lower.contains("graduate")) {
                requiredYears = 1;
            } else {
                requiredYears = 3;
            }
        }

        double score;
        String base;
        if (resumeYears >= requiredYears) {
            int over = resumeYears - requiredYears;
            if (over <= 5) {
                score = 10.0;
                base = resumeYears + " ans d'experience pertinente, excellent profil";
            } else if (over <= 10) {
                score = 9.0;
                base = resumeYears + " ans d'experience pertinente, tres experimente";
            } else if (over <= 15) {
                score = 8.0;
                base = resumeYears + " ans d'experience pertinente, tres senior";
            } else {
                score = 7.0;
                base = resumeYears + " ans d'experience pertinente, profil tres senior";
            }
        } else {
            int gap = requiredYears - resumeYears;
            score = Math.max(0, 10 - gap * 2);
            base = resumeYears + " ans d'experience pertinente, " + requiredYears + " requis";
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("resume_years", resumeYears);
        metadata.put("required_years", requiredYears);
        metadata.put("semantic_evaluation", usingSemantic);
        String explanation = usingSemantic && TextUtils.notBlank(semanticExplanation) ? semanticExplanation : base;
        return ScoreDetail.of(ScoreDimension.EXPERIENCE_YEARS, score, explanation, metadata);
    }

    // -------- education --------

    ScoreDetail scoreEducation(String resume, List<String> requirements, String description) {
        String resumeLower = resume.toLowerCase(Locale.ROOT);
        String jobText = (description + " " + String.join(" ", requirements)).toLowerCase(Locale.ROOT);
        boolean mandatory = jobText.contains("required") || jobText.contains("requis") || jobText.contains("minimum");

        int candidateLevel = 0;
        String candidateDegree = "Non spécifié";
        int requiredLevel = 0;
        String requiredDegree = "Non spécifié";
        for (Map.Entry<String, Integer> e : EDUCATION_LEVELS.entrySet()) {
            if (resumeLower.contains(e.getKey()) && e.getValue() > candidateLevel) {
                candidateLevel = e.getValue();
                candidateDegree = capitalize(e.getKey());
            }
            if (mandatory && jobText.contains(e.getKey()) && e.getValue() > requiredLevel) {
                requiredLevel = e.getValue();
                requiredDegree = capitalize(e.getKey());
            }
        }
        if (requiredLevel == 0) {
            requiredLevel = DEFAULT_REQUIRED_EDUCATION;
            requiredDegree = "Bachelor (par défaut)";
        }

        double score;
        String explanation;
        if (candidateLevel >= requiredLevel) {
            score = 5.0;
            explanation = candidateDegree + " correspond aux attentes (" + requiredDegree + ")";
        } else if (candidateLevel >= requiredLevel - 1) {
            score = 3.0;
            explanation = candidateDegree + " légèrement en dessous de " + requiredDegree;
        } else {
            score = 1.0;
            explanation = candidateDegree + " en dessous de " + requiredDegree;
        }
        return ScoreDetail.of(ScoreDimension.EDUCATION_MATCH, score, explanation,
                Map.of("candidate_level", candidateLevel, "required_level", requiredLevel));
    }

    // -------- salary --------

    ScoreDetail scoreSalary(Integer jobSalary, Integer expectation) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("job_salary", jobSalary);
        if (expectation == null || expectation <= 0) {
            return ScoreDetail.of(ScoreDimension.SALARY_FIT, 5.0, "Salaire non spécifié, assumé acceptable", metadata);
        }
        metadata.put("candidate_expectation", expectation);
        if (jobSalary == null || jobSalary <= 0) {
            return ScoreDetail.of(ScoreDimension.SALARY_FIT, 5.0, "Salaire de l'offre non communiqué, assumé acceptable", metadata);
        }

        double diff = (jobSalary - expectation) * 100.0 / expectation;
        metadata.put("diff_percent", Math.round(diff * 100.0) / 100.0);
        double score;
        String explanation;
        if (diff >= 10) {
            score = 5.0;
            explanation = String.format(Locale.ROOT, "Salaire offert supérieur aux attentes (+%.0f%%)", diff);
        } else if (diff >= 0) {
            score = 5.0;
            explanation = String.format(Locale.ROOT, "Salaire offert correspond aux attentes (±%.0f%%)", diff);
        } else if (diff >= -10) {
            score = 4.0;
            explanation = String.format(Locale.ROOT, "Salaire légèrement en dessous des attentes (%.0f%%)", diff);
        } else if (diff >= -20) {
            score = 2.0;
            explanation = String.format(Locale.ROOT, "Salaire en dessous des attentes (%.0f%%)", diff);
        } else {
            score = 0.0;
            explanation = String.format(Locale.ROOT, "Salaire très en dessous des attentes (%.0f%%)", diff);
        }
        return ScoreDetail.of(ScoreDimension.SALARY_FIT, score, explanation, metadata);
    }

    // -------- location --------

    ScoreDetail scoreLocation(String jobLocation, String candidateLocation) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("job_location", TextUtils.safe(jobLocation));
        metadata.put("candidate_location", TextUtils.notBlank(candidateLocation) ? candidateLocation : "Non spécifié");
        if (!TextUtils.notBlank(candidateLocation)) {
            return ScoreDetail.of(ScoreDimension.LOCATION_MATCH, 3.0, "Localisation non spécifiée", metadata);
        }
        if (!TextUtils.notBlank(jobLocation)) {
            return ScoreDetail.of(ScoreDimension.LOCATION_MATCH, 3.0, "Localisation de l'offre non spécifiée", metadata);
        }

        String job = jobLocation.trim().toLowerCase(Locale.ROOT);
        String cand = candidateLocation.trim().toLowerCase(Locale.ROOT);
        double score;
        String explanation;
        if (isRemote(job)) {
            score = 5.0;
            explanation = "Poste en remote, flexible";
        } else if (isRemote(cand)) {
            score = 1.0;
            explanation = "Candidat recherche remote, poste sur site";
        } else if (job.contains(cand) || cand.contains(job)) {
            score = 5.0;
            explanation = "Localisation parfaitement alignée";
        } else if (REGIONS.stream().anyMatch(r -> job.contains(r) && cand.contains(r))) {
            score = 3.0;
            explanation = "Même région mais pas même ville";
        } else {
            score = 1.0;
            explanation = "Localisations différentes";
        }
        return ScoreDetail.of(ScoreDimension.LOCATION_MATCH, score, explanation, metadata);
    }

    static boolean isRemote(String location) {
        String lower = TextUtils.lower(location);
        return lower.contains("remote") || lower.contains("télétravail") || lower.contains("teletravail");
    }

    private static String capitalize(String s) {
        return s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }

    private static <T> List<T> head(List<T> list, int max) {
        return list.size() <= max ? new ArrayList<>(list) : new ArrayList<>(list.subList(0, max));
    }
}
