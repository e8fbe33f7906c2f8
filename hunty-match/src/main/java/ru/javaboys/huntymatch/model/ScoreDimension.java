package ru.javaboys.huntymatch.model;

/**
 * Все оси скоринга с ключом для сериализации, человекочитаемой меткой и максимумом баллов.
 */
public enum ScoreDimension {

    SKILLS_MATCHING("skills_matching", "skills", 15.0),
    EXPERIENCE_YEARS("experience_years", "experience", 10.0),
    EDUCATION_MATCH("education_match", "education", 5.0),
    SALARY_FIT("salary_fit", "salary fit", 5.0),
    LOCATION_MATCH("location_match", "location", 5.0),

    SOFT_SKILLS_MATCH("soft_skills_match", "soft skills", 15.0),
    CULTURE_FIT("culture_fit", "culture fit", 10.0),
    GROWTH_POTENTIAL("growth_potential", "growth potential", 10.0),
    PROJECT_RELEVANCE("project_relevance", "project relevance", 5.0),

    INDUSTRY_EXPERIENCE("industry_experience", "industry experience", 10.0),
    RARE_SKILLS_PREMIUM("rare_skills_premium", "rare skills", 5.0),
    CAREER_TRAJECTORY("career_trajectory", "career trajectory", 5.0);

    private final String key;
    private final String label;
    private final double maxScore;

    ScoreDimension(String key, String label, double maxScore) {
        this.key = key;
        this.label = label;
        this.maxScore = maxScore;
    }

    public String getKey() {
        return key;
    }

    public String getLabel() {
        return label;
    }

    public double getMaxScore() {
        return maxScore;
    }
}
