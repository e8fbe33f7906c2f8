package ru.javaboys.huntymatch.model;

/**
 * Quality bands over the 0..100 total. The same bands drive the recommendation
 * and the label of the fallback explanation.
 */
public enum MatchTier {

    EXCELLENT(85.0, "Excellent",
            "Strongly recommended - Excellent candidate, proceed to interview immediately"),
    STRONG(75.0, "Strong",
            "Recommended - Strong candidate, proceed to interview"),
    GOOD(65.0, "Good",
            "Consider for interview - Good candidate with minor gaps"),
    MODERATE(50.0, "Moderate",
            "Moderate fit - Review carefully before proceeding"),
    WEAK(Double.NEGATIVE_INFINITY, "Weak",
            "Not recommended - Significant gaps in requirements");

    private final double threshold;
    private final String label;
    private final String recommendation;

    MatchTier(double threshold, String label, String recommendation) {
        this.threshold = threshold;
        this.label = label;
        this.recommendation = recommendation;
    }

    public static MatchTier of(double totalScore) {
        for (MatchTier tier : values()) {
            if (totalScore >= tier.threshold) {
                return tier;
            }
        }
        return WEAK;
    }

    public String getLabel() {
        return label;
    }

    public String getRecommendation() {
        return recommendation;
    }
}
