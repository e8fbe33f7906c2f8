package ru.javaboys.huntymatch;

import com.github.benmanes.caffeine.cache.Caffeine;
import ru.javaboys.huntymatch.ai.OracleGateway;
import ru.javaboys.huntymatch.ai.OracleService;
import ru.javaboys.huntymatch.config.MatchProperties;
import ru.javaboys.huntymatch.model.CandidateContext;
import ru.javaboys.huntymatch.model.JobRecord;
import ru.javaboys.huntymatch.scoring.BonusScorer;
import ru.javaboys.huntymatch.scoring.DeterministicScorer;
import ru.javaboys.huntymatch.scoring.ExperienceExtractor;
import ru.javaboys.huntymatch.scoring.ScoreExplainer;
import ru.javaboys.huntymatch.scoring.SemanticScorer;
import ru.javaboys.huntymatch.scoring.SkillMatcher;
import ru.javaboys.huntymatch.scoring.SoftSkillEvaluator;
import ru.javaboys.huntymatch.service.MatchScoringService;
import ru.javaboys.huntymatch.service.ScoringMetrics;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Engine wired by hand, without a Spring context, with the clock fixed in 2024.
 */
public final class MatchEngineFixture {

    public static final Clock CLOCK_2024 = Clock.fixed(Instant.parse("2024-06-01T10:00:00Z"), ZoneOffset.UTC);

    public static final String TRUCK_DRIVER_RESUME = """
            Jean Dupont
            Chauffeur poids lourd
            Permis B, C, CE - FIMO / FCO à jour - Carte conducteur
            Expérience
            2015-2024 Chauffeur routier, Transports Martin, Lyon
            2012-2015 Livreur VL, Express Livraison
            Qualités: Ponctualité, Autonomie
            Formation
            Diplôme CAP Conduite routière
            """;

    public static final String LONG_HAUL_DRIVER_RESUME = """
            Jean-Pierre Martin
            Chauffeur Poids Lourd longue distance, 12 ans d'expérience route
            Permis C, CE - FIMO à jour - Carte conducteur valide
            2012-2024 Chauffeur international, TransRoute, Lyon
            Trajets Europe, livraisons régulières, respect des temps de conduite
            Qualités: Ponctualité, Autonomie
            Diplôme CAP Conduite routière
            """;

    public static final String DATA_SCIENTIST_RESUME = """
            Marie Lambert
            Data Scientist
            2021-2024 Data Scientist, FinTech SA, Paris
            Python, machine learning, SQL, deep learning
            Master en statistiques
            """;

    public final MatchProperties properties;
    public final ScoringMetrics metrics;
    public final OracleGateway gateway;
    public final SkillMatcher skillMatcher;
    public final ExperienceExtractor experienceExtractor;
    public final SoftSkillEvaluator softSkillEvaluator;
    public final DeterministicScorer deterministicScorer;
    public final SemanticScorer semanticScorer;
    public final BonusScorer bonusScorer;
    public final ScoreExplainer scoreExplainer;
    public final MatchScoringService matchScoringService;

    private MatchEngineFixture(OracleService oracle, MatchProperties properties) {
        this.properties = properties;
        this.metrics = new ScoringMetrics();
        this.gateway = new OracleGateway(oracle, properties);
        this.skillMatcher = new SkillMatcher();
        this.experienceExtractor = new ExperienceExtractor(gateway, CLOCK_2024, properties);
        this.softSkillEvaluator = new SoftSkillEvaluator(gateway, skillMatcher);
        this.deterministicScorer = new DeterministicScorer(skillMatcher, softSkillEvaluator, experienceExtractor);
        this.semanticScorer = new SemanticScorer(gateway);
        this.bonusScorer = new BonusScorer(gateway);
        this.scoreExplainer = new ScoreExplainer(gateway);
        this.matchScoringService = new MatchScoringService(deterministicScorer, semanticScorer, bonusScorer,
                scoreExplainer, Caffeine.newBuilder().maximumSize(100).build(), metrics, properties);
    }

    public static MatchEngineFixture with(OracleService oracle) {
        return new MatchEngineFixture(oracle, new MatchProperties());
    }

    public static MatchEngineFixture with(OracleService oracle, MatchProperties properties) {
        return new MatchEngineFixture(oracle, properties);
    }

    public static JobRecord truckDriverJob() {
        return JobRecord.builder()
                .id("job-truck")
                .title("Chauffeur Poids Lourd")
                .company("Transports Rhône")
                .location("Lyon")
                .salary(32000)
                .industry("transport")
                .description("Nous recherchons un chauffeur poids lourd pour des livraisons régionales. "
                        + "Permis C obligatoire, minimum 3 ans d'expérience.")
                .requirements(List.of("Permis C", "FIMO", "Ponctualité"))
                .build();
    }

    public static CandidateContext truckDriverInLyon() {
        return CandidateContext.builder().resumeText(TRUCK_DRIVER_RESUME).location("Lyon").build();
    }

    public static JobRecord longHaulDriverJob() {
        return JobRecord.builder()
                .id("job-long-haul")
                .title("Chauffeur Poids Lourd - Longue Distance")
                .company("TransEurope Logistics")
                .location("Paris / France")
                .salary(42000)
                .industry("transport")
                .description("Recherche chauffeur poids lourd experimente pour routes internationales Europe. "
                        + "Permis C + FIMO requis. Trajets longue distance, livraisons regulieres Allemagne, "
                        + "Belgique, Italie. Respect des temps de conduite, maintenance vehicule.")
                .requirements(List.of("Permis C", "FIMO", "Carte conducteur", "Expérience route",
                        "Ponctualité", "Autonomie"))
                .build();
    }

    public static CandidateContext longHaulDriverInFrance() {
        return CandidateContext.builder()
                .resumeText(LONG_HAUL_DRIVER_RESUME)
                .location("France")
                .salaryExpectation(40000)
                .build();
    }
}
