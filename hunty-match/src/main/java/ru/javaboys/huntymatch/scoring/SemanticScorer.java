package ru.javaboys.huntymatch.scoring;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.javaboys.huntymatch.ai.OracleGateway;
import ru.javaboys.huntymatch.model.JobRecord;
import ru.javaboys.huntymatch.model.ScoreDetail;
import ru.javaboys.huntymatch.model.ScoreDimension;
import ru.javaboys.huntymatch.model.SemanticScore;
import ru.javaboys.huntymatch.util.TextUtils;

/**
 * Qualitative part of the match (0..40), one model round-trip per dimension.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SemanticScorer {

    private static final String ANSWER_FORMAT = """

            Format your response EXACTLY as:
            SCORE: [number]
            EXPLANATION: [your explanation]
            """;

    private static final String SOFT_SKILLS_PROMPT = """
            Analyze the soft skills match between a resume and a job position.

            Evaluate the candidate's soft skills based on:
            1. Leadership: ability to lead projects, teams, or initiatives
            2. Communication: written and verbal communication skills
            3. Teamwork: collaboration and working with others
            4. Problem-solving: analytical thinking and solution-oriented approach
            5. Initiative: proactiveness and self-motivation

            Provide:
            1. A score from 0 to 15 (15 = exceptional soft skills match)
            2. A concise explanation (2-3 sentences) justifying the score
            """ + ANSWER_FORMAT;

    private static final String CULTURE_FIT_PROMPT = """
            Analyze the culture fit between a candidate and the company/role.

            Evaluate the candidate's culture fit based on:
            1. Values alignment: do the candidate's values match the company's?
            2. Work style: does the candidate's approach match the role expectations?
            3. Environment preference: does the candidate thrive in this type of environment?
            4. Long-term fit: is this a mutually beneficial match?

            Provide:
            1. A score from 0 to 10 (10 = perfect culture fit)
            2. A concise explanation (2-3 sentences) justifying the score
            """ + ANSWER_FORMAT;

    private static final String GROWTH_POTENTIAL_PROMPT = """
            Analyze the candidate's growth potential for a role.

            Evaluate the candidate's growth potential based on:
            1. Learning capacity: evidence of continuous learning, certifications, new skills
            2. Career progression: trajectory showing increasing responsibilities
            3. Adaptability: ability to adapt to new technologies, roles, or environments
            4. Future potential: likelihood of excelling and growing in this role

            Provide:
            1. A score from 0 to 10 (10 = exceptional growth potential)
            2. A concise explanation (2-3 sentences) justifying the score
            """ + ANSWER_FORMAT;

    private static final String PROJECT_RELEVANCE_PROMPT = """
            Analyze the relevance of the candidate's past projects to a job.

            Evaluate project relevance based on:
            1. Domain similarity: are the projects in a similar domain/industry?
            2. Technical similarity: do the projects use similar technologies?
            3. Scope similarity: are the project scopes comparable?
            4. Impact: did the projects have measurable, relevant impact?

            Provide:
            1. A score from 0 to 5 (5 = highly relevant projects)
            2. A concise explanation (1-2 sentences) justifying the score
            """ + ANSWER_FORMAT;

    private final OracleGateway oracleGateway;

    public SemanticScore score(String conversationId, JobRecord job, String resumeText) {
        String resume = oracleGateway.trimResume(resumeText);
        String description = oracleGateway.trimJob(job.getDescription());
        String title = TextUtils.safe(job.getTitle());

        ScoreDetail softSkills = scoreDimension(conversationId, ScoreDimension.SOFT_SKILLS_MATCH, SOFT_SKILLS_PROMPT, """
                JOB TITLE: %s

                JOB DESCRIPTION:
                %s

                CANDIDATE RESUME:
                %s
                """.formatted(title, description, resume));

        String culture = TextUtils.notBlank(job.getCompanyCulture())
                ? "\nCOMPANY CULTURE:\n" + job.getCompanyCulture().trim()
                : "";
        ScoreDetail cultureFit = scoreDimension(conversationId, ScoreDimension.CULTURE_FIT, CULTURE_FIT_PROMPT, """
                JOB DESCRIPTION:
                %s%s

                CANDIDATE RESUME:
                %s
                """.formatted(description, culture, resume));

        ScoreDetail growth = scoreDimension(conversationId, ScoreDimension.GROWTH_POTENTIAL, GROWTH_POTENTIAL_PROMPT, """
                JOB TITLE: %s

                CANDIDATE RESUME:
                %s
                """.formatted(title, resume));

        ScoreDetail projects = scoreDimension(conversationId, ScoreDimension.PROJECT_RELEVANCE, PROJECT_RELEVANCE_PROMPT, """
                JOB DESCRIPTION:
                %s

                CANDIDATE RESUME:
                %s
                """.formatted(description, resume));

        return new SemanticScore(softSkills, cultureFit, growth, projects);
    }

    private ScoreDetail scoreDimension(String conversationId, ScoreDimension dimension, String system, String user) {
        try {
            return oracleGateway.score(conversationId + "-" + dimension.getKey(), dimension, system, user);
        } catch (RuntimeException e) {
            log.warn("Semantic scoring of {} failed: {}", dimension.getKey(), e.getMessage());
            return ScoreDetail.failed(dimension, e.getMessage());
        }
    }
}
