package ru.javaboys.huntymatch.scoring;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.javaboys.huntymatch.ai.OracleGateway;
import ru.javaboys.huntymatch.model.BonusScore;
import ru.javaboys.huntymatch.model.JobRecord;
import ru.javaboys.huntymatch.model.ScoreDetail;
import ru.javaboys.huntymatch.model.ScoreDimension;
import ru.javaboys.huntymatch.util.TextUtils;

/**
 * Bonus part of the match (0..20): industry experience, rare skills, career trajectory.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BonusScorer {

    private static final String INDUSTRY_PROMPT = """
            Analyze the candidate's industry-specific experience for a job.

            Evaluate the candidate's industry experience based on:
            1. Years in the specific industry: how long has the candidate worked in this industry?
            2. Domain knowledge: does the candidate understand industry-specific challenges?
            3. Relevant projects: has the candidate worked on industry-relevant projects?
            4. Industry-specific skills: does the candidate have specialized domain skills?

            Scoring guidelines:
            - 10 points: 5+ years in the exact industry with deep domain expertise
            - 7-9 points: 3-5 years in the industry or related fields
            - 4-6 points: 1-3 years or transferable experience from adjacent industries
            - 1-3 points: no direct industry experience but relevant skills
            - 0 points: no relevant industry experience

            Provide:
            1. A score from 0 to 10
            2. A concise explanation (2-3 sentences) justifying the score

            Format your response EXACTLY as:
            SCORE: [number]
            EXPLANATION: [your explanation]
            """;

    private static final String RARE_SKILLS_PROMPT = """
            Analyze the candidate's rare and highly sought-after skills FOR THIS SPECIFIC JOB.

            CRITICAL INSTRUCTION: only award points for rare skills that are RELEVANT and VALUABLE
            for this specific job position. Rare skills that are irrelevant to the job score 0 points.

            For example:
            - AI/ML skills are rare and valuable for a Data Scientist job (high score)
            - AI/ML skills are irrelevant for a Truck Driver job (0 points)
            - CDL license + hazmat certification are rare for a Truck Driver (high score)
            - CDL license is irrelevant for a Data Scientist (0 points)

            Evaluate rare skills based on:
            1. Relevance FIRST: is this skill valuable for THIS job?
            2. Rarity: is this skill hard to find in candidates for this position?
            3. Market demand: is this skill in high demand for this role?
            4. Competitive advantage: does this skill differentiate the candidate?

            Scoring guidelines:
            - 5 points: multiple rare skills that are extremely hard to find AND highly relevant
            - 4 points: at least one rare skill in high demand AND relevant to the job
            - 3 points: some specialized skills that add value to this position
            - 1-2 points: minor differentiating skills
            - 0 points: no rare skills OR skills are irrelevant to this job

            Provide:
            1. A score from 0 to 5
            2. A concise explanation (1-2 sentences) listing the rare skills and their relevance

            Format your response EXACTLY as:
            SCORE: [number]
            EXPLANATION: [your explanation]
            """;

    private static final String TRAJECTORY_PROMPT = """
            Analyze the candidate's career trajectory and progression.

            Evaluate career trajectory based on:
            1. Coherence: is there a logical progression and story?
            2. Advancement: has the candidate taken on increasing responsibilities?
            3. Consistency: no unexplained gaps or frequent job-hopping?
            4. Fit: is this next position a natural next step?

            Scoring guidelines:
            - 5 points: clear, coherent progression with steady advancement
            - 4 points: good progression with minor gaps or pivots
            - 3 points: acceptable trajectory with some inconsistencies
            - 1-2 points: fragmented career or unclear direction
            - 0 points: incoherent trajectory or major red flags

            Provide:
            1. A score from 0 to 5
            2. A concise explanation (1-2 sentences) justifying the score

            Format your response EXACTLY as:
            SCORE: [number]
            EXPLANATION: [your explanation]
            """;

    private final OracleGateway oracleGateway;

    public BonusScore score(String conversationId, JobRecord job, String resumeText) {
        String resume = oracleGateway.trimResume(resumeText);
        String description = oracleGateway.trimJob(job.getDescription());
        String title = TextUtils.safe(job.getTitle());

        String industry = TextUtils.notBlank(job.getIndustry()) ? "\nINDUSTRY: " + job.getIndustry().trim() : "";
        ScoreDetail industryExperience = scoreDimension(conversationId, ScoreDimension.INDUSTRY_EXPERIENCE, INDUSTRY_PROMPT, """
                JOB DESCRIPTION:
                %s%s

                CANDIDATE RESUME:
                %s
                """.formatted(description, industry, resume));

        ScoreDetail rareSkills = scoreDimension(conversationId, ScoreDimension.RARE_SKILLS_PREMIUM, RARE_SKILLS_PROMPT, """
                JOB TITLE: %s

                JOB DESCRIPTION:
                %s

                CANDIDATE RESUME:
                %s
                """.formatted(title, description, resume));

        ScoreDetail trajectory = scoreDimension(conversationId, ScoreDimension.CAREER_TRAJECTORY, TRAJECTORY_PROMPT, """
                JOB TITLE: %s

                CANDIDATE RESUME:
                %s
                """.formatted(title, resume));

        return new BonusScore(industryExperience, rareSkills, trajectory);
    }

    private ScoreDetail scoreDimension(String conversationId, ScoreDimension dimension, String system, String user) {
        try {
            return oracleGateway.score(conversationId + "-" + dimension.getKey(), dimension, system, user);
        } catch (RuntimeException e) {
            log.warn("Bonus scoring of {} failed: {}", dimension.getKey(), e.getMessage());
            return ScoreDetail.failed(dimension, e.getMessage());
        }
    }
}
