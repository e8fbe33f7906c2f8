package ru.javaboys.huntymatch.mapper;

import org.springframework.stereotype.Component;
import ru.javaboys.huntymatch.dto.DetailedMatchDto;
import ru.javaboys.huntymatch.dto.ScoreGroupDto;
import ru.javaboys.huntymatch.model.DetailedMatch;
import ru.javaboys.huntymatch.model.ScoreBreakdown;
import ru.javaboys.huntymatch.model.ScoreDetail;
import ru.javaboys.huntymatch.model.ScoreDimension;
import ru.javaboys.huntymatch.model.ScoreGroup;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link DetailedMatch} → {@link DetailedMatchDto}. Numbers are rounded to 2 decimals.
 */
@Component
public class DetailedMatchMapper {

    public DetailedMatchDto toDto(DetailedMatch match) {
        if (match == null) {
            return null;
        }
        DetailedMatchDto dto = new DetailedMatchDto();
        dto.setJobTitle(match.getJobTitle());
        dto.setCompany(match.getCompany());
        dto.setMatchScore(round2(match.getMatchScore()));

        ScoreBreakdown b = match.getScoreBreakdown();
        DetailedMatchDto.ScoreBreakdownDto breakdown = new DetailedMatchDto.ScoreBreakdownDto();
        breakdown.setDeterministic(toGroupDto(b.getDeterministic()));
        breakdown.setSemantic(toGroupDto(b.getSemantic()));
        breakdown.setBonus(toGroupDto(b.getBonus()));
        dto.setScoreBreakdown(breakdown);

        dto.setOverallExplanation(match.getOverallExplanation());
        dto.setStrengths(new ArrayList<>(match.getStrengths()));
        dto.setWeaknesses(new ArrayList<>(match.getWeaknesses()));
        dto.setRecommendation(match.getRecommendation());
        dto.setTier(match.getTier().name());
        dto.setSalary(match.getSalary());
        dto.setLocation(match.getLocation());
        return dto;
    }

    ScoreGroupDto toGroupDto(ScoreGroup group) {
        ScoreGroupDto dto = new ScoreGroupDto();
        dto.setTotal(round2(group.getTotal()));
        dto.setMax(group.getMaxTotal());
        Map<String, Map<String, Object>> details = new LinkedHashMap<>();
        for (Map.Entry<ScoreDimension, ScoreDetail> e : group.details().entrySet()) {
            ScoreDetail d = e.getValue();
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("score", round2(d.getScore()));
            entry.put("max", d.getMaxScore());
            entry.put("explanation", d.getExplanation());
            for (Map.Entry<String, Object> m : d.getMetadata().entrySet()) {
                // метаданные не перетирают основные поля
                entry.putIfAbsent(m.getKey(), m.getValue() instanceof Double ? round2((Double) m.getValue()) : m.getValue());
            }
            details.put(e.getKey().getKey(), entry);
        }
        dto.setDetails(details);
        return dto;
    }

    static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
