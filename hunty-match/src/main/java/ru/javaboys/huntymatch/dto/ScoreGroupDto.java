package ru.javaboys.huntymatch.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ScoreGroupDto {
    private double total;
    private double max;
    // ключ измерения -> {score, max, explanation, ...metadata}
    private Map<String, Map<String, Object>> details = new LinkedHashMap<>();
}
