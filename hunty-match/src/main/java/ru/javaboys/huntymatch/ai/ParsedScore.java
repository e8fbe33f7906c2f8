package ru.javaboys.huntymatch.ai;

import lombok.Value;

@Value
public class ParsedScore {
    double score;          // уже в [0, max]
    String explanation;
    boolean salvaged;      // число найдено не в строке SCORE:
}
