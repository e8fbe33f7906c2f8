package ru.javaboys.huntymatch.scoring;

import lombok.Value;

import java.util.List;

@Value
public class SoftSkillMatch {
    List<String> matched;
    List<String> missing;
    boolean semantic;   // решение принимала модель
}
