package ru.javaboys.huntymatch.model;

import lombok.Builder;
import lombok.Value;

/**
 * Per-request candidate data passed explicitly into every scoring call.
 */
@Value
@Builder
public class CandidateContext {

    String resumeText;
    String location;
    Integer salaryExpectation;

    public boolean hasResume() {
        return resumeText != null && !resumeText.isBlank();
    }

    public static CandidateContext ofResume(String resumeText) {
        return CandidateContext.builder().resumeText(resumeText).build();
    }
}
