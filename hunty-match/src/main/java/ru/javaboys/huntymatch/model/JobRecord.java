package ru.javaboys.huntymatch.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Job offer as delivered by the offer storage.
 */
@Value
@Builder
@Jacksonized
public class JobRecord {

    String id;          // опционально, ключ для кэша
    String title;
    String company;
    String location;
    Integer salary;     // годовой, может отсутствовать
    String industry;
    String description;
    @Singular(ignoreNullCollections = true) List<String> requirements;
    String companyCulture;

    /**
     * Stable key for memoization: the offer id when known, otherwise title + company.
     */
    public String cacheKey() {
        if (id != null && !id.isBlank()) {
            return id;
        }
        return (title == null ? "" : title) + "@" + (company == null ? "" : company);
    }
}
