package com.trialmatch.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A normalized registry record. Optional fields are {@code null} when the registry did not supply them.
 * Read-only once built; a later fetch supersedes it rather than mutating it.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class Trial {
    public final String id;
    public final String title;
    public final String phase;
    public final String status;
    public final String briefSummary;
    public final String inclusionCriteria;
    public final String exclusionCriteria;
    @Singular
    public final List<String> locations;
    @Singular
    public final List<String> interventions;
    @Singular
    public final List<String> conditions;
    public final String minimumAge;
    public final String maximumAge;
    public final String sex;
    public final Integer enrollment;
}
