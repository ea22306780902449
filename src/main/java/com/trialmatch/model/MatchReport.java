package com.trialmatch.model;

import java.util.List;
import java.util.Locale;

/**
 * Outcome of a batch match: ranked results plus the candidates that could not be evaluated.
 * Absence of a trial from {@link #results()} is never an ineligibility verdict; check {@link #failures()}.
 */
public final class MatchReport {
    private final String condition;
    private final int candidateCount;
    private final List<MatchResult> results;
    private final List<TrialFailure> failures;
    private final int belowMinScore;

    public MatchReport(String condition, int candidateCount, List<MatchResult> results, List<TrialFailure> failures, int belowMinScore) {
        this.condition = condition == null ? "" : condition;
        this.candidateCount = Math.max(0, candidateCount);
        this.results = results == null ? List.of() : List.copyOf(results);
        this.failures = failures == null ? List.of() : List.copyOf(failures);
        this.belowMinScore = Math.max(0, belowMinScore);
    }

    public String condition() {
        return condition;
    }

    public int candidateCount() {
        return candidateCount;
    }

    public List<MatchResult> results() {
        return results;
    }

    public List<TrialFailure> failures() {
        return failures;
    }

    public int unevaluatedCount() {
        return failures.size();
    }

    /**
     * Scored trials dropped by the minimum-score filter.
     */
    public int belowMinScore() {
        return belowMinScore;
    }

    public boolean isPartial() {
        return !failures.isEmpty();
    }

    public String summary() {
        return String.format(
                Locale.ROOT,
                "condition=%s candidates=%d matched=%d below_min_score=%d; %d of %d trials could not be evaluated",
                condition,
                candidateCount,
                results.size(),
                belowMinScore,
                failures.size(),
                candidateCount
        );
    }
}
