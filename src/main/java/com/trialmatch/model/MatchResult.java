package com.trialmatch.model;

import java.util.List;
import java.util.Locale;

/**
 * Verdict for one (patient, trial) pair. Built once by the response parser, never mutated.
 * An ineligible verdict never carries a score at or above {@link #STRONG_MATCH_THRESHOLD},
 * and an eligible verdict never carries exclusion violations.
 */
public final class MatchResult {
    public static final double STRONG_MATCH_THRESHOLD = 0.9;

    private final Trial trial;
    private final boolean eligible;
    private final double score;
    private final String explanation;
    private final String reasoning;
    private final List<String> inclusionMatches;
    private final List<String> inclusionMismatches;
    private final List<String> exclusionViolations;
    private final List<String> exclusionPasses;
    private final String provider;

    public MatchResult(
            Trial trial,
            boolean eligible,
            double score,
            String explanation,
            String reasoning,
            List<String> inclusionMatches,
            List<String> inclusionMismatches,
            List<String> exclusionViolations,
            List<String> exclusionPasses,
            String provider
    ) {
        if (trial == null) {
            throw new IllegalArgumentException("trial is required");
        }
        if (!Double.isFinite(score) || score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score out of range: " + score);
        }
        List<String> violations = exclusionViolations == null ? List.of() : List.copyOf(exclusionViolations);
        if (eligible && !violations.isEmpty()) {
            throw new IllegalArgumentException("eligible verdict with exclusion violations for trial " + trial.id);
        }
        if (!eligible && score >= STRONG_MATCH_THRESHOLD) {
            throw new IllegalArgumentException("ineligible verdict with strong score " + score + " for trial " + trial.id);
        }
        this.trial = trial;
        this.eligible = eligible;
        this.score = score;
        this.explanation = explanation == null ? "" : explanation;
        this.reasoning = reasoning == null || reasoning.isBlank() ? null : reasoning;
        this.inclusionMatches = inclusionMatches == null ? List.of() : List.copyOf(inclusionMatches);
        this.inclusionMismatches = inclusionMismatches == null ? List.of() : List.copyOf(inclusionMismatches);
        this.exclusionViolations = violations;
        this.exclusionPasses = exclusionPasses == null ? List.of() : List.copyOf(exclusionPasses);
        this.provider = provider == null ? "" : provider;
    }

    public Trial trial() {
        return trial;
    }

    public String trialId() {
        return trial.id;
    }

    public boolean eligible() {
        return eligible;
    }

    public double score() {
        return score;
    }

    public String explanation() {
        return explanation;
    }

    /**
     * Detailed reasoning from the backend, or {@code null} when it gave none.
     */
    public String reasoning() {
        return reasoning;
    }

    public List<String> inclusionMatches() {
        return inclusionMatches;
    }

    public List<String> inclusionMismatches() {
        return inclusionMismatches;
    }

    public List<String> exclusionViolations() {
        return exclusionViolations;
    }

    public List<String> exclusionPasses() {
        return exclusionPasses;
    }

    public String provider() {
        return provider;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "MatchResult[trial=%s, eligible=%s, score=%.2f]", trial.id, eligible, score);
    }
}
