package com.trialmatch.matching;

import com.trialmatch.error.ParseFailureException;
import com.trialmatch.model.MatchResult;
import com.trialmatch.model.Trial;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns a reasoning backend reply into a {@link MatchResult}.
 *
 * <p>The reply is expected to hold a JSON object but may wrap it in prose or Markdown fences.
 * Recovery steps: locate the first balanced {@code {...}} span that parses, coerce
 * string-typed booleans and numbers, clamp the score into [0, 1], default missing lists to empty.
 * Only the verdict and the score are required; without them the reply is a {@link ParseFailureException}.
 *
 * <p>Consistency rules applied after recovery:
 * <ul>
 *   <li>eligible with exclusion violations is downgraded to ineligible, score capped at {@link #POOR_MATCH_CEILING}</li>
 *   <li>ineligible with a score at or above {@link MatchResult#STRONG_MATCH_THRESHOLD} is capped at {@link #MODERATE_MATCH_CEILING}</li>
 * </ul>
 * Both adjustments are noted in the explanation.
 */
public final class MatchResponseParser {
    public static final double POOR_MATCH_CEILING = 0.3;
    public static final double MODERATE_MATCH_CEILING = 0.8;

    private static final String[] ELIGIBLE_KEYS = {"eligible", "is_eligible"};
    private static final String[] SCORE_KEYS = {"score", "match_score"};

    /**
     * Turns a backend reply into a verdict for {@code trial}. The first balanced JSON object carrying
     * a verdict or score is used, keys are read under their aliases, scores are clamped to [0, 1] and
     * contradictory verdicts are capped.
     *
     * @throws com.trialmatch.error.ParseFailureException when no usable verdict or score is found
     */
    public MatchResult parse(Trial trial, String raw, String provider) {
        if (raw == null || raw.isBlank()) {
            throw new ParseFailureException("empty reply from reasoning backend", raw);
        }
        JSONObject o = locateObject(raw);
        if (o == null) {
            throw new ParseFailureException("no JSON object found in reply", raw);
        }

        Boolean eligibleValue = coerceBoolean(first(o, ELIGIBLE_KEYS));
        if (eligibleValue == null) {
            throw new ParseFailureException("reply lacks a usable 'eligible' verdict", raw);
        }
        Double scoreValue = coerceScore(first(o, SCORE_KEYS));
        if (scoreValue == null) {
            throw new ParseFailureException("reply lacks a usable numeric 'score'", raw);
        }

        boolean eligible = eligibleValue;
        double score = clamp(scoreValue);
        String reasoning = text(o.opt("reasoning"));
        String explanation = text(o.opt("explanation"));
        if (explanation == null) {
            explanation = reasoning == null ? "No explanation provided." : reasoning;
        }
        List<String> inclusionMatches = strings(o.opt("inclusion_matches"));
        List<String> inclusionMismatches = strings(o.opt("inclusion_mismatches"));
        List<String> exclusionViolations = strings(o.opt("exclusion_violations"));
        List<String> exclusionPasses = strings(o.opt("exclusion_passes"));

        if (eligible && !exclusionViolations.isEmpty()) {
            eligible = false;
            score = Math.min(score, POOR_MATCH_CEILING);
            explanation = explanation + " [Verdict downgraded to ineligible: the reply reported eligible alongside "
                    + exclusionViolations.size() + " exclusion violation(s).]";
        }
        if (!eligible && score >= MatchResult.STRONG_MATCH_THRESHOLD) {
            explanation = explanation + String.format(Locale.ROOT,
                    " [Score %.2f capped at %.2f: an ineligible verdict cannot be a strong match.]",
                    score, MODERATE_MATCH_CEILING);
            score = MODERATE_MATCH_CEILING;
        }

        return new MatchResult(
                trial,
                eligible,
                score,
                explanation,
                reasoning,
                inclusionMatches,
                inclusionMismatches,
                exclusionViolations,
                exclusionPasses,
                provider
        );
    }

    /**
     * Scans for balanced brace spans, honouring string literals, and returns the first that parses
     * as a JSON object carrying a verdict or a score. Falls back to the first span that parses at all.
     */
    static JSONObject locateObject(String raw) {
        JSONObject firstParsed = null;
        int from = raw.indexOf('{');
        while (from >= 0) {
            int end = matchingBrace(raw, from);
            if (end < 0) {
                from = raw.indexOf('{', from + 1);
                continue;
            }
            try {
                JSONObject candidate = new JSONObject(raw.substring(from, end + 1));
                if (first(candidate, ELIGIBLE_KEYS) != null || first(candidate, SCORE_KEYS) != null) {
                    return candidate;
                }
                if (firstParsed == null) {
                    firstParsed = candidate;
                }
            } catch (JSONException ignored) {
                // Not JSON; keep scanning from the next opening brace.
            }
            from = raw.indexOf('{', from + 1);
        }
        return firstParsed;
    }

    private static int matchingBrace(String raw, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < raw.length(); i++) {
            char ch = raw.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (ch == '\\') {
                    escaped = true;
                } else if (ch == '"') {
                    inString = false;
                }
                continue;
            }
            if (ch == '"') {
                inString = true;
            } else if (ch == '{') {
                depth++;
            } else if (ch == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static Object first(JSONObject o, String[] keys) {
        for (String key : keys) {
            if (o.has(key) && !o.isNull(key)) {
                return o.get(key);
            }
        }
        return null;
    }

    static Boolean coerceBoolean(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            String t = s.trim().toLowerCase(Locale.ROOT);
            if (t.equals("true") || t.equals("yes") || t.equals("eligible")) {
                return Boolean.TRUE;
            }
            if (t.equals("false") || t.equals("no") || t.equals("ineligible") || t.equals("not eligible")) {
                return Boolean.FALSE;
            }
        }
        return null;
    }

    static Double coerceScore(Object value) {
        double d;
        if (value instanceof Number n) {
            d = n.doubleValue();
        } else if (value instanceof String s) {
            try {
                d = Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return Double.isNaN(d) ? null : d;
    }

    private static double clamp(double score) {
        if (score < 0.0) {
            return 0.0;
        }
        return Math.min(score, 1.0);
    }

    private static String text(Object value) {
        if (value == null || JSONObject.NULL.equals(value)) {
            return null;
        }
        String s = value.toString().trim();
        return s.isEmpty() ? null : s;
    }

    private static List<String> strings(Object value) {
        List<String> out = new ArrayList<>();
        if (value instanceof JSONArray arr) {
            for (int i = 0; i < arr.length(); i++) {
                String item = text(arr.opt(i));
                if (item != null) {
                    out.add(item);
                }
            }
        } else {
            String single = text(value);
            if (single != null) {
                out.add(single);
            }
        }
        return out;
    }
}
