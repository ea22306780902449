package com.trialmatch.registry;

import com.trialmatch.model.Trial;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes ClinicalTrials.gov API v2 study documents into {@link Trial}.
 * Fields the registry leaves out stay {@code null}; no placeholder text is invented.
 */
public final class StudyParser {
    private static final Pattern INCLUSION_HEADING = Pattern.compile("(?im)^\\s*(?:key\\s+)?inclusion\\s+criteria\\s*:?");
    private static final Pattern EXCLUSION_HEADING = Pattern.compile("(?im)^\\s*(?:key\\s+)?exclusion\\s+criteria\\s*:?");

    private final int maxLocations;

    public StudyParser(int maxLocations) {
        this.maxLocations = Math.max(0, maxLocations);
    }

    /**
     * @return the normalized trial, or {@code null} when the document has no NCT identifier
     */
    public Trial parse(JSONObject study) {
        JSONObject protocol = module(study, "protocolSection");
        JSONObject identification = module(protocol, "identificationModule");
        String id = text(identification, "nctId");
        if (id == null) {
            return null;
        }
        JSONObject description = module(protocol, "descriptionModule");
        JSONObject eligibility = module(protocol, "eligibilityModule");
        JSONObject status = module(protocol, "statusModule");
        JSONObject design = module(protocol, "designModule");
        JSONObject conditions = module(protocol, "conditionsModule");
        JSONObject arms = module(protocol, "armsInterventionsModule");
        JSONObject contacts = module(protocol, "contactsLocationsModule");

        String[] criteria = splitCriteria(text(eligibility, "eligibilityCriteria"));
        String title = text(identification, "briefTitle");
        if (title == null) {
            title = text(identification, "officialTitle");
        }

        Trial.TrialBuilder builder = Trial.builder()
                .id(id)
                .title(title)
                .phase(firstString(design.optJSONArray("phases")))
                .status(text(status, "overallStatus"))
                .briefSummary(text(description, "briefSummary"))
                .inclusionCriteria(criteria[0])
                .exclusionCriteria(criteria[1])
                .locations(locations(contacts.optJSONArray("locations")))
                .interventions(interventions(arms.optJSONArray("interventions")))
                .conditions(strings(conditions.optJSONArray("conditions")))
                .minimumAge(text(eligibility, "minimumAge"))
                .maximumAge(text(eligibility, "maximumAge"))
                .sex(text(eligibility, "sex"));
        JSONObject enrollment = design.optJSONObject("enrollmentInfo");
        if (enrollment != null && enrollment.has("count") && !enrollment.isNull("count")) {
            builder.enrollment(enrollment.optInt("count"));
        }
        return builder.build();
    }

    /**
     * Splits a raw eligibility block into {inclusion, exclusion}. Text without an
     * exclusion heading is kept whole as the inclusion block.
     */
    static String[] splitCriteria(String raw) {
        if (raw == null || raw.isBlank()) {
            return new String[]{null, null};
        }
        Matcher exclusion = EXCLUSION_HEADING.matcher(raw);
        if (!exclusion.find()) {
            return new String[]{stripHeading(raw, INCLUSION_HEADING), null};
        }
        String before = raw.substring(0, exclusion.start());
        String after = raw.substring(exclusion.end());
        return new String[]{stripHeading(before, INCLUSION_HEADING), blankToNull(after)};
    }

    private static String stripHeading(String block, Pattern heading) {
        Matcher m = heading.matcher(block);
        String body = m.find() ? block.substring(m.end()) : block;
        return blankToNull(body);
    }

    private List<String> locations(JSONArray arr) {
        List<String> out = new ArrayList<>();
        if (arr == null) {
            return out;
        }
        for (int i = 0; i < arr.length() && out.size() < maxLocations; i++) {
            JSONObject loc = arr.optJSONObject(i);
            if (loc == null) {
                continue;
            }
            String city = text(loc, "city");
            String region = text(loc, "state");
            if (region == null) {
                region = text(loc, "country");
            }
            if (city != null && region != null) {
                String label = city + ", " + region;
                if (!out.contains(label)) {
                    out.add(label);
                }
            }
        }
        return out;
    }

    private List<String> interventions(JSONArray arr) {
        List<String> out = new ArrayList<>();
        if (arr == null) {
            return out;
        }
        for (int i = 0; i < arr.length(); i++) {
            JSONObject item = arr.optJSONObject(i);
            String name = item == null ? null : text(item, "name");
            if (name != null) {
                out.add(name);
            }
        }
        return out;
    }

    private static List<String> strings(JSONArray arr) {
        List<String> out = new ArrayList<>();
        if (arr == null) {
            return out;
        }
        for (int i = 0; i < arr.length(); i++) {
            String value = blankToNull(arr.optString(i, ""));
            if (value != null) {
                out.add(value);
            }
        }
        return out;
    }

    private static String firstString(JSONArray arr) {
        List<String> values = strings(arr);
        return values.isEmpty() ? null : values.get(0).toUpperCase(Locale.ROOT);
    }

    private static JSONObject module(JSONObject parent, String name) {
        if (parent == null) {
            return new JSONObject();
        }
        JSONObject child = parent.optJSONObject(name);
        return child == null ? new JSONObject() : child;
    }

    private static String text(JSONObject o, String key) {
        if (o == null || !o.has(key) || o.isNull(key)) {
            return null;
        }
        return blankToNull(o.optString(key, ""));
    }

    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
