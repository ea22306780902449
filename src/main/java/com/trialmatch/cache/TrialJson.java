package com.trialmatch.cache;

import com.trialmatch.model.Trial;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Serializes {@link Trial} for the file cache. Absent optional fields are left out of the document.
 */
public final class TrialJson {
    private TrialJson() {
    }

    public static JSONObject toJson(Trial trial) {
        JSONObject o = new JSONObject();
        o.put("id", trial.id);
        putIfPresent(o, "title", trial.title);
        putIfPresent(o, "phase", trial.phase);
        putIfPresent(o, "status", trial.status);
        putIfPresent(o, "brief_summary", trial.briefSummary);
        putIfPresent(o, "inclusion_criteria", trial.inclusionCriteria);
        putIfPresent(o, "exclusion_criteria", trial.exclusionCriteria);
        o.put("locations", new JSONArray(trial.locations));
        o.put("interventions", new JSONArray(trial.interventions));
        o.put("conditions", new JSONArray(trial.conditions));
        putIfPresent(o, "minimum_age", trial.minimumAge);
        putIfPresent(o, "maximum_age", trial.maximumAge);
        putIfPresent(o, "sex", trial.sex);
        if (trial.enrollment != null) {
            o.put("enrollment", trial.enrollment.intValue());
        }
        return o;
    }

    public static Trial fromJson(JSONObject o) {
        return Trial.builder()
                .id(o.getString("id"))
                .title(optText(o, "title"))
                .phase(optText(o, "phase"))
                .status(optText(o, "status"))
                .briefSummary(optText(o, "brief_summary"))
                .inclusionCriteria(optText(o, "inclusion_criteria"))
                .exclusionCriteria(optText(o, "exclusion_criteria"))
                .locations(strings(o.optJSONArray("locations")))
                .interventions(strings(o.optJSONArray("interventions")))
                .conditions(strings(o.optJSONArray("conditions")))
                .minimumAge(optText(o, "minimum_age"))
                .maximumAge(optText(o, "maximum_age"))
                .sex(optText(o, "sex"))
                .enrollment(o.has("enrollment") ? o.getInt("enrollment") : null)
                .build();
    }

    public static JSONArray toJsonArray(List<Trial> trials) {
        JSONArray arr = new JSONArray();
        for (Trial trial : trials) {
            arr.put(toJson(trial));
        }
        return arr;
    }

    public static List<Trial> fromJsonArray(JSONArray arr) {
        List<Trial> out = new ArrayList<>(arr.length());
        for (int i = 0; i < arr.length(); i++) {
            out.add(fromJson(arr.getJSONObject(i)));
        }
        return out;
    }

    private static void putIfPresent(JSONObject o, String key, String value) {
        if (value != null) {
            o.put(key, value);
        }
    }

    private static String optText(JSONObject o, String key) {
        if (!o.has(key) || o.isNull(key)) {
            return null;
        }
        return o.optString(key, null);
    }

    private static List<String> strings(JSONArray arr) {
        if (arr == null) {
            return List.of();
        }
        List<String> out = new ArrayList<>(arr.length());
        for (int i = 0; i < arr.length(); i++) {
            String value = arr.optString(i, "");
            if (!value.isBlank()) {
                out.add(value);
            }
        }
        return out;
    }
}
