package com.trialmatch.model;

import com.trialmatch.error.ValidationFailureException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a patient document (snake_case field names, ISO dates) into a validated {@link PatientRecord}.
 */
public final class PatientJson {
    private PatientJson() {
    }

    public static PatientRecord parse(String json) {
        JSONObject root;
        try {
            root = new JSONObject(json == null ? "" : json);
        } catch (JSONException e) {
            throw new ValidationFailureException("patient", "not a JSON object: " + e.getMessage(), e);
        }
        return fromJson(root);
    }

    public static PatientRecord fromJson(JSONObject root) {
        PatientRecord.Builder builder = PatientRecord.builder()
                .age(age(root))
                .gender(Gender.fromLabel(root.optString("gender", "")))
                .smokingStatus(SmokingStatus.fromLabel(root.optString("smoking_status", "")));
        if (root.has("pregnancy_status") && !root.isNull("pregnancy_status")) {
            Object raw = root.get("pregnancy_status");
            if (!(raw instanceof Boolean)) {
                throw new ValidationFailureException("pregnancy_status", "must be true or false");
            }
            builder.pregnant((Boolean) raw);
        }

        for (JSONObject c : objects(root, "conditions")) {
            builder.condition(new Condition(
                    c.optString("name", ""),
                    c.optString("icd10_code", null),
                    date(c, "onset_date")
            ));
        }
        for (JSONObject m : objects(root, "medications")) {
            builder.medication(new Medication(
                    m.optString("name", ""),
                    m.optString("dosage", null),
                    m.optString("frequency", null)
            ));
        }
        for (JSONObject l : objects(root, "lab_results")) {
            Object value = l.opt("value");
            String testName = l.optString("test_name", "");
            String unit = l.optString("unit", "");
            LocalDate date = date(l, "test_date");
            if (value instanceof Number number) {
                builder.labResult(new LabResult(testName, number.doubleValue(), unit, date));
            } else {
                builder.labResult(LabResult.parse(testName, value == null || JSONObject.NULL.equals(value) ? null : value.toString(), unit, date));
            }
        }
        return builder.build();
    }

    private static int age(JSONObject root) {
        Object raw = root.opt("age");
        if (!(raw instanceof Number)) {
            throw new ValidationFailureException("age", "is required and must be an integer");
        }
        try {
            return new BigDecimal(raw.toString()).intValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            throw new ValidationFailureException("age", "must be a whole number of years, got " + raw, e);
        }
    }

    private static List<JSONObject> objects(JSONObject root, String key) {
        List<JSONObject> out = new ArrayList<>();
        if (!root.has(key) || root.isNull(key)) {
            return out;
        }
        JSONArray arr = root.optJSONArray(key);
        if (arr == null) {
            throw new ValidationFailureException(key, "must be an array");
        }
        for (int i = 0; i < arr.length(); i++) {
            JSONObject item = arr.optJSONObject(i);
            if (item == null) {
                throw new ValidationFailureException(key + "[" + i + "]", "must be an object");
            }
            out.add(item);
        }
        return out;
    }

    private static LocalDate date(JSONObject o, String key) {
        String raw = o.optString(key, "");
        if (raw.isBlank() || o.isNull(key)) {
            return null;
        }
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeParseException e) {
            throw new ValidationFailureException(key, "'" + raw + "' is not an ISO date", e);
        }
    }
}
