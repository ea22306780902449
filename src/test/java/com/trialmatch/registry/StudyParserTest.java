package com.trialmatch.registry;

import com.trialmatch.model.Trial;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StudyParserTest {

    @Test
    void parse_shouldNormalizeFullStudy() {
        JSONObject protocol = new JSONObject()
                .put("identificationModule", new JSONObject().put("nctId", "NCT04000001").put("briefTitle", "Insulin Glargine Study"))
                .put("statusModule", new JSONObject().put("overallStatus", "RECRUITING"))
                .put("descriptionModule", new JSONObject().put("briefSummary", "A study of basal insulin."))
                .put("designModule", new JSONObject()
                        .put("phases", new JSONArray().put("phase3"))
                        .put("enrollmentInfo", new JSONObject().put("count", 420)))
                .put("conditionsModule", new JSONObject().put("conditions", new JSONArray().put("Type 2 Diabetes").put(" ")))
                .put("armsInterventionsModule", new JSONObject().put("interventions", new JSONArray()
                        .put(new JSONObject().put("name", "Insulin Glargine"))
                        .put(new JSONObject().put("type", "DRUG"))))
                .put("eligibilityModule", new JSONObject()
                        .put("eligibilityCriteria", "Inclusion Criteria:\n* Age 18-75\n* HbA1c 7-10%\n\nExclusion Criteria:\n* Pregnancy\n* eGFR < 30")
                        .put("minimumAge", "18 Years")
                        .put("maximumAge", "75 Years")
                        .put("sex", "ALL"))
                .put("contactsLocationsModule", new JSONObject().put("locations", new JSONArray()
                        .put(new JSONObject().put("city", "Boston").put("state", "Massachusetts"))
                        .put(new JSONObject().put("city", "Boston").put("state", "Massachusetts"))
                        .put(new JSONObject().put("city", "Lyon").put("country", "France"))
                        .put(new JSONObject().put("city", "Nowhere"))));
        JSONObject study = new JSONObject().put("protocolSection", protocol);

        Trial trial = new StudyParser(5).parse(study);

        assertEquals("NCT04000001", trial.id);
        assertEquals("Insulin Glargine Study", trial.title);
        assertEquals("PHASE3", trial.phase);
        assertEquals("RECRUITING", trial.status);
        assertEquals("A study of basal insulin.", trial.briefSummary);
        assertEquals("* Age 18-75\n* HbA1c 7-10%", trial.inclusionCriteria);
        assertEquals("* Pregnancy\n* eGFR < 30", trial.exclusionCriteria);
        assertEquals(List.of("Boston, Massachusetts", "Lyon, France"), trial.locations);
        assertEquals(List.of("Insulin Glargine"), trial.interventions);
        assertEquals(List.of("Type 2 Diabetes"), trial.conditions);
        assertEquals("18 Years", trial.minimumAge);
        assertEquals("75 Years", trial.maximumAge);
        assertEquals("ALL", trial.sex);
        assertEquals(420, trial.enrollment);
    }

    @Test
    void parse_shouldLeaveMissingFieldsNull() {
        JSONObject study = new JSONObject()
                .put("protocolSection", new JSONObject()
                        .put("identificationModule", new JSONObject().put("nctId", "NCT04000002")));

        Trial trial = new StudyParser(5).parse(study);

        assertEquals("NCT04000002", trial.id);
        assertNull(trial.title);
        assertNull(trial.phase);
        assertNull(trial.inclusionCriteria);
        assertNull(trial.exclusionCriteria);
        assertNull(trial.enrollment);
        assertTrue(trial.locations.isEmpty());
    }

    @Test
    void parse_shouldReturnNullWithoutIdentifier() {
        assertNull(new StudyParser(5).parse(new JSONObject().put("protocolSection", new JSONObject())));
    }

    @Test
    void parse_shouldCapLocations() {
        JSONArray locations = new JSONArray();
        for (int i = 0; i < 8; i++) {
            locations.put(new JSONObject().put("city", "City" + i).put("state", "State"));
        }
        JSONObject study = new JSONObject().put("protocolSection", new JSONObject()
                .put("identificationModule", new JSONObject().put("nctId", "NCT04000003"))
                .put("contactsLocationsModule", new JSONObject().put("locations", locations)));

        assertEquals(3, new StudyParser(3).parse(study).locations.size());
    }

    @Test
    void splitCriteria_shouldKeepWholeTextAsInclusionWithoutExclusionHeading() {
        String[] parts = StudyParser.splitCriteria("Adults with moderate asthma\nFEV1 60-85% predicted");

        assertEquals("Adults with moderate asthma\nFEV1 60-85% predicted", parts[0]);
        assertNull(parts[1]);
    }

    @Test
    void splitCriteria_shouldRecognizeKeyHeadings() {
        String[] parts = StudyParser.splitCriteria("Key Inclusion Criteria:\n- BMI >= 30\nKey Exclusion Criteria:\n- Prior bariatric surgery");

        assertEquals("- BMI >= 30", parts[0]);
        assertEquals("- Prior bariatric surgery", parts[1]);
    }
}
