package com.trialmatch.matching;

import com.trialmatch.model.Condition;
import com.trialmatch.model.Gender;
import com.trialmatch.model.LabResult;
import com.trialmatch.model.Medication;
import com.trialmatch.model.PatientRecord;
import com.trialmatch.model.Trial;

import java.math.BigDecimal;
import java.util.List;

/**
 * Renders a patient and one trial's criteria into the matching prompt.
 * Output depends only on the inputs. Every populated patient field is rendered;
 * absent optional fields are left out rather than printed as "unknown".
 */
public final class CriteriaFormatter {

    public String format(PatientRecord patient, Trial trial) {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("You are a clinical trial matching expert. Analyze whether the patient below is eligible for the clinical trial below.\n\n");
        appendPatient(sb, patient);
        sb.append('\n');
        appendTrial(sb, trial);
        sb.append('\n');
        appendInstructions(sb);
        return sb.toString();
    }

    String formatPatient(PatientRecord patient) {
        StringBuilder sb = new StringBuilder(1024);
        appendPatient(sb, patient);
        return sb.toString();
    }

    private void appendPatient(StringBuilder sb, PatientRecord patient) {
        sb.append("Patient Profile:\n");
        sb.append("- Age: ").append(patient.age()).append(" years\n");
        sb.append("- Gender: ").append(patient.gender().label()).append('\n');
        if (patient.smokingStatus() != null) {
            sb.append("- Smoking Status: ").append(patient.smokingStatus().label()).append('\n');
        }
        if (patient.hasPregnancyStatus()) {
            sb.append("- Pregnancy Status: ").append(patient.pregnant() ? "Pregnant" : "Not pregnant").append('\n');
        } else if (patient.gender() == Gender.MALE) {
            sb.append("- Pregnancy Status: not applicable (male patient)\n");
        }

        List<Condition> conditions = patient.conditions();
        if (!conditions.isEmpty()) {
            sb.append("\nMedical Conditions:\n");
            for (Condition condition : conditions) {
                sb.append("  - ").append(oneLine(condition.name()));
                if (condition.code() != null) {
                    sb.append(" (ICD-10: ").append(oneLine(condition.code())).append(')');
                }
                if (condition.onsetDate() != null) {
                    sb.append(" since ").append(condition.onsetDate());
                }
                sb.append('\n');
            }
        }

        List<Medication> medications = patient.medications();
        if (!medications.isEmpty()) {
            sb.append("\nCurrent Medications:\n");
            for (Medication medication : medications) {
                sb.append("  - ").append(oneLine(medication.name()));
                if (medication.dosage() != null) {
                    sb.append(' ').append(oneLine(medication.dosage()));
                }
                if (medication.frequency() != null) {
                    sb.append(", ").append(oneLine(medication.frequency()));
                }
                sb.append('\n');
            }
        }

        List<LabResult> labs = patient.labResults();
        if (!labs.isEmpty()) {
            sb.append("\nRecent Lab Results:\n");
            for (LabResult lab : labs) {
                sb.append("  - ").append(oneLine(lab.testName())).append(": ")
                        .append(number(lab.value())).append(' ').append(oneLine(lab.unit()));
                if (lab.observedOn() != null) {
                    sb.append(" (").append(lab.observedOn()).append(')');
                }
                sb.append('\n');
            }
        }
    }

    private void appendTrial(StringBuilder sb, Trial trial) {
        sb.append("Clinical Trial: ").append(trial.title == null ? trial.id : oneLine(trial.title)).append('\n');
        sb.append("NCT ID: ").append(trial.id).append('\n');
        if (trial.phase != null) {
            sb.append("Phase: ").append(trial.phase).append('\n');
        }
        if (!trial.conditions.isEmpty()) {
            sb.append("Conditions Studied: ").append(String.join("; ", trial.conditions)).append('\n');
        }
        if (trial.minimumAge != null) {
            sb.append("Minimum Age: ").append(trial.minimumAge).append('\n');
        }
        if (trial.maximumAge != null) {
            sb.append("Maximum Age: ").append(trial.maximumAge).append('\n');
        }
        if (trial.sex != null) {
            sb.append("Sex Eligible: ").append(trial.sex).append('\n');
        }

        sb.append("\nInclusion Criteria:\n");
        sb.append(trial.inclusionCriteria == null ? "(none listed)" : trial.inclusionCriteria.trim()).append('\n');
        sb.append("\nExclusion Criteria:\n");
        sb.append(trial.exclusionCriteria == null ? "(none listed)" : trial.exclusionCriteria.trim()).append('\n');
    }

    private void appendInstructions(StringBuilder sb) {
        sb.append("Your task:\n");
        sb.append("1) Parse the inclusion and exclusion criteria.\n");
        sb.append("2) Compare each criterion against the patient data above; judge only what the data states.\n");
        sb.append("3) Decide whether the patient meets ALL inclusion criteria.\n");
        sb.append("4) Decide whether the patient violates ANY exclusion criterion.\n");
        sb.append("5) An exclusion criterion that cannot apply to this patient (for example pregnancy for a male patient) counts as passed.\n");
        sb.append("6) Give an overall match score between 0.0 and 1.0 and a short explanation.\n\n");
        sb.append("Respond with a single JSON object with exactly these fields and no other text:\n");
        sb.append("{\n");
        sb.append("  \"eligible\": true,\n");
        sb.append("  \"score\": 0.85,\n");
        sb.append("  \"explanation\": \"Brief summary for the patient\",\n");
        sb.append("  \"reasoning\": \"Detailed reasoning\",\n");
        sb.append("  \"inclusion_matches\": [\"criterion met\"],\n");
        sb.append("  \"inclusion_mismatches\": [\"criterion not met\"],\n");
        sb.append("  \"exclusion_violations\": [\"exclusion violated\"],\n");
        sb.append("  \"exclusion_passes\": [\"exclusion passed\"]\n");
        sb.append("}\n\n");
        sb.append("Scoring guidance:\n");
        sb.append("- 0.9 to 1.0: strong match, all inclusion criteria met, no exclusion violated\n");
        sb.append("- 0.6 to 0.8: moderate match, some criteria unclear\n");
        sb.append("- 0.4 to 0.5: weak match, explicit mismatches\n");
        sb.append("- 0.0 to 0.3: poor match, or an exclusion criterion is violated\n");
        sb.append("If any exclusion criterion is violated, \"eligible\" must be false.\n");
    }

    private static String number(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static String oneLine(String text) {
        return text.replace("\r", " ").replace("\n", " ").trim();
    }
}
