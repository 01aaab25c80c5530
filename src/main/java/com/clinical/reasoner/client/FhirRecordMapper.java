package com.clinical.reasoner.client;

import com.clinical.reasoner.model.Dose;
import com.clinical.reasoner.model.Frequency;
import com.clinical.reasoner.model.MedicationRecord;
import com.clinical.reasoner.model.PatientContext;
import com.clinical.reasoner.model.Route;
import org.hl7.fhir.r4.model.AllergyIntolerance;
import org.hl7.fhir.r4.model.BaseDateTimeType;
import org.hl7.fhir.r4.model.CodeableConcept;
import org.hl7.fhir.r4.model.Coding;
import org.hl7.fhir.r4.model.Condition;
import org.hl7.fhir.r4.model.Dosage;
import org.hl7.fhir.r4.model.MedicationRequest;
import org.hl7.fhir.r4.model.MedicationStatement;
import org.hl7.fhir.r4.model.Period;
import org.hl7.fhir.r4.model.Quantity;
import org.hl7.fhir.r4.model.Resource;
import org.hl7.fhir.r4.model.Timing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps FHIR R4 medication, allergy and condition resources to engine inputs.
 * <p>
 * Drug names are reduced to the leading ingredient words of the coded text, so
 * "Metformin 500 MG Oral Tablet" becomes "metformin". Resources marked entered-in-error,
 * cancelled or refuted are skipped. Records whose medication cannot be named are still
 * mapped so the timeline can report them as invalid.
 */
public class FhirRecordMapper {
    private static final Logger logger = LoggerFactory.getLogger(FhirRecordMapper.class);

    // leading words up to the first strength figure
    private static final Pattern INGREDIENT_PREFIX = Pattern.compile("^([A-Za-z][A-Za-z\\-/ ]*?)\\s+\\d");

    private static final Set<String> SALT_SUFFIXES = Set.of("sodium", "potassium", "hydrochloride", "hcl",
            "calcium", "magnesium", "besylate", "succinate", "tartrate", "maleate", "mesylate");

    private static final Set<String> ACTIVE_CONDITION_STATUSES = Set.of("active", "recurrence", "relapse");
    private static final Set<String> ACTIVE_ALLERGY_STATUSES = Set.of("active");
    private static final Set<String> EXCLUDED_VERIFICATION_STATUSES = Set.of("refuted", "entered-in-error");

    private final double defaultConfidence;

    public FhirRecordMapper() {
        this(1.0);
    }

    /**
     * @param defaultConfidence Extraction confidence given to every mapped record; coded FHIR
     *                          data carries no per-field certainty of its own
     */
    public FhirRecordMapper(double defaultConfidence) {
        if (defaultConfidence < 0.0 || defaultConfidence > 1.0) {
            throw new IllegalArgumentException("Default confidence must be within [0, 1]: " + defaultConfidence);
        }
        this.defaultConfidence = defaultConfidence;
    }

    /**
     * Map all medication statements and requests in a record set
     * @param recordSet Retrieved FHIR resources
     * @return Medication records in retrieval order
     */
    public List<MedicationRecord> toRecords(PatientRecordSet recordSet) {
        if (recordSet == null) {
            throw new IllegalArgumentException("PatientRecordSet cannot be null");
        }

        List<MedicationRecord> records = new ArrayList<>();
        for (MedicationStatement statement : recordSet.getMedicationStatements()) {
            if (statement.getStatus() == MedicationStatement.MedicationStatementStatus.ENTEREDINERROR
                    || statement.getStatus() == MedicationStatement.MedicationStatementStatus.NOTTAKEN) {
                logger.debug("Skipping MedicationStatement {} with status {}", statement.getIdElement().getIdPart(),
                        statement.getStatus().toCode());
                continue;
            }
            records.add(mapStatement(statement));
        }
        for (MedicationRequest request : recordSet.getMedicationRequests()) {
            MedicationRequest.MedicationRequestStatus status = request.getStatus();
            if (status == MedicationRequest.MedicationRequestStatus.ENTEREDINERROR
                    || status == MedicationRequest.MedicationRequestStatus.CANCELLED
                    || status == MedicationRequest.MedicationRequestStatus.DRAFT) {
                logger.debug("Skipping MedicationRequest {} with status {}", request.getIdElement().getIdPart(),
                        status.toCode());
                continue;
            }
            records.add(mapRequest(request));
        }

        logger.debug("Mapped {} medication records for patient {}", records.size(), recordSet.getPatientId());
        return records;
    }

    /**
     * Build the patient context from active allergies and active conditions
     * @param recordSet Retrieved FHIR resources
     * @param asOfDate Date the evaluation is anchored to
     * @return Patient context
     */
    public PatientContext toContext(PatientRecordSet recordSet, LocalDate asOfDate) {
        if (recordSet == null) {
            throw new IllegalArgumentException("PatientRecordSet cannot be null");
        }

        List<String> allergies = new ArrayList<>();
        for (AllergyIntolerance allergy : recordSet.getAllergies()) {
            if (!hasStatus(allergy.getClinicalStatus(), ACTIVE_ALLERGY_STATUSES, true)
                    || hasStatus(allergy.getVerificationStatus(), EXCLUDED_VERIFICATION_STATUSES, false)) {
                continue;
            }
            String substance = conceptText(allergy.getCode());
            if (substance == null) {
                continue;
            }
            String entry = substance.replace(":", " ");
            String reaction = reactionText(allergy);
            if (reaction != null) {
                entry += ":" + reaction.replace(":", " ");
            }
            allergies.add(entry);
        }

        List<String> conditions = new ArrayList<>();
        for (Condition condition : recordSet.getConditions()) {
            if (!hasStatus(condition.getClinicalStatus(), ACTIVE_CONDITION_STATUSES, true)
                    || hasStatus(condition.getVerificationStatus(), EXCLUDED_VERIFICATION_STATUSES, false)) {
                continue;
            }
            String name = conceptText(condition.getCode());
            if (name != null) {
                conditions.add(name);
            }
        }

        return new PatientContext(allergies, conditions, asOfDate);
    }

    private MedicationRecord mapStatement(MedicationStatement statement) {
        MedicationRecord.Builder builder = MedicationRecord.builder()
                .drugName(ingredientName(statement.hasMedicationCodeableConcept()
                        ? conceptText(statement.getMedicationCodeableConcept())
                        : statement.hasMedicationReference() ? statement.getMedicationReference().getDisplay() : null))
                .sourcePrescriptionId(sourceId("MedicationStatement", statement))
                .extractionConfidence(defaultConfidence);

        if (statement.hasEffectivePeriod()) {
            Period period = statement.getEffectivePeriod();
            builder.observedDate(toLocalDate(period.getStartElement()));
            builder.explicitEndDate(toLocalDate(period.getEndElement()));
        } else if (statement.hasEffectiveDateTimeType()) {
            builder.observedDate(toLocalDate(statement.getEffectiveDateTimeType()));
        }
        if (statement.hasDateAsserted()) {
            builder.visitDate(toLocalDate(statement.getDateAssertedElement()));
            builder.recordedAt(toInstant(statement.getDateAsserted()));
        }
        if (statement.hasInformationSource() && statement.getInformationSource().hasDisplay()) {
            builder.prescriber(statement.getInformationSource().getDisplay());
        }
        if (statement.hasDosage()) {
            applyDosage(builder, statement.getDosageFirstRep());
        }
        for (CodeableConcept reason : statement.getReasonCode()) {
            String text = conceptText(reason);
            if (text != null) {
                builder.diagnosis(text);
            }
        }
        return builder.build();
    }

    private MedicationRecord mapRequest(MedicationRequest request) {
        MedicationRecord.Builder builder = MedicationRecord.builder()
                .drugName(ingredientName(request.hasMedicationCodeableConcept()
                        ? conceptText(request.getMedicationCodeableConcept())
                        : request.hasMedicationReference() ? request.getMedicationReference().getDisplay() : null))
                .sourcePrescriptionId(sourceId("MedicationRequest", request))
                .extractionConfidence(defaultConfidence);

        Period validity = request.hasDispenseRequest() && request.getDispenseRequest().hasValidityPeriod()
                ? request.getDispenseRequest().getValidityPeriod()
                : null;
        if (request.hasAuthoredOn()) {
            builder.observedDate(toLocalDate(request.getAuthoredOnElement()));
            builder.recordedAt(toInstant(request.getAuthoredOn()));
        } else if (validity != null && validity.hasStart()) {
            builder.observedDate(toLocalDate(validity.getStartElement()));
        }
        if (validity != null && validity.hasEnd()) {
            builder.explicitEndDate(toLocalDate(validity.getEndElement()));
        }
        if (request.hasRequester() && request.getRequester().hasDisplay()) {
            builder.prescriber(request.getRequester().getDisplay());
        }
        if (request.hasDosageInstruction()) {
            applyDosage(builder, request.getDosageInstructionFirstRep());
        }
        for (CodeableConcept reason : request.getReasonCode()) {
            String text = conceptText(reason);
            if (text != null) {
                builder.diagnosis(text);
            }
        }
        return builder.build();
    }

    private void applyDosage(MedicationRecord.Builder builder, Dosage dosage) {
        for (Dosage.DosageDoseAndRateComponent doseAndRate : dosage.getDoseAndRate()) {
            if (doseAndRate.hasDoseQuantity()) {
                Quantity quantity = doseAndRate.getDoseQuantity();
                if (quantity.hasValue()) {
                    builder.dose(new Dose(quantity.getValue(), quantity.hasUnit() ? quantity.getUnit() : quantity.getCode()));
                    break;
                }
            }
        }

        builder.frequency(frequencyOf(dosage));

        if (dosage.hasRoute()) {
            Route route = Route.fromCode(conceptText(dosage.getRoute()));
            if (route == Route.OTHER) {
                for (Coding coding : dosage.getRoute().getCoding()) {
                    route = Route.fromCode(coding.getCode());
                    if (route != Route.OTHER) {
                        break;
                    }
                }
            }
            builder.route(route);
        }
    }

    /**
     * Structured timing repeat first, then the timing code, then as-needed, then free text
     */
    static Frequency frequencyOf(Dosage dosage) {
        if (dosage.hasTiming()) {
            Timing timing = dosage.getTiming();
            if (timing.hasRepeat()) {
                Timing.TimingRepeatComponent repeat = timing.getRepeat();
                if (repeat.hasFrequency() && repeat.hasPeriod() && repeat.hasPeriodUnit()) {
                    double days = repeat.getPeriod().doubleValue() * daysPerUnit(repeat.getPeriodUnit());
                    Frequency frequency = Frequency.fromTiming(repeat.getFrequency(), days);
                    if (frequency != Frequency.UNSPECIFIED) {
                        return frequency;
                    }
                }
            }
            if (timing.hasCode()) {
                for (Coding coding : timing.getCode().getCoding()) {
                    Frequency frequency = Frequency.fromCode(coding.getCode());
                    if (frequency != Frequency.UNSPECIFIED) {
                        return frequency;
                    }
                }
                Frequency frequency = Frequency.fromCode(timing.getCode().getText());
                if (frequency != Frequency.UNSPECIFIED) {
                    return frequency;
                }
            }
        }
        if (dosage.hasAsNeededBooleanType() && dosage.getAsNeededBooleanType().booleanValue()) {
            return Frequency.AS_NEEDED;
        }
        return Frequency.fromCode(dosage.getText());
    }

    private static double daysPerUnit(Timing.UnitsOfTime unit) {
        return switch (unit) {
            case S -> 1.0 / 86400.0;
            case MIN -> 1.0 / 1440.0;
            case H -> 1.0 / 24.0;
            case D -> 1.0;
            case WK -> 7.0;
            case MO -> 30.0;
            case A -> 365.0;
            default -> 0.0;
        };
    }

    /**
     * Reduce coded medication text to its ingredient words
     * @param text Text such as "Warfarin Sodium 5 MG Oral Tablet"
     * @return "Warfarin", or the trimmed text when it has no strength figure
     */
    static String ingredientName(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        Matcher matcher = INGREDIENT_PREFIX.matcher(text.trim());
        if (matcher.find()) {
            return stripSalt(matcher.group(1).trim());
        }
        return text.trim();
    }

    private static String stripSalt(String name) {
        String[] words = name.split("\\s+");
        if (words.length > 1) {
            String last = words[words.length - 1].toLowerCase(Locale.ROOT);
            if (SALT_SUFFIXES.contains(last)) {
                return name.substring(0, name.length() - words[words.length - 1].length()).trim();
            }
        }
        return name;
    }

    private static String reactionText(AllergyIntolerance allergy) {
        for (AllergyIntolerance.AllergyIntoleranceReactionComponent reaction : allergy.getReaction()) {
            for (CodeableConcept manifestation : reaction.getManifestation()) {
                String text = conceptText(manifestation);
                if (text != null) {
                    return text;
                }
            }
        }
        return null;
    }

    /**
     * @param missingMatches Result when the status is absent
     */
    private static boolean hasStatus(CodeableConcept status, Set<String> codes, boolean missingMatches) {
        if (status == null || !status.hasCoding()) {
            return missingMatches;
        }
        return status.getCoding().stream().anyMatch(coding -> coding.hasCode() && codes.contains(coding.getCode()));
    }

    private static String conceptText(CodeableConcept concept) {
        if (concept == null) {
            return null;
        }
        if (concept.hasText() && !concept.getText().isBlank()) {
            return concept.getText();
        }
        for (Coding coding : concept.getCoding()) {
            if (coding.hasDisplay() && !coding.getDisplay().isBlank()) {
                return coding.getDisplay();
            }
        }
        return null;
    }

    private static String sourceId(String resourceType, Resource resource) {
        String idPart = resource.getIdElement().getIdPart();
        return idPart != null ? resourceType + "/" + idPart : null;
    }

    /**
     * Calendar date as written in the resource; an offset carried by the value is honoured
     * rather than the host's zone
     */
    private static LocalDate toLocalDate(BaseDateTimeType dateTime) {
        if (dateTime == null || !dateTime.hasValue()) {
            return null;
        }
        return LocalDate.of(dateTime.getYear(), dateTime.getMonth() + 1, dateTime.getDay());
    }

    private static Instant toInstant(Date date) {
        return date != null ? date.toInstant() : null;
    }
}
