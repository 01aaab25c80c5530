package com.clinical.reasoner.evidence;

import com.clinical.reasoner.model.AllergyFinding;
import com.clinical.reasoner.model.ChangeEvent;
import com.clinical.reasoner.model.ContraindicationFinding;
import com.clinical.reasoner.model.Finding;
import com.clinical.reasoner.model.InteractionFinding;
import com.clinical.reasoner.model.MedicationPeriod;
import com.clinical.reasoner.model.TimelineSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Wraps findings and change events with rationales.
 * <p>
 * Items whose confidence is below the review threshold are never given a clinical explanation.
 * Findings below the threshold leave the headline list and go to the review queue only; change
 * events below it stay in the timeline and are also queued.
 */
public class EvidenceComposer {

    private static final Logger logger = LoggerFactory.getLogger(EvidenceComposer.class);

    private static final double DEFAULT_REVIEW_THRESHOLD = 0.4;

    private final double reviewThreshold;

    public EvidenceComposer() {
        this(DEFAULT_REVIEW_THRESHOLD);
    }

    public EvidenceComposer(double reviewThreshold) {
        if (reviewThreshold < 0.0 || reviewThreshold > 1.0) {
            throw new IllegalArgumentException("Review threshold must be within [0, 1]: " + reviewThreshold);
        }
        this.reviewThreshold = reviewThreshold;
    }

    /**
     * Compose rationales for one evaluation
     * @param findings Findings in finding order
     * @param events Change events in timeline order
     * @param snapshot Timeline the findings were evaluated against
     * @return Headline findings, explained changes and the review queue
     */
    public ComposedEvidence compose(List<Finding> findings, List<ChangeEvent> events, TimelineSnapshot snapshot) {
        if (findings == null || events == null || snapshot == null) {
            throw new IllegalArgumentException("Findings, events and snapshot cannot be null");
        }

        List<ExplainedFinding> headline = new ArrayList<>();
        List<ExplainedFinding> reviewFindings = new ArrayList<>();
        for (Finding finding : findings) {
            ExplainedFinding explained = new ExplainedFinding(finding, explainFinding(finding, snapshot));
            if (explained.needsReview()) {
                reviewFindings.add(explained);
            } else {
                headline.add(explained);
            }
        }

        List<ExplainedChange> changes = new ArrayList<>();
        List<ExplainedChange> reviewChanges = new ArrayList<>();
        for (ChangeEvent event : events) {
            ExplainedChange explained = new ExplainedChange(event, explainChange(event));
            changes.add(explained);
            if (explained.needsReview() && event.isVisible()) {
                reviewChanges.add(explained);
            }
        }

        if (!reviewFindings.isEmpty() || !reviewChanges.isEmpty()) {
            logger.debug("{} findings and {} changes below review threshold {}",
                    reviewFindings.size(), reviewChanges.size(), reviewThreshold);
        }
        return new ComposedEvidence(headline, changes, new ReviewQueue(reviewFindings, reviewChanges));
    }

    public double getReviewThreshold() {
        return reviewThreshold;
    }

    private Rationale explainFinding(Finding finding, TimelineSnapshot snapshot) {
        List<EvidenceFact> facts = new ArrayList<>();
        String ruleDetail = finding.getSeverity().label();
        if (finding instanceof InteractionFinding interaction && !interaction.isExactMatch()) {
            ruleDetail += ", " + interaction.getClassA() + " + " + interaction.getClassB();
        }
        facts.add(new EvidenceFact(EvidenceFact.Kind.RULE, finding.getRuleId(), ruleDetail));
        for (String supporting : finding.getSupportingRuleIds()) {
            facts.add(new EvidenceFact(EvidenceFact.Kind.SUPPORTING_RULE, supporting, ""));
        }
        for (String entity : finding.getInvolvedEntities()) {
            for (MedicationPeriod period : snapshot.getPeriods(entity)) {
                if (period.isActiveOn(snapshot.getAsOfDate())) {
                    facts.add(new EvidenceFact(EvidenceFact.Kind.PERIOD, entity, period.toString()));
                }
            }
        }
        for (String recordId : finding.getSourceRecordIds()) {
            facts.add(new EvidenceFact(EvidenceFact.Kind.RECORD, recordId, ""));
        }
        if (finding instanceof AllergyFinding allergy) {
            facts.add(new EvidenceFact(EvidenceFact.Kind.ALLERGY, allergy.getAllergy().getSubstance(),
                    allergy.getAllergy() + ", " + allergy.getMatch().name().toLowerCase(Locale.ROOT) + " match"));
        } else if (finding instanceof ContraindicationFinding contraindication) {
            facts.add(new EvidenceFact(EvidenceFact.Kind.CONDITION, contraindication.getCondition(),
                    "matched on " + contraindication.getMatchedOn()));
        }
        facts.sort(EvidenceFact.ORDER);

        double confidence = finding.getConfidence();
        if (confidence < reviewThreshold) {
            return new Rationale(facts, reviewNote(confidence, finding.getKind().label() + " " + finding.summary()),
                    null, null, confidence, false);
        }

        StringBuilder explanation = new StringBuilder();
        explanation.append(capitalize(finding.getSeverity().label())).append(' ')
                .append(finding.getKind().label().replace('_', ' ')).append(": ")
                .append(finding.summary()).append('.');
        if (!finding.getMechanism().isEmpty()) {
            explanation.append(' ').append(sentence(finding.getMechanism()));
        }
        if (!finding.getRecommendation().isEmpty()) {
            explanation.append(" Recommended: ").append(sentence(finding.getRecommendation()));
        }
        explanation.append(" Confidence ").append(format(confidence))
                .append(" (").append(ConfidenceBand.of(confidence).label()).append(") from fact confidence ")
                .append(format(finding.getFactConfidence())).append(" x rule confidence ")
                .append(format(finding.getRuleConfidence())).append('.');

        return new Rationale(facts, explanation.toString(), finding.getMechanism(), finding.getRecommendation(),
                confidence, true);
    }

    private Rationale explainChange(ChangeEvent event) {
        List<EvidenceFact> facts = new ArrayList<>();
        for (String recordId : event.getSourceRecordIds()) {
            facts.add(new EvidenceFact(EvidenceFact.Kind.RECORD, recordId, ""));
        }
        for (String recordId : event.getConflictingRecordIds()) {
            facts.add(new EvidenceFact(EvidenceFact.Kind.CONFLICTING_RECORD, recordId, "same-day regimen conflict"));
        }
        if (event.getGap() != null) {
            facts.add(new EvidenceFact(EvidenceFact.Kind.TREATMENT_GAP, event.getDrugIdentity(),
                    event.getGap().toString()));
        }
        facts.sort(EvidenceFact.ORDER);

        double confidence = event.getConfidence();
        if (confidence < reviewThreshold) {
            return new Rationale(facts, reviewNote(confidence, event.toString()), null, null, confidence, false);
        }

        StringBuilder explanation = new StringBuilder();
        explanation.append(capitalize(event.getDrugIdentity())).append(' ')
                .append(event.getKind().label().replace('_', ' '))
                .append(" on ").append(event.getDate());
        if (event.getPreviousValue() != null && event.getNewValue() != null
                && !event.getPreviousValue().equals(event.getNewValue())) {
            explanation.append(" from ").append(event.getPreviousValue()).append(" to ").append(event.getNewValue());
        } else if (event.getNewValue() != null) {
            explanation.append(" at ").append(event.getNewValue());
        } else if (event.getPreviousValue() != null) {
            explanation.append(" after ").append(event.getPreviousValue());
        }
        explanation.append('.');
        if (event.getGap() != null) {
            explanation.append(" Not taken for ").append(event.getGap().getDays()).append(" days.");
        }
        if (event.isAmbiguous()) {
            explanation.append(" Records on this date disagreed; the most recently recorded one was used.");
        }
        if (event.isOverlapping()) {
            explanation.append(" The new regimen overlaps the previous one.");
        }
        explanation.append(" Confidence ").append(format(confidence))
                .append(" (").append(ConfidenceBand.of(confidence).label()).append(").");

        return new Rationale(facts, explanation.toString(), null, null, confidence, true);
    }

    private String reviewNote(double confidence, String subject) {
        return "Needs clinician review: confidence " + format(confidence) + " is below the review threshold "
                + format(reviewThreshold) + " for " + subject;
    }

    private static String sentence(String text) {
        String trimmed = text.trim();
        return trimmed.endsWith(".") ? trimmed : trimmed + ".";
    }

    private static String capitalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
