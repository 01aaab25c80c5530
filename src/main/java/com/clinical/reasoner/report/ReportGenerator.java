package com.clinical.reasoner.report;

import com.clinical.reasoner.engine.EvaluationResult;
import com.clinical.reasoner.evidence.ExplainedChange;
import com.clinical.reasoner.evidence.ExplainedFinding;
import com.clinical.reasoner.model.ConcurrentUse;
import com.clinical.reasoner.model.Diagnostic;
import com.clinical.reasoner.model.Finding;
import com.clinical.reasoner.model.MedicationPeriod;
import com.clinical.reasoner.model.RiskLevel;
import com.clinical.reasoner.model.Severity;
import com.clinical.reasoner.model.TreatmentGap;
import com.clinical.reasoner.timeline.VisitComparison;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Generates formatted medication safety reports
 */
public class ReportGenerator {

    private static final String SEPARATOR = "================================================================================";
    private static final String SUB_SEPARATOR = "--------------------------------------------------------------------------------";
    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    /**
     * Generate complete report for all evaluated patients
     * @param results List of patient evaluation results
     * @return Formatted report string
     */
    public String generateReport(List<EvaluationResult> results) {
        if (results == null || results.isEmpty()) {
            return "No patients evaluated.";
        }

        StringBuilder report = new StringBuilder();

        report.append(SEPARATOR).append("\n");
        report.append("MEDICATION TIMELINE AND DRUG SAFETY REPORT\n");
        report.append("Rule catalog: ").append(results.get(0).getCatalogVersion()).append("\n");
        report.append("Date: ").append(LocalDate.now().format(DATE_FORMATTER)).append("\n");
        report.append(SEPARATOR).append("\n\n");

        report.append("PATIENT RESULTS\n");
        report.append(SUB_SEPARATOR).append("\n\n");

        for (EvaluationResult result : results) {
            report.append(formatPatientResult(result));
            report.append("\n").append(SUB_SEPARATOR).append("\n\n");
        }

        report.append(generateSummary(results));
        report.append(SEPARATOR).append("\n");

        return report.toString();
    }

    /**
     * Format one patient's timeline, changes, findings and review items
     * @param result Evaluation result
     * @return Formatted patient section
     */
    String formatPatientResult(EvaluationResult result) {
        StringBuilder sb = new StringBuilder();

        sb.append("Patient ID: ").append(result.getPatientId()).append("\n");
        sb.append("As Of: ").append(result.getAsOfDate().format(DATE_FORMATTER)).append("\n");
        sb.append("Risk Level: ").append(formatRisk(result.getRiskLevel())).append("\n\n");

        List<MedicationPeriod> periods = result.getTimeline().getAllPeriods();
        sb.append("Medication Timeline:\n");
        if (periods.isEmpty()) {
            sb.append("  (no valid medication records)\n");
        }
        for (MedicationPeriod period : periods) {
            sb.append("  ").append(period.isActiveOn(result.getAsOfDate()) ? "* " : "  ")
                    .append(period.getDrugIdentity()).append(" ").append(period.regimenText())
                    .append(" from ").append(period.getStartDate().format(DATE_FORMATTER))
                    .append(formatEnd(period)).append("\n");
        }
        for (TreatmentGap gap : result.getTimeline().getTreatmentGaps()) {
            sb.append("  Gap: ").append(gap.getDrugIdentity()).append(" not taken ")
                    .append(gap.getStoppedOn().format(DATE_FORMATTER)).append(" to ")
                    .append(gap.getResumedOn().format(DATE_FORMATTER))
                    .append(" (").append(gap.getDays()).append(" days)\n");
        }
        for (ConcurrentUse concurrent : result.getTimeline().getConcurrentUse()) {
            if (concurrent.isSignificant()) {
                sb.append("  Concurrent: ").append(concurrent.getDrugA()).append(" + ").append(concurrent.getDrugB())
                        .append(" for ").append(concurrent.getDays()).append(" days\n");
            }
        }
        sb.append("\n");

        List<ExplainedChange> visibleChanges = result.getChanges().stream()
                .filter(c -> c.getEvent().isVisible())
                .toList();
        if (!visibleChanges.isEmpty()) {
            sb.append("Medication Changes:\n");
            for (ExplainedChange change : visibleChanges) {
                sb.append("  ").append(change.getEvent().getDate().format(DATE_FORMATTER)).append(" ")
                        .append(change.getEvent().getDrugIdentity()).append(": ")
                        .append(change.getEvent().getKind().label().replace('_', ' '));
                if (change.getEvent().getPreviousValue() != null && change.getEvent().getNewValue() != null) {
                    sb.append(" (").append(change.getEvent().getPreviousValue()).append(" -> ")
                            .append(change.getEvent().getNewValue()).append(")");
                }
                sb.append(change.needsReview() ? " [review]" : "").append("\n");
            }
            sb.append("\n");
        }

        result.getVisitComparison().ifPresent(comparison -> sb.append(formatVisitComparison(comparison)));

        sb.append("Safety Findings:\n");
        if (result.getFindings().isEmpty()) {
            sb.append("  None\n");
        }
        for (ExplainedFinding explained : result.getFindings()) {
            sb.append(formatFinding(explained));
        }
        sb.append("\n");

        if (!result.getReviewQueue().isEmpty()) {
            sb.append("Needs Clinician Review:\n");
            for (ExplainedFinding explained : result.getReviewQueue().getFindings()) {
                sb.append("  ? ").append(explained.getRationale().getExplanation()).append("\n");
            }
            for (ExplainedChange change : result.getReviewQueue().getChanges()) {
                sb.append("  ? ").append(change.getRationale().getExplanation()).append("\n");
            }
            sb.append("\n");
        }

        if (!result.getDiagnostics().isEmpty()) {
            sb.append("Diagnostics:\n");
            for (Diagnostic diagnostic : result.getDiagnostics()) {
                sb.append("  - ").append(diagnostic).append("\n");
            }
        }

        return sb.toString();
    }

    /**
     * Format a single finding with severity symbol, rule and explanation
     * @param explained Finding with its rationale
     * @return Formatted finding lines
     */
    private String formatFinding(ExplainedFinding explained) {
        Finding finding = explained.getFinding();
        StringBuilder sb = new StringBuilder();

        sb.append("  ").append(getSeveritySymbol(finding.getSeverity())).append(" ");
        sb.append("[").append(finding.getSeverity().name()).append("] ");
        sb.append(finding.getKind().label().replace('_', ' ')).append(": ").append(finding.summary());
        sb.append(" (").append(finding.getRuleId()).append(", confidence ")
                .append(String.format(Locale.ROOT, "%.2f", explained.getRationale().getConfidence()))
                .append(" ").append(explained.getRationale().getBand().label()).append(")");
        sb.append("\n");

        if (explained.getRationale().getExplanation() != null) {
            sb.append("      ").append(explained.getRationale().getExplanation()).append("\n");
        }

        return sb.toString();
    }

    /**
     * Format the differences between the two latest visits
     * @param comparison Visit comparison
     * @return Formatted comparison lines
     */
    private String formatVisitComparison(VisitComparison comparison) {
        StringBuilder sb = new StringBuilder();

        sb.append("Visit Comparison (").append(comparison.getEarlierVisit().format(DATE_FORMATTER))
                .append(" -> ").append(comparison.getLaterVisit().format(DATE_FORMATTER)).append("):\n");
        appendDrugList(sb, "New", comparison.getNewDrugs());
        appendDrugList(sb, "Restarted", comparison.getRestartedDrugs());
        appendDrugList(sb, "Discontinued", comparison.getDiscontinuedDrugs());
        sb.append("  Continued: ").append(comparison.getContinuedDrugs().size()).append("\n");
        for (VisitComparison.RegimenChange change : comparison.getRegimenChanges()) {
            sb.append("  Changed: ").append(change).append("\n");
        }
        sb.append("\n");

        return sb.toString();
    }

    private void appendDrugList(StringBuilder sb, String label, List<String> drugs) {
        if (!drugs.isEmpty()) {
            sb.append("  ").append(label).append(": ").append(String.join(", ", drugs)).append("\n");
        }
    }

    private String formatEnd(MedicationPeriod period) {
        if (period.getEndDate() == null) {
            return ", ongoing";
        }
        String end = " to " + period.getEndDate().format(DATE_FORMATTER);
        return switch (period.getEndKind()) {
            case EXPLICIT -> end + " (stopped)";
            case REGIMEN_CHANGE -> end + " (regimen changed)";
            case VISIT_ABSENCE -> end + " (no longer recorded)";
            default -> end;
        };
    }

    /**
     * Get display symbol for finding severity
     * @param severity Finding severity
     * @return Symbol string
     */
    private String getSeveritySymbol(Severity severity) {
        return switch (severity) {
            case CONTRAINDICATED -> "✗";
            case MAJOR -> "!";
            case MODERATE -> "~";
            default -> "-";
        };
    }

    /**
     * Format risk level for display
     * @param riskLevel Overall risk level
     * @return Formatted risk string
     */
    private String formatRisk(RiskLevel riskLevel) {
        return switch (riskLevel) {
            case CRITICAL -> "CRITICAL - CONTRAINDICATED COMBINATION PRESENT";
            case HIGH -> "HIGH";
            case MODERATE -> "MODERATE";
            case LOW -> "LOW";
            default -> "MINIMAL";
        };
    }

    /**
     * Generate summary statistics for all results
     * @param results List of patient evaluation results
     * @return Formatted summary string
     */
    private String generateSummary(List<EvaluationResult> results) {
        StringBuilder sb = new StringBuilder();

        sb.append(SEPARATOR).append("\n");
        sb.append("SUMMARY\n");
        sb.append(SEPARATOR).append("\n\n");

        sb.append("Total Patients Evaluated: ").append(results.size()).append("\n");
        for (RiskLevel level : RiskLevel.values()) {
            long count = results.stream()
                    .filter(r -> r.getRiskLevel() == level)
                    .count();
            sb.append("  - ").append(formatRiskLabel(level)).append(": ").append(count).append("\n");
        }

        int findings = results.stream().mapToInt(r -> r.getFindings().size()).sum();
        int highPriority = results.stream().mapToInt(r -> r.getHighPriorityFindings().size()).sum();
        int review = results.stream().mapToInt(r -> r.getReviewQueue().size()).sum();
        int diagnostics = results.stream().mapToInt(r -> r.getDiagnostics().size()).sum();

        sb.append("\n");
        sb.append("Safety Findings: ").append(findings).append(" (").append(highPriority)
                .append(" major or contraindicated)\n");
        sb.append("Items Needing Clinician Review: ").append(review).append("\n");
        sb.append("Diagnostics: ").append(diagnostics).append("\n\n");

        return sb.toString();
    }

    private String formatRiskLabel(RiskLevel level) {
        String name = level.name().toLowerCase(Locale.ROOT);
        return Character.toUpperCase(name.charAt(0)) + name.substring(1) + " Risk";
    }
}
