package com.clinical.reasoner.evaluator;

import com.clinical.reasoner.catalog.ContraindicationRule;
import com.clinical.reasoner.catalog.CrossReactivityRule;
import com.clinical.reasoner.catalog.InteractionRule;
import com.clinical.reasoner.catalog.RuleCatalog;
import com.clinical.reasoner.model.AllergyEntry;
import com.clinical.reasoner.model.AllergyFinding;
import com.clinical.reasoner.model.AllergyMatch;
import com.clinical.reasoner.model.ContraindicationFinding;
import com.clinical.reasoner.model.Diagnostic;
import com.clinical.reasoner.model.DiagnosticKind;
import com.clinical.reasoner.model.DuplicateTherapyFinding;
import com.clinical.reasoner.model.Finding;
import com.clinical.reasoner.model.InteractionFinding;
import com.clinical.reasoner.model.MedicationPeriod;
import com.clinical.reasoner.model.PatientContext;
import com.clinical.reasoner.model.Severity;
import com.clinical.reasoner.model.TimelineSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Evaluates the active medication set of a timeline against the rule catalog and the
 * patient's allergies and chronic conditions.
 * <p>
 * Four checks run over the active set: pairwise interactions, allergy conflicts,
 * contraindications and duplicate therapy. Each finding's confidence is the weakest
 * involved fact's confidence times the certainty of the rule that matched.
 */
public class SafetyEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(SafetyEvaluator.class);

    private static final double DEFAULT_EXACT_RULE_CONFIDENCE = 0.95;
    private static final double DEFAULT_CLASS_RULE_CONFIDENCE = 0.75;

    // Same drug under overlapping regimens
    private static final Severity SAME_DRUG_DUPLICATE_SEVERITY = Severity.MODERATE;

    // Direct allergy matches without a milder documented reaction
    private static final Severity DIRECT_ALLERGY_SEVERITY = Severity.CONTRAINDICATED;

    private final RuleCatalog catalog;
    private final double exactRuleConfidence;
    private final double classRuleConfidence;

    public SafetyEvaluator(RuleCatalog catalog) {
        this(catalog, DEFAULT_EXACT_RULE_CONFIDENCE, DEFAULT_CLASS_RULE_CONFIDENCE);
    }

    public SafetyEvaluator(RuleCatalog catalog, double exactRuleConfidence, double classRuleConfidence) {
        if (catalog == null) {
            throw new IllegalArgumentException("RuleCatalog cannot be null");
        }
        this.catalog = catalog;
        this.exactRuleConfidence = exactRuleConfidence;
        this.classRuleConfidence = classRuleConfidence;
    }

    /**
     * Main evaluation method that runs every safety check over the active medication set
     * @param snapshot Timeline whose as-of date defines the active set
     * @param context Patient allergies and chronic conditions
     * @return Findings ordered by severity descending, then involved entities
     */
    public SafetyEvaluation evaluate(TimelineSnapshot snapshot, PatientContext context) {
        if (snapshot == null) {
            throw new IllegalArgumentException("TimelineSnapshot cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("PatientContext cannot be null");
        }

        Map<String, ActiveDrug> active = collectActiveDrugs(snapshot);
        List<Finding> findings = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();

        for (ActiveDrug drug : active.values()) {
            if (!catalog.isKnownDrug(drug.name)) {
                diagnostics.add(new Diagnostic(DiagnosticKind.CATALOG_GAP, drug.name,
                        "No class membership in catalog " + catalog.getVersion()
                                + "; only exact drug-pair rules were checked"));
            }
        }

        findings.addAll(evaluateInteractions(active));
        findings.addAll(evaluateAllergies(active, context));
        findings.addAll(evaluateContraindications(active, context));
        findings.addAll(evaluateDuplicateTherapy(active));

        findings.sort(Finding.ORDER);
        diagnostics.sort(Diagnostic.ORDER);
        logger.debug("Evaluated {} active drugs: {} findings, {} catalog gaps",
                active.size(), findings.size(), diagnostics.size());
        return new SafetyEvaluation(findings, diagnostics);
    }

    /**
     * Evaluate every unordered pair of active drugs. An exact drug-pair rule takes precedence;
     * class rules that also match are attached as supporting rules.
     */
    private List<Finding> evaluateInteractions(Map<String, ActiveDrug> active) {
        List<Finding> findings = new ArrayList<>();
        List<ActiveDrug> drugs = new ArrayList<>(active.values());

        for (int i = 0; i < drugs.size(); i++) {
            for (int j = i + 1; j < drugs.size(); j++) {
                ActiveDrug a = drugs.get(i);
                ActiveDrug b = drugs.get(j);
                List<ClassMatch> classMatches = findClassMatches(a.name, b.name);
                Optional<InteractionRule> exact = catalog.findDrugInteraction(a.name, b.name);
                double factConfidence = Math.min(a.confidence, b.confidence);
                List<String> sources = mergeSources(a, b);

                if (exact.isPresent()) {
                    InteractionRule rule = exact.get();
                    List<String> supporting = classMatches.stream().map(m -> m.rule.getId()).toList();
                    findings.add(new InteractionFinding(a.name, b.name, null, null, rule.getSeverity(),
                            rule.getId(), supporting, rule.getMechanism(), rule.getManagement(), sources,
                            factConfidence, exactRuleConfidence));
                } else if (!classMatches.isEmpty()) {
                    ClassMatch primary = classMatches.get(0);
                    List<String> supporting = classMatches.subList(1, classMatches.size()).stream()
                            .map(m -> m.rule.getId())
                            .toList();
                    findings.add(new InteractionFinding(a.name, b.name, primary.classA, primary.classB,
                            primary.rule.getSeverity(), primary.rule.getId(), supporting,
                            primary.rule.getMechanism(), primary.rule.getManagement(), sources,
                            factConfidence, classRuleConfidence));
                }
            }
        }
        return findings;
    }

    /**
     * Class rules matching any class of drugA against any class of drugB, most severe first.
     * Unknown drugs have no classes and therefore never match here.
     */
    private List<ClassMatch> findClassMatches(String drugA, String drugB) {
        Map<String, ClassMatch> byRule = new TreeMap<>();
        for (String classA : catalog.classesOf(drugA)) {
            for (String classB : catalog.classesOf(drugB)) {
                catalog.findClassInteraction(classA, classB)
                        .ifPresent(rule -> byRule.putIfAbsent(rule.getId(), new ClassMatch(rule, classA, classB)));
            }
        }
        List<ClassMatch> matches = new ArrayList<>(byRule.values());
        matches.sort(Comparator.comparing((ClassMatch m) -> m.rule.getSeverity(), Comparator.reverseOrder())
                .thenComparing(m -> m.rule.getId()));
        return matches;
    }

    /**
     * Evaluate allergies: one finding per (drug, allergen). A direct substance match outranks a
     * class match, which outranks catalog cross-reactivity.
     */
    private List<Finding> evaluateAllergies(Map<String, ActiveDrug> active, PatientContext context) {
        List<Finding> findings = new ArrayList<>();

        for (AllergyEntry allergy : context.getAllergies()) {
            String allergen = allergy.getSubstance();
            List<CrossReactivityRule> crossRules = catalog.crossReactivityFor(allergen);

            for (ActiveDrug drug : active.values()) {
                SortedSet<String> classes = catalog.classesOf(drug.name);
                List<CrossReactivityRule> crossMatches = crossRules.stream()
                        .filter(r -> r.getDrugOrClass().equals(drug.name) || classes.contains(r.getDrugOrClass()))
                        .sorted(Comparator.comparing(CrossReactivityRule::getSeverity, Comparator.reverseOrder())
                                .thenComparing(CrossReactivityRule::getId))
                        .toList();
                List<String> crossIds = crossMatches.stream().map(CrossReactivityRule::getId).toList();

                if (allergen.equals(drug.name)) {
                    findings.add(new AllergyFinding(drug.name, allergy, AllergyMatch.SUBSTANCE,
                            directAllergySeverity(allergy), "ALLERGY:" + allergen, crossIds,
                            "Patient has a recorded allergy to " + allergen + describeReaction(allergy),
                            "Avoid " + drug.name + " and choose an alternative outside the allergen",
                            drug.sources, drug.confidence, exactRuleConfidence));
                } else if (classes.contains(allergen)) {
                    findings.add(new AllergyFinding(drug.name, allergy, AllergyMatch.DRUG_CLASS,
                            directAllergySeverity(allergy), "ALLERGY-CLASS:" + allergen, crossIds,
                            drug.name + " belongs to " + allergen + ", a class the patient is allergic to"
                                    + describeReaction(allergy),
                            "Avoid all " + allergen + " agents",
                            drug.sources, drug.confidence, classRuleConfidence));
                } else if (!crossMatches.isEmpty()) {
                    CrossReactivityRule rule = crossMatches.get(0);
                    findings.add(new AllergyFinding(drug.name, allergy, AllergyMatch.CROSS_REACTIVITY,
                            rule.getSeverity(), rule.getId(), crossIds.subList(1, crossIds.size()),
                            rule.getMechanism(), rule.getManagement(),
                            drug.sources, drug.confidence, classRuleConfidence));
                }
            }
        }
        return findings;
    }

    /**
     * A documented reaction type may carry a milder severity than an outright contraindication
     */
    private Severity directAllergySeverity(AllergyEntry allergy) {
        Optional<Severity> reaction = catalog.reactionSeverity(allergy.getReactionType());
        if (reaction.isPresent() && !reaction.get().isAtLeast(DIRECT_ALLERGY_SEVERITY)) {
            return reaction.get();
        }
        return DIRECT_ALLERGY_SEVERITY;
    }

    private String describeReaction(AllergyEntry allergy) {
        return allergy.getReactionType() == null ? "" : " (reaction: " + allergy.getReactionType() + ")";
    }

    /**
     * Evaluate contraindications: one finding per (drug, condition). Rules naming the drug itself
     * outrank rules naming one of its classes.
     */
    private List<Finding> evaluateContraindications(Map<String, ActiveDrug> active, PatientContext context) {
        List<Finding> findings = new ArrayList<>();
        Comparator<ContraindicationRule> mostSevere = Comparator
                .comparing(ContraindicationRule::getSeverity, Comparator.reverseOrder())
                .thenComparing(ContraindicationRule::getId);

        for (String condition : context.getChronicConditions()) {
            List<ContraindicationRule> rules = catalog.contraindicationsFor(condition);
            if (rules.isEmpty()) {
                continue;
            }
            for (ActiveDrug drug : active.values()) {
                SortedSet<String> classes = catalog.classesOf(drug.name);
                List<ContraindicationRule> exact = rules.stream()
                        .filter(r -> r.getDrugOrClass().equals(drug.name))
                        .sorted(mostSevere)
                        .toList();
                List<ContraindicationRule> byClass = rules.stream()
                        .filter(r -> classes.contains(r.getDrugOrClass()))
                        .sorted(mostSevere)
                        .toList();
                if (exact.isEmpty() && byClass.isEmpty()) {
                    continue;
                }

                List<ContraindicationRule> ranked = new ArrayList<>(exact);
                ranked.addAll(byClass);
                ContraindicationRule primary = ranked.get(0);
                List<String> supporting = ranked.subList(1, ranked.size()).stream()
                        .map(ContraindicationRule::getId)
                        .toList();
                double ruleConfidence = exact.isEmpty() ? classRuleConfidence : exactRuleConfidence;

                findings.add(new ContraindicationFinding(drug.name, condition, primary.getDrugOrClass(),
                        primary.getSeverity(), primary.getId(), supporting, primary.getMechanism(),
                        primary.getManagement(), drug.sources, drug.confidence, ruleConfidence));
            }
        }
        return findings;
    }

    /**
     * Evaluate duplicate therapy: two or more active drugs sharing a therapeutic class, unless the
     * class is exempt or an allowlisted combination covers them, and any drug active under two
     * overlapping regimens.
     */
    private List<Finding> evaluateDuplicateTherapy(Map<String, ActiveDrug> active) {
        List<Finding> findings = new ArrayList<>();

        Map<String, SortedSet<String>> membersByClass = new TreeMap<>();
        for (ActiveDrug drug : active.values()) {
            for (String cls : catalog.classesOf(drug.name)) {
                membersByClass.computeIfAbsent(cls, k -> new TreeSet<>()).add(drug.name);
            }
        }

        for (Map.Entry<String, SortedSet<String>> entry : membersByClass.entrySet()) {
            String cls = entry.getKey();
            SortedSet<String> members = entry.getValue();
            if (members.size() < 2 || catalog.isDuplicateExempt(cls)) {
                continue;
            }
            if (catalog.findAllowedCombination(members).isPresent()) {
                logger.debug("Duplicate {} therapy {} covered by an allowed combination", cls, members);
                continue;
            }
            List<ActiveDrug> involved = members.stream().map(active::get).toList();
            double factConfidence = involved.stream().mapToDouble(d -> d.confidence).min().orElse(1.0);
            List<String> sources = involved.stream()
                    .flatMap(d -> d.sources.stream())
                    .sorted()
                    .distinct()
                    .toList();
            findings.add(new DuplicateTherapyFinding(new ArrayList<>(members), cls, catalog.duplicateSeverity(cls),
                    "DUP:" + cls,
                    members.size() + " active drugs share therapeutic class " + cls,
                    "Confirm that more than one " + cls + " agent is intended",
                    sources, factConfidence, classRuleConfidence));
        }

        for (ActiveDrug drug : active.values()) {
            if (drug.periods.size() < 2) {
                continue;
            }
            String regimens = drug.periods.stream()
                    .map(MedicationPeriod::regimenText)
                    .collect(Collectors.joining(" and "));
            findings.add(new DuplicateTherapyFinding(List.of(drug.name), null, SAME_DRUG_DUPLICATE_SEVERITY,
                    "DUP:" + drug.name,
                    drug.name + " is active under overlapping regimens: " + regimens,
                    "Confirm which " + drug.name + " regimen is current and discontinue the other",
                    drug.sources, drug.confidence, exactRuleConfidence));
        }
        return findings;
    }

    private Map<String, ActiveDrug> collectActiveDrugs(TimelineSnapshot snapshot) {
        Map<String, ActiveDrug> active = new TreeMap<>();
        for (MedicationPeriod period : snapshot.getActivePeriods()) {
            active.computeIfAbsent(period.getDrugIdentity(), ActiveDrug::new).add(period);
        }
        return active;
    }

    private static List<String> mergeSources(ActiveDrug a, ActiveDrug b) {
        TreeSet<String> sources = new TreeSet<>(a.sources);
        sources.addAll(b.sources);
        return new ArrayList<>(sources);
    }

    /**
     * A drug in the active set with the periods that make it active
     */
    private static final class ActiveDrug {
        private final String name;
        private final List<MedicationPeriod> periods = new ArrayList<>();
        private final List<String> sources = new ArrayList<>();
        private double confidence = 1.0;

        ActiveDrug(String name) {
            this.name = name;
        }

        void add(MedicationPeriod period) {
            periods.add(period);
            for (String id : period.getSourceRecordIds()) {
                if (!sources.contains(id)) {
                    sources.add(id);
                }
            }
            sources.sort(null);
            confidence = Math.min(confidence, period.getConfidence());
        }
    }

    private static final class ClassMatch {
        private final InteractionRule rule;
        private final String classA;
        private final String classB;

        ClassMatch(InteractionRule rule, String classA, String classB) {
            this.rule = rule;
            this.classA = classA;
            this.classB = classB;
        }
    }
}
