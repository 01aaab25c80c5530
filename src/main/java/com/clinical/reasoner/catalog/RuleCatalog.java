package com.clinical.reasoner.catalog;

import com.clinical.reasoner.model.Severity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Immutable, versioned rule tables used by the safety evaluator.
 * <p>
 * Drug and class identifiers are interned to integer indices at load time. Class membership is
 * an array indexed by drug index; pair rules are keyed by the packed unordered index pair, so
 * every lookup is a hash or array access. Instances are never mutated after construction and
 * can be shared by any number of concurrent evaluations.
 */
public final class RuleCatalog {

    private static final Severity DEFAULT_DUPLICATE_SEVERITY = Severity.MODERATE;

    private final String version;
    private final Map<String, Integer> drugIndex;
    private final Map<String, Integer> classIndex;
    private final String[] classNames;
    private final int[][] classesByDrug;
    private final Map<Long, InteractionRule> drugPairs;
    private final Map<Long, InteractionRule> classPairs;
    private final Map<String, List<ContraindicationRule>> contraindicationsByCondition;
    private final Map<String, List<CrossReactivityRule>> crossReactivityByAllergen;
    private final Map<String, Severity> reactionSeverity;
    private final Map<String, Severity> duplicateSeverity;
    private final List<CombinationRule> combinationAllowlist;
    private final Set<String> duplicateExemptClasses;
    private final int ruleCount;

    RuleCatalog(String version,
                Map<String, Integer> drugIndex,
                Map<String, Integer> classIndex,
                int[][] classesByDrug,
                Map<Long, InteractionRule> drugPairs,
                Map<Long, InteractionRule> classPairs,
                Map<String, List<ContraindicationRule>> contraindicationsByCondition,
                Map<String, List<CrossReactivityRule>> crossReactivityByAllergen,
                Map<String, Severity> reactionSeverity,
                Map<String, Severity> duplicateSeverity,
                List<CombinationRule> combinationAllowlist,
                Set<String> duplicateExemptClasses) {
        this.version = version;
        this.drugIndex = Map.copyOf(drugIndex);
        this.classIndex = Map.copyOf(classIndex);
        this.classNames = new String[classIndex.size()];
        classIndex.forEach((name, idx) -> this.classNames[idx] = name);
        this.classesByDrug = new int[classesByDrug.length][];
        for (int i = 0; i < classesByDrug.length; i++) {
            this.classesByDrug[i] = classesByDrug[i] != null ? classesByDrug[i].clone() : new int[0];
        }
        this.drugPairs = Map.copyOf(drugPairs);
        this.classPairs = Map.copyOf(classPairs);
        this.contraindicationsByCondition = copyOfLists(contraindicationsByCondition);
        this.crossReactivityByAllergen = copyOfLists(crossReactivityByAllergen);
        this.reactionSeverity = Map.copyOf(reactionSeverity);
        this.duplicateSeverity = Map.copyOf(duplicateSeverity);
        this.combinationAllowlist = List.copyOf(combinationAllowlist);
        this.duplicateExemptClasses = Set.copyOf(duplicateExemptClasses);
        this.ruleCount = drugPairs.size() + classPairs.size()
                + contraindicationsByCondition.values().stream().mapToInt(List::size).sum()
                + crossReactivityByAllergen.values().stream().mapToInt(List::size).sum()
                + combinationAllowlist.size();
    }

    /**
     * Pack two interned indices into an order-independent key
     */
    static long pairKey(int a, int b) {
        int lo = Math.min(a, b);
        int hi = Math.max(a, b);
        return ((long) lo << 32) | (hi & 0xffffffffL);
    }

    public String getVersion() {
        return version;
    }

    public int getRuleCount() {
        return ruleCount;
    }

    /**
     * A drug is known when the class-membership table lists at least one class for it
     * @param drug Drug identity
     * @return true if the drug has class membership
     */
    public boolean isKnownDrug(String drug) {
        Integer idx = drugIndex.get(drug);
        return idx != null && idx < classesByDrug.length && classesByDrug[idx].length > 0;
    }

    /**
     * @param drug Drug identity
     * @return Therapeutic classes of the drug in lexical order, empty when unknown
     */
    public SortedSet<String> classesOf(String drug) {
        Integer idx = drugIndex.get(drug);
        TreeSet<String> classes = new TreeSet<>();
        if (idx == null || idx >= classesByDrug.length) {
            return classes;
        }
        for (int c : classesByDrug[idx]) {
            classes.add(classNames[c]);
        }
        return classes;
    }

    /**
     * Exact drug-drug rule, independent of argument order
     */
    public Optional<InteractionRule> findDrugInteraction(String drugA, String drugB) {
        Integer a = drugIndex.get(drugA);
        Integer b = drugIndex.get(drugB);
        if (a == null || b == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(drugPairs.get(pairKey(a, b)));
    }

    /**
     * Class-level rule, independent of argument order
     */
    public Optional<InteractionRule> findClassInteraction(String classA, String classB) {
        Integer a = classIndex.get(classA);
        Integer b = classIndex.get(classB);
        if (a == null || b == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(classPairs.get(pairKey(a, b)));
    }

    public List<ContraindicationRule> contraindicationsFor(String condition) {
        return contraindicationsByCondition.getOrDefault(condition, List.of());
    }

    public List<CrossReactivityRule> crossReactivityFor(String allergen) {
        return crossReactivityByAllergen.getOrDefault(allergen, List.of());
    }

    /**
     * Severity the catalog assigns to a reaction type, e.g. a mild rash history
     */
    public Optional<Severity> reactionSeverity(String reactionType) {
        if (reactionType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(reactionSeverity.get(reactionType));
    }

    public Severity duplicateSeverity(String therapeuticClass) {
        return duplicateSeverity.getOrDefault(therapeuticClass, DEFAULT_DUPLICATE_SEVERITY);
    }

    public boolean isDuplicateExempt(String therapeuticClass) {
        return duplicateExemptClasses.contains(therapeuticClass);
    }

    /**
     * @param drugs Active drugs sharing a class
     * @return The first allowlisted combination covering all of them
     */
    public Optional<CombinationRule> findAllowedCombination(Collection<String> drugs) {
        for (CombinationRule rule : combinationAllowlist) {
            if (rule.covers(drugs)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    private static <T> Map<String, List<T>> copyOfLists(Map<String, List<T>> source) {
        Map<String, List<T>> copy = new HashMap<>();
        source.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Mutable accumulator used by {@link CatalogLoader}; interns identifiers as they are added.
     */
    static final class Builder {
        private String version = "unversioned";
        private final Map<String, Integer> drugIndex = new HashMap<>();
        private final Map<String, Integer> classIndex = new HashMap<>();
        private final Map<Integer, TreeSet<Integer>> membership = new HashMap<>();
        private final Map<Long, InteractionRule> drugPairs = new HashMap<>();
        private final Map<Long, InteractionRule> classPairs = new HashMap<>();
        private final Map<String, List<ContraindicationRule>> contraindications = new HashMap<>();
        private final Map<String, List<CrossReactivityRule>> crossReactivity = new HashMap<>();
        private final Map<String, Severity> reactionSeverity = new HashMap<>();
        private final Map<String, Severity> duplicateSeverity = new HashMap<>();
        private final List<CombinationRule> allowlist = new ArrayList<>();
        private final Set<String> exemptClasses = new HashSet<>();

        Builder version(String version) {
            this.version = version;
            return this;
        }

        int internDrug(String drug) {
            return drugIndex.computeIfAbsent(drug, d -> drugIndex.size());
        }

        int internClass(String cls) {
            return classIndex.computeIfAbsent(cls, c -> classIndex.size());
        }

        void addMembership(String drug, String cls) {
            int d = internDrug(drug);
            int c = internClass(cls);
            membership.computeIfAbsent(d, k -> new TreeSet<>()).add(c);
        }

        /**
         * @return the previously registered rule for the same pair, or null
         */
        InteractionRule addDrugPair(InteractionRule rule) {
            return drugPairs.putIfAbsent(pairKey(internDrug(rule.getFirst()), internDrug(rule.getSecond())), rule);
        }

        InteractionRule addClassPair(InteractionRule rule) {
            return classPairs.putIfAbsent(pairKey(internClass(rule.getFirst()), internClass(rule.getSecond())), rule);
        }

        void addContraindication(ContraindicationRule rule) {
            contraindications.computeIfAbsent(rule.getCondition(), k -> new ArrayList<>()).add(rule);
        }

        void addCrossReactivity(CrossReactivityRule rule) {
            crossReactivity.computeIfAbsent(rule.getAllergen(), k -> new ArrayList<>()).add(rule);
        }

        void addReactionSeverity(String reaction, Severity severity) {
            reactionSeverity.put(reaction, severity);
        }

        void addDuplicateSeverity(String cls, Severity severity) {
            internClass(cls);
            duplicateSeverity.put(cls, severity);
        }

        void addCombination(CombinationRule rule) {
            allowlist.add(rule);
        }

        void addExemptClass(String cls) {
            exemptClasses.add(cls);
        }

        RuleCatalog build() {
            int[][] classesByDrug = new int[drugIndex.size()][];
            for (int d = 0; d < classesByDrug.length; d++) {
                TreeSet<Integer> classes = membership.get(d);
                classesByDrug[d] = classes == null
                        ? new int[0]
                        : classes.stream().mapToInt(Integer::intValue).toArray();
            }
            return new RuleCatalog(version, drugIndex, classIndex, classesByDrug, drugPairs, classPairs,
                    contraindications, crossReactivity, reactionSeverity, duplicateSeverity, allowlist,
                    exemptClasses);
        }
    }
}
