package com.clinical.reasoner.catalog;

import com.clinical.reasoner.model.PatientContext;
import com.clinical.reasoner.model.Severity;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Loads the rule catalog from JSON. Any missing section entry field, unknown severity,
 * duplicate rule id or duplicate rule pair aborts the load with {@link CatalogLoadException};
 * a catalog is either loaded completely or not at all.
 */
public class CatalogLoader {

    private static final Logger logger = LoggerFactory.getLogger(CatalogLoader.class);

    private final ObjectMapper objectMapper;

    public CatalogLoader() {
        this(new ObjectMapper());
    }

    public CatalogLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Load a catalog bundled on the classpath
     * @param resource Classpath resource such as "catalog/rule-catalog.json"
     * @return Loaded catalog
     */
    public RuleCatalog fromClasspath(String resource) {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new CatalogLoadException("Rule catalog not found on classpath: " + resource);
            }
            return parse(in, resource);
        } catch (IOException e) {
            throw new CatalogLoadException("Failed to read rule catalog " + resource + ": " + e.getMessage(), e);
        }
    }

    /**
     * Load a catalog from a file
     * @param path JSON file
     * @return Loaded catalog
     */
    public RuleCatalog fromPath(Path path) {
        if (path == null || !Files.isReadable(path)) {
            throw new CatalogLoadException("Rule catalog file is not readable: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return parse(in, path.toString());
        } catch (IOException e) {
            throw new CatalogLoadException("Failed to read rule catalog " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parse catalog JSON from a stream
     * @param in JSON stream
     * @param source Description of the source for error messages
     * @return Loaded catalog
     */
    public RuleCatalog parse(InputStream in, String source) {
        JsonNode root;
        try {
            root = objectMapper.readTree(in);
        } catch (IOException e) {
            throw new CatalogLoadException("Corrupt rule catalog " + source + ": " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new CatalogLoadException("Rule catalog " + source + " is empty or not a JSON object");
        }

        RuleCatalog.Builder builder = new RuleCatalog.Builder();
        Set<String> ruleIds = new HashSet<>();

        builder.version(requiredText(root, "version", source));

        for (JsonNode node : array(root, "drugClasses", source, true)) {
            builder.addMembership(identifier(node, "drug", source), identifier(node, "class", source));
        }

        for (JsonNode node : array(root, "therapeuticClasses", source, false)) {
            String cls = identifier(node, "class", source);
            if (node.hasNonNull("duplicateSeverity")) {
                builder.addDuplicateSeverity(cls, severity(node, "duplicateSeverity", source));
            }
        }

        for (JsonNode node : array(root, "drugInteractions", source, true)) {
            String a = identifier(node, "drugA", source);
            String b = identifier(node, "drugB", source);
            if (a.equals(b)) {
                throw new CatalogLoadException("Drug interaction pairs a drug with itself in " + source + ": " + a);
            }
            InteractionRule rule = new InteractionRule(
                    ruleId(node, "DDI:" + pairName(a, b), ruleIds, source), a, b,
                    severity(node, "severity", source),
                    requiredText(node, "mechanism", source),
                    optionalText(node, "management"),
                    optionalText(node, "evidence"),
                    false);
            if (builder.addDrugPair(rule) != null) {
                throw new CatalogLoadException("Duplicate drug interaction for " + pairName(a, b) + " in " + source);
            }
        }

        for (JsonNode node : array(root, "classInteractions", source, true)) {
            String a = identifier(node, "classA", source);
            String b = identifier(node, "classB", source);
            InteractionRule rule = new InteractionRule(
                    ruleId(node, "CLS:" + pairName(a, b), ruleIds, source), a, b,
                    severity(node, "severity", source),
                    requiredText(node, "mechanism", source),
                    optionalText(node, "management"),
                    optionalText(node, "evidence"),
                    true);
            if (builder.addClassPair(rule) != null) {
                throw new CatalogLoadException("Duplicate class interaction for " + pairName(a, b) + " in " + source);
            }
        }

        for (JsonNode node : array(root, "contraindications", source, true)) {
            String target = identifier(node, "drugOrClass", source);
            String condition = PatientContext.normalizeCondition(requiredText(node, "condition", source));
            builder.addContraindication(new ContraindicationRule(
                    ruleId(node, "CI:" + target + "@" + condition, ruleIds, source),
                    target, condition,
                    severity(node, "severity", source),
                    requiredText(node, "mechanism", source),
                    optionalText(node, "management")));
        }

        for (JsonNode node : array(root, "allergyCrossReactivity", source, false)) {
            String allergen = identifier(node, "allergen", source);
            String target = identifier(node, "drugOrClass", source);
            builder.addCrossReactivity(new CrossReactivityRule(
                    ruleId(node, "XR:" + allergen + ">" + target, ruleIds, source),
                    allergen, target,
                    severity(node, "severity", source),
                    requiredText(node, "mechanism", source),
                    optionalText(node, "management")));
        }

        for (JsonNode node : array(root, "allergyReactionSeverity", source, false)) {
            builder.addReactionSeverity(identifier(node, "reaction", source), severity(node, "severity", source));
        }

        for (JsonNode node : array(root, "combinationAllowlist", source, false)) {
            List<String> members = new ArrayList<>();
            JsonNode membersNode = node.get("members");
            if (membersNode == null || !membersNode.isArray() || membersNode.size() < 2) {
                throw new CatalogLoadException("Combination allowlist entry needs at least two members in " + source);
            }
            for (JsonNode member : membersNode) {
                members.add(normalize(member.asText()));
            }
            builder.addCombination(new CombinationRule(
                    ruleId(node, "COMBO:" + String.join("+", members.stream().sorted().toList()), ruleIds, source),
                    members, optionalText(node, "reason")));
        }

        for (JsonNode node : array(root, "duplicateExemptClasses", source, false)) {
            builder.addExemptClass(normalize(node.asText()));
        }

        RuleCatalog catalog = builder.build();
        logger.info("Loaded rule catalog {} (version {}, {} rules)", source, catalog.getVersion(), catalog.getRuleCount());
        return catalog;
    }

    private Iterable<JsonNode> array(JsonNode root, String field, String source, boolean required) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            if (required) {
                throw new CatalogLoadException("Rule catalog " + source + " is missing section '" + field + "'");
            }
            return List.of();
        }
        if (!node.isArray()) {
            throw new CatalogLoadException("Section '" + field + "' in " + source + " must be an array");
        }
        return node;
    }

    private String ruleId(JsonNode node, String generated, Set<String> seen, String source) {
        String id = node.hasNonNull("id") ? node.get("id").asText().trim() : generated;
        if (id.isEmpty()) {
            id = generated;
        }
        if (!seen.add(id)) {
            throw new CatalogLoadException("Duplicate rule id '" + id + "' in " + source);
        }
        return id;
    }

    private Severity severity(JsonNode node, String field, String source) {
        String raw = requiredText(node, field, source);
        try {
            return Severity.fromString(raw);
        } catch (IllegalArgumentException e) {
            throw new CatalogLoadException("Unknown severity '" + raw + "' in " + source, e);
        }
    }

    private String identifier(JsonNode node, String field, String source) {
        return normalize(requiredText(node, field, source));
    }

    private String requiredText(JsonNode node, String field, String source) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            throw new CatalogLoadException("Missing required field '" + field + "' in " + source + ": " + node);
        }
        return value.asText().trim();
    }

    private String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText().trim();
    }

    private static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }

    private static String pairName(String a, String b) {
        return a.compareTo(b) <= 0 ? a + "+" + b : b + "+" + a;
    }
}
