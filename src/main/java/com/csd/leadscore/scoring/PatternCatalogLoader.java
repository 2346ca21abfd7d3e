package com.csd.leadscore.scoring;

import com.csd.leadscore.exception.PatternCatalogException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Reads and validates the JSON pattern catalog. Any structural problem is reported as a
 * {@link PatternCatalogException}; a half-loaded catalog is never returned.
 */
@Slf4j
public class PatternCatalogLoader {

    public static final String DEFAULT_RESOURCE = "lead-patterns.json";

    private final ObjectMapper objectMapper;

    public PatternCatalogLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Load the catalog bundled on the classpath.
     */
    public static PatternCatalog loadDefault() {
        PatternCatalogLoader loader = new PatternCatalogLoader(new ObjectMapper());
        try (InputStream in = PatternCatalogLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new PatternCatalogException("Pattern catalog resource not found: " + DEFAULT_RESOURCE);
            }
            return loader.load(in);
        } catch (IOException e) {
            throw new PatternCatalogException("Failed to read pattern catalog " + DEFAULT_RESOURCE, e);
        }
    }

    public PatternCatalog load(InputStream in) {
        JsonNode root;
        try {
            root = objectMapper.readTree(in);
        } catch (IOException e) {
            throw new PatternCatalogException("Pattern catalog is not valid JSON: " + e.getMessage(), e);
        }
        return parse(root);
    }

    public PatternCatalog parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new PatternCatalogException("Pattern catalog must be a JSON object");
        }

        JsonNode keywords = required(root, "keywords");
        JsonNode roles = required(root, "roles");
        JsonNode executive = required(roles, "executive");
        JsonNode decisionMaker = required(roles, "decisionMaker");
        JsonNode companySize = required(root, "companySize");
        JsonNode scale = required(root, "scale");

        PatternCatalog catalog = PatternCatalog.builder()
                .baseScore(requiredInt(root, "baseScore"))
                .highKeywords(keywordWeights(required(keywords, "high"), "keywords.high"))
                .mediumKeywords(keywordWeights(required(keywords, "medium"), "keywords.medium"))
                .negativeKeywords(keywordWeights(required(keywords, "negative"), "keywords.negative"))
                .executiveRoles(keywordList(required(executive, "keywords"), "roles.executive.keywords"))
                .executiveRoleScore(requiredInt(executive, "score"))
                .decisionMakerRoles(keywordList(required(decisionMaker, "keywords"), "roles.decisionMaker.keywords"))
                .decisionMakerRoleScore(requiredInt(decisionMaker, "score"))
                .defaultRoleScore(requiredInt(roles, "defaultScore"))
                .sizeMultipliers(multipliers(required(companySize, "multipliers")))
                .defaultSizeMultiplier(positiveDecimal(required(companySize, "default"), "companySize.default"))
                .urgency(patternGroup(required(root, "urgency"), "urgency"))
                .budget(patternGroup(required(root, "budget"), "budget"))
                .scaleFamilies(scaleFamilies(required(scale, "families")))
                .scaleTiers(scaleTiers(required(scale, "tiers")))
                .build();

        log.info("Pattern catalog loaded: {} high, {} medium, {} negative keywords, {} size tiers",
                catalog.getHighKeywords().size(), catalog.getMediumKeywords().size(),
                catalog.getNegativeKeywords().size(), catalog.getSizeMultipliers().size());
        return catalog;
    }

    private Map<String, Integer> keywordWeights(JsonNode node, String path) {
        if (!node.isObject()) {
            throw new PatternCatalogException(path + " must be an object of keyword to weight");
        }
        Map<String, Integer> weights = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getKey().isBlank()) {
                throw new PatternCatalogException(path + " contains a blank keyword");
            }
            if (!field.getValue().isInt()) {
                throw new PatternCatalogException(path + "." + field.getKey() + " must be an integer weight");
            }
            weights.put(field.getKey().toLowerCase(Locale.ROOT), field.getValue().intValue());
        }
        return Collections.unmodifiableMap(weights);
    }

    private List<String> keywordList(JsonNode node, String path) {
        if (!node.isArray()) {
            throw new PatternCatalogException(path + " must be an array");
        }
        List<String> list = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isTextual() || item.asText().isBlank()) {
                throw new PatternCatalogException(path + " contains a blank or non-text entry");
            }
            list.add(item.asText().toLowerCase(Locale.ROOT));
        }
        return List.copyOf(list);
    }

    private Map<String, BigDecimal> multipliers(JsonNode node) {
        if (!node.isObject()) {
            throw new PatternCatalogException("companySize.multipliers must be an object");
        }
        Map<String, BigDecimal> result = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getKey().isBlank()) {
                throw new PatternCatalogException("companySize.multipliers contains a blank size");
            }
            result.put(field.getKey(), positiveDecimal(field.getValue(), "companySize.multipliers." + field.getKey()));
        }
        return Collections.unmodifiableMap(result);
    }

    private PatternCatalog.PatternGroup patternGroup(JsonNode node, String path) {
        int increment = requiredInt(node, "increment");
        int cap = requiredInt(node, "cap");
        if (increment <= 0 || cap <= 0) {
            throw new PatternCatalogException(path + " increment and cap must be positive");
        }
        JsonNode patterns = required(node, "patterns");
        if (!patterns.isArray() || patterns.isEmpty()) {
            throw new PatternCatalogException(path + ".patterns must be a non-empty array");
        }
        List<Pattern> compiled = new ArrayList<>();
        for (JsonNode p : patterns) {
            compiled.add(compile(p.asText(), path));
        }
        return new PatternCatalog.PatternGroup(List.copyOf(compiled), increment, cap);
    }

    private List<PatternCatalog.ScaleFamily> scaleFamilies(JsonNode node) {
        if (!node.isArray() || node.isEmpty()) {
            throw new PatternCatalogException("scale.families must be a non-empty array");
        }
        List<PatternCatalog.ScaleFamily> families = new ArrayList<>();
        for (JsonNode family : node) {
            String unit = requiredText(family, "unit");
            Pattern pattern = compile(requiredText(family, "pattern"), "scale.families." + unit);
            if (pattern.matcher("").groupCount() < 1) {
                throw new PatternCatalogException("scale.families." + unit + " pattern must capture the number in group 1");
            }
            families.add(new PatternCatalog.ScaleFamily(unit, pattern));
        }
        return List.copyOf(families);
    }

    private List<PatternCatalog.ScaleTier> scaleTiers(JsonNode node) {
        if (!node.isArray() || node.isEmpty()) {
            throw new PatternCatalogException("scale.tiers must be a non-empty array");
        }
        List<PatternCatalog.ScaleTier> tiers = new ArrayList<>();
        for (JsonNode tier : node) {
            tiers.add(new PatternCatalog.ScaleTier(
                    requiredText(tier, "name"),
                    requiredInt(tier, "minimum"),
                    requiredInt(tier, "points"),
                    requiredText(tier, "label")));
        }
        tiers.sort(Comparator.comparingInt(PatternCatalog.ScaleTier::getMinimum).reversed());
        return List.copyOf(tiers);
    }

    private Pattern compile(String regex, String path) {
        if (regex == null || regex.isBlank()) {
            throw new PatternCatalogException(path + " contains a blank pattern");
        }
        try {
            return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException e) {
            throw new PatternCatalogException(path + " pattern does not compile: " + regex, e);
        }
    }

    private BigDecimal positiveDecimal(JsonNode node, String path) {
        if (!node.isNumber()) {
            throw new PatternCatalogException(path + " must be a number");
        }
        BigDecimal value = node.decimalValue();
        if (value.signum() <= 0) {
            throw new PatternCatalogException(path + " must be positive, got " + value);
        }
        return value;
    }

    private JsonNode required(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            throw new PatternCatalogException("Pattern catalog is missing '" + field + "'");
        }
        return node;
    }

    private int requiredInt(JsonNode parent, String field) {
        JsonNode node = required(parent, field);
        if (!node.isInt()) {
            throw new PatternCatalogException("'" + field + "' must be an integer");
        }
        return node.intValue();
    }

    private String requiredText(JsonNode parent, String field) {
        JsonNode node = required(parent, field);
        if (!node.isTextual() || node.asText().isBlank()) {
            throw new PatternCatalogException("'" + field + "' must be non-blank text");
        }
        return node.asText();
    }
}
