package com.feeledger.policy;

import com.feeledger.error.ErrorCode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Reads JSON policy documents into the typed policy model.
 *
 * A document is either a single policy object or an array of them. Field names
 * are snake_case; enum values are lowercase. Every policy read is validated.
 */
public class PolicyDocumentReader {

    private final ObjectMapper mapper;
    private final PolicyValidator validator;
    private final int defaultPrecision;

    public PolicyDocumentReader(PolicyValidator validator, int defaultPrecision) {
        this.mapper = JsonMapper.builder()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .build();
        this.validator = validator;
        this.defaultPrecision = defaultPrecision;
    }

    public List<FeePolicy> readAll(InputStream in) {
        JsonNode root = readTree(in);
        List<FeePolicy> policies = new ArrayList<>();
        if (root.isArray()) {
            root.forEach(node -> policies.add(toPolicy(node)));
        } else {
            policies.add(toPolicy(root));
        }
        return policies;
    }

    public FeePolicy read(String json) {
        try {
            return toPolicy(mapper.readTree(json));
        } catch (JsonProcessingException ex) {
            throw new PolicyViolationException("policy document is not valid JSON: " + ex.getOriginalMessage());
        }
    }

    private JsonNode readTree(InputStream in) {
        try {
            return mapper.readTree(in);
        } catch (JsonProcessingException ex) {
            throw new PolicyViolationException("policy document is not valid JSON: " + ex.getOriginalMessage());
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    private FeePolicy toPolicy(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new PolicyViolationException("policy must be a JSON object");
        }
        List<FeeComponent> components = new ArrayList<>();
        JsonNode componentsNode = node.path("components");
        if (!componentsNode.isMissingNode() && !componentsNode.isArray()) {
            throw new PolicyViolationException("components must be an array");
        }
        componentsNode.forEach(c -> components.add(toComponent(c)));

        FeePolicy policy = new FeePolicy(
            text(node, "policy_key"),
            node.path("version").asInt(1),
            text(node, "channel_key"),
            text(node, "currency"),
            node.has("precision") ? node.get("precision").asInt() : defaultPrecision,
            node.path("strict").asBoolean(false),
            date(node, "effective_from"),
            date(node, "effective_to"),
            node.path("priority").asInt(0),
            text(node, "scope_id"),
            components
        );
        validator.validate(policy);
        return policy;
    }

    private FeeComponent toComponent(JsonNode node) {
        if (!node.isObject()) {
            throw new PolicyViolationException(ErrorCode.INVALID_COMPONENT, "component must be a JSON object");
        }
        String id = text(node, "id");
        ComponentType type = enumValue(node, "type", ComponentType::fromValue, ErrorCode.INVALID_COMPONENT);
        if (type == null) {
            throw new PolicyViolationException(ErrorCode.INVALID_COMPONENT, id + ": type is required");
        }
        ComponentHeader header = new ComponentHeader(
            id,
            text(node, "name"),
            enumValue(node, "scope", Scope::fromValue, ErrorCode.INVALID_COMPONENT),
            node.path("precedence").asInt(ComponentHeader.DEFAULT_PRECEDENCE),
            node.has("base") ? toBase(id, node.get("base")) : null,
            strings(node.path("tags")),
            conditions(node.path("conditions")),
            node.has("line_selector") && !node.get("line_selector").isNull()
                ? toSelector(node.get("line_selector")) : null,
            enumValue(node, "proration", ProrationMethod::fromValue, ErrorCode.INVALID_COMPONENT),
            node.has("refund") ? toRefund(node.get("refund")) : null
        );

        return switch (type) {
            case RATE -> new FeeComponent.Rate(header, decimal(node, "rate"));
            case RATE_PP -> new FeeComponent.RatePp(header, decimal(node, "pp"));
            case FIXED_UNIT -> new FeeComponent.FixedUnit(header, decimal(node, "fixed"));
            case FIXED_ORDER -> new FeeComponent.FixedOrder(header, decimal(node, "fixed"));
            case TIER -> new FeeComponent.Tier(header,
                enumValue(node, "tier_by", TierBy::fromValue, ErrorCode.INVALID_COMPONENT),
                enumValue(node, "boundary", TierBoundary::fromValue, ErrorCode.INVALID_COMPONENT),
                tiers(node.path("tiers")));
            case CAP -> new FeeComponent.Cap(header, decimal(node, "min"), decimal(node, "max"),
                toTargets(node.path("targets")));
            case OVERRIDE -> new FeeComponent.OverrideRule(header,
                strings(node.path("excludes")),
                strings(node.path("exclude_tags")),
                decimal(node, "replace_amount"),
                text(node, "reason"));
        };
    }

    /**
     * A base is a field name, an array of field names (summed), or an
     * expression object: {@code {"field": "net"}} or
     * {@code {"op": "add", "left": ..., "right": ...}}.
     */
    private BaseSpec toBase(String componentId, JsonNode node) {
        if (node.isTextual()) {
            return BaseSpec.field(node.asText());
        }
        if (node.isArray()) {
            List<String> fields = strings(node);
            if (fields.isEmpty()) {
                throw new PolicyViolationException(ErrorCode.INVALID_BASE_SPEC, componentId + ": base list is empty");
            }
            return BaseSpec.sumOf(fields);
        }
        if (node.isObject()) {
            if (node.has("field")) {
                return BaseSpec.field(node.get("field").asText());
            }
            String op = node.path("op").asText("");
            if ("add".equals(op)) {
                if (!node.has("left") || !node.has("right")) {
                    throw new PolicyViolationException(ErrorCode.INVALID_BASE_SPEC,
                        componentId + ": add needs left and right");
                }
                return new BaseSpec.Add(toBase(componentId, node.get("left")), toBase(componentId, node.get("right")));
            }
            throw new PolicyViolationException(ErrorCode.INVALID_BASE_SPEC,
                componentId + ": unsupported base operation '" + op + "'");
        }
        throw new PolicyViolationException(ErrorCode.INVALID_BASE_SPEC, componentId + ": base must be a string, array or object");
    }

    private LineSelector toSelector(JsonNode node) {
        LineSelector.Mode mode = "exclude".equalsIgnoreCase(node.path("mode").asText("include"))
            ? LineSelector.Mode.EXCLUDE : LineSelector.Mode.INCLUDE;
        List<List<Condition>> anyOf = new ArrayList<>();
        node.path("any_of").forEach(group -> anyOf.add(conditions(group)));
        return new LineSelector(mode, conditions(node.path("where")), anyOf, node.path("require_match").asBoolean(false));
    }

    private RefundConfig toRefund(JsonNode node) {
        return new RefundConfig(
            node.path("refundable").asBoolean(true),
            enumValue(node, "behavior", RefundBehavior::fromValue, ErrorCode.INVALID_COMPONENT),
            node.path("cap_refund_to_original").asBoolean(true)
        );
    }

    private CapTargets toTargets(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return CapTargets.ALL;
        }
        List<ComponentType> types = new ArrayList<>();
        for (String raw : strings(node.path("types"))) {
            types.add(parseEnum(raw, ComponentType::fromValue, ErrorCode.INVALID_COMPONENT));
        }
        List<Scope> scopes = new ArrayList<>();
        for (String raw : strings(node.path("scopes"))) {
            scopes.add(parseEnum(raw, Scope::fromValue, ErrorCode.INVALID_COMPONENT));
        }
        return new CapTargets(strings(node.path("component_ids")), strings(node.path("tags")), types, scopes);
    }

    private List<TierBracket> tiers(JsonNode node) {
        List<TierBracket> tiers = new ArrayList<>();
        node.forEach(t -> tiers.add(new TierBracket(
            decimal(t, "min"), decimal(t, "max"), decimal(t, "rate"), decimal(t, "fixed"))));
        return tiers;
    }

    private List<Condition> conditions(JsonNode node) {
        List<Condition> conditions = new ArrayList<>();
        node.forEach(c -> conditions.add(new Condition(
            text(c, "field"),
            enumValue(c, "operator", Operator::fromValue, ErrorCode.LINE_SELECTOR_BAD_OPERATOR),
            literal(c.get("value")))));
        return conditions;
    }

    private Object literal(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isArray()) {
            List<Object> values = new ArrayList<>();
            node.forEach(v -> values.add(literal(v)));
            return values;
        }
        return node.asText();
    }

    private static List<String> strings(JsonNode node) {
        List<String> values = new ArrayList<>();
        node.forEach(v -> values.add(v.asText()));
        return values;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static BigDecimal decimal(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        try {
            return new BigDecimal(value.asText().trim());
        } catch (NumberFormatException ex) {
            throw new PolicyViolationException(ErrorCode.INVALID_COMPONENT,
                field + " is not a decimal value: " + value.asText());
        }
    }

    private static LocalDate date(JsonNode node, String field) {
        String raw = text(node, field);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(raw);
        } catch (DateTimeParseException ex) {
            throw new PolicyViolationException(field + " must be an ISO date: " + raw);
        }
    }

    private static <E> E enumValue(JsonNode node, String field, Function<String, E> parser, ErrorCode code) {
        return parseEnum(text(node, field), parser, code);
    }

    private static <E> E parseEnum(String raw, Function<String, E> parser, ErrorCode code) {
        if (raw == null) {
            return null;
        }
        try {
            return parser.apply(raw);
        } catch (IllegalArgumentException ex) {
            throw new PolicyViolationException(code, ex.getMessage());
        }
    }
}
