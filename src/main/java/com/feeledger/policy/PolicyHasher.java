package com.feeledger.policy;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Content hash of a policy, stored on every ledger entry so a settlement can be
 * traced to the exact rules that produced it.
 *
 * The hash ignores declaration order of components, tags, targets and tiers:
 * components are sorted by id, string sets alphabetically and tiers by min.
 * Format: {@code v2:} followed by the first 16 hex chars of a SHA-256 digest.
 */
@Component
public class PolicyHasher {

    public static final String HASH_VERSION = "v2";

    public String hash(FeePolicy policy) {
        Map<String, Object> canonical = new TreeMap<>();
        canonical.put("policy_key", policy.policyKey());
        canonical.put("version", policy.version());
        canonical.put("currency", policy.currency());
        canonical.put("precision", policy.precision());
        canonical.put("strict", policy.strict());
        canonical.put("components", policy.components().stream()
            .sorted(Comparator.comparing(FeeComponent::id))
            .map(this::canonicalComponent)
            .toList());
        String digest = CanonicalJson.sha256Hex(CanonicalJson.write(canonical));
        return HASH_VERSION + ":" + digest.substring(0, 16);
    }

    private Map<String, Object> canonicalComponent(FeeComponent component) {
        ComponentHeader header = component.header();
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", header.id());
        map.put("type", component.type().getValue());
        map.put("scope", header.scope().getValue());
        map.put("precedence", header.precedence());
        map.put("base", header.base());
        map.put("tags", sorted(header.tags()));
        map.put("conditions", header.conditions().stream().map(this::canonicalCondition).toList());
        map.put("line_selector", header.lineSelector());
        map.put("proration", header.proration() != null ? header.proration().getValue() : null);
        map.put("refund", header.refund());

        switch (component.type()) {
            case RATE -> map.put("rate", CanonicalJson.decimal(((FeeComponent.Rate) component).rate()));
            case RATE_PP -> map.put("pp", CanonicalJson.decimal(((FeeComponent.RatePp) component).pp()));
            case FIXED_UNIT -> map.put("fixed", CanonicalJson.decimal(((FeeComponent.FixedUnit) component).fixed()));
            case FIXED_ORDER -> map.put("fixed", CanonicalJson.decimal(((FeeComponent.FixedOrder) component).fixed()));
            case TIER -> {
                FeeComponent.Tier tier = (FeeComponent.Tier) component;
                map.put("tier_by", tier.tierBy().getValue());
                map.put("boundary", tier.boundary().getValue());
                map.put("tiers", tier.tiers().stream()
                    .sorted(Comparator.comparing(TierBracket::min))
                    .map(b -> {
                        Map<String, Object> bracket = new LinkedHashMap<>();
                        bracket.put("min", CanonicalJson.decimal(b.min()));
                        bracket.put("max", CanonicalJson.decimal(b.max()));
                        bracket.put("rate", CanonicalJson.decimal(b.rate()));
                        bracket.put("fixed", CanonicalJson.decimal(b.fixed()));
                        return bracket;
                    })
                    .toList());
            }
            case CAP -> {
                FeeComponent.Cap cap = (FeeComponent.Cap) component;
                map.put("min", CanonicalJson.decimal(cap.min()));
                map.put("max", CanonicalJson.decimal(cap.max()));
                Map<String, Object> targets = new LinkedHashMap<>();
                targets.put("component_ids", sorted(cap.targets().componentIds()));
                targets.put("tags", sorted(cap.targets().tags()));
                targets.put("types", sorted(cap.targets().types().stream().map(ComponentType::getValue).toList()));
                targets.put("scopes", sorted(cap.targets().scopes().stream().map(Scope::getValue).toList()));
                map.put("targets", targets);
            }
            case OVERRIDE -> {
                FeeComponent.OverrideRule override = (FeeComponent.OverrideRule) component;
                map.put("excludes", sorted(override.excludes()));
                map.put("exclude_tags", sorted(override.excludeTags()));
                map.put("replace_amount", CanonicalJson.decimal(override.replaceAmount()));
                map.put("reason", override.reason());
            }
        }
        return map;
    }

    private Map<String, Object> canonicalCondition(Condition condition) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("field", condition.field());
        map.put("operator", condition.operator().getValue());
        map.put("value", condition.value());
        return map;
    }

    private static List<String> sorted(List<String> values) {
        List<String> copy = new ArrayList<>(values);
        copy.sort(null);
        return copy;
    }
}
