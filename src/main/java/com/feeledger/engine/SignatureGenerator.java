package com.feeledger.engine;

import com.feeledger.policy.CanonicalJson;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deterministic SHA-256 over the policy hash, the normalized input and the
 * result amounts. Used to recognise a replayed calculation, not for security.
 */
final class SignatureGenerator {

    private SignatureGenerator() {
    }

    static String sign(String engineVersion, String policyHash, String channelKey, AmountModel.Normalized input,
                       int precision, BigDecimal totalFee, List<BreakdownEntry> breakdown) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("engine_version", engineVersion);
        payload.put("policy_hash", policyHash);
        payload.put("channel_key", channelKey);
        payload.put("lines", input.lines().stream().map(SignatureGenerator::line).toList());
        payload.put("order", order(input.order()));
        payload.put("precision", precision);
        payload.put("total_fee", CanonicalJson.decimal(totalFee));
        payload.put("amounts", breakdown.stream()
            .map(e -> List.of(e.componentId(), CanonicalJson.decimal(e.amount())))
            .toList());
        return CanonicalJson.sha256Hex(CanonicalJson.write(payload));
    }

    private static Map<String, Object> line(PricedLine line) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("line_id", line.lineId());
        map.put("net", CanonicalJson.decimal(line.net()));
        map.put("gross", CanonicalJson.decimal(line.gross()));
        map.put("tax", CanonicalJson.decimal(line.tax()));
        map.put("quantity", CanonicalJson.decimal(line.quantity()));
        map.put("attributes", line.attributes());
        return map;
    }

    private static Map<String, Object> order(PricedOrder order) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("net", CanonicalJson.decimal(order.net()));
        map.put("gross", CanonicalJson.decimal(order.gross()));
        map.put("tax", CanonicalJson.decimal(order.tax()));
        map.put("shipping", CanonicalJson.decimal(order.shipping()));
        map.put("quantity", CanonicalJson.decimal(order.quantity()));
        return map;
    }
}
