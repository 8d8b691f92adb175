package com.feeledger.engine;

import com.feeledger.error.ErrorCode;
import com.feeledger.error.FeeCalculationException;
import com.feeledger.math.DecimalMath;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Normalizes caller-supplied amounts.
 *
 * Per line: quantity defaults to 1; tax is taken as given, else derived from
 * gross and net, else from {@code tax_rate}, else zero; the missing one of
 * net/gross is derived from the other. Order totals default to line sums.
 */
final class AmountModel {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private AmountModel() {
    }

    record Normalized(List<PricedLine> lines, PricedOrder order) {}

    static Normalized normalize(FeeTransaction transaction) {
        if (transaction.lines().isEmpty()) {
            throw new FeeCalculationException(ErrorCode.MISSING_LINES, "transaction has no lines");
        }
        List<PricedLine> lines = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < transaction.lines().size(); i++) {
            PricedLine line = normalizeLine(i, transaction.lines().get(i));
            if (!seen.add(line.lineId())) {
                throw new FeeCalculationException(ErrorCode.INVALID_LINE, "duplicate line_id: " + line.lineId());
            }
            lines.add(line);
        }

        OrderTotals explicit = transaction.order();
        BigDecimal net = explicit.net() != null ? explicit.net() : DecimalMath.sum(lines.stream().map(PricedLine::net).toList());
        BigDecimal gross = explicit.gross() != null ? explicit.gross() : DecimalMath.sum(lines.stream().map(PricedLine::gross).toList());
        BigDecimal tax = explicit.tax() != null ? explicit.tax() : DecimalMath.sum(lines.stream().map(PricedLine::tax).toList());
        BigDecimal shipping = explicit.shipping() != null ? explicit.shipping() : BigDecimal.ZERO;
        BigDecimal quantity = explicit.quantity() != null ? explicit.quantity() : DecimalMath.sum(lines.stream().map(PricedLine::quantity).toList());
        return new Normalized(List.copyOf(lines), new PricedOrder(net, gross, tax, shipping, quantity, lines.size()));
    }

    private static PricedLine normalizeLine(int index, TransactionLine line) {
        if (line == null) {
            throw new FeeCalculationException(ErrorCode.INVALID_LINE, "line " + (index + 1) + " is null");
        }
        String lineId = line.lineId() != null && !line.lineId().isBlank() ? line.lineId() : "line_" + (index + 1);
        if (line.net() == null && line.gross() == null) {
            throw new FeeCalculationException(ErrorCode.INVALID_LINE, lineId + ": net or gross is required");
        }
        BigDecimal quantity = line.quantity() != null ? line.quantity() : BigDecimal.ONE;
        if (quantity.signum() < 0) {
            throw new FeeCalculationException(ErrorCode.INVALID_LINE, lineId + ": quantity must not be negative");
        }

        BigDecimal net = line.net();
        BigDecimal gross = line.gross();
        BigDecimal tax = line.tax();
        if (tax == null) {
            if (net != null && gross != null) {
                tax = gross.subtract(net);
            } else if (net == null && line.taxRate() != null) {
                BigDecimal divisor = BigDecimal.ONE.add(line.taxRate().divide(HUNDRED));
                net = DecimalMath.div(gross, divisor, DecimalMath.RATIO_SCALE).stripTrailingZeros();
                tax = gross.subtract(net);
            } else if (gross == null && line.taxRate() != null) {
                tax = DecimalMath.percentOf(net, line.taxRate());
            } else {
                tax = BigDecimal.ZERO;
            }
        }
        if (net == null) {
            net = gross.subtract(tax);
        }
        if (gross == null) {
            gross = net.add(tax);
        }
        BigDecimal unitPrice = quantity.signum() == 0
            ? net
            : DecimalMath.div(net, quantity, DecimalMath.RATIO_SCALE).stripTrailingZeros();
        return new PricedLine(index, lineId, net, gross, tax, quantity, unitPrice, line.attributes());
    }
}
