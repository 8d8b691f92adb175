package com.feeledger.engine;

import com.feeledger.error.ErrorCode;
import com.feeledger.error.FeeCalculationException;
import com.feeledger.policy.BaseSpec;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.function.Function;

final class BaseSpecEvaluator {

    private BaseSpecEvaluator() {
    }

    /**
     * Evaluates {@code spec} with {@code lookup} resolving leaf fields.
     * An unresolvable field is a {@link ErrorCode#MISSING_BASE_FIELD} error.
     */
    static BigDecimal evaluate(String componentId, BaseSpec spec, Function<String, Optional<BigDecimal>> lookup,
                               String where) {
        if (spec instanceof BaseSpec.FieldRef ref) {
            return lookup.apply(ref.field())
                .orElseThrow(() -> new FeeCalculationException(ErrorCode.MISSING_BASE_FIELD,
                    componentId + ": base field '" + ref.field() + "' is missing on " + where));
        }
        if (spec instanceof BaseSpec.Add add) {
            return evaluate(componentId, add.left(), lookup, where)
                .add(evaluate(componentId, add.right(), lookup, where));
        }
        throw new FeeCalculationException(ErrorCode.INVALID_BASE_SPEC, componentId + ": unsupported base expression");
    }
}
