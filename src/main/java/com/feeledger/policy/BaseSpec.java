package com.feeledger.policy;

import java.util.List;

/**
 * Expression selecting the amount a component is computed on: a field reference
 * or an {@code add} of two sub-expressions. Multiple fields are always summed.
 */
public sealed interface BaseSpec {

    record FieldRef(String field) implements BaseSpec {}

    record Add(BaseSpec left, BaseSpec right) implements BaseSpec {}

    BaseSpec NET = new FieldRef("net");

    static BaseSpec field(String field) {
        return new FieldRef(field);
    }

    /** Left-nested {@code add} over the given fields. */
    static BaseSpec sumOf(List<String> fields) {
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("sumOf requires at least one field");
        }
        BaseSpec spec = new FieldRef(fields.get(0));
        for (int i = 1; i < fields.size(); i++) {
            spec = new Add(spec, new FieldRef(fields.get(i)));
        }
        return spec;
    }
}
