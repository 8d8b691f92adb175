package com.feeledger.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Lines a refund touched and lines it left alone. Reporting only. */
public record Coverage(
    @JsonProperty("affected_line_ids") List<String> affectedLineIds,
    @JsonProperty("unaffected_line_ids") List<String> unaffectedLineIds
) {

    public static final Coverage NONE = new Coverage(List.of(), List.of());

    public Coverage {
        affectedLineIds = List.copyOf(affectedLineIds);
        unaffectedLineIds = List.copyOf(unaffectedLineIds);
    }
}
