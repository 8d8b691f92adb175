package com.feeledger.storage;

/**
 * Which child collections {@link FeeStorageAdapter#loadEntry} assembles.
 * Skipped collections come back empty.
 */
public record LoadOptions(boolean components, boolean lines, boolean refundPlan, boolean warnings) {

    public static final LoadOptions FULL = new LoadOptions(true, true, true, true);
    public static final LoadOptions HEADER_ONLY = new LoadOptions(false, false, false, false);
}
