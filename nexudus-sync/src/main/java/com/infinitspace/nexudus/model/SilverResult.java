package com.infinitspace.nexudus.model;

/**
 * Aggregate counts of one silver writer run.
 *
 * @param read       latest bronze rows loaded
 * @param written    silver rows upserted
 * @param excluded   rows the transformer or a business filter left out on purpose
 * @param errors     rows whose transform failed (logged to meta.sync_errors)
 * @param satellites satellite rows upserted (location hours)
 */
public record SilverResult(int read, int written, int excluded, int errors, int satellites) {

    public int skipped() {
        return excluded + errors;
    }
}
