package io.dbmaint.model;

import java.util.Locale;

/**
 * Where a pre-delete dump is kept.
 */
public enum DumpStorage {
    /** Dump stays in a local directory. */
    LOCAL,
    /** Dump is staged locally, uploaded to object storage under {@code db_dumps/}, then removed. */
    S3;

    /**
     * Parses a configuration value ({@code local} or {@code s3}, case-insensitive).
     * {@code null} maps to {@link #LOCAL}.
     *
     * @throws IllegalArgumentException for any other value
     */
    public static DumpStorage parse(String value) {
        if (value == null) {
            return LOCAL;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "local" -> LOCAL;
            case "s3" -> S3;
            default -> throw new IllegalArgumentException("Unknown dump_storage: " + value);
        };
    }
}
