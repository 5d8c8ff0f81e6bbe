package com.arcs.model;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Display names and file names for quotes.
 *
 * <p>A normalized name looks like {@code ARCS 2024-12-18 [PO:PO-999]}: the
 * application name, the creation date and, when there is one, the PO number.
 */
public final class QuoteNames {

    public static final int MAX_FILE_NAME_LENGTH = 120;

    private QuoteNames() {
    }

    public static String defaultName(String appName, OffsetDateTime createdAt) {
        return appName + " " + DateTimeFormatter.ISO_LOCAL_DATE.format(dateOf(createdAt));
    }

    public static String normalizedName(String appName, Quote quote) {
        String name = defaultName(appName, quote.createdAt());
        if (quote.hasPoNumber()) {
            name = name + " [PO:" + quote.poNumber() + "]";
        }
        return name;
    }

    /** Replaces anything outside {@code [A-Za-z0-9._-]} with '_' and caps the length. */
    public static String safeFileName(String name) {
        String cleaned = (name == null ? "" : name).replaceAll("[^A-Za-z0-9._-]", "_");
        return cleaned.length() > MAX_FILE_NAME_LENGTH ? cleaned.substring(0, MAX_FILE_NAME_LENGTH) : cleaned;
    }

    // quotes without a creation time (hand-edited files) are dated today
    private static LocalDate dateOf(OffsetDateTime createdAt) {
        return createdAt != null ? createdAt.toLocalDate() : LocalDate.now(ZoneOffset.UTC);
    }
}
