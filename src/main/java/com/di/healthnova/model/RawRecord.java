package com.di.healthnova.model;

/**
 * Uninterpreted record produced by a provider adapter. Values and timestamps are kept exactly as
 * they appear in the source file; interpretation is the canonicalization mapper's job.
 *
 * @param fieldName    provider-specific field name (column header, JSON kind, XML record type)
 * @param rawValue     value text as found in the file
 * @param unitHint     unit declared by the file, or null when the file declares none
 * @param timestampRaw timestamp text as found in the file
 * @param provider     provider that produced the file (normalized, lower case)
 * @param position     1-based row / entry / element index inside the file, for diagnostics
 */
public record RawRecord(
        String fieldName,
        String rawValue,
        String unitHint,
        String timestampRaw,
        String provider,
        int position
) {
}
