package com.di.healthnova.model;

import com.di.healthnova.exception.ErrorCategory;

/**
 * Informational note attached to an ingestion result: one record or row was skipped.
 *
 * @param position 1-based row / entry / element index in the raw file (0 when unknown)
 * @param category why it was skipped
 * @param detail   human-readable detail
 */
public record PartialIngestionWarning(int position, ErrorCategory category, String detail) {

    @Override
    public String toString() {
        return "#" + position + " " + category + ": " + detail;
    }
}
