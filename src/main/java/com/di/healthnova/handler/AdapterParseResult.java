package com.di.healthnova.handler;

import com.di.healthnova.model.PartialIngestionWarning;
import com.di.healthnova.model.RawRecord;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Output of one adapter parse: the raw records plus the rows that were skipped.
 */
@Value
public class AdapterParseResult {
    List<RawRecord> records;
    List<PartialIngestionWarning> skipped;

    public int skippedCount() {
        return skipped.size();
    }

    /** Mutable collector used by adapters while walking a file. */
    public static final class Collector {
        private final List<RawRecord> records = new ArrayList<>();
        private final List<PartialIngestionWarning> skipped = new ArrayList<>();

        public void add(RawRecord record) {
            records.add(record);
        }

        public void skip(PartialIngestionWarning warning) {
            skipped.add(warning);
        }

        public AdapterParseResult build() {
            return new AdapterParseResult(List.copyOf(records), List.copyOf(skipped));
        }
    }
}
