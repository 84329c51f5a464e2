package com.di.healthnova.handler;

import com.di.healthnova.model.RawFile;

/**
 * Parses one provider's export format into uninterpreted raw records.
 *
 * <p>Implementations are stateless and side-effect free. Malformed rows are skipped and reported in
 * the {@link AdapterParseResult}; only an unrecognized envelope fails the whole parse.
 */
public interface ProviderAdapter {

    /** Provider key used in job requests and mapping tables, e.g. "fitbit". */
    String provider();

    RawFormat format();

    /** True when the file name looks like this provider's export; used when no provider is declared. */
    boolean canHandle(String fileName);

    /**
     * @throws com.di.healthnova.exception.UnsupportedFormatException if the envelope is not recognized
     * @throws com.di.healthnova.exception.RawFileReadException if the content cannot be read
     */
    AdapterParseResult parse(RawFile file);
}
