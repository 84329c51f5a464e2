package com.di.healthnova.ingest;

import com.di.healthnova.model.RawFile;

/**
 * Turns a raw_file_ref into file content. Where files live (local disk, object storage) is the resolver's concern.
 */
public interface RawFileResolver {

    /**
     * @throws com.di.healthnova.exception.RawFileReadException if the file is missing or unreadable
     */
    RawFile resolve(String rawFileRef);
}
