package com.di.healthnova.handler;

/**
 * One row / entry / element of an otherwise valid file is malformed. Adapters catch it, skip the
 * record and keep going.
 */
public class MalformedRecordException extends Exception {

    public MalformedRecordException(String message) {
        super(message);
    }
}
