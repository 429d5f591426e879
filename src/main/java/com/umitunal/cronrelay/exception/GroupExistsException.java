package com.umitunal.cronrelay.exception;

/**
 * The consumer group being created already exists on the stream.
 * Callers that only need the group to exist treat this as success.
 */
public class GroupExistsException extends StreamStoreException {

    public GroupExistsException(String stream, String group) {
        super("BUSYGROUP Consumer group '" + group + "' already exists on stream '" + stream + "'");
    }
}
