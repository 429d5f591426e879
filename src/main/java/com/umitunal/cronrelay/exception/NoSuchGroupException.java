package com.umitunal.cronrelay.exception;

public class NoSuchGroupException extends StreamStoreException {

    public NoSuchGroupException(String stream, String group) {
        super("NOGROUP No consumer group '" + group + "' on stream '" + stream + "'");
    }
}
