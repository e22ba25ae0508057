package com.buddy.engine.error;

public class UnknownJobTypeException extends EngineException {
    public UnknownJobTypeException(String type) {
        super(Kind.UNKNOWN_TYPE, "Unknown job type: " + type);
    }
}
