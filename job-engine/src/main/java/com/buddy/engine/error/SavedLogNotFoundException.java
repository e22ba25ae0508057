package com.buddy.engine.error;

public class SavedLogNotFoundException extends EngineException {
    public SavedLogNotFoundException(String id) {
        super(Kind.NOT_FOUND, "Log not found: " + id);
    }
}
