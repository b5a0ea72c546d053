package com.example.harborwatch.exception;

public class UnknownFrameException extends RuntimeException {

    private final String frameName;

    public UnknownFrameException(String frameName) {
        super("No calibration frame configured under the name '" + frameName + "'");
        this.frameName = frameName;
    }

    public String getFrameName() {
        return frameName;
    }
}
