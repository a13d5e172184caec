package com.faceattendance.matching;

public class InvalidDescriptorException extends Exception {

    public InvalidDescriptorException(String message) {
        super(message);
    }

    public InvalidDescriptorException(String message, Throwable cause) {
        super(message, cause);
    }
}
