package com.example.diffreview.application;

/** The diff of a working tree could not be obtained; the message is shown to the user as is. */
public class DiffAcquisitionException extends Exception {

    public DiffAcquisitionException(String message) {
        super(message);
    }

    public DiffAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
