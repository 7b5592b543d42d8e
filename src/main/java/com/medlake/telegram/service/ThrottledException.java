package com.medlake.telegram.service;

/**
 * An upstream provider kept throttling after every retry was spent.
 */
public class ThrottledException extends RuntimeException {
    public ThrottledException(String message) { super(message); }
    public ThrottledException(String message, Throwable cause) { super(message, cause); }
}
