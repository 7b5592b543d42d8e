package com.medlake.telegram.service;

/**
 * Transport failure while talking to the message-history source.
 */
public class HistorySourceException extends RuntimeException {
    public HistorySourceException(String m) { super(m); }
    public HistorySourceException(String m, Throwable c) { super(m, c); }
}
