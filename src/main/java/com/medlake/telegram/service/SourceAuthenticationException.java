package com.medlake.telegram.service;

/**
 * The history source rejected the configured credentials. Nothing can be crawled, so the run aborts.
 */
public class SourceAuthenticationException extends HistorySourceException {
    public SourceAuthenticationException(String m) { super(m); }
    public SourceAuthenticationException(String m, Throwable c) { super(m, c); }
}
