package com.covenantguard.detectors;

/**
 * A detector met an expression shape it was not designed for and cannot
 * decide whether the function is safe.
 */
public class DetectorException extends RuntimeException {
    public DetectorException(String message) { super(message); }
    public DetectorException(String message, Throwable cause) { super(message, cause); }
}
