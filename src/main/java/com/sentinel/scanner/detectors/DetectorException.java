package com.sentinel.scanner.detectors;

/**
 * Внутренний сбой одного детектора
 */
public class DetectorException extends RuntimeException {

    public DetectorException(String message) {
        super(message);
    }

    public DetectorException(String message, Throwable cause) {
        super(message, cause);
    }
}
