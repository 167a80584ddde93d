package com.sentinel.scanner.models;

/**
 * Терминальный статус сессии
 */
public enum ScanStatus {
    COMPLETED,
    CANCELLED
}
