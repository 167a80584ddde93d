package com.sentinel.scanner.models;

/**
 * Именованные профили сканирования
 */
public enum ScanType {
    QUICK,
    DEEP,
    CUSTOM
}
