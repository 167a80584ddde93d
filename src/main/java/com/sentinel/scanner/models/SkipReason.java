package com.sentinel.scanner.models;

/**
 * Причина, по которой путь не был оценен детекторами
 */
public enum SkipReason {
    SYMLINK("symlink", false),
    DEPTH_LIMIT("depth-limit", false),
    EXTENSION_FILTER("extension-filter", false),
    SIZE_LIMIT("size-limit", false),
    IO_ERROR("io-error", true),
    TIMEOUT("timeout", true);

    private final String code;
    private final boolean error;

    SkipReason(String code, boolean error) {
        this.code = code;
        this.error = error;
    }

    public String getCode() {
        return code;
    }

    /**
     * Учитывается ли пропуск как ошибка в статистике
     */
    public boolean isError() {
        return error;
    }
}
