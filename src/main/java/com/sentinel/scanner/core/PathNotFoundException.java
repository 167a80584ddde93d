package com.sentinel.scanner.core;

import java.nio.file.Path;

/**
 * Корень сканирования не существует; сессия не начинается
 */
public class PathNotFoundException extends RuntimeException {

    private final transient Path path;

    public PathNotFoundException(Path path) {
        super("Путь не существует: " + path);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
