package com.enterprise.sqltemplate.script;

import java.nio.file.Path;

public class ScriptNotFoundException extends RuntimeException {

    private final Path path;

    public ScriptNotFoundException(Path path) {
        super("Script not found: " + path);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
