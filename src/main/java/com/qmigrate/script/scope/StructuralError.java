package com.qmigrate.script.scope;

/** Fatal, file-local inconsistency in the scope tree (orphan else, conflicting reserved key). */
public class StructuralError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String file;

    public StructuralError(String file, String message) {
        super(message + (file == null || file.isEmpty() ? "" : " in: " + file));
        this.file = file;
    }

    public String file() {
        return file;
    }
}
