package com.desweep.core.scanner;

import com.desweep.core.model.DependencyType;

/**
 * A metadata record could not be read. The scanner skips it and continues.
 */
public class MalformedRecordException extends RuntimeException {

    private final DependencyType type;

    public MalformedRecordException(DependencyType type, String message) {
        super(message);
        this.type = type;
    }

    public DependencyType getType() {
        return type;
    }
}
