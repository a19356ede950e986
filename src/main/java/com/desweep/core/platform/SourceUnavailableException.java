package com.desweep.core.platform;

import com.desweep.core.model.MetadataCollection;

/**
 * One metadata source could not be fetched for this run. The loader degrades it
 * to an empty collection and continues.
 */
public class SourceUnavailableException extends RuntimeException {

    private final MetadataCollection source;

    public SourceUnavailableException(MetadataCollection source, Throwable cause) {
        super("Metadata source unavailable: " + source.stage()
                + (cause != null && cause.getMessage() != null ? " (" + cause.getMessage() + ")" : ""), cause);
        this.source = source;
    }

    public MetadataCollection getSource() {
        return source;
    }
}
