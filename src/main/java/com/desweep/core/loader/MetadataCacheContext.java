package com.desweep.core.loader;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the dataset loaded during one run so later loads in the same run reuse it.
 * <p>
 * Owned by the caller and passed to {@link BulkMetadataLoader#load}; nothing is shared
 * between two contexts.
 */
public final class MetadataCacheContext {

    private final AtomicReference<BulkDataset> current = new AtomicReference<>();

    public Optional<BulkDataset> current() {
        return Optional.ofNullable(current.get());
    }

    void set(BulkDataset dataset) {
        current.set(dataset);
    }

    /** Drops the in-memory dataset; the next load goes to disk or live. */
    public void invalidate() {
        current.set(null);
    }
}
