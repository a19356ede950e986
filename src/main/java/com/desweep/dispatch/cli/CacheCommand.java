package com.desweep.dispatch.cli;

import com.desweep.core.cache.CacheInfo;
import com.desweep.core.cache.CacheStore;
import com.desweep.core.loader.BulkMetadataLoader;
import com.desweep.core.loader.MetadataCacheContext;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: desweep cache [--clear] [--list]
 */
@Command(name = "cache", mixinStandardHelpOptions = true, description = "Show, list or clear the metadata cache")
@Component
public class CacheCommand implements Callable<Integer> {

    @Option(names = "--clear", description = "Delete the bulk metadata cache")
    private boolean clear;

    @Option(names = "--list", description = "List every cache file")
    private boolean list;

    private final BulkMetadataLoader loader;
    private final CacheStore cacheStore;

    public CacheCommand(BulkMetadataLoader loader, CacheStore cacheStore) {
        this.loader = loader;
        this.cacheStore = cacheStore;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (clear) {
            if (loader.invalidate(new MetadataCacheContext())) {
                ConsoleOutput.success("Bulk metadata cache cleared");
            } else {
                ConsoleOutput.info("No bulk metadata cache to clear");
            }
            return 0;
        }

        if (list) {
            var all = cacheStore.listAll();
            if (all.isEmpty()) {
                ConsoleOutput.info("No cache files");
            }
            for (CacheInfo info : all) {
                System.out.printf("  %-12s %-14s %6d items  %8d bytes  %s%n", info.cacheType(), info.accountId(),
                        info.itemCount(), info.fileSize(), info.ageString());
            }
            return 0;
        }

        CacheInfo info = loader.cacheStatus();
        if (!info.exists()) {
            ConsoleOutput.info("No bulk metadata cache at " + info.filePath());
            return 0;
        }
        ConsoleOutput.info("Bulk metadata cache: " + info.filePath());
        System.out.println("  Cached:  " + info.cachedAt() + " (" + info.ageString() + ")");
        System.out.println("  Items:   " + info.itemCount());
        System.out.println("  Size:    " + info.fileSize() + " bytes");
        return 0;
    }
}
