package com.libragraph.artifacts.core.cache;

import io.quarkus.runtime.ShutdownEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;

/**
 * Trims the object cache once, when the application stops. Cleanup races with writers
 * in other processes, so it runs here rather than from every worker.
 */
@ApplicationScoped
public class CacheJanitor {

    private static final Logger log = Logger.getLogger(CacheJanitor.class);

    @Inject
    ObjectCache cache;

    @ConfigProperty(name = "artifacts.cache.target-bytes", defaultValue = "10737418240")
    long targetBytes;

    @ConfigProperty(name = "artifacts.cache.cleanup-on-shutdown", defaultValue = "true")
    boolean cleanupOnShutdown;

    void onShutdown(@Observes ShutdownEvent event) {
        if (cleanupOnShutdown) {
            cleanup();
        }
    }

    /**
     * Evicts down to the configured target. Failures are logged; eviction is best effort.
     *
     * @return bytes reclaimed
     */
    public long cleanup() {
        try {
            return cache.cleanup(targetBytes);
        } catch (IOException e) {
            log.warnf(e, "Cache cleanup of %s failed", cache.root());
            return 0;
        }
    }
}
