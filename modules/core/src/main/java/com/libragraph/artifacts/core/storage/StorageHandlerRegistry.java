package com.libragraph.artifacts.core.storage;

import com.libragraph.artifacts.core.storage.handlers.TrackingHandler;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps URI schemes to {@link StorageHandler}s. All handler beans are discovered via CDI;
 * URIs with an unknown scheme fall back to {@link TrackingHandler}.
 */
@ApplicationScoped
public class StorageHandlerRegistry {

    private static final Logger log = Logger.getLogger(StorageHandlerRegistry.class);

    private static final Pattern SCHEME = Pattern.compile("^([a-zA-Z][a-zA-Z0-9+.\\-]*):");

    @Inject
    Instance<StorageHandler> handlers;

    @Inject
    TrackingHandler tracking;

    private final Map<String, StorageHandler> byScheme = new HashMap<>();
    private StorageHandler fallback;

    StorageHandlerRegistry() {
    }

    public StorageHandlerRegistry(List<StorageHandler> handlers, StorageHandler fallback) {
        handlers.forEach(this::register);
        this.fallback = fallback;
    }

    @PostConstruct
    void init() {
        for (StorageHandler handler : handlers) {
            register(handler);
        }
        fallback = tracking;
        log.debugf("Storage handlers registered for schemes %s", byScheme.keySet());
    }

    private void register(StorageHandler handler) {
        for (String scheme : handler.schemes()) {
            StorageHandler previous = byScheme.put(scheme.toLowerCase(Locale.ROOT), handler);
            if (previous != null && previous != handler) {
                throw new IllegalStateException("Scheme " + scheme + " claimed by both "
                        + previous.getClass().getSimpleName() + " and " + handler.getClass().getSimpleName());
            }
        }
    }

    /**
     * The handler for {@code uri}'s scheme, or the fallback for unknown schemes.
     */
    public StorageHandler handlerFor(String uri) {
        return find(schemeOf(uri).orElse("")).orElseGet(() -> {
            log.debugf("No handler for %s, tracking it as an opaque reference", uri);
            return fallback;
        });
    }

    public Optional<StorageHandler> find(String scheme) {
        return Optional.ofNullable(byScheme.get(scheme.toLowerCase(Locale.ROOT)));
    }

    /**
     * The scheme of {@code uri}, lower-cased; empty for plain paths.
     */
    public static Optional<String> schemeOf(String uri) {
        Matcher m = SCHEME.matcher(uri);
        // "C:" is a drive letter, not a scheme
        if (!m.find() || m.group(1).length() == 1) {
            return Optional.empty();
        }
        return Optional.of(m.group(1).toLowerCase(Locale.ROOT));
    }
}
