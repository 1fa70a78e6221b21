package com.libragraph.artifacts.core.cache;

import java.nio.file.Path;

/**
 * Result of {@link ObjectCache#lookupOrOpen}: the final object path, whether a complete
 * object is already there, and an opener for populating it.
 */
public record CacheLookup(Path path, boolean exists, CacheOpener opener) {
}
