/**
 * Shared utilities for all artifact store modules.
 *
 * <p>Contains {@link com.libragraph.artifacts.util.HashUtil}, the MD5 and etag digest
 * helpers used by manifests, the object cache and the storage handlers.
 * No framework dependencies.
 */
package com.libragraph.artifacts.util;
