package com.libragraph.artifacts.core.manifest;

/**
 * Names recorded in manifests written by this library.
 */
public final class ManifestDefaults {

    /** Storage policy name: local files uploaded, references resolved through handlers. */
    public static final String STORAGE_POLICY = "wandb-storage-policy-v1";

    private ManifestDefaults() {
    }
}
