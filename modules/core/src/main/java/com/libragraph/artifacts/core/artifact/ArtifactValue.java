package com.libragraph.artifacts.core.artifact;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A value stored in an artifact as a JSON file named {@code <name>.<typeSuffix>.json}.
 */
public interface ArtifactValue {

    /**
     * Type tag placed before {@code .json}, e.g. {@code table}.
     */
    String typeSuffix();

    /**
     * The JSON form of this value. May add supporting files to {@code artifact}.
     */
    JsonNode toJson(Artifact artifact);
}
