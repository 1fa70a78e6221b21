package com.libragraph.artifacts.core.artifact;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ArtifactUriTest {

    @Test
    void shouldCarryHexFormOfId() {
        ArtifactUri uri = ArtifactUri.of("QXJ0aWZhY3Q6MQ==", "dir/file.txt");

        assertThat(uri.toString()).isEqualTo("wandb-artifact://41727469666163743a31/dir/file.txt");
        assertThat(uri.artifactId()).isEqualTo("QXJ0aWZhY3Q6MQ==");
    }

    @Test
    void shouldParseNestedPath() {
        ArtifactUri uri = ArtifactUri.parse("wandb-artifact://41727469666163743a31/a/b/c.txt");

        assertThat(uri.hexId()).isEqualTo("41727469666163743a31");
        assertThat(uri.path()).isEqualTo("a/b/c.txt");
    }

    @Test
    void shouldRejectMalformedUris() {
        assertThatThrownBy(() -> ArtifactUri.parse("s3://bucket/key")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ArtifactUri.parse("wandb-artifact://abcd")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ArtifactUri.parse("wandb-artifact://abcd/"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
