package com.libragraph.artifacts.core.storage.bucket;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class BucketLocationTest {

    @Test
    void shouldParseS3VersionQuery() {
        BucketLocation location = BucketLocation.parse("s3://my-bucket/path/to/obj.bin?versionId=abc%2B1");

        assertThat(location.scheme()).isEqualTo("s3");
        assertThat(location.bucket()).isEqualTo("my-bucket");
        assertThat(location.key()).isEqualTo("path/to/obj.bin");
        assertThat(location.version()).isEqualTo("abc+1");
        assertThat(location.uri()).isEqualTo("s3://my-bucket/path/to/obj.bin");
    }

    @Test
    void shouldParseGcsGenerationFragment() {
        BucketLocation location = BucketLocation.parse("gs://bucket/data/file.csv#1700000000000");

        assertThat(location.key()).isEqualTo("data/file.csv");
        assertThat(location.version()).isEqualTo("1700000000000");
    }

    @Test
    void shouldParseBucketOnly() {
        BucketLocation location = BucketLocation.parse("s3://bucket");

        assertThat(location.key()).isEmpty();
        assertThat(location.version()).isNull();
        assertThat(location.directoryPrefix()).isEmpty();
    }

    @Test
    void shouldNormalizeDirectoryPrefix() {
        assertThat(BucketLocation.parse("s3://b/dir").directoryPrefix()).isEqualTo("dir/");
        assertThat(BucketLocation.parse("s3://b/dir//").directoryPrefix()).isEqualTo("dir/");
    }

    @Test
    void shouldRejectNonBucketUris() {
        assertThatThrownBy(() -> BucketLocation.parse("/local/path"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BucketLocation.parse("s3:///key"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldStripEtagQuotes() {
        assertThat(BucketObject.stripQuotes("\"abc\"")).isEqualTo("abc");
        assertThat(BucketObject.stripQuotes("W/\"abc\"")).isEqualTo("abc");
        assertThat(BucketObject.stripQuotes("abc")).isEqualTo("abc");
        assertThat(BucketObject.stripQuotes(null)).isNull();
    }
}
