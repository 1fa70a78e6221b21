package com.libragraph.artifacts.core.storage.bucket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.artifacts.core.storage.ReferenceNotFoundException;
import com.libragraph.artifacts.core.storage.StorageException;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * {@link BucketClient} for Google Cloud Storage over its JSON API.
 *
 * <p>The object generation is exposed as the version id. Requests carry a bearer
 * token when one is configured and are anonymous otherwise.
 */
public class GcsJsonBucketClient implements BucketClient {

    private static final Logger log = Logger.getLogger(GcsJsonBucketClient.class);

    private static final int PAGE_SIZE = 1000;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String endpoint;
    private final String accessToken;

    public GcsJsonBucketClient(HttpClient httpClient, ObjectMapper objectMapper,
                               String endpoint, String accessToken) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.endpoint = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        this.accessToken = accessToken;
    }

    @Override
    public Optional<BucketObject> stat(String bucket, String key, String versionId) {
        if (key.isEmpty()) {
            return Optional.empty();
        }
        String url = objectUrl(bucket, key) + (versionId != null ? "?generation=" + encode(versionId) : "");
        return getJson(url).map(json -> toObject(bucket, json));
    }

    @Override
    public Stream<BucketObject> list(String bucket, String prefix) {
        Iterator<BucketObject> pages = new PageIterator(bucket, "prefix=" + encode(prefix));
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(pages, Spliterator.ORDERED), false);
    }

    @Override
    public List<BucketObject> listVersions(String bucket, String key) {
        List<BucketObject> versions = new ArrayList<>();
        Iterator<BucketObject> it = new PageIterator(bucket, "versions=true&prefix=" + encode(key));
        while (it.hasNext()) {
            BucketObject object = it.next();
            if (object.key().equals(key)) {
                versions.add(object);
            }
        }
        return versions;
    }

    @Override
    public boolean versioningEnabled(String bucket) {
        String url = endpoint + "/storage/v1/b/" + encode(bucket) + "?fields=versioning";
        JsonNode json = getJson(url)
                .orElseThrow(() -> new ReferenceNotFoundException("Bucket not found: gs://" + bucket));
        return json.path("versioning").path("enabled").asBoolean(false);
    }

    @Override
    public InputStream open(BucketObject object) {
        String url = objectUrl(object.bucket(), object.key()) + "?alt=media"
                + (object.versionId() != null ? "&generation=" + encode(object.versionId()) : "");
        String location = "gs://" + object.bucket() + "/" + object.key();
        try {
            HttpResponse<InputStream> response = httpClient.send(request(url),
                    HttpResponse.BodyHandlers.ofInputStream());
            if (response.statusCode() == 200) {
                return response.body();
            }
            response.body().close();
            if (response.statusCode() == 404) {
                throw new ReferenceNotFoundException("Object not found: " + location);
            }
            throw new StorageException("Failed to read " + location + ": HTTP " + response.statusCode());
        } catch (IOException e) {
            throw new StorageException("Failed to read " + location, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted reading " + location, e);
        }
    }

    private Optional<JsonNode> getJson(String url) {
        try {
            HttpResponse<byte[]> response = httpClient.send(request(url), HttpResponse.BodyHandlers.ofByteArray());
            if (response.statusCode() == 404) {
                return Optional.empty();
            }
            if (response.statusCode() != 200) {
                throw new StorageException("GCS request failed: HTTP " + response.statusCode() + " for " + url);
            }
            return Optional.of(objectMapper.readTree(response.body()));
        } catch (IOException e) {
            throw new StorageException("GCS request failed: " + url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted requesting " + url, e);
        }
    }

    private HttpRequest request(String url) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(url)).GET();
        if (accessToken != null && !accessToken.isBlank()) {
            builder.header("Authorization", "Bearer " + accessToken);
        }
        return builder.build();
    }

    private String objectUrl(String bucket, String key) {
        return endpoint + "/storage/v1/b/" + encode(bucket) + "/o/" + encode(key);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static BucketObject toObject(String bucket, JsonNode json) {
        return new BucketObject(
                bucket,
                json.path("name").asText(),
                json.path("size").asLong(0),
                BucketObject.stripQuotes(textOrNull(json, "etag")),
                textOrNull(json, "generation"),
                textOrNull(json, "md5Hash"),
                textOrNull(json, "contentType"));
    }

    private static String textOrNull(JsonNode json, String field) {
        JsonNode value = json.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    /**
     * Follows {@code nextPageToken}, requesting the next page only when the current one is drained.
     */
    private class PageIterator implements Iterator<BucketObject> {

        private final String bucket;
        private final String query;
        private final Deque<BucketObject> buffer = new ArrayDeque<>();
        private String pageToken;
        private boolean lastPage;

        PageIterator(String bucket, String query) {
            this.bucket = bucket;
            this.query = query;
        }

        @Override
        public boolean hasNext() {
            while (buffer.isEmpty() && !lastPage) {
                fetchPage();
            }
            return !buffer.isEmpty();
        }

        @Override
        public BucketObject next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return buffer.poll();
        }

        private void fetchPage() {
            String url = endpoint + "/storage/v1/b/" + encode(bucket) + "/o?" + query
                    + "&maxResults=" + PAGE_SIZE
                    + (pageToken != null ? "&pageToken=" + encode(pageToken) : "");
            JsonNode page = getJson(url)
                    .orElseThrow(() -> new ReferenceNotFoundException("Bucket not found: gs://" + bucket));
            for (JsonNode item : page.path("items")) {
                buffer.add(toObject(bucket, item));
            }
            pageToken = textOrNull(page, "nextPageToken");
            lastPage = pageToken == null;
            log.debugf("Listed %d objects from gs://%s", page.path("items").size(), bucket);
        }
    }
}
