package com.libragraph.artifacts.core.storage.handlers;

import com.libragraph.artifacts.core.cache.CacheKey;
import com.libragraph.artifacts.core.cache.CacheLookup;
import com.libragraph.artifacts.core.cache.ObjectCache;
import com.libragraph.artifacts.core.manifest.ManifestEntry;
import com.libragraph.artifacts.core.storage.CachedDownload;
import com.libragraph.artifacts.core.storage.DigestMismatchException;
import com.libragraph.artifacts.core.storage.ReferenceNotFoundException;
import com.libragraph.artifacts.core.storage.StorageException;
import com.libragraph.artifacts.core.storage.StorageHandler;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

/**
 * References to HTTP(S) resources.
 *
 * <p>Adding reads only response headers: the {@code ETag} (quotes removed) becomes the
 * digest and {@code Content-Length} the size. Downloads are cached under (url, etag) and
 * rejected when the server's ETag has changed.
 */
@ApplicationScoped
public class HttpHandler implements StorageHandler {

    private static final Logger log = Logger.getLogger(HttpHandler.class);

    @Inject
    HttpClient httpClient;

    @Inject
    ObjectCache cache;

    HttpHandler() {
    }

    public HttpHandler(HttpClient httpClient, ObjectCache cache) {
        this.httpClient = httpClient;
        this.cache = cache;
    }

    @Override
    public Set<String> schemes() {
        return Set.of("http", "https");
    }

    @Override
    public List<ManifestEntry> storePath(String uri, String name, boolean checksum, int maxObjects) {
        String entryName = name != null ? name : nameFromUrl(uri);
        if (!checksum) {
            return List.of(ManifestEntry.reference(entryName, uri, uri, null, Map.of()));
        }
        HttpHeaders headers = metadata(uri);
        Optional<String> etag = etag(headers);
        OptionalLong length = headers.firstValueAsLong("Content-Length");
        return List.of(ManifestEntry.reference(
                entryName,
                uri,
                etag.orElse(uri),
                length.isPresent() ? length.getAsLong() : null,
                etag.map(value -> Map.of("etag", value)).orElse(Map.of())));
    }

    @Override
    public String loadPath(ManifestEntry entry, boolean local) {
        String ref = HandlerSupport.requireRef(entry);
        if (!local) {
            return ref;
        }
        CacheLookup lookup = HandlerSupport.lookup(cache, CacheKey.etag(ref, entry.digest()), entry);
        return CachedDownload.fetch(lookup, ref, entry.size().orElse(null), () -> {
            HttpResponse<InputStream> response = send(HttpRequest.newBuilder(URI.create(ref)).GET().build(),
                    HttpResponse.BodyHandlers.ofInputStream(), ref);
            if (!isSuccess(response.statusCode())) {
                response.body().close();
                throw failure(ref, response.statusCode());
            }
            if (!HandlerSupport.isUnchecked(entry)) {
                String found = etag(response.headers()).orElse(ref);
                if (!entry.digest().equals(found)) {
                    response.body().close();
                    throw new DigestMismatchException(ref, entry.digest(), found);
                }
            }
            return response.body();
        }).toString();
    }

    /**
     * Response headers from a HEAD request, or from a GET whose body is discarded when
     * the server does not allow HEAD.
     */
    private HttpHeaders metadata(String uri) {
        HttpRequest head = HttpRequest.newBuilder(URI.create(uri))
                .method("HEAD", HttpRequest.BodyPublishers.noBody())
                .build();
        HttpResponse<Void> response = send(head, HttpResponse.BodyHandlers.discarding(), uri);
        if (response.statusCode() == 405 || response.statusCode() == 501) {
            log.debugf("HEAD not allowed for %s, reading headers from GET", uri);
            HttpResponse<InputStream> get = send(HttpRequest.newBuilder(URI.create(uri)).GET().build(),
                    HttpResponse.BodyHandlers.ofInputStream(), uri);
            try (InputStream ignored = get.body()) {
                if (!isSuccess(get.statusCode())) {
                    throw failure(uri, get.statusCode());
                }
                return get.headers();
            } catch (IOException e) {
                throw new StorageException("Failed to close response from " + uri, e);
            }
        }
        if (!isSuccess(response.statusCode())) {
            throw failure(uri, response.statusCode());
        }
        return response.headers();
    }

    private <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> handler, String uri) {
        try {
            return httpClient.send(request, handler);
        } catch (IOException e) {
            throw new StorageException("Request to " + uri + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted requesting " + uri, e);
        }
    }

    private static boolean isSuccess(int status) {
        return status >= 200 && status < 300;
    }

    private static StorageException failure(String uri, int status) {
        if (status == 404 || status == 410) {
            return new ReferenceNotFoundException("HTTP " + status + " for " + uri);
        }
        return new StorageException("HTTP " + status + " for " + uri);
    }

    private static Optional<String> etag(HttpHeaders headers) {
        return headers.firstValue("ETag")
                .map(value -> value.startsWith("W/") ? value.substring(2) : value)
                .map(value -> value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")
                        ? value.substring(1, value.length() - 1)
                        : value)
                .filter(value -> !value.isEmpty());
    }

    private static String nameFromUrl(String uri) {
        String path = URI.create(uri).getPath();
        String name = path == null ? "" : BucketEntries.basename(path);
        return name.isEmpty() ? URI.create(uri).getHost() : name;
    }
}
