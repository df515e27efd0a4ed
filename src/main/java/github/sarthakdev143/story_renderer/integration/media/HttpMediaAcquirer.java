package github.sarthakdev143.story_renderer.integration.media;

import github.sarthakdev143.story_renderer.config.RenderProperties;
import github.sarthakdev143.story_renderer.exception.MediaFetchException;
import github.sarthakdev143.story_renderer.service.MediaAcquirer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Downloads remote clips into a cache named by the SHA-256 of the URL. A cached file is returned as-is
 * without revalidation.
 */
@Component
public class HttpMediaAcquirer implements MediaAcquirer {

    private static final Logger logger = LoggerFactory.getLogger(HttpMediaAcquirer.class);
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration READ_TIMEOUT = Duration.ofSeconds(30);
    private static final String DEFAULT_EXTENSION = ".mp4";
    private static final Pattern EXTENSION_PATTERN = Pattern.compile("\\.[a-z0-9]{1,5}");

    private final RestClient restClient;
    private final Path cacheDir;
    private final Map<String, Object> urlLocks = new ConcurrentHashMap<>();

    @Autowired
    public HttpMediaAcquirer(RenderProperties properties) {
        this(RestClient.builder().requestFactory(requestFactory()).build(), properties.videoCacheDir());
    }

    HttpMediaAcquirer(RestClient restClient, Path cacheDir) {
        this.restClient = restClient;
        this.cacheDir = cacheDir;
    }

    @Override
    public Path acquire(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Media URL is required.");
        }

        String trimmed = url.trim();
        Path target = cachePathFor(trimmed);
        if (Files.isRegularFile(target)) {
            return target;
        }

        // one download per URL even when several scenes share a clip
        Object lock = urlLocks.computeIfAbsent(trimmed, ignored -> new Object());
        synchronized (lock) {
            if (Files.isRegularFile(target)) {
                return target;
            }
            download(trimmed, target);
            return target;
        }
    }

    Path cachePathFor(String url) {
        return cacheDir.resolve(sha256(url) + extensionOf(url));
    }

    static String extensionOf(String url) {
        String path = url;
        int cut = indexOfAny(path, '?', '#');
        if (cut >= 0) {
            path = path.substring(0, cut);
        }
        int slash = path.lastIndexOf('/');
        String lastSegment = slash >= 0 ? path.substring(slash + 1) : path;
        int dot = lastSegment.lastIndexOf('.');
        if (dot <= 0) {
            return DEFAULT_EXTENSION;
        }
        String extension = lastSegment.substring(dot).toLowerCase(Locale.ROOT);
        return EXTENSION_PATTERN.matcher(extension).matches() ? extension : DEFAULT_EXTENSION;
    }

    private void download(String url, Path target) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new MediaFetchException(url, e);
        }

        logger.info("Downloading media url={} target={}", url, target);
        byte[] body;
        try {
            body = restClient.get()
                    .uri(uri)
                    .retrieve()
                    .body(byte[].class);
        } catch (RestClientException e) {
            throw new MediaFetchException(url, e);
        }

        if (body == null || body.length == 0) {
            throw new MediaFetchException(url, "empty response body");
        }

        Path tempFile = null;
        try {
            Files.createDirectories(cacheDir);
            tempFile = Files.createTempFile(cacheDir, "download-", ".part");
            Files.write(tempFile, body);
            Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new MediaFetchException(url, e);
        } finally {
            deleteQuietly(tempFile);
        }
    }

    private static SimpleClientHttpRequestFactory requestFactory() {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(CONNECT_TIMEOUT);
        factory.setReadTimeout(READ_TIMEOUT);
        return factory;
    }

    private static int indexOfAny(String value, char first, char second) {
        int a = value.indexOf(first);
        int b = value.indexOf(second);
        if (a < 0) {
            return b;
        }
        if (b < 0) {
            return a;
        }
        return Math.min(a, b);
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException ignored) {
            // Cleanup failures are non-fatal.
        }
    }
}
