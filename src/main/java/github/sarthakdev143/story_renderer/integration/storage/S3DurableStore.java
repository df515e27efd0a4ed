package github.sarthakdev143.story_renderer.integration.storage;

import github.sarthakdev143.story_renderer.config.RenderProperties;
import github.sarthakdev143.story_renderer.model.RenderJob;
import github.sarthakdev143.story_renderer.service.DurableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import tools.jackson.core.JacksonException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Mirrors job records and the project index into an S3 bucket and uploads finished videos. Every
 * failure is logged and reported as "unavailable" so rendering falls back to local storage.
 */
public class S3DurableStore implements DurableStore {

    private static final Logger logger = LoggerFactory.getLogger(S3DurableStore.class);
    private static final String JSON_CONTENT_TYPE = "application/json";
    private static final String VIDEO_CONTENT_TYPE = "video/mp4";

    private final S3Client s3Client;
    private final String bucket;
    private final String baseUrl;
    private final String videoPrefix;
    private final String jobPrefix;
    private final String indexKey;

    public S3DurableStore(S3Client s3Client, RenderProperties.S3 settings) {
        this.s3Client = s3Client;
        this.bucket = settings.getBucket();
        this.baseUrl = settings.resolveBaseUrl();
        this.videoPrefix = trimSlashes(settings.getVideoPrefix());
        this.jobPrefix = trimSlashes(settings.getJobPrefix());
        this.indexKey = trimSlashes(settings.getIndexKey());
        logger.info("S3 durable store initialized bucket={} baseUrl={}", bucket, baseUrl);
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public void putJob(RenderJob job) {
        String key = jobKey(job.id());
        try {
            s3Client.putObject(putRequest(key, JSON_CONTENT_TYPE), RequestBody.fromBytes(RenderJobCodec.writeJob(job)));
        } catch (SdkException e) {
            logger.error("Failed to mirror job {} to s3://{}/{}", job.id(), bucket, key, e);
        }
    }

    @Override
    public Optional<RenderJob> getJob(String jobId) {
        String key = jobKey(jobId);
        try {
            byte[] content = s3Client.getObjectAsBytes(getRequest(key)).asByteArray();
            return Optional.of(RenderJobCodec.readJob(content));
        } catch (NoSuchKeyException e) {
            logger.debug("No remote job record at s3://{}/{}", bucket, key);
            return Optional.empty();
        } catch (SdkException | JacksonException e) {
            logger.error("Failed to fetch job {} from s3://{}/{}", jobId, bucket, key, e);
            return Optional.empty();
        }
    }

    @Override
    public void putIndex(Map<String, String> projectIndex) {
        try {
            s3Client.putObject(
                    putRequest(indexKey, JSON_CONTENT_TYPE),
                    RequestBody.fromBytes(RenderJobCodec.writeIndex(projectIndex)));
        } catch (SdkException e) {
            logger.error("Failed to mirror project index to s3://{}/{}", bucket, indexKey, e);
        }
    }

    @Override
    public Map<String, String> getIndex() {
        try {
            byte[] content = s3Client.getObjectAsBytes(getRequest(indexKey)).asByteArray();
            return RenderJobCodec.readIndex(content);
        } catch (NoSuchKeyException e) {
            return Map.of();
        } catch (SdkException | JacksonException e) {
            logger.error("Failed to fetch project index from s3://{}/{}", bucket, indexKey, e);
            return Map.of();
        }
    }

    @Override
    public Optional<String> uploadArtifact(Path artifact, String projectKey) {
        if (artifact == null || !Files.isRegularFile(artifact)) {
            return Optional.empty();
        }

        String key = videoPrefix + "/" + projectKey + "/" + artifact.getFileName();
        try {
            s3Client.putObject(putRequest(key, VIDEO_CONTENT_TYPE), RequestBody.fromFile(artifact));
            logger.info("Uploaded render artifact to s3://{}/{}", bucket, key);
            return Optional.of(baseUrl + "/" + key);
        } catch (SdkException e) {
            logger.error("Failed to upload render artifact {} to s3://{}/{}", artifact, bucket, key, e);
            return Optional.empty();
        }
    }

    String jobKey(String jobId) {
        return jobPrefix + "/" + jobId + ".json";
    }

    private PutObjectRequest putRequest(String key, String contentType) {
        return PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType(contentType)
                .build();
    }

    private GetObjectRequest getRequest(String key) {
        return GetObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();
    }

    private static String trimSlashes(String value) {
        String trimmed = value == null ? "" : value.trim();
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
