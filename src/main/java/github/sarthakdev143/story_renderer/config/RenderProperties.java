package github.sarthakdev143.story_renderer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

/**
 * Output layout, scene concurrency and optional object storage for the render pipeline.
 */
@ConfigurationProperties(prefix = "render")
public class RenderProperties {

    private Path outputDir = Path.of("outputs");
    private int sceneWorkers = 4;
    private double defaultSceneSeconds = 3.0;
    private String publicPathPrefix = "/videos";
    private Storage storage = new Storage();

    public Path getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(Path outputDir) {
        this.outputDir = outputDir;
    }

    public int getSceneWorkers() {
        return sceneWorkers;
    }

    public void setSceneWorkers(int sceneWorkers) {
        this.sceneWorkers = sceneWorkers;
    }

    public double getDefaultSceneSeconds() {
        return defaultSceneSeconds;
    }

    public void setDefaultSceneSeconds(double defaultSceneSeconds) {
        this.defaultSceneSeconds = defaultSceneSeconds;
    }

    public String getPublicPathPrefix() {
        return publicPathPrefix;
    }

    public void setPublicPathPrefix(String publicPathPrefix) {
        this.publicPathPrefix = publicPathPrefix;
    }

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public Path renderDir() {
        return outputDir.resolve("renders");
    }

    public Path audioCacheDir() {
        return outputDir.resolve("cache").resolve("audio");
    }

    public Path videoCacheDir() {
        return outputDir.resolve("cache").resolve("video");
    }

    public Path subtitleCacheDir() {
        return outputDir.resolve("cache").resolve("subtitles");
    }

    public static class Storage {

        private S3 s3 = new S3();

        public S3 getS3() {
            return s3;
        }

        public void setS3(S3 s3) {
            this.s3 = s3;
        }
    }

    public static class S3 {

        private boolean enabled;
        private String bucket;
        private String region;
        private String endpoint;
        private String accessKey;
        private String secretKey;
        private String baseUrl;
        private String videoPrefix = "videos";
        private String jobPrefix = "jobs";
        private String indexKey = "renders/project_index.json";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBucket() {
            return bucket;
        }

        public void setBucket(String bucket) {
            this.bucket = bucket;
        }

        public String getRegion() {
            return region;
        }

        public void setRegion(String region) {
            this.region = region;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getAccessKey() {
            return accessKey;
        }

        public void setAccessKey(String accessKey) {
            this.accessKey = accessKey;
        }

        public String getSecretKey() {
            return secretKey;
        }

        public void setSecretKey(String secretKey) {
            this.secretKey = secretKey;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getVideoPrefix() {
            return videoPrefix;
        }

        public void setVideoPrefix(String videoPrefix) {
            this.videoPrefix = videoPrefix;
        }

        public String getJobPrefix() {
            return jobPrefix;
        }

        public void setJobPrefix(String jobPrefix) {
            this.jobPrefix = jobPrefix;
        }

        public String getIndexKey() {
            return indexKey;
        }

        public void setIndexKey(String indexKey) {
            this.indexKey = indexKey;
        }

        /**
         * Public URL prefix of uploaded objects, derived from the endpoint or AWS region when not configured.
         */
        public String resolveBaseUrl() {
            if (baseUrl != null && !baseUrl.isBlank()) {
                return stripTrailingSlash(baseUrl);
            }
            if (endpoint != null && !endpoint.isBlank()) {
                return stripTrailingSlash(endpoint) + "/" + bucket;
            }
            if (region != null && !region.isBlank() && !"us-east-1".equals(region)) {
                return "https://" + bucket + ".s3." + region + ".amazonaws.com";
            }
            return "https://" + bucket + ".s3.amazonaws.com";
        }

        private static String stripTrailingSlash(String value) {
            String trimmed = value.trim();
            while (trimmed.endsWith("/")) {
                trimmed = trimmed.substring(0, trimmed.length() - 1);
            }
            return trimmed;
        }
    }
}
