package github.sarthakdev143.story_renderer.config;

import github.sarthakdev143.story_renderer.integration.storage.LocalOnlyDurableStore;
import github.sarthakdev143.story_renderer.integration.storage.S3DurableStore;
import github.sarthakdev143.story_renderer.service.DurableStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

import java.net.URI;

@Configuration
public class StorageConfig {

    private static final String S3_ENABLED_PROPERTY = "render.storage.s3.enabled";

    @Bean
    @ConditionalOnProperty(name = S3_ENABLED_PROPERTY, havingValue = "true")
    public S3Client renderS3Client(RenderProperties properties) {
        RenderProperties.S3 s3 = properties.getStorage().getS3();
        if (s3.getBucket() == null || s3.getBucket().isBlank()) {
            throw new IllegalStateException("render.storage.s3.bucket is required when S3 storage is enabled.");
        }

        S3ClientBuilder builder = S3Client.builder()
                .region(s3.getRegion() == null || s3.getRegion().isBlank() ? Region.US_EAST_1 : Region.of(s3.getRegion()))
                .credentialsProvider(credentialsProvider(s3));
        if (s3.getEndpoint() != null && !s3.getEndpoint().isBlank()) {
            builder.endpointOverride(URI.create(s3.getEndpoint())).forcePathStyle(true);
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnProperty(name = S3_ENABLED_PROPERTY, havingValue = "true")
    public DurableStore s3DurableStore(S3Client renderS3Client, RenderProperties properties) {
        return new S3DurableStore(renderS3Client, properties.getStorage().getS3());
    }

    @Bean
    @ConditionalOnProperty(name = S3_ENABLED_PROPERTY, havingValue = "false", matchIfMissing = true)
    public DurableStore localOnlyDurableStore() {
        return new LocalOnlyDurableStore();
    }

    private AwsCredentialsProvider credentialsProvider(RenderProperties.S3 s3) {
        if (s3.getAccessKey() != null && !s3.getAccessKey().isBlank()
                && s3.getSecretKey() != null && !s3.getSecretKey().isBlank()) {
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(s3.getAccessKey(), s3.getSecretKey()));
        }
        return DefaultCredentialsProvider.create();
    }
}
