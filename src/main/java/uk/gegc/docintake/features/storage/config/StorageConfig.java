package uk.gegc.docintake.features.storage.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;
import uk.gegc.docintake.features.storage.application.BlobStore;
import uk.gegc.docintake.features.storage.infra.LocalBlobStore;
import uk.gegc.docintake.features.storage.infra.S3BlobStore;
import uk.gegc.docintake.shared.exception.StorageConfigurationException;

import java.nio.file.Path;
import java.util.function.Function;

/**
 * Builds the single {@link BlobStore} used by the application. The backend is chosen once here
 * from {@code app.storage.use-remote}; a remote store that cannot be constructed degrades to
 * local storage with a warning instead of stopping the process.
 */
@Slf4j
@Configuration
public class StorageConfig {

    @Bean
    public BlobStore blobStore(StorageProperties properties) {
        return createBlobStore(properties, StorageConfig::buildS3Client);
    }

    static BlobStore createBlobStore(StorageProperties properties, Function<StorageProperties.Remote, S3Client> clientFactory) {
        Path localRoot = Path.of(properties.getLocal().getRootDir());
        if (!properties.isUseRemote()) {
            log.info("Using local blob store at {}", localRoot.toAbsolutePath());
            return new LocalBlobStore(localRoot);
        }

        StorageProperties.Remote remote = properties.getRemote();
        S3Client client = null;
        try {
            client = clientFactory.apply(remote);
            S3BlobStore store = new S3BlobStore(client, remote.getBucket());
            log.info("Using S3 blob store for bucket '{}'", remote.getBucket());
            return store;
        } catch (RuntimeException e) {
            if (client != null) {
                client.close();
            }
            log.warn("Remote storage unavailable ({}). Falling back to local blob store at {}",
                    e.getMessage(), localRoot.toAbsolutePath());
            return new LocalBlobStore(localRoot);
        }
    }

    static S3Client buildS3Client(StorageProperties.Remote remote) {
        if (isBlank(remote.getAccessKey()) || isBlank(remote.getSecretKey())) {
            throw new StorageConfigurationException("AWS AccessKeyId and SecretAccessKey must be configured for S3 storage");
        }
        if (isBlank(remote.getBucket())) {
            throw new StorageConfigurationException("S3 bucket name must be configured for S3 storage");
        }
        if (isBlank(remote.getRegion())) {
            throw new StorageConfigurationException("AWS region must be configured for S3 storage");
        }

        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(remote.getRegion().trim()))
                .credentialsProvider(StaticCredentialsProvider.create(
                        AwsBasicCredentials.create(remote.getAccessKey(), remote.getSecretKey())))
                .serviceConfiguration(S3Configuration.builder()
                        .pathStyleAccessEnabled(remote.isPathStyleAccess())
                        .build());
        if (remote.getEndpoint() != null) {
            builder.endpointOverride(remote.getEndpoint());
        }
        return builder.build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
