package uk.gegc.docintake.features.storage.infra;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.ServerSideEncryption;
import uk.gegc.docintake.features.storage.application.BlobStore;
import uk.gegc.docintake.features.storage.application.MediaTypes;
import uk.gegc.docintake.features.storage.domain.StoredObject;
import uk.gegc.docintake.features.storage.domain.StoredObjectRef;
import uk.gegc.docintake.shared.exception.DocumentStorageException;
import uk.gegc.docintake.shared.exception.ResourceNotFoundException;
import uk.gegc.docintake.shared.exception.StorageConfigurationException;

import java.util.UUID;

/**
 * S3 (or S3-compatible) object store. Objects are written with SSE-S3 (AES256) encryption.
 * Construction checks that the bucket is reachable and fails with
 * {@link StorageConfigurationException} otherwise.
 */
@Slf4j
public class S3BlobStore implements BlobStore, AutoCloseable {

    static final String SCHEME = "s3";

    private final S3Client s3Client;
    private final String bucket;

    public S3BlobStore(S3Client s3Client, String bucket) {
        this.s3Client = s3Client;
        this.bucket = bucket;
        verifyBucket();
    }

    private void verifyBucket() {
        try {
            s3Client.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
            log.info("S3 bucket '{}' is reachable", bucket);
        } catch (NoSuchBucketException e) {
            throw new StorageConfigurationException("S3 bucket '" + bucket + "' does not exist", e);
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                throw new StorageConfigurationException("S3 bucket '" + bucket + "' does not exist", e);
            }
            if (e.statusCode() == 403) {
                throw new StorageConfigurationException(
                        "Access denied to S3 bucket '" + bucket + "'. Check your AWS credentials.", e);
            }
            throw new StorageConfigurationException("Error accessing S3 bucket '" + bucket + "': " + e.getMessage(), e);
        } catch (SdkException e) {
            throw new StorageConfigurationException("Error accessing S3 bucket '" + bucket + "': " + e.getMessage(), e);
        }
    }

    @Override
    public StoredObjectRef put(String name, String mediaType, byte[] content) {
        String baseName = FilenameUtils.getName(name == null ? "" : name);
        String key = UUID.randomUUID() + "_" + (baseName.isBlank() ? "file" : baseName);
        String contentType = mediaType == null || mediaType.isBlank()
                ? MediaTypes.inferFromFileName(name)
                : mediaType;

        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType(contentType)
                .contentLength((long) content.length)
                .serverSideEncryption(ServerSideEncryption.AES256)
                .build();

        try {
            s3Client.putObject(request, RequestBody.fromBytes(content));
        } catch (SdkException e) {
            throw new DocumentStorageException("Failed to upload " + name + " to S3 bucket " + bucket, e);
        }

        log.debug("Uploaded {} bytes to s3://{}/{}", content.length, bucket, key);
        return new StoredObjectRef(SCHEME + "://" + bucket + "/" + key);
    }

    @Override
    public StoredObject get(StoredObjectRef ref) {
        String key = keyOf(ref);
        try {
            ResponseBytes<GetObjectResponse> bytes = s3Client.getObjectAsBytes(GetObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build());
            String contentType = bytes.response().contentType();
            if (contentType == null || contentType.isBlank()) {
                contentType = MediaTypes.inferFromFileName(key);
            }
            return new StoredObject(bytes.asByteArray(), contentType);
        } catch (NoSuchKeyException e) {
            throw new ResourceNotFoundException("Stored object " + ref + " not found", e);
        } catch (SdkException e) {
            throw new DocumentStorageException("Failed to download " + ref, e);
        }
    }

    @Override
    public void delete(StoredObjectRef ref) {
        String key = keyOf(ref);
        try {
            // S3 deletes are idempotent, so check existence first to report missing objects
            s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build());
            s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
        } catch (NoSuchKeyException e) {
            throw new ResourceNotFoundException("Stored object " + ref + " not found", e);
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                throw new ResourceNotFoundException("Stored object " + ref + " not found", e);
            }
            throw new DocumentStorageException("Failed to delete " + ref, e);
        } catch (SdkException e) {
            throw new DocumentStorageException("Failed to delete " + ref, e);
        }
        log.debug("Deleted s3://{}/{}", bucket, key);
    }

    @Override
    public String backendName() {
        return "s3:" + bucket;
    }

    @Override
    public void close() {
        s3Client.close();
    }

    private String keyOf(StoredObjectRef ref) {
        String prefix = bucket + "/";
        if (!SCHEME.equals(ref.scheme()) || !ref.path().startsWith(prefix) || ref.path().length() == prefix.length()) {
            throw new ResourceNotFoundException("Stored object " + ref + " not found");
        }
        return ref.path().substring(prefix.length());
    }
}
