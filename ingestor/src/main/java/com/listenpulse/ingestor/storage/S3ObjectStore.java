package com.listenpulse.ingestor.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.io.IOException;
import java.util.Optional;

/**
 * S3-backed object store. A single PutObject only becomes visible once the whole
 * body has been received, which gives the atomic-replace guarantee without a
 * temporary key.
 */
public class S3ObjectStore implements ObjectStore {

    private static final Logger logger = LoggerFactory.getLogger(S3ObjectStore.class);

    private final S3Client s3Client;
    private final String bucket;

    /**
     * Production constructor. Credentials and, unless {@code region} is given,
     * the region come from the SDK default provider chains.
     */
    public S3ObjectStore(String bucket, String region) {
        S3ClientBuilder builder = S3Client.builder();
        if (region != null && !region.isBlank()) {
            builder.region(Region.of(region));
        }
        this.s3Client = builder.build();
        this.bucket = bucket;
        logger.info("S3ObjectStore initialized for bucket: {}", bucket);
    }

    /**
     * Test constructor. Accepts an injected S3 client for mocking.
     */
    public S3ObjectStore(S3Client s3Client, String bucket) {
        this.s3Client = s3Client;
        this.bucket = bucket;
    }

    @Override
    public Optional<byte[]> get(String key) throws IOException {
        GetObjectRequest request = GetObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();
        try {
            ResponseBytes<GetObjectResponse> bytes = s3Client.getObjectAsBytes(request);
            return Optional.of(bytes.asByteArray());
        } catch (NoSuchKeyException e) {
            logger.debug("No object at {}", describe(key));
            return Optional.empty();
        } catch (SdkException e) {
            throw new IOException("Failed to read " + describe(key) + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean exists(String key) throws IOException {
        HeadObjectRequest request = HeadObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();
        try {
            s3Client.headObject(request);
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return false;
            }
            throw new IOException("Failed to check " + describe(key) + ": " + e.getMessage(), e);
        } catch (SdkException e) {
            throw new IOException("Failed to check " + describe(key) + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void put(String key, byte[] content, String contentType) throws IOException {
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType(contentType)
                .build();
        try {
            s3Client.putObject(request, RequestBody.fromBytes(content));
            logger.debug("Wrote {} bytes to {}", content.length, describe(key));
        } catch (SdkException e) {
            throw new IOException("Failed to write " + describe(key) + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String describe(String key) {
        return "s3://" + bucket + "/" + key;
    }
}
