package io.github.yok.bucketdblink.storage.s3;

import io.github.yok.bucketdblink.storage.ObjectStore;
import io.github.yok.bucketdblink.storage.ObjectStoreException;
import io.github.yok.bucketdblink.storage.StoredObject;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Utilities;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetUrlRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.S3Object;

/**
 * {@link ObjectStore} backed by an Amazon S3 (or S3-compatible) bucket.
 *
 * <p>
 * Listing follows continuation tokens until the bucket is exhausted, so the result keeps the
 * key order S3 returns. Public URLs are computed locally with {@link S3Utilities}; no request is
 * made for them.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class S3ObjectStore implements ObjectStore {

    private static final int PAGE_SIZE = 1000;

    private final S3Client s3;
    private final S3Utilities utilities;
    private final String bucket;

    /**
     * Creates a store for one bucket.
     *
     * @param s3 S3 client
     * @param utilities URL helper configured for the same region/endpoint as {@code s3}
     * @param bucket bucket name
     * @throws IllegalStateException if {@code bucket} is blank
     */
    public S3ObjectStore(S3Client s3, S3Utilities utilities, String bucket) {
        if (StringUtils.isBlank(bucket)) {
            throw new IllegalStateException(
                    "storage.bucket is not configured. Please set 'storage.bucket' (BUCKET_NAME).");
        }
        this.s3 = s3;
        this.utilities = utilities;
        this.bucket = bucket;
    }

    @Override
    public List<StoredObject> listObjects() {
        List<StoredObject> objects = new ArrayList<>();
        String token = null;
        try {
            do {
                ListObjectsV2Response resp = s3.listObjectsV2(ListObjectsV2Request.builder()
                        .bucket(bucket).maxKeys(PAGE_SIZE).continuationToken(token).build());
                for (S3Object o : resp.contents()) {
                    objects.add(new StoredObject(o.key(), publicUrl(o.key())));
                }
                token = Boolean.TRUE.equals(resp.isTruncated()) ? resp.nextContinuationToken()
                        : null;
            } while (token != null);
        } catch (SdkException e) {
            throw new ObjectStoreException("LIST failed: bucket=" + bucket, e);
        }
        log.info("Listed {} objects in bucket [{}]", objects.size(), bucket);
        return objects;
    }

    @Override
    public byte[] fetch(String path) {
        try {
            return s3.getObjectAsBytes(GetObjectRequest.builder().bucket(bucket).key(path).build())
                    .asByteArray();
        } catch (SdkException e) {
            throw new ObjectStoreException("GET failed: s3://" + bucket + "/" + path, e);
        }
    }

    private String publicUrl(String key) {
        return utilities.getUrl(GetUrlRequest.builder().bucket(bucket).key(key).build())
                .toExternalForm();
    }
}
