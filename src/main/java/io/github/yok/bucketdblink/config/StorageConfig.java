package io.github.yok.bucketdblink.config;

import lombok.Value;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Source bucket settings, bound from the {@code storage.*} properties.
 *
 * <pre>
 * storage:
 *   bucket: landing-zone
 *   credentials-file: /secrets/aws-credentials
 *   profile: default
 *   region: us-east-1
 *   endpoint-override: http://localhost:9000
 * </pre>
 *
 * <p>
 * When {@code credentials-file} is blank the SDK default credential chain is used. When
 * {@code endpoint-override} is set, path-style access is enabled so S3-compatible stores work.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@ConfigurationProperties(prefix = "storage")
public class StorageConfig {

    // Bucket whose objects are indexed and loaded
    String bucket;
    // AWS credentials (profile) file path
    String credentialsFile;
    // Profile name inside the credentials file
    String profile;
    // Region of the bucket
    String region;
    // Endpoint of an S3-compatible store
    String endpointOverride;

    /**
     * Creates storage settings.
     *
     * @param bucket bucket name
     * @param credentialsFile credentials file path, or blank
     * @param profile profile name in the credentials file
     * @param region bucket region
     * @param endpointOverride custom endpoint URI, or blank
     */
    public StorageConfig(String bucket, String credentialsFile,
            @DefaultValue("default") String profile, @DefaultValue("us-east-1") String region,
            String endpointOverride) {
        this.bucket = bucket;
        this.credentialsFile = credentialsFile;
        this.profile = profile;
        this.region = region;
        this.endpointOverride = endpointOverride;
    }

    /**
     * Returns whether a credentials file is configured.
     *
     * @return {@code true} if {@code credentials-file} is not blank
     */
    public boolean hasCredentialsFile() {
        return StringUtils.isNotBlank(credentialsFile);
    }

    /**
     * Returns whether a custom endpoint is configured.
     *
     * @return {@code true} if {@code endpoint-override} is not blank
     */
    public boolean hasEndpointOverride() {
        return StringUtils.isNotBlank(endpointOverride);
    }
}
