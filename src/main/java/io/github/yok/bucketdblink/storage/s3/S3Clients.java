package io.github.yok.bucketdblink.storage.s3;

import io.github.yok.bucketdblink.config.StorageConfig;
import java.net.URI;
import java.nio.file.Paths;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.http.urlconnection.UrlConnectionHttpClient;
import software.amazon.awssdk.profiles.ProfileFile;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.S3Utilities;

/**
 * Builds S3 clients from {@link StorageConfig}.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class S3Clients {

    /**
     * Creates an S3 client. The caller owns the client and must close it.
     *
     * @param config storage settings
     * @return configured client
     */
    public S3Client create(StorageConfig config) {
        S3ClientBuilder b = S3Client.builder().region(Region.of(config.getRegion()))
                .httpClient(UrlConnectionHttpClient.create())
                .credentialsProvider(credentialsProvider(config));
        if (config.hasEndpointOverride()) {
            b = b.endpointOverride(URI.create(config.getEndpointOverride()))
                    .serviceConfiguration(pathStyle());
        }
        log.info("S3 client created (region={}, endpoint={})", config.getRegion(),
                config.hasEndpointOverride() ? config.getEndpointOverride() : "default");
        return b.build();
    }

    /**
     * Creates the URL helper matching {@link #create(StorageConfig)}.
     *
     * @param config storage settings
     * @return URL helper
     */
    public S3Utilities utilities(StorageConfig config) {
        S3Utilities.Builder b = S3Utilities.builder().region(Region.of(config.getRegion()));
        if (config.hasEndpointOverride()) {
            b = b.endpoint(URI.create(config.getEndpointOverride()))
                    .s3Configuration(pathStyle());
        }
        return b.build();
    }

    /**
     * Resolves credentials: the configured profile file if any, otherwise the default chain.
     *
     * @param config storage settings
     * @return credentials provider
     */
    AwsCredentialsProvider credentialsProvider(StorageConfig config) {
        if (!config.hasCredentialsFile()) {
            return DefaultCredentialsProvider.create();
        }
        ProfileFile file = ProfileFile.builder().content(Paths.get(config.getCredentialsFile()))
                .type(ProfileFile.Type.CREDENTIALS).build();
        return ProfileCredentialsProvider.builder().profileFile(file)
                .profileName(config.getProfile()).build();
    }

    private static S3Configuration pathStyle() {
        return S3Configuration.builder().pathStyleAccessEnabled(true).build();
    }
}
