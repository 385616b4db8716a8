package io.github.yok.bucketdblink;

import io.github.yok.bucketdblink.config.ConnectionConfig;
import io.github.yok.bucketdblink.config.LoaderConfig;
import io.github.yok.bucketdblink.config.StorageConfig;
import io.github.yok.bucketdblink.core.BucketLoader;
import io.github.yok.bucketdblink.core.LoadReport;
import io.github.yok.bucketdblink.db.DriverManagerConnectionFactory;
import io.github.yok.bucketdblink.storage.ObjectStore;
import io.github.yok.bucketdblink.storage.s3.S3Clients;
import io.github.yok.bucketdblink.storage.s3.S3ObjectStore;
import io.github.yok.bucketdblink.util.ErrorHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import software.amazon.awssdk.services.s3.S3Client;

/**
 * Provides the application entry point.
 *
 * <p>
 * A run has a single mode: list the configured bucket, then load every CSV group and image group
 * into the PostgreSQL server. Command-line arguments are not used; unknown arguments are logged
 * and ignored.
 * </p>
 *
 * <p>
 * Spring Boot binds {@link ConnectionConfig}, {@link StorageConfig} and {@link LoaderConfig} from
 * {@code application.yml} (environment variables {@code DB_HOST}, {@code DB_PORT},
 * {@code DB_USER}, {@code DB_PASSWORD}, {@code BUCKET_NAME}, {@code CRED_PATH}) and passes them to
 * {@link BucketLoader}.
 * </p>
 *
 * @see BucketLoader
 * @see S3Clients
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({ConnectionConfig.class, StorageConfig.class, LoaderConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner {

    private final ConnectionConfig connectionConfig;
    private final StorageConfig storageConfig;
    private final LoaderConfig loaderConfig;
    private final S3Clients s3Clients;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        app.run(args);
    }

    /**
     * Entry point invoked after Spring Boot starts. Runs one full load.
     *
     * @param args command-line arguments (ignored)
     */
    @Override
    public void run(String... args) {
        for (String arg : args) {
            log.warn("Unknown argument: {}", arg);
        }
        log.info("Starting load. Bucket [{}], Server [{}:{}], Loader {}",
                storageConfig.getBucket(), connectionConfig.getHost(), connectionConfig.getPort(),
                loaderConfig);

        try (S3Client s3 = s3Clients.create(storageConfig)) {
            ObjectStore store = new S3ObjectStore(s3, s3Clients.utilities(storageConfig),
                    storageConfig.getBucket());
            LoadReport report = new BucketLoader(store,
                    new DriverManagerConnectionFactory(connectionConfig),
                    connectionConfig.getAdminDatabase(), loaderConfig).run();
            log.info("Load completed. Groups={}, skipped objects={}", report.getGroups().size(),
                    report.getSkipped().size());
        } catch (Exception e) {
            ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
        }
    }
}
