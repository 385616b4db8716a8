package io.github.yok.bucketdblink;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.mockConstruction;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.bucketdblink.config.ConnectionConfig;
import io.github.yok.bucketdblink.config.LoaderConfig;
import io.github.yok.bucketdblink.config.StorageConfig;
import io.github.yok.bucketdblink.core.BucketLoader;
import io.github.yok.bucketdblink.core.LoadReport;
import io.github.yok.bucketdblink.storage.s3.S3Clients;
import io.github.yok.bucketdblink.util.ErrorHandler;
import java.sql.SQLException;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.MockedConstruction;
import org.springframework.boot.SpringApplication;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Utilities;

class MainTest {

    private final ConnectionConfig connectionConfig =
            new ConnectionConfig("localhost", 5432, "postgres", "", "postgres", "");
    private final StorageConfig storageConfig =
            new StorageConfig("landing", "", "default", "us-east-1", "");
    private final LoaderConfig loaderConfig = new LoaderConfig(100, false);

    private S3Clients s3Clients;
    private S3Client s3;

    @BeforeEach
    void setUp() {
        ErrorHandler.disableExitForCurrentThread();
        s3Clients = mock(S3Clients.class);
        s3 = mock(S3Client.class);
        when(s3Clients.create(any(StorageConfig.class))).thenReturn(s3);
        when(s3Clients.utilities(any(StorageConfig.class)))
                .thenReturn(S3Utilities.builder().region(Region.US_EAST_1).build());
    }

    @AfterEach
    void tearDown() {
        ErrorHandler.restoreExitForCurrentThread();
    }

    @Test
    void main_正常ケース_SpringApplicationが起動されること() {
        try (MockedConstruction<SpringApplication> mocked =
                mockConstruction(SpringApplication.class)) {
            Main.main(new String[] {"extra"});

            SpringApplication app = mocked.constructed().get(0);
            verify(app).setAddCommandLineProperties(false);
            verify(app).run("extra");
        }
    }

    @Test
    void run_正常ケース_ローダが1回実行されS3クライアントが閉じられること() {
        try (MockedConstruction<BucketLoader> mocked = mockConstruction(BucketLoader.class,
                (loader, context) -> when(loader.run())
                        .thenReturn(new LoadReport(List.of(), List.of())))) {
            new Main(connectionConfig, storageConfig, loaderConfig, s3Clients).run();

            assertEquals(1, mocked.constructed().size());
            verify(s3).close();
        }
    }

    @Test
    void run_異常ケース_ローダ失敗_ErrorHandler経由で例外が通知されること() {
        SQLException failure = new SQLException("connection refused");
        try (MockedConstruction<BucketLoader> mocked = mockConstruction(BucketLoader.class,
                (loader, context) -> when(loader.run()).thenThrow(failure))) {
            Main main = new Main(connectionConfig, storageConfig, loaderConfig, s3Clients);

            IllegalStateException ex = assertThrows(IllegalStateException.class, main::run);

            assertEquals("Fatal error: connection refused", ex.getMessage());
            assertInstanceOf(SQLException.class, ex.getCause());
            verify(s3).close();
        }
    }

    @Test
    void run_異常ケース_バケット未設定_ErrorHandler経由で例外が通知されること() {
        StorageConfig noBucket = new StorageConfig("", "", "default", "us-east-1", "");
        Main main = new Main(connectionConfig, noBucket, loaderConfig, s3Clients);

        IllegalStateException ex = assertThrows(IllegalStateException.class, main::run);

        assertInstanceOf(IllegalStateException.class, ex.getCause());
    }
}
