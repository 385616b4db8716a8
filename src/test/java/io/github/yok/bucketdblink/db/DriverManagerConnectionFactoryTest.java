package io.github.yok.bucketdblink.db;

import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.mockStatic;
import io.github.yok.bucketdblink.config.ConnectionConfig;
import java.sql.Connection;
import java.sql.DriverManager;
import org.junit.jupiter.api.Test;
import org.mockito.MockedStatic;

class DriverManagerConnectionFactoryTest {

    @Test
    void open_正常ケース_データベース名_設定のサーバとユーザで接続されること() throws Exception {
        ConnectionConfig config =
                new ConnectionConfig("db.local", 6543, "loader", "secret", "postgres", "");
        Connection conn = mock(Connection.class);

        try (MockedStatic<DriverManager> dm = mockStatic(DriverManager.class)) {
            dm.when(() -> DriverManager.getConnection("jdbc:postgresql://db.local:6543/salesdb",
                    "loader", "secret")).thenReturn(conn);

            assertSame(conn, new DriverManagerConnectionFactory(config).open("salesdb"));
        }
    }

    @Test
    void constructor_異常ケース_存在しないドライバクラス_IllegalStateExceptionがスローされること() {
        ConnectionConfig config = new ConnectionConfig("localhost", 5432, "postgres", "",
                "postgres", "com.example.NoSuchDriver");

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> new DriverManagerConnectionFactory(config));
        assertTrue(ex.getMessage().contains("com.example.NoSuchDriver"));
    }
}
