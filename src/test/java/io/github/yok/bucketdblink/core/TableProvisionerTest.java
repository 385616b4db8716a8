package io.github.yok.bucketdblink.core;

import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class TableProvisionerTest {

    private final TableProvisioner provisioner = new TableProvisioner();

    private static Connection adminWithLookup(boolean exists, Statement st) throws SQLException {
        Connection admin = mock(Connection.class);
        PreparedStatement ps = mock(PreparedStatement.class);
        ResultSet rs = mock(ResultSet.class);
        when(admin.prepareStatement("SELECT 1 FROM pg_database WHERE datname = ?"))
                .thenReturn(ps);
        when(ps.executeQuery()).thenReturn(rs);
        when(rs.next()).thenReturn(exists);
        when(admin.createStatement()).thenReturn(st);
        return admin;
    }

    @Test
    void ensureDatabase_正常ケース_存在しないデータベース_CREATE_DATABASEが実行されること()
            throws Exception {
        Statement st = mock(Statement.class);
        Connection admin = adminWithLookup(false, st);

        provisioner.ensureDatabase(admin, "salesdb");

        verify(admin).setAutoCommit(true);
        verify(st).execute("CREATE DATABASE \"salesdb\"");
    }

    @Test
    void ensureDatabase_正常ケース_既存データベース_作成されないこと() throws Exception {
        Statement st = mock(Statement.class);
        Connection admin = adminWithLookup(true, st);

        provisioner.ensureDatabase(admin, "salesdb");

        verify(admin, never()).createStatement();
        verify(st, never()).execute(anyString());
    }

    @Test
    void ensureTable_正常ケース_推論列_スキーマとテーブルが作成されコミットされること()
            throws Exception {
        Connection conn = mock(Connection.class);
        Statement st = mock(Statement.class);
        when(conn.createStatement()).thenReturn(st);

        provisioner.ensureTable(conn, new GroupKey("salesdb", "public", "orders"),
                List.of(new InferredColumn("id", ColumnType.INTEGER),
                        new InferredColumn("amount", ColumnType.REAL)));

        InOrder order = inOrder(st, conn);
        order.verify(st).execute("CREATE SCHEMA IF NOT EXISTS \"public\"");
        order.verify(st).execute(
                "CREATE TABLE IF NOT EXISTS \"public\".\"orders\" (\"id\" INTEGER, \"amount\" REAL)");
        order.verify(conn).commit();
        verify(st).close();
    }

    @Test
    void ensureTable_正常ケース_引用符を含む識別子_二重化してクォートされること() throws Exception {
        Connection conn = mock(Connection.class);
        Statement st = mock(Statement.class);
        when(conn.createStatement()).thenReturn(st);

        provisioner.ensureTable(conn, new GroupKey("db", "my\"schema", "Order Lines"),
                List.of(new InferredColumn("unit price", ColumnType.REAL)));

        verify(st).execute("CREATE SCHEMA IF NOT EXISTS \"my\"\"schema\"");
        verify(st).execute("CREATE TABLE IF NOT EXISTS \"my\"\"schema\".\"Order Lines\""
                + " (\"unit price\" REAL)");
    }

    @Test
    void ensureTable_正常ケース_2回呼び出し_いずれもIF_NOT_EXISTSで成功すること() throws Exception {
        Connection conn = mock(Connection.class);
        Statement st = mock(Statement.class);
        when(conn.createStatement()).thenReturn(st);
        GroupKey key = new GroupKey("salesdb", "public", "orders");
        List<InferredColumn> columns = List.of(new InferredColumn("id", ColumnType.INTEGER));

        provisioner.ensureTable(conn, key, columns);
        provisioner.ensureTable(conn, key, columns);

        verify(st, times(2)).execute("CREATE SCHEMA IF NOT EXISTS \"public\"");
        verify(conn, times(2)).commit();
    }

    @Test
    void ensureImageTable_正常ケース_固定レイアウトのテーブルが作成されコミットはされないこと()
            throws Exception {
        Connection conn = mock(Connection.class);
        Statement st = mock(Statement.class);
        when(conn.createStatement()).thenReturn(st);

        provisioner.ensureImageTable(conn, new GroupKey("mediadb", "assets", "photos"));

        verify(st).execute("CREATE SCHEMA IF NOT EXISTS \"assets\"");
        verify(st).execute("CREATE TABLE IF NOT EXISTS \"assets\".\"photos\" (id SERIAL PRIMARY"
                + " KEY, file_name TEXT NOT NULL, url TEXT NOT NULL UNIQUE)");
        verify(conn, never()).commit();
        verify(conn, never()).rollback();
    }

    @Test
    void ensureTable_異常ケース_DDL失敗_ロールバックされ例外が再スローされること() throws Exception {
        Connection conn = mock(Connection.class);
        Statement st = mock(Statement.class);
        when(conn.createStatement()).thenReturn(st);
        SQLException failure = new SQLException("permission denied for schema");
        when(st.execute("CREATE SCHEMA IF NOT EXISTS \"public\"")).thenThrow(failure);

        SQLException ex = assertThrows(SQLException.class,
                () -> provisioner.ensureTable(conn, new GroupKey("db", "public", "t"),
                        List.of(new InferredColumn("a", ColumnType.TEXT))));

        assertSame(failure, ex);
        verify(conn).rollback();
        verify(conn, never()).commit();
    }

    @Test
    void ensureImageTable_異常ケース_ロールバックも失敗_元の例外に抑制例外として付与されること()
            throws Exception {
        Connection conn = mock(Connection.class);
        Statement st = mock(Statement.class);
        when(conn.createStatement()).thenReturn(st);
        when(st.execute(anyString())).thenThrow(new SQLException("ddl failed"));
        SQLException rollbackFailure = new SQLException("connection lost");
        doThrow(rollbackFailure).when(conn).rollback();

        SQLException ex = assertThrows(SQLException.class,
                () -> provisioner.ensureImageTable(conn, new GroupKey("db", "s", "t")));

        assertSame(rollbackFailure, ex.getSuppressed()[0]);
    }
}
