package io.github.yok.bucketdblink.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.bucketdblink.storage.InMemoryObjectStore;
import io.github.yok.bucketdblink.storage.ObjectStoreException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CsvMergerTest {

    private static final GroupKey KEY = new GroupKey("salesdb", "public", "orders");

    private InMemoryObjectStore store;
    private CsvMerger merger;

    @BeforeEach
    void setUp() {
        store = new InMemoryObjectStore("landing");
        merger = new CsvMerger(store);
    }

    @Test
    void merge_正常ケース_複数シャード_シャード順に行が連結されること() throws Exception {
        store.put("x/salesdb/public/orders/part1.csv", "id,amount\n1,10.5\n2,20.25\n");
        store.put("x/salesdb/public/orders/part2.csv", "id,amount\n3,30.0\n");

        MergedDataset ds = merger.merge(KEY,
                List.of("x/salesdb/public/orders/part1.csv", "x/salesdb/public/orders/part2.csv"));

        assertEquals(List.of("id", "amount"), ds.getColumns());
        assertEquals(3, ds.rowCount());
        assertEquals(List.of("1", "2", "3"), ds.column(0));
        assertEquals(List.of("10.5", "20.25", "30.0"), ds.column(1));
    }

    @Test
    void merge_正常ケース_列構成が異なるシャード_列は和集合となり欠損値で埋まること() throws Exception {
        store.put("a.csv", "id,name\n1,alice\n");
        store.put("b.csv", "name,email\nbob,bob@example.com\n");

        MergedDataset ds = merger.merge(KEY, List.of("a.csv", "b.csv"));

        assertEquals(List.of("id", "name", "email"), ds.getColumns());
        assertEquals(Arrays.asList("1", "alice", null), ds.getRows().get(0));
        assertEquals(Arrays.asList(null, "bob", "bob@example.com"), ds.getRows().get(1));
    }

    @Test
    void merge_正常ケース_UTF8でない内容_ISO_8859_1で読み直されること() throws Exception {
        store.put("latin.csv", "name\nCafé\n".getBytes(StandardCharsets.ISO_8859_1));

        MergedDataset ds = merger.merge(KEY, List.of("latin.csv"));

        assertEquals(List.of("Café"), ds.column(0));
    }

    @Test
    void merge_正常ケース_BOM付きUTF8_先頭列名にBOMが残らないこと() throws Exception {
        store.put("bom.csv", "\uFEFFid,name\n1,あ\n");

        MergedDataset ds = merger.merge(KEY, List.of("bom.csv"));

        assertEquals(List.of("id", "name"), ds.getColumns());
        assertEquals(List.of("あ"), ds.column(1));
    }

    @Test
    void merge_正常ケース_NAトークン_欠損値として扱われること() throws Exception {
        store.put("na.csv", "a,b,c,d\n,NA,NULL,keep\nNaN,n/a,#N/A,\"\"\nN.A.,none,-,0\n");

        MergedDataset ds = merger.merge(KEY, List.of("na.csv"));

        assertEquals(Arrays.asList(null, null, null, "keep"), ds.getRows().get(0));
        assertEquals(Arrays.asList(null, null, null, null), ds.getRows().get(1));
        assertEquals(List.of("N.A.", "none", "-", "0"), ds.getRows().get(2));
    }

    @Test
    void merge_正常ケース_ヘッダのみ_行数0で列は保持されること() throws Exception {
        store.put("empty.csv", "id,name\n");

        MergedDataset ds = merger.merge(KEY, List.of("empty.csv"));

        assertEquals(List.of("id", "name"), ds.getColumns());
        assertEquals(0, ds.rowCount());
    }

    @Test
    void merge_正常ケース_列数が不足する行_欠損値で補われること() throws Exception {
        store.put("short.csv", "a,b,c\n1\n2,3\n");

        MergedDataset ds = merger.merge(KEY, List.of("short.csv"));

        assertEquals(Arrays.asList("1", null, null), ds.getRows().get(0));
        assertEquals(Arrays.asList("2", "3", null), ds.getRows().get(1));
    }

    @Test
    void merge_異常ケース_列数が超過する行_IOExceptionがスローされること() {
        store.put("long.csv", "a,b\n1,2,3\n");

        IOException ex =
                assertThrows(IOException.class, () -> merger.merge(KEY, List.of("long.csv")));
        assertTrue(ex.getMessage().contains("long.csv"));
    }

    @Test
    void merge_異常ケース_空ファイル_IOExceptionがスローされること() {
        store.put("blank.csv", "");

        IOException ex =
                assertThrows(IOException.class, () -> merger.merge(KEY, List.of("blank.csv")));
        assertTrue(ex.getMessage().startsWith("No columns to parse"));
    }

    @Test
    void merge_異常ケース_オブジェクトが存在しない_ObjectStoreExceptionが伝播すること() {
        assertThrows(ObjectStoreException.class,
                () -> merger.merge(KEY, List.of("missing.csv")));
    }

    @Test
    void parse_正常ケース_重複列名と空列名_接尾辞とUnnamedで命名されること() throws Exception {
        CsvMerger.Shard shard = merger.parse("dup.csv", "a,a,,a\n1,2,3,4\n");

        assertEquals(List.of("a", "a.1", "Unnamed: 2", "a.2"), shard.header);
        assertEquals(List.of(List.of("1", "2", "3", "4")), shard.rows);
    }

    @Test
    void parse_正常ケース_引用符と埋め込み改行_1セルとして読まれること() throws Exception {
        CsvMerger.Shard shard =
                merger.parse("quoted.csv", "id,memo\n1,\"line1\nline2, with comma\"\n");

        assertEquals(List.of("1", "line1\nline2, with comma"), shard.rows.get(0));
    }

    @Test
    void decode_正常ケース_UTF8とLatin1_それぞれ正しく復号されること() throws Exception {
        assertEquals("über",
                merger.decode("u.csv", "über".getBytes(StandardCharsets.UTF_8)));
        assertEquals("über",
                merger.decode("l.csv", "über".getBytes(StandardCharsets.ISO_8859_1)));
    }
}
