package io.github.yok.bucketdblink.core;

import io.github.yok.bucketdblink.storage.ObjectStore;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * Fetches the CSV shards of one group and concatenates them into a {@link MergedDataset}.
 *
 * <p>
 * <strong>Decoding:</strong> strict UTF-8 first, ISO-8859-1 on malformed input. A failure after
 * the fallback is propagated.
 * </p>
 *
 * <p>
 * <strong>Parsing:</strong> comma delimiter, double-quote quoting, blank lines ignored, first
 * record is the header. Empty header names become {@code Unnamed: <index>} and repeated names get
 * a {@code .1}, {@code .2}, ... suffix. NA tokens such as {@code ""}, {@code NA}, {@code NULL} or
 * {@code NaN} become missing values. Short records are padded with missing values; long records
 * are an error.
 * </p>
 *
 * <p>
 * <strong>Merging:</strong> shards are appended in the given order. Columns are matched by name;
 * a column first seen in a later shard is appended and earlier rows get missing values for it.
 * Column sets are not validated across shards.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class CsvMerger {

    // Tokens read as missing values (same set as the usual data-frame CSV readers)
    static final Set<String> NA_VALUES = Set.of("", "#N/A", "#N/A N/A", "#NA", "-1.#IND",
            "-1.#QNAN", "-NaN", "-nan", "1.#IND", "1.#QNAN", "<NA>", "N/A", "NA", "NULL", "NaN",
            "None", "n/a", "nan", "null");

    private static final char BOM = '\uFEFF';

    private final ObjectStore objectStore;

    /**
     * Creates a merger reading from the given store.
     *
     * @param objectStore source of shard bytes
     */
    public CsvMerger(ObjectStore objectStore) {
        this.objectStore = objectStore;
    }

    /**
     * Fetches, parses and concatenates the shards of one group.
     *
     * @param key group being merged (for logging)
     * @param paths shard object keys in discovery order
     * @return merged dataset
     * @throws IOException if a shard cannot be decoded or parsed
     */
    public MergedDataset merge(GroupKey key, List<String> paths) throws IOException {
        List<String> columns = new ArrayList<>();
        Map<String, Integer> columnIndex = new HashMap<>();
        List<List<String>> rows = new ArrayList<>();

        for (String path : paths) {
            Shard shard = parse(path, decode(path, objectStore.fetch(path)));

            int[] target = new int[shard.header.size()];
            for (int i = 0; i < target.length; i++) {
                String name = shard.header.get(i);
                Integer idx = columnIndex.get(name);
                if (idx == null) {
                    idx = columns.size();
                    columns.add(name);
                    columnIndex.put(name, idx);
                }
                target[i] = idx;
            }

            for (List<String> record : shard.rows) {
                List<String> row = new ArrayList<>(Collections.nCopies(columns.size(), null));
                for (int i = 0; i < target.length; i++) {
                    row.set(target[i], record.get(i));
                }
                rows.add(row);
            }
            log.info("[{}] Shard read: {} (rows={})", key, path, shard.rows.size());
        }

        // pad rows read before a later shard introduced new columns
        for (List<String> row : rows) {
            while (row.size() < columns.size()) {
                row.add(null);
            }
        }

        log.info("[{}] Merged {} shard(s): columns={}, rows={}", key, paths.size(),
                columns.size(), rows.size());
        return new MergedDataset(columns, rows);
    }

    /**
     * Decodes shard bytes as UTF-8, falling back to ISO-8859-1.
     *
     * @param path object key (for logging)
     * @param data raw bytes
     * @return decoded text without a leading byte-order mark
     * @throws CharacterCodingException if the fallback decoding fails as well
     */
    String decode(String path, byte[] data) throws CharacterCodingException {
        String text;
        try {
            text = strictDecode(StandardCharsets.UTF_8, data);
        } catch (CharacterCodingException e) {
            log.info("Not valid UTF-8, retrying as ISO-8859-1: {}", path);
            text = strictDecode(StandardCharsets.ISO_8859_1, data);
        }
        return !text.isEmpty() && text.charAt(0) == BOM ? text.substring(1) : text;
    }

    private static String strictDecode(Charset charset, byte[] data)
            throws CharacterCodingException {
        return charset.newDecoder().onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT).decode(ByteBuffer.wrap(data))
                .toString();
    }

    /**
     * Parses decoded CSV text.
     *
     * @param path object key (for error messages)
     * @param text decoded content
     * @return header and data rows
     * @throws IOException if the text has no header or a record is wider than the header
     */
    Shard parse(String path, String text) throws IOException {
        try (CSVParser parser = CSVParser.parse(text, CSVFormat.DEFAULT)) {
            Iterator<CSVRecord> it = parser.iterator();
            if (!it.hasNext()) {
                throw new IOException("No columns to parse from file: " + path);
            }
            List<String> header = normalizeHeader(it.next());

            List<List<String>> rows = new ArrayList<>();
            while (it.hasNext()) {
                CSVRecord record = it.next();
                if (record.size() > header.size()) {
                    throw new IOException("Error tokenizing data in " + path + ": expected "
                            + header.size() + " fields in line " + record.getRecordNumber()
                            + ", saw " + record.size());
                }
                List<String> row = new ArrayList<>(header.size());
                for (int i = 0; i < header.size(); i++) {
                    row.add(i < record.size() ? toCell(record.get(i)) : null);
                }
                rows.add(row);
            }
            return new Shard(header, rows);
        } catch (UncheckedIOException e) {
            throw new IOException("Failed to parse CSV: " + path, e.getCause());
        } catch (IllegalStateException e) {
            throw new IOException("Failed to parse CSV: " + path, e);
        }
    }

    private static String toCell(String raw) {
        return NA_VALUES.contains(raw) ? null : raw;
    }

    private static List<String> normalizeHeader(CSVRecord record) {
        List<String> names = new ArrayList<>(record.size());
        Set<String> used = new HashSet<>();
        for (int i = 0; i < record.size(); i++) {
            String base = record.get(i).isEmpty() ? "Unnamed: " + i : record.get(i);
            String name = base;
            int n = 1;
            while (!used.add(name)) {
                name = base + "." + n++;
            }
            names.add(name);
        }
        return names;
    }

    /**
     * One parsed shard.
     */
    static final class Shard {
        final List<String> header;
        final List<List<String>> rows;

        Shard(List<String> header, List<List<String>> rows) {
            this.header = header;
            this.rows = rows;
        }
    }
}
