package io.github.yok.bucketdblink.core;

import io.github.yok.bucketdblink.config.LoaderConfig;
import io.github.yok.bucketdblink.db.ConnectionFactory;
import io.github.yok.bucketdblink.storage.ObjectStore;
import java.io.IOException;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one full load: index the bucket, then load every group.
 *
 * <p>
 * Tabular groups are processed first (merge, infer, provision, insert), then image groups
 * (provision the fixed metadata table, insert). Groups run one at a time. The first failure
 * aborts the run; groups committed before it stay committed, and every open connection is closed
 * before the exception leaves {@link #run()}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class BucketLoader {

    private final ObjectStore objectStore;
    private final ConnectionFactory connectionFactory;
    private final String adminDatabase;
    private final boolean sortGroups;

    private final PathIndexer pathIndexer;
    private final CsvMerger csvMerger;
    private final SchemaInferencer schemaInferencer;
    private final TableProvisioner tableProvisioner;
    private final DataLoader dataLoader;

    /**
     * Creates a loader with the default components.
     *
     * @param objectStore source bucket
     * @param connectionFactory opens connections to the target server
     * @param adminDatabase administrative database name
     * @param loaderConfig load behavior settings
     */
    public BucketLoader(ObjectStore objectStore, ConnectionFactory connectionFactory,
            String adminDatabase, LoaderConfig loaderConfig) {
        this(objectStore, connectionFactory, adminDatabase, loaderConfig.isSortGroups(),
                new PathIndexer(), new CsvMerger(objectStore), new SchemaInferencer(),
                new TableProvisioner(), new DataLoader(loaderConfig.getInsertPageSize()));
    }

    /**
     * Creates a loader with explicit components (for tests).
     *
     * @param objectStore source bucket
     * @param connectionFactory opens connections to the target server
     * @param adminDatabase administrative database name
     * @param sortGroups whether to process groups in sorted order
     * @param pathIndexer path indexer
     * @param csvMerger shard merger
     * @param schemaInferencer type inferencer
     * @param tableProvisioner DDL step
     * @param dataLoader insert step
     */
    BucketLoader(ObjectStore objectStore, ConnectionFactory connectionFactory,
            String adminDatabase, boolean sortGroups, PathIndexer pathIndexer,
            CsvMerger csvMerger, SchemaInferencer schemaInferencer,
            TableProvisioner tableProvisioner, DataLoader dataLoader) {
        this.objectStore = objectStore;
        this.connectionFactory = connectionFactory;
        this.adminDatabase = adminDatabase;
        this.sortGroups = sortGroups;
        this.pathIndexer = pathIndexer;
        this.csvMerger = csvMerger;
        this.schemaInferencer = schemaInferencer;
        this.tableProvisioner = tableProvisioner;
        this.dataLoader = dataLoader;
    }

    /**
     * Discovers and loads every group of the bucket.
     *
     * @return per-group results and skipped objects
     * @throws IOException if a CSV shard cannot be decoded or parsed
     * @throws SQLException if a database, DDL or insert step fails
     */
    public LoadReport run() throws IOException, SQLException {
        log.info("=== BucketLoader started ===");
        BucketIndex index = pathIndexer.index(objectStore.listObjects());
        if (sortGroups) {
            index = index.sorted();
        }

        List<LoadReport.GroupResult> results = new ArrayList<>();
        try (ConnectionManager connections =
                new ConnectionManager(connectionFactory, adminDatabase, tableProvisioner)) {
            for (Map.Entry<GroupKey, List<String>> group : index.getTabularGroups().entrySet()) {
                results.add(loadTabular(connections, group.getKey(), group.getValue()));
            }
            for (Map.Entry<GroupKey, List<ImageRecord>> group : index.getImageGroups()
                    .entrySet()) {
                results.add(loadImages(connections, group.getKey(), group.getValue()));
            }
        }

        LoadReport report = new LoadReport(results, index.getSkipped());
        log.info("=== BucketLoader finished ===");
        logSummary(report);
        return report;
    }

    private LoadReport.GroupResult loadTabular(ConnectionManager connections, GroupKey key,
            List<String> paths) throws IOException, SQLException {
        Connection connection = connections.connectionFor(key.getDatabase());
        MergedDataset dataset = csvMerger.merge(key, paths);
        List<InferredColumn> columns = schemaInferencer.infer(dataset);
        tableProvisioner.ensureTable(connection, key, columns);
        int inserted = dataLoader.loadRows(connection, key, dataset, columns);
        log.info("Data inserted into {}", key);
        return new LoadReport.GroupResult(key, ObjectKind.TABULAR, dataset.rowCount(), inserted);
    }

    private LoadReport.GroupResult loadImages(ConnectionManager connections, GroupKey key,
            List<ImageRecord> records) throws SQLException {
        Connection connection = connections.connectionFor(key.getDatabase());
        tableProvisioner.ensureImageTable(connection, key);
        int inserted = dataLoader.loadImages(connection, key, records);
        log.info("Image metadata inserted into {}", key);
        return new LoadReport.GroupResult(key, ObjectKind.IMAGE, records.size(), inserted);
    }

    /**
     * Outputs a consolidated log of the run.
     *
     * @param report run outcome
     */
    private void logSummary(LoadReport report) {
        log.info("===== Summary =====");
        int maxNameLen = report.getGroups().stream().mapToInt(g -> g.getKey().toString().length())
                .max().orElse(0);
        if (maxNameLen > 0) {
            String fmt = "  %-7s %-" + maxNameLen + "s inserted=%d / submitted=%d";
            for (LoadReport.GroupResult g : report.getGroups()) {
                log.info(String.format(fmt, g.getKind(), g.getKey(), g.getInsertedRows(),
                        g.getSubmittedRows()));
            }
        }
        log.info("Groups={}, inserted rows={}, skipped objects={}", report.getGroups().size(),
                report.totalInserted(), report.getSkipped().size());
    }
}
