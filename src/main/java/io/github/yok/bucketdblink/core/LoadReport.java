package io.github.yok.bucketdblink.core;

import java.util.List;
import lombok.Value;

/**
 * Outcome of one completed run.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class LoadReport {

    /**
     * Result of loading one group.
     */
    @Value
    public static class GroupResult {
        GroupKey key;
        // TABULAR or IMAGE
        ObjectKind kind;
        // rows sent to the database
        int submittedRows;
        // rows actually inserted (conflicts skipped)
        int insertedRows;
    }

    List<GroupResult> groups;
    List<SkippedObject> skipped;

    /**
     * Creates a report.
     *
     * @param groups per-group results in processing order
     * @param skipped objects excluded from every group
     */
    public LoadReport(List<GroupResult> groups, List<SkippedObject> skipped) {
        this.groups = List.copyOf(groups);
        this.skipped = List.copyOf(skipped);
    }

    /**
     * Returns the rows inserted across all groups.
     *
     * @return total inserted rows
     */
    public int totalInserted() {
        return groups.stream().mapToInt(GroupResult::getInsertedRows).sum();
    }
}
