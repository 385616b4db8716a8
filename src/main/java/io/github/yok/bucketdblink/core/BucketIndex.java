package io.github.yok.bucketdblink.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.Getter;

/**
 * Result of indexing a bucket listing.
 *
 * <p>
 * Both group maps iterate in first-discovery order of their keys; values keep listing order.
 * Collections returned by the getters are unmodifiable.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class BucketIndex {

    // group → tabular object paths
    private final Map<GroupKey, List<String>> tabularGroups;
    // group → image metadata rows
    private final Map<GroupKey, List<ImageRecord>> imageGroups;
    // objects excluded from every group
    private final List<SkippedObject> skipped;

    /**
     * Creates an index. The maps are copied preserving their iteration order.
     *
     * @param tabularGroups tabular groups
     * @param imageGroups image groups
     * @param skipped skipped objects
     */
    public BucketIndex(Map<GroupKey, List<String>> tabularGroups,
            Map<GroupKey, List<ImageRecord>> imageGroups, List<SkippedObject> skipped) {
        this.tabularGroups = Collections.unmodifiableMap(new LinkedHashMap<>(tabularGroups));
        this.imageGroups = Collections.unmodifiableMap(new LinkedHashMap<>(imageGroups));
        this.skipped = List.copyOf(skipped);
    }

    /**
     * Returns a copy whose groups iterate in (database, schema, table) order.
     *
     * @return sorted index
     */
    public BucketIndex sorted() {
        return new BucketIndex(new TreeMap<>(tabularGroups), new TreeMap<>(imageGroups), skipped);
    }
}
