package io.github.yok.bucketdblink.core;

import io.github.yok.bucketdblink.storage.StoredObject;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Groups bucket objects by the target location encoded in their path.
 *
 * <p>
 * Layout: {@code <prefix>/<database>/<schema>/<table>/<filename>}. Segment 0 is ignored and
 * segments after the file name are ignored. Objects with fewer than five segments or with an
 * unsupported extension are skipped and reported in {@link BucketIndex#getSkipped()}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class PathIndexer {

    static final int MIN_SEGMENTS = 5;

    /**
     * Indexes a full bucket listing.
     *
     * @param objects objects in listing order
     * @return tabular groups, image groups and skipped objects
     */
    public BucketIndex index(List<StoredObject> objects) {
        Map<GroupKey, List<String>> tabular = new LinkedHashMap<>();
        Map<GroupKey, List<ImageRecord>> images = new LinkedHashMap<>();
        List<SkippedObject> skipped = new ArrayList<>();

        for (StoredObject object : objects) {
            ObjectRef ref = parse(object);
            if (!ref.hasLocation()) {
                skip(skipped, ref, SkippedObject.Reason.TOO_FEW_SEGMENTS);
                continue;
            }
            switch (ref.getKind()) {
                case TABULAR:
                    tabular.computeIfAbsent(ref.groupKey(), k -> new ArrayList<>())
                            .add(ref.getPath());
                    break;
                case IMAGE:
                    images.computeIfAbsent(ref.groupKey(), k -> new ArrayList<>())
                            .add(new ImageRecord(ref.getFileName(), ref.getPublicUrl()));
                    break;
                default:
                    skip(skipped, ref, SkippedObject.Reason.UNSUPPORTED_EXTENSION);
            }
        }

        log.info("Indexed {} objects: tabular groups={}, image groups={}, skipped={}",
                objects.size(), tabular.size(), images.size(), skipped.size());
        return new BucketIndex(tabular, images, skipped);
    }

    /**
     * Parses one object path.
     *
     * @param object listed object
     * @return reference; location fields are {@code null} if the path is too short
     */
    ObjectRef parse(StoredObject object) {
        String path = object.getPath();
        String[] parts = path.split("/", -1);
        ObjectKind kind = ObjectKind.of(path);
        if (parts.length < MIN_SEGMENTS) {
            return new ObjectRef(path, object.getPublicUrl(), kind, null, null, null, null);
        }
        return new ObjectRef(path, object.getPublicUrl(), kind, parts[1], parts[2], parts[3],
                parts[4]);
    }

    private void skip(List<SkippedObject> skipped, ObjectRef ref, SkippedObject.Reason reason) {
        log.info("Skipping file with unexpected path structure: {} ({})", ref.getPath(), reason);
        skipped.add(new SkippedObject(ref.getPath(), reason));
    }
}
