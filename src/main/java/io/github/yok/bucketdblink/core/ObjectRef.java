package io.github.yok.bucketdblink.core;

import lombok.Value;

/**
 * A bucket object with its parsed path components.
 *
 * <p>
 * Path components are {@code null} when the path has fewer segments than the layout
 * {@code <prefix>/<database>/<schema>/<table>/<filename>} requires.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class ObjectRef {

    String path;
    String publicUrl;
    ObjectKind kind;
    String database;
    String schema;
    String table;
    String fileName;

    /**
     * Returns whether all path components are present.
     *
     * @return {@code true} if database, schema, table and file name were parsed
     */
    public boolean hasLocation() {
        return fileName != null;
    }

    /**
     * Returns the group this object belongs to.
     *
     * @return group key
     * @throws IllegalStateException if the path has no location
     */
    public GroupKey groupKey() {
        if (!hasLocation()) {
            throw new IllegalStateException("Object has no target location: " + path);
        }
        return new GroupKey(database, schema, table);
    }
}
