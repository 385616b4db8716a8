package io.github.yok.bucketdblink.storage;

import java.util.List;

/**
 * Read-only access to the objects of one bucket.
 *
 * <p>
 * Implementations perform blocking calls and do not retry. Failures surface as
 * {@link ObjectStoreException}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface ObjectStore {

    /**
     * Lists every object of the bucket.
     *
     * @return objects in the order the storage backend returns them
     */
    List<StoredObject> listObjects();

    /**
     * Reads the full content of an object.
     *
     * @param path object key
     * @return object bytes
     */
    byte[] fetch(String path);
}
