package io.github.yok.bucketdblink.storage;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * {@link ObjectStore} held in memory. Listing order is insertion order.
 */
public class InMemoryObjectStore implements ObjectStore {

    private final String bucket;
    private final Map<String, byte[]> objects = new LinkedHashMap<>();

    public InMemoryObjectStore(String bucket) {
        this.bucket = bucket;
    }

    public InMemoryObjectStore put(String path, byte[] content) {
        objects.put(path, content);
        return this;
    }

    public InMemoryObjectStore put(String path, String utf8Content) {
        return put(path, utf8Content.getBytes(StandardCharsets.UTF_8));
    }

    public String urlOf(String path) {
        return "https://storage.example.com/" + bucket + "/" + path;
    }

    @Override
    public List<StoredObject> listObjects() {
        return objects.keySet().stream().map(p -> new StoredObject(p, urlOf(p)))
                .collect(Collectors.toList());
    }

    @Override
    public byte[] fetch(String path) {
        byte[] data = objects.get(path);
        if (data == null) {
            throw new ObjectStoreException("GET failed: " + path,
                    new IllegalArgumentException("not found"));
        }
        return data;
    }
}
