package io.github.yok.bucketdblink.storage;

import lombok.Value;

/**
 * One object of a bucket listing.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class StoredObject {

    // Full object key, e.g. "landing/salesdb/public/orders/part1.csv"
    String path;
    // Publicly resolvable URL of the object
    String publicUrl;
}
