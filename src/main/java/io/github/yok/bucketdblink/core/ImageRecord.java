package io.github.yok.bucketdblink.core;

import lombok.Value;

/**
 * Metadata row recorded for an image object.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class ImageRecord {

    String fileName;
    String url;
}
