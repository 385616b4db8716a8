package io.github.yok.bucketdblink.core;

import lombok.Value;

/**
 * An object left out of every group, with the reason.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class SkippedObject {

    /**
     * Why an object was skipped.
     */
    public enum Reason {
        // Fewer than five slash-separated segments.
        TOO_FEW_SEGMENTS,
        // Neither a CSV file nor an allowed image type.
        UNSUPPORTED_EXTENSION
    }

    String path;
    Reason reason;
}
