package io.github.yok.bucketdblink.core;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Getter;
import org.apache.commons.io.FilenameUtils;

/**
 * Kind of a bucket object, decided from its file extension.
 *
 * <p>
 * The tabular extension is matched case-sensitively ({@code data.CSV} is not tabular); image
 * extensions are matched case-insensitively.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum ObjectKind {

    // Comma-Separated Values shard, loaded as rows.
    TABULAR(true, "csv"),

    // Image file, recorded as a (file_name, url) metadata row.
    IMAGE(false, "jpeg", "jpg", "png", "gif", "bmp", "tiff", "webp", "svg", "heic"),

    // Anything else; never loaded.
    UNRECOGNIZED(false);

    // Recognized extensions (without dot)
    private final Set<String> extensions;
    private final boolean caseSensitive;

    ObjectKind(boolean caseSensitive, String... exts) {
        this.caseSensitive = caseSensitive;
        this.extensions = Arrays.stream(exts).collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Determines whether the given extension belongs to this kind.
     *
     * @param ext extension without dot
     * @return {@code true} if the extension matches
     */
    public boolean matches(String ext) {
        return extensions.contains(caseSensitive ? ext : ext.toLowerCase(Locale.ROOT));
    }

    /**
     * Classifies an object key by the extension of its last path segment.
     *
     * @param path object key
     * @return {@link #TABULAR}, {@link #IMAGE} or {@link #UNRECOGNIZED}
     */
    public static ObjectKind of(String path) {
        String ext = FilenameUtils.getExtension(path);
        if (TABULAR.matches(ext)) {
            return TABULAR;
        }
        if (IMAGE.matches(ext)) {
            return IMAGE;
        }
        return UNRECOGNIZED;
    }
}
