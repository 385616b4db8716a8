package io.github.yok.bucketdblink.config;

import com.google.common.base.Preconditions;
import lombok.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Load behavior settings, bound from the {@code loader.*} properties.
 *
 * <ul>
 * <li>{@code loader.insert-page-size}: rows per multi-row INSERT statement (default 100)</li>
 * <li>{@code loader.sort-groups}: process groups in sorted (database, schema, table) order instead
 * of discovery order (default false)</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@ConfigurationProperties(prefix = "loader")
public class LoaderConfig {

    int insertPageSize;
    boolean sortGroups;

    /**
     * Creates loader settings.
     *
     * @param insertPageSize rows per INSERT statement; must be positive
     * @param sortGroups whether to sort group keys before processing
     * @throws IllegalArgumentException if {@code insertPageSize} is not positive
     */
    public LoaderConfig(@DefaultValue("100") int insertPageSize,
            @DefaultValue("false") boolean sortGroups) {
        Preconditions.checkArgument(insertPageSize > 0,
                "loader.insert-page-size must be positive: %s", insertPageSize);
        this.insertPageSize = insertPageSize;
        this.sortGroups = sortGroups;
    }
}
