package io.github.yok.bucketdblink.db;

import com.google.common.base.Preconditions;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Generated;
import org.apache.commons.lang3.StringUtils;

/**
 * Quotes SQL identifiers built from object path segments and CSV headers.
 *
 * <p>
 * Names are always emitted as PostgreSQL delimited identifiers, so case and spaces are preserved.
 * An embedded double quote is escaped by doubling it. Blank names and names containing a NUL
 * character cannot be represented and are rejected.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class SqlIdentifiers {

    /**
     * Prevents instantiation.
     */
    @Generated
    private SqlIdentifiers() {}

    /**
     * Quotes one identifier.
     *
     * @param name raw identifier
     * @return delimited identifier, e.g. {@code "Order ""Lines"""}
     * @throws IllegalArgumentException if {@code name} is blank or contains NUL
     */
    public static String quote(String name) {
        Preconditions.checkArgument(StringUtils.isNotBlank(name),
                "SQL identifier must not be blank: [%s]", name);
        Preconditions.checkArgument(name.indexOf('\0') < 0,
                "SQL identifier must not contain NUL: [%s]", name);
        return '"' + name.replace("\"", "\"\"") + '"';
    }

    /**
     * Quotes a schema-qualified table name.
     *
     * @param schema schema name
     * @param table table name
     * @return {@code "schema"."table"}
     */
    public static String qualified(String schema, String table) {
        return quote(schema) + "." + quote(table);
    }

    /**
     * Quotes each name and joins them with {@code ", "}.
     *
     * @param names raw identifiers
     * @return comma-separated delimited identifiers
     */
    public static String quoteAll(List<String> names) {
        return names.stream().map(SqlIdentifiers::quote).collect(Collectors.joining(", "));
    }
}
