package io.github.yok.bucketdblink.core;

import java.sql.Connection;
import java.sql.SQLException;
import lombok.Generated;
import lombok.extern.slf4j.Slf4j;

/**
 * Rollback helper shared by the provisioning and load steps.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
final class Transactions {

    @Generated
    private Transactions() {}

    /**
     * Rolls back the current transaction after a failure. A rollback failure is attached to the
     * original exception as suppressed and logged; it never replaces the original.
     *
     * @param connection connection to roll back
     * @param key group being processed (for logging)
     * @param failure original failure
     */
    static void rollback(Connection connection, GroupKey key, SQLException failure) {
        try {
            connection.rollback();
            log.warn("[{}] Transaction rolled back due to error.", key);
        } catch (SQLException rollbackEx) {
            failure.addSuppressed(rollbackEx);
            log.warn("[{}] Rollback failed: {}", key, rollbackEx.getMessage(), rollbackEx);
        }
    }
}
