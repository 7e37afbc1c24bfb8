package io.github.yok.factlink.db;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.sql.SQLException;
import java.sql.SQLTransientException;
import java.util.Set;

/**
 * Decides whether a connection failure is worth retrying.
 *
 * <h2>Transient</h2>
 * <ul>
 * <li>{@link SQLTransientException} (including the pool's acquisition timeout)</li>
 * <li>SQLState class {@code 08} (connection exception), except {@code 08004}</li>
 * <li>{@code 53300} too many connections, {@code 57P01}-{@code 57P03} server shutting down or
 * starting</li>
 * <li>{@link SocketTimeoutException} or {@link ConnectException} anywhere in the cause chain</li>
 * </ul>
 *
 * <h2>Never transient</h2>
 * <ul>
 * <li>{@link UnknownHostException} anywhere in the cause chain</li>
 * <li>SQLState class {@code 28} (invalid authorization) and {@code 3D000} (unknown database)</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public class TransientErrorClassifier {

    private static final Set<String> TRANSIENT_STATES =
            Set.of("53300", "57P01", "57P02", "57P03");

    private static final Set<String> PERMANENT_STATES = Set.of("08004", "3D000");

    /**
     * Classifies an acquisition failure.
     *
     * @param error failure raised by the pool or driver
     * @return {@code true} if a retry may succeed
     */
    public boolean isTransient(Throwable error) {
        if (error == null) {
            return false;
        }
        boolean transientSeen = false;
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof UnknownHostException) {
                return false;
            }
            if (t instanceof SQLException) {
                String state = ((SQLException) t).getSQLState();
                if (state != null) {
                    if (state.startsWith("28") || PERMANENT_STATES.contains(state)) {
                        return false;
                    }
                    if (state.startsWith("08") || TRANSIENT_STATES.contains(state)) {
                        transientSeen = true;
                    }
                }
                if (t instanceof SQLTransientException) {
                    transientSeen = true;
                }
            }
            if (t instanceof SocketTimeoutException || t instanceof ConnectException) {
                transientSeen = true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return transientSeen;
    }
}
