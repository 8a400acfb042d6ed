package com.consulthub.socket.ws;

import com.consulthub.socket.session.Connection;
import org.slf4j.MDC;

/**
 * Scopes the {@code userId} and {@code connectionId} MDC keys to a single log call.
 * <p>
 * Connection callbacks run on shared event-loop threads, so the keys are never left set
 * once the call returns.
 * </p>
 */
final class ConnectionMdc {
    static final String USER_ID = "userId";
    static final String CONNECTION_ID = "connectionId";

    private ConnectionMdc() {
    }

    static void run(Connection connection, Runnable logCall) {
        try (MDC.MDCCloseable user = MDC.putCloseable(USER_ID, connection.getUserId());
             MDC.MDCCloseable id = MDC.putCloseable(CONNECTION_ID, connection.getId())) {
            logCall.run();
        }
    }
}
