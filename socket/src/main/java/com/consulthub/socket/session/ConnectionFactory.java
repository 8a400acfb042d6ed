package com.consulthub.socket.session;

import com.consulthub.core.msg.Envelope;
import com.consulthub.socket.config.SocketConfig;
import reactor.core.publisher.Sinks;

import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;

/**
 * Factory for creating Connection objects.
 * <p>
 * Separated from the hub to isolate queue sizing and id generation.
 * </p>
 */
public class ConnectionFactory {
    private final int sendQueueSize;

    public ConnectionFactory(SocketConfig config) {
        this(config.getSendQueueSize());
    }

    public ConnectionFactory(int sendQueueSize) {
        this.sendQueueSize = sendQueueSize;
    }

    /**
     * Creates a new connection for an authenticated user.
     *
     * @param userId authenticated user identifier
     * @return Connection instance with an empty, bounded outbound queue
     */
    public Connection create(String userId) {
        // Unicast sink over an exact-capacity queue: offer fails instead of blocking when full
        Sinks.Many<Envelope> queue = Sinks.many().unicast().onBackpressureBuffer(
            new ArrayBlockingQueue<>(sendQueueSize)
        );

        return new Connection(UUID.randomUUID().toString(), userId, sendQueueSize, queue);
    }

}
