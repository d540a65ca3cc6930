package com.socialpost.application.port.out;

import java.util.Optional;

/**
 * Pull-based access to a broker topic. Not thread-safe; owned by a single consumption loop.
 */
public interface BrokerReader extends AutoCloseable {

    void subscribe(String topic);

    /**
     * Waits up to the reader's poll timeout for the next message.
     */
    Optional<BrokerMessage> receiveNext();

    /**
     * Marks the message, and everything before it on its partition, as consumed.
     */
    void commit(BrokerMessage message);

    /**
     * Repositions the reader so the message is delivered again.
     */
    void rewind(BrokerMessage message);

    @Override
    void close();

    record BrokerMessage(
        String topic,
        int partition,
        long offset,
        String key,
        String payload
    ) {}
}
