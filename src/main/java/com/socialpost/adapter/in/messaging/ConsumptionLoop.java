package com.socialpost.adapter.in.messaging;

import com.socialpost.application.port.out.BrokerReader;
import com.socialpost.application.port.out.BrokerReader.BrokerMessage;
import com.socialpost.application.port.out.MetricsPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Single-threaded receive, process, commit cycle over one topic.
 *
 * <p>An offset is committed only after its message was processed. A failed message is
 * logged and counted, never committed, and handled according to the failure policy.
 * A failed poll, commit or rewind is logged and counted as well; the loop keeps running.
 * {@link #requestStop()} is cooperative: the message in flight always finishes.
 */
public class ConsumptionLoop {

    private static final Logger log = LoggerFactory.getLogger(ConsumptionLoop.class);

    private final BrokerReader reader;
    private final MessageProcessor processor;
    private final MetricsPort metrics;
    private final ConsumerFailurePolicy failurePolicy;
    private final long retryBackoffMs;

    private volatile boolean stopRequested;

    public ConsumptionLoop(
            BrokerReader reader,
            MessageProcessor processor,
            MetricsPort metrics,
            ConsumerFailurePolicy failurePolicy,
            long retryBackoffMs) {
        this.reader = reader;
        this.processor = processor;
        this.metrics = metrics;
        this.failurePolicy = failurePolicy;
        this.retryBackoffMs = retryBackoffMs;
    }

    /**
     * Blocks until {@link #requestStop()} is called. Closes the reader on the way out.
     */
    public void run(String topic) {
        reader.subscribe(topic);
        log.info("Consuming topic={} (failurePolicy={})", topic, failurePolicy);
        try {
            while (!stopRequested) {
                Optional<BrokerMessage> next;
                try {
                    next = reader.receiveNext();
                } catch (RuntimeException e) {
                    metrics.incrementConsumerErrors();
                    log.error("Failed to poll topic={}", topic, e);
                    backOff();
                    continue;
                }
                next.ifPresent(this::handle);
            }
        } finally {
            reader.close();
            log.info("Stopped consuming topic={}", topic);
        }
    }

    public void requestStop() {
        stopRequested = true;
    }

    private void handle(BrokerMessage message) {
        try {
            processor.process(message);
        } catch (RuntimeException e) {
            metrics.incrementProjectionFailures();
            log.error("Failed to process message: topic={}, partition={}, offset={}, key={}",
                message.topic(), message.partition(), message.offset(), message.key(), e);
            if (shouldRetry(e)) {
                backOff();
                rewind(message);
            }
            return;
        }
        try {
            reader.commit(message);
        } catch (RuntimeException e) {
            // uncommitted offsets are redelivered and projection skips what it already applied
            metrics.incrementConsumerErrors();
            log.error("Failed to commit offset: topic={}, partition={}, offset={}",
                message.topic(), message.partition(), message.offset(), e);
        }
    }

    private void rewind(BrokerMessage message) {
        try {
            reader.rewind(message);
        } catch (RuntimeException e) {
            metrics.incrementConsumerErrors();
            log.error("Failed to rewind to offset: topic={}, partition={}, offset={}",
                message.topic(), message.partition(), message.offset(), e);
        }
    }

    private boolean shouldRetry(RuntimeException failure) {
        if (failurePolicy != ConsumerFailurePolicy.RETRY || stopRequested) {
            return false;
        }
        return !(failure instanceof UnrecognizedEventTypeException || failure instanceof MalformedEventException);
    }

    private void backOff() {
        if (retryBackoffMs <= 0) {
            return;
        }
        try {
            Thread.sleep(retryBackoffMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopRequested = true;
        }
    }
}
