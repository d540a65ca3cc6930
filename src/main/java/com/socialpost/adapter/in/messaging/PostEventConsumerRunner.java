package com.socialpost.adapter.in.messaging;

import com.socialpost.adapter.out.messaging.KafkaBrokerReader;
import com.socialpost.application.port.out.MetricsPort;
import com.socialpost.infrastructure.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Runs the read-model consumption loop on its own thread for the lifetime of the context.
 */
@Component
@ConditionalOnProperty(prefix = "app.consumer", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PostEventConsumerRunner implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(PostEventConsumerRunner.class);

    private static final long STOP_TIMEOUT_MS = 10_000;

    private final ConsumerFactory<String, String> consumerFactory;
    private final PostEventConsumer consumer;
    private final MetricsPort metrics;
    private final AppProperties appProperties;

    private volatile ConsumptionLoop loop;
    private volatile Thread worker;

    public PostEventConsumerRunner(
            ConsumerFactory<String, String> consumerFactory,
            PostEventConsumer consumer,
            MetricsPort metrics,
            AppProperties appProperties) {
        this.consumerFactory = consumerFactory;
        this.consumer = consumer;
        this.metrics = metrics;
        this.appProperties = appProperties;
    }

    @Override
    public synchronized void start() {
        if (worker != null) {
            return;
        }
        AppProperties.Consumer settings = appProperties.getConsumer();
        KafkaBrokerReader reader = new KafkaBrokerReader(
            consumerFactory.createConsumer(settings.getGroupId(), null),
            Duration.ofMillis(settings.getPollTimeoutMs()));
        ConsumptionLoop newLoop = new ConsumptionLoop(
            reader, consumer, metrics, settings.getFailurePolicy(), settings.getRetryBackoffMs());
        String topic = appProperties.getKafka().getTopic();

        Thread thread = new Thread(() -> {
            try {
                newLoop.run(topic);
            } catch (RuntimeException e) {
                log.error("Consumption loop for topic={} terminated unexpectedly", topic, e);
            }
        }, "post-event-consumer");
        thread.setDaemon(true);

        loop = newLoop;
        worker = thread;
        thread.start();
        log.info("Started post event consumer: topic={}, groupId={}", topic, settings.getGroupId());
    }

    @Override
    public synchronized void stop() {
        Thread thread = worker;
        if (thread == null) {
            return;
        }
        loop.requestStop();
        try {
            thread.join(STOP_TIMEOUT_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (thread.isAlive()) {
            log.warn("Post event consumer did not stop within {} ms", STOP_TIMEOUT_MS);
        }
        worker = null;
        loop = null;
    }

    @Override
    public boolean isRunning() {
        Thread thread = worker;
        return thread != null && thread.isAlive();
    }
}
