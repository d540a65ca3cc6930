package com.socialpost.adapter.out.messaging;

import com.socialpost.application.port.out.BrokerReader;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link BrokerReader} over a Kafka consumer with auto-commit disabled. Records from one
 * poll are buffered and handed out one at a time.
 */
public class KafkaBrokerReader implements BrokerReader {

    private static final Logger log = LoggerFactory.getLogger(KafkaBrokerReader.class);

    private final Consumer<String, String> consumer;
    private final Duration pollTimeout;
    private final Deque<ConsumerRecord<String, String>> buffer = new ArrayDeque<>();

    public KafkaBrokerReader(Consumer<String, String> consumer, Duration pollTimeout) {
        this.consumer = consumer;
        this.pollTimeout = pollTimeout;
    }

    @Override
    public void subscribe(String topic) {
        consumer.subscribe(List.of(topic));
        log.info("Subscribed to topic={}", topic);
    }

    @Override
    public Optional<BrokerMessage> receiveNext() {
        if (buffer.isEmpty()) {
            ConsumerRecords<String, String> records = consumer.poll(pollTimeout);
            for (ConsumerRecord<String, String> record : records) {
                buffer.addLast(record);
            }
        }
        ConsumerRecord<String, String> record = buffer.pollFirst();
        if (record == null) {
            return Optional.empty();
        }
        return Optional.of(new BrokerMessage(
            record.topic(),
            record.partition(),
            record.offset(),
            record.key(),
            record.value()
        ));
    }

    @Override
    public void commit(BrokerMessage message) {
        TopicPartition partition = new TopicPartition(message.topic(), message.partition());
        consumer.commitSync(Map.of(partition, new OffsetAndMetadata(message.offset() + 1)));
        log.debug("Committed offset {} on {}", message.offset() + 1, partition);
    }

    @Override
    public void rewind(BrokerMessage message) {
        TopicPartition partition = new TopicPartition(message.topic(), message.partition());
        buffer.removeIf(record -> record.topic().equals(message.topic()) && record.partition() == message.partition());
        consumer.seek(partition, message.offset());
        log.debug("Rewound {} to offset {}", partition, message.offset());
    }

    @Override
    public void close() {
        buffer.clear();
        consumer.close();
    }
}
