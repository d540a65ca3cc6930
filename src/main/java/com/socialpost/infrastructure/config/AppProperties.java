package com.socialpost.infrastructure.config;

import com.socialpost.adapter.in.messaging.ConsumerFailurePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private Kafka kafka = new Kafka();
    private Consumer consumer = new Consumer();

    public Kafka getKafka() {
        return kafka;
    }

    public void setKafka(Kafka kafka) {
        this.kafka = kafka;
    }

    public Consumer getConsumer() {
        return consumer;
    }

    public void setConsumer(Consumer consumer) {
        this.consumer = consumer;
    }

    public static class Kafka {
        private String topic = "SocialMediaPostEvents";
        private long publishTimeoutMs = 10_000;
        private int partitions = 3;

        public String getTopic() {
            return topic;
        }

        public void setTopic(String topic) {
            this.topic = topic;
        }

        public long getPublishTimeoutMs() {
            return publishTimeoutMs;
        }

        public void setPublishTimeoutMs(long publishTimeoutMs) {
            this.publishTimeoutMs = publishTimeoutMs;
        }

        public int getPartitions() {
            return partitions;
        }

        public void setPartitions(int partitions) {
            this.partitions = partitions;
        }
    }

    public static class Consumer {
        private boolean enabled = true;
        private String groupId = "social-post-projector";
        private long pollTimeoutMs = 500;
        private ConsumerFailurePolicy failurePolicy = ConsumerFailurePolicy.SKIP;
        private long retryBackoffMs = 1_000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getGroupId() {
            return groupId;
        }

        public void setGroupId(String groupId) {
            this.groupId = groupId;
        }

        public long getPollTimeoutMs() {
            return pollTimeoutMs;
        }

        public void setPollTimeoutMs(long pollTimeoutMs) {
            this.pollTimeoutMs = pollTimeoutMs;
        }

        public ConsumerFailurePolicy getFailurePolicy() {
            return failurePolicy;
        }

        public void setFailurePolicy(ConsumerFailurePolicy failurePolicy) {
            this.failurePolicy = failurePolicy;
        }

        public long getRetryBackoffMs() {
            return retryBackoffMs;
        }

        public void setRetryBackoffMs(long retryBackoffMs) {
            this.retryBackoffMs = retryBackoffMs;
        }
    }
}
