package com.ssomonitor.detection.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.listener.CommonErrorHandler;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.ExponentialBackOff;

import java.util.HashMap;
import java.util.Map;

/**
 * Task queue consumer. One record per poll and manual acknowledgment: a record is committed only
 * after its result has been delivered, and the commit itself is performed by the consumer thread.
 */
@Configuration
@Slf4j
public class KafkaConfig {

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    @Value("${spring.kafka.consumer.retry-backoff-ms:1000}")
    private long consumerRetryBackoffMs;

    @Value("${spring.kafka.consumer.retry-max-backoff-ms:30000}")
    private long consumerRetryMaxBackoffMs;

    @Value("${spring.kafka.consumer.max-poll-interval-ms:300000}")
    private int maxPollIntervalMs;

    @Value("${worker.queue.auto-startup:true}")
    private boolean autoStartup;

    private Map<String, Object> buildConsumerProps(String groupId) {
        Map<String, Object> props = new HashMap<>();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);

        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        // prefetch of one: the next task is fetched only once the container is resumed
        props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, 1);
        props.put(ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG, maxPollIntervalMs);
        return props;
    }

    @Bean
    public ConsumerFactory<String, String> taskConsumerFactory(WorkerProperties properties) {
        return new DefaultKafkaConsumerFactory<>(
                buildConsumerProps(properties.getQueue().getGroupId()),
                new StringDeserializer(),
                new StringDeserializer()
        );
    }

    /**
     * Failures of the listener method itself (not of the task) are retried without limit by seeking back.
     */
    @Bean
    public CommonErrorHandler taskErrorHandler() {
        ExponentialBackOff backOff = new ExponentialBackOff(consumerRetryBackoffMs, 2.0);
        backOff.setMaxInterval(consumerRetryMaxBackoffMs);

        DefaultErrorHandler errorHandler = new DefaultErrorHandler(backOff);
        errorHandler.setRetryListeners((record, ex, attempt) ->
                log.warn("Redelivering task record: topic={}, partition={}, offset={}, attempt={}, error={}",
                        record.topic(), record.partition(), record.offset(), attempt, ex.getMessage()));
        return errorHandler;
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, String> taskKafkaListenerContainerFactory(
            ConsumerFactory<String, String> taskConsumerFactory, CommonErrorHandler taskErrorHandler) {
        ConcurrentKafkaListenerContainerFactory<String, String> factory = new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(taskConsumerFactory);
        factory.setConcurrency(1);
        factory.setAutoStartup(autoStartup);
        factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.MANUAL);
        factory.setCommonErrorHandler(taskErrorHandler);
        return factory;
    }
}
