package com.ssomonitor.detection.service;

import com.ssomonitor.detection.config.WorkerProperties;
import com.ssomonitor.detection.dto.AnalysisResult;
import com.ssomonitor.detection.dto.MergedCandidate;
import com.ssomonitor.detection.dto.TaskMessage;
import com.ssomonitor.detection.entity.TaskState;
import com.ssomonitor.detection.exception.AnalysisLaunchException;
import com.ssomonitor.detection.exception.TaskDecodingException;
import com.ssomonitor.detection.metrics.WorkerMetrics;
import com.ssomonitor.detection.service.executor.TaskExecutor;
import com.ssomonitor.detection.util.MdcContext;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.config.KafkaListenerEndpointRegistry;
import org.springframework.kafka.listener.MessageListenerContainer;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pulls tasks from the queue and hands each one to a worker thread.
 *
 * <p>The listener container's consumer thread owns the broker connection. It only dispatches; acks from
 * worker threads are queued by the container and committed on that thread. While the in-flight limit is
 * reached the container is paused, so it keeps polling without fetching more tasks.
 */
@Service
@ConditionalOnProperty(name = "worker.role", havingValue = "consumer", matchIfMissing = true)
@Slf4j
public class TaskConsumerService {

    public static final String LISTENER_ID = "taskListener";

    private final TaskCodec taskCodec;
    private final TaskExecutor taskExecutor;
    private final CandidateReconciler reconciler;
    private final ResultDeliverer deliverer;
    private final WorkerMetrics metrics;
    private final WorkerProperties properties;
    private final KafkaListenerEndpointRegistry registry;
    private final Executor workerPool;
    private final AtomicInteger inFlight = new AtomicInteger();

    public TaskConsumerService(TaskCodec taskCodec,
                               TaskExecutor taskExecutor,
                               CandidateReconciler reconciler,
                               ResultDeliverer deliverer,
                               WorkerMetrics metrics,
                               WorkerProperties properties,
                               KafkaListenerEndpointRegistry registry,
                               @Qualifier("taskWorkerExecutor") Executor workerPool) {
        this.taskCodec = taskCodec;
        this.taskExecutor = taskExecutor;
        this.reconciler = reconciler;
        this.deliverer = deliverer;
        this.metrics = metrics;
        this.properties = properties;
        this.registry = registry;
        this.workerPool = workerPool;
    }

    @KafkaListener(
            id = LISTENER_ID,
            topics = "${worker.queue.topic:landscape_analysis_treq}",
            groupId = "${worker.queue.group-id:login-detection-worker}",
            containerFactory = "taskKafkaListenerContainerFactory"
    )
    public void onTask(ConsumerRecord<String, String> record, Acknowledgment acknowledgment) {
        log.info("Received task record: topic={}, partition={}, offset={}",
                record.topic(), record.partition(), record.offset());
        metrics.taskReceived();

        if (inFlight.incrementAndGet() >= properties.getConsumer().getMaxInFlight()) {
            pauseListener();
        }
        try {
            workerPool.execute(() -> handle(record, acknowledgment));
        } catch (RuntimeException e) {
            // rejected: the container's error handler seeks back and redelivers this record
            release();
            throw e;
        }
    }

    int getInFlight() {
        return inFlight.get();
    }

    private void handle(ConsumerRecord<String, String> record, Acknowledgment acknowledgment) {
        try {
            process(record, acknowledgment);
        } catch (RuntimeException e) {
            log.error("Unexpected failure handling task record at offset {}, acknowledging it: {}",
                    record.offset(), e.getMessage(), e);
            acknowledgment.acknowledge();
        } finally {
            MdcContext.clear();
            release();
        }
    }

    void process(ConsumerRecord<String, String> record, Acknowledgment acknowledgment) {
        String analysisName = properties.getAnalysisName();
        String correlationId = header(record, properties.getQueue().getCorrelationIdHeader());
        MdcContext.setTask(correlationId, analysisName);

        TaskMessage task;
        try {
            task = taskCodec.decode(record.value(), analysisName);
        } catch (TaskDecodingException e) {
            log.error("Discarding undecodable task record at offset {}: {}", record.offset(), e.getMessage());
            acknowledgment.acknowledge();
            return;
        }

        if (correlationId != null) {
            task.getTaskConfig().setTaskId(correlationId);
        }
        String replyTo = header(record, properties.getQueue().getReplyToHeader());
        if (replyTo != null) {
            task.getTaskConfig().setReplyTo(replyTo);
        }
        MdcContext.setTask(task.getTaskId(), analysisName);

        task.getTaskConfig().transitionTo(TaskState.RECEIVED, Instant.now());
        log.info("Processing task {} for domain {}", task.getTaskId(), task.getDomain());

        AnalysisResult result;
        try {
            result = taskExecutor.execute(task);
        } catch (AnalysisLaunchException e) {
            log.error("Could not start the analysis of task {}: {}", task.getTaskId(), e.getMessage(), e);
            metrics.taskFailed();
            result = AnalysisResult.failure(e.getMessage());
            task.setAnalysisResult(result);
            task.getTaskConfig().transitionTo(TaskState.COMPLETED, Instant.now());
        }

        List<MergedCandidate> merged = reconciler.merge(result.candidatesOrEmpty(), task.getScanDomain());
        deliverer.deliver(merged, task);

        acknowledgment.acknowledge();
        metrics.taskCompleted();
        log.info("Task {} acknowledged with {} merged candidates", task.getTaskId(), merged.size());
    }

    private static String header(ConsumerRecord<String, String> record, String name) {
        Header header = record.headers().lastHeader(name);
        if (header == null || header.value() == null) {
            return null;
        }
        String value = new String(header.value(), StandardCharsets.UTF_8).trim();
        return value.isEmpty() ? null : value;
    }

    private synchronized void pauseListener() {
        MessageListenerContainer container = registry.getListenerContainer(LISTENER_ID);
        if (container != null && !container.isPauseRequested()) {
            log.debug("In-flight limit reached, pausing task listener");
            container.pause();
        }
    }

    private synchronized void release() {
        if (inFlight.decrementAndGet() < properties.getConsumer().getMaxInFlight()) {
            MessageListenerContainer container = registry.getListenerContainer(LISTENER_ID);
            if (container != null && container.isPauseRequested()) {
                log.debug("Resuming task listener");
                container.resume();
            }
        }
    }
}
