package com.coffee.diagnosis.service.queue;

import com.coffee.diagnosis.config.DiagnosisProperties;
import com.coffee.diagnosis.model.PredictionResults;
import com.coffee.diagnosis.model.ProcessingMode;
import com.coffee.diagnosis.model.ProcessingRequest;
import com.coffee.diagnosis.model.HealthStatus;
import com.coffee.diagnosis.model.RequestStatus;
import com.coffee.diagnosis.model.RequestStatusRecord;
import com.coffee.diagnosis.service.PredictionOrchestrator;
import com.coffee.diagnosis.service.RequestProcessor;
import com.coffee.diagnosis.service.store.FileSystemImageStore;
import com.coffee.diagnosis.service.store.JdbcPredictionRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PredictionWorkerTest {

    private static final String TOPIC = "image-processing-queue";

    @TempDir
    Path directory;

    private final PredictionOrchestrator orchestrator = mock(PredictionOrchestrator.class);
    private final ProcessingRequestCodec codec = new ProcessingRequestCodec(new ObjectMapper().findAndRegisterModules());
    private final InMemoryQueueBroker broker = new InMemoryQueueBroker();
    private FileSystemImageStore imageStore;
    private JdbcPredictionRepository repository;
    private PredictionWorker worker;
    private DiagnosisProperties properties;

    @BeforeEach
    void setUp() {
        imageStore = new FileSystemImageStore(directory.resolve("uploads"));
        repository = new JdbcPredictionRepository(
                new JdbcTemplate(new DriverManagerDataSource("jdbc:sqlite:" + directory.resolve("worker.db"))));
        RequestProcessor processor = new RequestProcessor(imageStore, repository, orchestrator);
        properties = new DiagnosisProperties(null, null, null,
                new DiagnosisProperties.QueueProperties("memory", TOPIC, Duration.ofSeconds(1), Duration.ofMillis(20),
                        "worker-1", Duration.ofDays(3), true),
                null);
        worker = new PredictionWorker(broker, codec, processor, properties);
        when(orchestrator.predict(any(), anyList())).thenReturn(PredictionResults.rust("hash"));
    }

    @Test
    void redeliveredRequestIsStoredOnce() {
        String payload = submit("req-1");
        broker.publish(TOPIC, payload);

        assertThat(worker.pollOnce()).isTrue();
        broker.publish(TOPIC, payload);
        assertThat(worker.pollOnce()).isTrue();

        assertThat(repository.countPredictions("req-1")).isEqualTo(1);
        assertThat(repository.getRequestStatus("req-1").orElseThrow().status()).isEqualTo(RequestStatus.SUCCESS);
        verify(orchestrator, times(1)).predict(any(), anyList());
        assertThat(broker.inFlightCount(TOPIC)).isZero();
        assertThat(broker.deadLetters(TOPIC)).isEmpty();
    }

    @Test
    void messagesLeftUnsettledByACrashAreProcessedAfterRecovery() {
        broker.publish(TOPIC, submit("req-2"));
        broker.poll(TOPIC, Duration.ofMillis(10));
        assertThat(worker.pollOnce()).isFalse();

        broker.recoverUnacknowledged(TOPIC);

        assertThat(worker.pollOnce()).isTrue();
        assertThat(repository.getRequestStatus("req-2").orElseThrow().status()).isEqualTo(RequestStatus.SUCCESS);
    }

    @Test
    void malformedMessagesAreDeadLettered() {
        broker.publish(TOPIC, "{not json");

        assertThat(worker.pollOnce()).isTrue();

        assertThat(broker.deadLetters(TOPIC)).containsExactly("{not json");
    }

    @Test
    void failedProcessingMarksTheRequestAndDeadLetters() {
        when(orchestrator.predict(any(), anyList())).thenThrow(new IllegalStateException("disk on fire"));
        String payload = submit("req-3");
        broker.publish(TOPIC, payload);

        assertThat(worker.pollOnce()).isTrue();

        assertThat(repository.getRequestStatus("req-3").orElseThrow().error()).isEqualTo("disk on fire");
        assertThat(repository.getRequestStatus("req-3").orElseThrow().status()).isEqualTo(RequestStatus.FAILED);
        assertThat(broker.deadLetters(TOPIC)).containsExactly(payload);
    }

    @Test
    void missingImageFailsTheRequest() {
        ProcessingRequest request = new ProcessingRequest("req-4", "ffffffffffffffffffffffffffffffff", List.of(),
                Instant.now());
        repository.recordSubmission(request, ProcessingMode.ASYNC);
        broker.publish(TOPIC, codec.encode(request));

        worker.pollOnce();

        assertThat(repository.getRequestStatus("req-4").orElseThrow().status()).isEqualTo(RequestStatus.FAILED);
        assertThat(broker.deadLetters(TOPIC)).hasSize(1);
    }

    @Test
    void workerStartsAndStopsAroundTheConsumeLoop() {
        worker.start();
        assertThat(worker.isRunning()).isTrue();

        worker.stop();

        assertThat(worker.isRunning()).isFalse();
    }

    @Test
    void failedAcknowledgementKeepsTheResultAndTheNextMessageIsStillConsumed() {
        FlakyBroker flaky = new FlakyBroker(broker);
        PredictionWorker flakyWorker = new PredictionWorker(flaky, codec,
                new RequestProcessor(imageStore, repository, orchestrator), properties);
        flaky.publish(TOPIC, submit("req-5"));

        assertThat(flakyWorker.pollOnce()).isTrue();

        assertThat(repository.getRequestStatus("req-5").orElseThrow().status()).isEqualTo(RequestStatus.SUCCESS);
        assertThat(broker.deadLetters(TOPIC)).isEmpty();
        assertThat(broker.inFlightCount(TOPIC)).isEqualTo(1);

        flaky.publish(TOPIC, submit("req-6"));
        assertThat(flakyWorker.pollOnce()).isTrue();
        assertThat(repository.getRequestStatus("req-6").orElseThrow().status()).isEqualTo(RequestStatus.SUCCESS);
    }

    @Test
    void failedDeadLetteringDoesNotEscapeTheWorker() {
        when(orchestrator.predict(any(), anyList())).thenThrow(new IllegalStateException("model crashed"));
        FlakyBroker flaky = new FlakyBroker(broker);
        PredictionWorker flakyWorker = new PredictionWorker(flaky, codec,
                new RequestProcessor(imageStore, repository, orchestrator), properties);
        flaky.publish(TOPIC, submit("req-7"));

        assertThat(flakyWorker.pollOnce()).isTrue();

        assertThat(repository.getRequestStatus("req-7").orElseThrow().status()).isEqualTo(RequestStatus.FAILED);
    }

    @Test
    void consumeLoopSurvivesBrokerErrors() throws InterruptedException {
        FlakyBroker flaky = new FlakyBroker(broker);
        PredictionWorker flakyWorker = new PredictionWorker(flaky, codec,
                new RequestProcessor(imageStore, repository, orchestrator), properties);
        flakyWorker.start();
        try {
            flaky.publish(TOPIC, submit("req-8"));
            awaitStatus("req-8", RequestStatus.SUCCESS);
            flaky.publish(TOPIC, submit("req-9"));
            awaitStatus("req-9", RequestStatus.SUCCESS);

            assertThat(flakyWorker.isRunning()).isTrue();
        } finally {
            flakyWorker.stop();
        }
    }

    private void awaitStatus(String requestId, RequestStatus expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (System.currentTimeMillis() < deadline) {
            if (repository.getRequestStatus(requestId).map(RequestStatusRecord::status).orElse(null) == expected) {
                return;
            }
            Thread.sleep(20);
        }
        assertThat(repository.getRequestStatus(requestId).orElseThrow().status()).isEqualTo(expected);
    }

    private String submit(String requestId) {
        String imageRef = imageStore.save(new byte[] {1, 2, 3});
        ProcessingRequest request = new ProcessingRequest(requestId, imageRef, List.of(1), Instant.now());
        repository.recordSubmission(request, ProcessingMode.ASYNC);
        return codec.encode(request);
    }

    /** Delegates to the in-memory broker; the first ack and the first reject time out. */
    private static final class FlakyBroker implements QueueBroker {

        private final InMemoryQueueBroker delegate;
        private final AtomicBoolean ackFailed = new AtomicBoolean();
        private final AtomicBoolean rejectFailed = new AtomicBoolean();

        private FlakyBroker(InMemoryQueueBroker delegate) {
            this.delegate = delegate;
        }

        @Override
        public boolean isAvailable() {
            return true;
        }

        @Override
        public void publish(String topic, String payload) {
            delegate.publish(topic, payload);
        }

        @Override
        public Optional<QueueDelivery> poll(String topic, Duration timeout) {
            return delegate.poll(topic, timeout).map(delivery -> new QueueDelivery() {
                @Override
                public String payload() {
                    return delivery.payload();
                }

                @Override
                public void ack() {
                    if (ackFailed.compareAndSet(false, true)) {
                        throw new QueryTimeoutException("redis timeout");
                    }
                    delivery.ack();
                }

                @Override
                public void reject(String reason) {
                    if (rejectFailed.compareAndSet(false, true)) {
                        throw new QueryTimeoutException("redis timeout");
                    }
                    delivery.reject(reason);
                }
            });
        }

        @Override
        public int recoverUnacknowledged(String topic) {
            return delegate.recoverUnacknowledged(topic);
        }

        @Override
        public HealthStatus health() {
            return delegate.health();
        }
    }
}
