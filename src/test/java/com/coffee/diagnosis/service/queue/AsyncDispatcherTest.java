package com.coffee.diagnosis.service.queue;

import com.coffee.diagnosis.config.DiagnosisProperties;
import com.coffee.diagnosis.model.PredictionResult;
import com.coffee.diagnosis.model.PredictionResults;
import com.coffee.diagnosis.model.ProcessingMode;
import com.coffee.diagnosis.model.ProcessingRequest;
import com.coffee.diagnosis.service.RequestProcessor;
import com.coffee.diagnosis.service.store.ImageStore;
import com.coffee.diagnosis.service.store.PredictionRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AsyncDispatcherTest {

    private static final String TOPIC = "image-processing-queue";

    private final ImageStore imageStore = mock(ImageStore.class);
    private final PredictionRepository repository = mock(PredictionRepository.class);
    private final RequestProcessor processor = mock(RequestProcessor.class);
    private final ProcessingRequestCodec codec = new ProcessingRequestCodec(new ObjectMapper().findAndRegisterModules());
    private ExecutorService publishExecutor;

    @BeforeEach
    void setUp() {
        publishExecutor = Executors.newCachedThreadPool();
        when(imageStore.save(any())).thenReturn("0123456789abcdef0123456789abcdef");
    }

    @AfterEach
    void tearDown() {
        publishExecutor.shutdownNow();
    }

    @Test
    void availableQueueAcceptsTheRequest() {
        InMemoryQueueBroker broker = new InMemoryQueueBroker();
        AsyncDispatcher dispatcher = dispatcher(broker, Duration.ofSeconds(3));

        SubmissionOutcome outcome = dispatcher.submit(new byte[] {1, 2, 3}, List.of(4), "req-1");

        assertThat(outcome.status()).isEqualTo(SubmissionStatus.PROCESSING);
        assertThat(outcome.result()).isEmpty();
        assertThat(outcome.request().requestId()).isEqualTo("req-1");
        assertThat(broker.pending(TOPIC)).isEqualTo(1);
        ProcessingRequest queued = codec.decode(broker.poll(TOPIC, Duration.ofMillis(10)).orElseThrow().payload());
        assertThat(queued.symptomIds()).containsExactly(4);
        verify(repository).recordSubmission(any(), eq(ProcessingMode.ASYNC));
        verify(processor, never()).process(any());
    }

    @Test
    void unavailableQueueProcessesSynchronously() {
        PredictionResult result = PredictionResults.rust("hash").withId(7L);
        when(processor.process(any())).thenReturn(result);
        AsyncDispatcher dispatcher = dispatcher(new UnavailableQueueBroker("disabled"), Duration.ofSeconds(3));

        SubmissionOutcome outcome = dispatcher.submit(new byte[] {1, 2, 3}, List.of(), null);

        assertThat(outcome.status()).isEqualTo(SubmissionStatus.COMPLETED);
        assertThat(outcome.result()).contains(result);
        assertThat(outcome.request().requestId()).isNotBlank();
        assertThat(outcome.request().imageRef()).isEqualTo("0123456789abcdef0123456789abcdef");
    }

    @Test
    void slowPublishFallsBackToSynchronousProcessing() {
        QueueBroker slow = mock(QueueBroker.class);
        doAnswer(invocation -> {
            Thread.sleep(2_000);
            return null;
        }).when(slow).publish(anyString(), anyString());
        when(processor.process(any())).thenReturn(PredictionResults.rust("hash"));
        AsyncDispatcher dispatcher = dispatcher(slow, Duration.ofMillis(100));

        SubmissionOutcome outcome = dispatcher.submit(new byte[] {9}, List.of(), "req-slow");

        assertThat(outcome.status()).isEqualTo(SubmissionStatus.COMPLETED);
        ArgumentCaptor<ProcessingRequest> captor = ArgumentCaptor.forClass(ProcessingRequest.class);
        verify(processor).process(captor.capture());
        assertThat(captor.getValue().requestId()).isEqualTo("req-slow");
    }

    @Test
    void synchronousRequestsAreLoggedAsSync() {
        when(processor.process(any())).thenReturn(PredictionResults.rust("hash"));
        AsyncDispatcher dispatcher = dispatcher(new InMemoryQueueBroker(), Duration.ofSeconds(3));

        dispatcher.processNow(new byte[] {1}, List.of(2, 3), "req-sync");

        ArgumentCaptor<ProcessingRequest> captor = ArgumentCaptor.forClass(ProcessingRequest.class);
        verify(repository).recordSubmission(captor.capture(), eq(ProcessingMode.SYNC));
        assertThat(captor.getValue().requestId()).isEqualTo("req-sync");
        assertThat(captor.getValue().symptomIds()).containsExactly(2, 3);
    }

    private AsyncDispatcher dispatcher(QueueBroker broker, Duration publishTimeout) {
        DiagnosisProperties properties = new DiagnosisProperties(null, null, null,
                new DiagnosisProperties.QueueProperties("memory", TOPIC, publishTimeout, Duration.ofMillis(50),
                        "worker-1", Duration.ofDays(3), false),
                null);
        return new AsyncDispatcher(imageStore, repository, broker, codec, processor, publishExecutor, properties);
    }
}
