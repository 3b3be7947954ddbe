package com.eyelevel.renamedclient.job;

import com.eyelevel.renamedclient.common.apiclient.RequestEngine;
import com.eyelevel.renamedclient.common.diagnostics.DiagnosticSink;
import com.eyelevel.renamedclient.dto.PdfSplitResult;
import com.eyelevel.renamedclient.exception.apiclient.ApiException;
import com.eyelevel.renamedclient.exception.apiclient.JobException;
import com.eyelevel.renamedclient.support.RecordingDiagnosticSink;
import com.eyelevel.renamedclient.support.RecordingSuspension;
import com.eyelevel.renamedclient.support.ScriptedTransport;
import com.eyelevel.renamedclient.support.TestEngines;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JobPollerTest {

    private static final String STATUS_URL = "https://api.test/v1/jobs/job-12345678-abcd";
    private static final String RESULT = "{\"originalFilename\":\"scan.pdf\",\"totalPages\":4,\"documents\":"
                                         + "[{\"index\":0,\"filename\":\"a.pdf\",\"pages\":\"1-2\","
                                         + "\"downloadUrl\":\"https://cdn.test/a.pdf\",\"size\":100},"
                                         + "{\"index\":1,\"filename\":\"b.pdf\",\"pages\":\"3-4\","
                                         + "\"downloadUrl\":\"https://cdn.test/b.pdf\",\"size\":200}]}";

    private ScriptedTransport transport;
    private RecordingSuspension suspension;
    private RecordingDiagnosticSink sink;

    @BeforeEach
    void setUp() {
        transport = new ScriptedTransport();
        suspension = new RecordingSuspension();
        sink = new RecordingDiagnosticSink();
    }

    private JobPoller poller(int maxAttempts) {
        RequestEngine engine = TestEngines.engine(transport, suspension, DiagnosticSink.noop(), 0);
        return new JobPoller(engine, new JobHandle(STATUS_URL, "job-12345678-abcd", Duration.ofSeconds(2),
                                                   maxAttempts), sink);
    }

    private static String status(String status, Integer progress) {
        return "{\"jobId\":\"job-12345678-abcd\",\"status\":\"" + status + "\""
               + (progress != null ? ",\"progress\":" + progress : "") + "}";
    }

    @Test
    void reportsProgressUntilCompletion() {
        transport.respond(200, status("processing", 10))
                 .respond(200, status("processing", 60))
                 .respond(200, "{\"jobId\":\"job-12345678-abcd\",\"status\":\"completed\",\"progress\":100,"
                               + "\"result\":" + RESULT + "}");
        JobPoller poller = poller(150);
        List<Integer> progress = new ArrayList<>();

        StepVerifier.create(poller.awaitResult(snapshot -> progress.add(snapshot.progress())))
                    .assertNext(result -> {
                        assertThat(result.totalPages()).isEqualTo(4);
                        assertThat(result.documents()).extracting("filename").containsExactly("a.pdf", "b.pdf");
                    })
                    .verifyComplete();

        assertThat(progress).containsExactly(10, 60, 100);
        assertThat(poller.getState()).isEqualTo(JobState.COMPLETED);
        assertThat(transport.requests()).hasSize(3);
        assertThat(suspension.delays()).containsExactly(Duration.ofSeconds(2), Duration.ofSeconds(2));
        assertThat(sink.events()).containsExactly("job job-12345678-abcd processing 10",
                                                  "job job-12345678-abcd processing 60",
                                                  "job job-12345678-abcd completed 100");
    }

    @Test
    void failedJobRaisesJobErrorWithServerMessage() {
        transport.respond(200, status("processing", 20))
                 .respond(200, "{\"jobId\":\"job-12345678-abcd\",\"status\":\"failed\",\"error\":\"bad scan\"}");
        JobPoller poller = poller(150);

        StepVerifier.create(poller.awaitResult(null))
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(JobException.class).hasMessage("bad scan");
                        assertThat(((JobException) error).getJobId()).isEqualTo("job-12345678-abcd");
                        assertThat(((JobException) error).getCode()).isEqualTo("JOB_ERROR");
                    })
                    .verify();

        assertThat(poller.getState()).isEqualTo(JobState.FAILED);
    }

    @Test
    void failedJobWithoutMessageUsesDefault() {
        transport.respond(200, status("failed", null));

        StepVerifier.create(poller(150).awaitResult(null))
                    .expectErrorSatisfies(error -> assertThat(error).hasMessage("Job failed"))
                    .verify();
    }

    @Test
    void givesUpAfterMaxAttemptsWithoutAnotherRequest() {
        transport.respondTimes(3, 200, status("pending", null));
        JobPoller poller = poller(3);

        StepVerifier.create(poller.awaitResult(null))
                    .expectErrorSatisfies(error -> assertThat(error).isInstanceOf(JobException.class)
                                                                    .hasMessage("Job polling timeout exceeded"))
                    .verify();

        assertThat(transport.requests()).hasSize(3);
        assertThat(suspension.delays()).hasSize(2);
        assertThat(poller.getState()).isEqualTo(JobState.TIMED_OUT);
    }

    @Test
    void completedWithoutResultKeepsPolling() {
        transport.respond(200, status("completed", 100))
                 .respond(200, "{\"jobId\":\"job-12345678-abcd\",\"status\":\"completed\",\"result\":" + RESULT + "}");

        StepVerifier.create(poller(150).awaitResult(null))
                    .assertNext(result -> assertThat(result.originalFilename()).isEqualTo("scan.pdf"))
                    .verifyComplete();

        assertThat(transport.requests()).hasSize(2);
    }

    @Test
    void observerFailuresAreIgnored() {
        transport.respond(200, status("processing", 50))
                 .respond(200, "{\"jobId\":\"job-12345678-abcd\",\"status\":\"completed\",\"result\":" + RESULT + "}");

        StepVerifier.create(poller(150).awaitResult(snapshot -> {
                        throw new IllegalStateException("observer broken");
                    }))
                    .expectNextCount(1)
                    .verifyComplete();
    }

    @Test
    void statusQueryErrorsPropagate() {
        transport.respond(401, "{\"error\":\"Invalid API key\"}");
        JobPoller poller = poller(150);

        StepVerifier.create(poller.awaitResult(null))
                    .expectErrorSatisfies(error -> assertThat(error).isInstanceOf(ApiException.class)
                                                                    .hasMessage("Invalid API key"))
                    .verify();

        assertThat(poller.getState()).isEqualTo(JobState.POLLING);
    }

    @Test
    void checkStatusIsIdempotent() {
        transport.respond(200, status("processing", 30)).respond(200, status("processing", 30));
        JobPoller poller = poller(150);

        StepVerifier.create(poller.checkStatus())
                    .assertNext(snapshot -> {
                        assertThat(snapshot.status()).isEqualTo(JobStatus.PROCESSING);
                        assertThat(snapshot.progress()).isEqualTo(30);
                        assertThat(snapshot.isComplete()).isFalse();
                    })
                    .verifyComplete();
        StepVerifier.create(poller.checkStatus())
                    .assertNext(snapshot -> assertThat(snapshot.progress()).isEqualTo(30))
                    .verifyComplete();

        assertThat(transport.requests()).hasSize(2);
        assertThat(transport.lastRequest().uri()).hasToString(STATUS_URL);
        assertThat(poller.getState()).isEqualTo(JobState.POLLING);
        assertThat(suspension.delays()).isEmpty();
    }

    @Test
    void cancelInterruptsAPendingWait() {
        suspension = RecordingSuspension.hanging();
        transport.respond(200, status("processing", 10));
        JobPoller poller = poller(150);

        StepVerifier.create(poller.awaitResult(null))
                    .then(poller::cancel)
                    .expectErrorSatisfies(error -> assertThat(error).isInstanceOf(JobException.class)
                                                                    .hasMessage("Job polling cancelled"))
                    .verify(Duration.ofSeconds(5));

        assertThat(poller.getState()).isEqualTo(JobState.CANCELLED);
        assertThat(transport.requests()).hasSize(1);
    }

    @Test
    void cancelledPollerDoesNotQueryAgain() {
        JobPoller poller = poller(150);
        poller.cancel();

        StepVerifier.create(poller.awaitResult(null))
                    .expectError(JobException.class)
                    .verify();

        assertThat(transport.requests()).isEmpty();
    }

    @Test
    void cancelAfterCompletionKeepsFinalState() {
        transport.respond(200, "{\"jobId\":\"job-12345678-abcd\",\"status\":\"completed\",\"result\":" + RESULT + "}");
        JobPoller poller = poller(150);

        StepVerifier.create(poller.awaitResult(null)).expectNextCount(1).verifyComplete();
        poller.cancel();

        assertThat(poller.getState()).isEqualTo(JobState.COMPLETED);
    }

    @Test
    void completedPollerReplaysItsResultWithoutQuerying() {
        transport.respond(200, "{\"jobId\":\"job-12345678-abcd\",\"status\":\"completed\",\"result\":" + RESULT + "}");
        JobPoller poller = poller(150);

        PdfSplitResult first = poller.waitForResult();
        PdfSplitResult second = poller.waitForResult();

        assertThat(second).isSameAs(first);
        assertThat(poller.getState()).isEqualTo(JobState.COMPLETED);
        assertThat(transport.requests()).hasSize(1);
    }

    @Test
    void failedPollerReplaysTheJobFailure() {
        transport.respond(200, "{\"jobId\":\"job-12345678-abcd\",\"status\":\"failed\",\"error\":\"bad scan\"}");
        JobPoller poller = poller(150);

        StepVerifier.create(poller.awaitResult(null)).expectError(JobException.class).verify();
        StepVerifier.create(poller.awaitResult(null))
                    .expectErrorSatisfies(error -> assertThat(error).isInstanceOf(JobException.class)
                                                                    .hasMessage("bad scan"))
                    .verify();

        assertThat(poller.getState()).isEqualTo(JobState.FAILED);
        assertThat(transport.requests()).hasSize(1);
    }

    @Test
    void timedOutPollerReplaysTheTimeout() {
        transport.respond(200, status("pending", null));
        JobPoller poller = poller(1);

        StepVerifier.create(poller.awaitResult(null)).expectError(JobException.class).verify();
        StepVerifier.create(poller.awaitResult(null))
                    .expectErrorSatisfies(error -> assertThat(error).hasMessage("Job polling timeout exceeded"))
                    .verify();

        assertThat(transport.requests()).hasSize(1);
    }
}
