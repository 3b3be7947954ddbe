package com.eyelevel.renamedclient.client;

import com.eyelevel.renamedclient.dto.ExtractOptions;
import com.eyelevel.renamedclient.dto.ExtractResult;
import com.eyelevel.renamedclient.dto.PdfSplitOptions;
import com.eyelevel.renamedclient.dto.PdfSplitResult;
import com.eyelevel.renamedclient.dto.RenameOptions;
import com.eyelevel.renamedclient.dto.RenameResult;
import com.eyelevel.renamedclient.dto.User;
import com.eyelevel.renamedclient.job.JobPoller;
import com.eyelevel.renamedclient.job.ProgressObserver;
import com.eyelevel.renamedclient.upload.FileSource;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

/**
 * Non-blocking access to the renamed.to API. Waits between retries and job polls are timers, never parked
 * threads, and all requests share a dedicated connection pool.
 *
 * <p>Obtained from {@link RenamedClient#reactive()}; its resources are released when that client is closed.
 * Every method is lazy: nothing is sent until the returned {@link Mono} is subscribed, and disposing the
 * subscription cancels the call at the next wait.
 */
public class ReactiveRenamedClient {

    private final RenamedOperations operations;

    ReactiveRenamedClient(RenamedOperations operations) {
        this.operations = operations;
    }

    public Mono<RenameResult> rename(FileSource file) {
        return rename(file, null);
    }

    public Mono<RenameResult> rename(FileSource file, @Nullable RenameOptions options) {
        return operations.rename(file, options);
    }

    /**
     * Starts a PDF split job. The emitted poller waits on timers; use {@link JobPoller#awaitResult}.
     */
    public Mono<JobPoller> pdfSplit(FileSource file, @Nullable PdfSplitOptions options) {
        return operations.pdfSplit(file, options);
    }

    public Mono<PdfSplitResult> pdfSplitAndWait(FileSource file, @Nullable PdfSplitOptions options,
                                                @Nullable ProgressObserver observer) {
        return pdfSplit(file, options).flatMap(poller -> poller.awaitResult(observer));
    }

    public Mono<ExtractResult> extract(FileSource file, @Nullable ExtractOptions options) {
        return operations.extract(file, options);
    }

    public Mono<User> getUser() {
        return operations.getUser();
    }

    public Mono<byte[]> downloadFile(String url) {
        return operations.downloadFile(url);
    }

    /**
     * Resumes tracking of a job started earlier, e.g. by another process.
     */
    public JobPoller poller(String statusUrl, @Nullable String jobId) {
        return operations.poller(statusUrl, jobId);
    }
}
