package com.eyelevel.renamedclient.common.apiclient.suspension;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;

/**
 * Sleeps on a {@code boundedElastic} worker using Spring Retry's {@link Sleeper}.
 *
 * <p>An interrupted sleep completes normally with the interrupt flag restored. The worker is only interrupted
 * when the subscription is cancelled, in which case nobody is listening for the outcome.
 */
@Slf4j
class SleepingSuspension implements Suspension {

    private final Sleeper sleeper;

    SleepingSuspension() {
        this(new ThreadWaitSleeper());
    }

    SleepingSuspension(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    @Override
    public Mono<Void> suspend(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return Mono.empty();
        }
        return Mono.<Void>fromRunnable(() -> sleep(delay)).subscribeOn(Schedulers.boundedElastic());
    }

    private void sleep(Duration delay) {
        try {
            sleeper.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            log.debug("Sleep of {} ms interrupted", delay.toMillis());
            Thread.currentThread().interrupt();
        }
    }
}
