package com.eyelevel.renamedclient.common.apiclient.suspension;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * How the client waits between retries and between job polls.
 *
 * <p>The retry engine and the job poller are written once against this interface; the blocking client plugs in
 * {@link #sleeping()} and the non-blocking client {@link #reactive()}.
 */
@FunctionalInterface
public interface Suspension {

    /**
     * @param delay How long to wait. Zero or negative delays complete immediately.
     *
     * @return A {@link Mono} that completes once the delay has elapsed.
     */
    Mono<Void> suspend(Duration delay);

    /**
     * Waits on a timer without holding a thread.
     */
    static Suspension reactive() {
        return ReactiveSuspension.INSTANCE;
    }

    /**
     * Parks a worker thread for the duration of the delay.
     */
    static Suspension sleeping() {
        return new SleepingSuspension();
    }
}
