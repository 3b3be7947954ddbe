package com.eyelevel.renamedclient.common.apiclient.suspension;

import reactor.core.publisher.Mono;

import java.time.Duration;

final class ReactiveSuspension implements Suspension {

    static final ReactiveSuspension INSTANCE = new ReactiveSuspension();

    private ReactiveSuspension() {
    }

    @Override
    public Mono<Void> suspend(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return Mono.empty();
        }
        return Mono.delay(delay).then();
    }
}
