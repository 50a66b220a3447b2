package com.arielplatform.orchestrator.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Hot multicast of control-loop events. Emission is serialised here because events
 * come from both the agent scheduler and request threads.
 */
@Component
public class ControlLoopEventBus {

    private static final Logger log = LoggerFactory.getLogger(ControlLoopEventBus.class);

    private final Sinks.Many<ControlLoopEvent> sink =
        Sinks.many().multicast().onBackpressureBuffer(64);

    public synchronized void publish(ControlLoopEvent event) {
        Sinks.EmitResult result = sink.tryEmitNext(event);
        if (result.isFailure()) {
            log.debug("Control-loop event dropped. type={} result={}", event.type(), result);
        }
    }

    public Flux<ControlLoopEvent> stream() {
        return sink.asFlux();
    }
}
