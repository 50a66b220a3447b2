package com.arielplatform.orchestrator.loop;

import com.arielplatform.common.agent.ArielAgent;
import com.arielplatform.common.warp.ResourceMonitor;
import com.arielplatform.common.warp.TickOutcome;
import com.arielplatform.common.warp.TickResult;
import com.arielplatform.common.warp.WarpConfig;
import com.arielplatform.orchestrator.event.ControlLoopEvent;
import com.arielplatform.orchestrator.event.ControlLoopEventBus;
import com.arielplatform.orchestrator.event.ControlLoopEventType;
import com.arielplatform.orchestrator.logger.ControlLoopFlowLogger;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives the warp sequence as a cancellable Reactor loop:
 * <pre>
 *   delay(next) → tick → choose next delay from the outcome → repeat until WARP_DRIVE_ENGAGED
 * </pre>
 *
 * <p>Delay after each outcome: THROTTLED waits the throttle backoff, REVERTED re-ticks
 * immediately, anything else waits the poll interval. Every delay and every tick runs on
 * the agent scheduler, which is also the loop's clock.
 *
 * <p>{@link #stop()} sets a flag read at the top of every tick and disposes the
 * subscription, cancelling any pending delay including a throttle backoff.
 */
@Component
public class WarpSequenceRunner {

    private static final Logger log = LoggerFactory.getLogger(WarpSequenceRunner.class);

    private final ArielAgent agent;
    private final ResourceMonitor resourceMonitor;
    private final Scheduler scheduler;
    private final WarpConfig config;
    private final ControlLoopEventBus eventBus;
    private final ControlLoopFlowLogger flowLogger;

    private final AtomicBoolean stopRequested = new AtomicBoolean();
    private Disposable subscription;

    public WarpSequenceRunner(ArielAgent agent,
                              ResourceMonitor resourceMonitor,
                              @Qualifier("agentScheduler") Scheduler scheduler,
                              WarpConfig config,
                              ControlLoopEventBus eventBus,
                              ControlLoopFlowLogger flowLogger) {
        this.agent           = agent;
        this.resourceMonitor = resourceMonitor;
        this.scheduler       = scheduler;
        this.config          = config;
        this.eventBus        = eventBus;
        this.flowLogger      = flowLogger;
    }

    /** Starts the loop from INIT. Returns false when a loop is already running. */
    public synchronized boolean start() {
        if (isRunning()) {
            return false;
        }
        launch(false);
        return true;
    }

    /** Stops any running loop, fully resets the sequence and runs it again. */
    public synchronized void restart() {
        stop();
        launch(true);
    }

    public synchronized void stop() {
        stopRequested.set(true);
        if (subscription != null && !subscription.isDisposed()) {
            subscription.dispose();
            flowLogger.logStage(ControlLoopFlowLogger.WARP_STOPPED, agent.id());
            publish(ControlLoopEventType.WARP_STOPPED, "cancelled by host");
        }
    }

    public synchronized boolean isRunning() {
        return subscription != null && !subscription.isDisposed();
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    private void launch(boolean restart) {
        stopRequested.set(false);
        subscription = sequence(restart).subscribe(
            outcome -> log.info("Warp sequence finished. outcome={} agentId={}", outcome, agent.id()),
            err -> {
                log.error("Warp sequence failed. agentId={}", agent.id(), err);
                publish(ControlLoopEventType.LOOP_FAILED, err.getMessage());
            }
        );
    }

    /**
     * The full sequence: (re)start on the agent scheduler, then tick until the terminal
     * state or a stop request. Emits the last outcome, or completes empty if stopped
     * before the first tick.
     */
    Mono<TickOutcome> sequence(boolean restart) {
        return Mono.fromRunnable(() -> {
                Instant now = now();
                if (restart) {
                    agent.warp().restart(now);
                } else {
                    agent.warp().start(now);
                }
                flowLogger.logStage(ControlLoopFlowLogger.WARP_STARTED, agent.id());
                publish(ControlLoopEventType.WARP_STARTED, restart ? "restart" : "start");
            })
            .subscribeOn(scheduler)
            .then(ticks());
    }

    private Mono<TickOutcome> ticks() {
        AtomicReference<Duration> nextDelay = new AtomicReference<>(Duration.ZERO);
        return Mono.defer(() -> Mono.delay(nextDelay.get(), scheduler))
            .filter(t -> !stopRequested.get())
            .map(t -> tickOnce(nextDelay))
            .repeat(() -> !stopRequested.get())
            .takeUntil(outcome -> outcome == TickOutcome.WARP_DRIVE_ENGAGED || outcome == TickOutcome.HALTED)
            .reduce((previous, latest) -> latest);
    }

    private TickOutcome tickOnce(AtomicReference<Duration> nextDelay) {
        TickResult result = agent.tick(resourceMonitor.sample(), now());
        flowLogger.logTick(result, agent.id());
        nextDelay.set(delayAfter(result.outcome()));

        switch (result.outcome()) {
            case THROTTLED          -> publish(ControlLoopEventType.THROTTLED,
                                               "backoff=" + config.throttleBackoff().toMillis() + "ms");
            case REVERTED           -> publish(ControlLoopEventType.PHASE_REVERTED, "instability detected");
            case ADVANCED           -> publish(ControlLoopEventType.PHASE_ADVANCED, "advanced");
            case WARP_DRIVE_ENGAGED -> publish(ControlLoopEventType.WARP_DRIVE_ENGAGED, "all teams active at light speed");
            default                 -> { }
        }
        if (result.complexityExceeded()) {
            publish(ControlLoopEventType.COMPLEXITY_WARNING,
                    "complexity=" + agent.warp().state().complexity());
        }
        return result.outcome();
    }

    Duration delayAfter(TickOutcome outcome) {
        return switch (outcome) {
            case THROTTLED -> config.throttleBackoff();
            case REVERTED  -> Duration.ZERO;
            default        -> config.pollInterval();
        };
    }

    private Instant now() {
        return Instant.ofEpochMilli(scheduler.now(TimeUnit.MILLISECONDS));
    }

    private void publish(ControlLoopEventType type, String detail) {
        eventBus.publish(new ControlLoopEvent(type, agent.id(), agent.warp().phase(), detail, now()));
    }
}
