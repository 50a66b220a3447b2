package com.arielplatform.orchestrator.loop;

import com.arielplatform.common.agent.ArielAgent;
import com.arielplatform.common.decision.DecisionParameters;
import com.arielplatform.common.emotion.EmotionalState;
import com.arielplatform.common.health.HealthConfig;
import com.arielplatform.common.health.HealthDiagnosticEngine;
import com.arielplatform.common.health.StrategyRegistry;
import com.arielplatform.common.incentive.IncentiveConfig;
import com.arielplatform.common.incentive.IncentiveSystem;
import com.arielplatform.common.performance.PerformanceTracker;
import com.arielplatform.common.warp.Phase;
import com.arielplatform.common.warp.ResourceSample;
import com.arielplatform.common.warp.TickOutcome;
import com.arielplatform.common.warp.WarpConfig;
import com.arielplatform.common.warp.WarpSystem;
import com.arielplatform.orchestrator.event.ControlLoopEvent;
import com.arielplatform.orchestrator.event.ControlLoopEventBus;
import com.arielplatform.orchestrator.event.ControlLoopEventType;
import com.arielplatform.orchestrator.logger.ControlLoopFlowLogger;
import com.arielplatform.orchestrator.memory.ClassicalMemoryBank;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the phase loop on a {@link VirtualTimeScheduler}, which is both the loop's
 * scheduler and its clock.
 */
class WarpSequenceRunnerTest {

    private VirtualTimeScheduler vts;
    private ArielAgent agent;
    private AtomicReference<ResourceSample> load;
    private AtomicInteger ticks;
    private ControlLoopEventBus eventBus;
    private WarpSequenceRunner runner;

    @BeforeEach
    void setUp() {
        vts   = VirtualTimeScheduler.create();
        load  = new AtomicReference<>(new ResourceSample(10, 10));
        ticks = new AtomicInteger();

        Clock clock = Clock.systemUTC();
        IncentiveSystem incentives = new IncentiveSystem(IncentiveConfig.defaults(), clock);
        agent = new ArielAgent("ariel-test",
            new WarpSystem(WarpConfig.defaults()),
            new HealthDiagnosticEngine(HealthConfig.defaults(), new StrategyRegistry(), clock),
            new EmotionalState(),
            incentives,
            new PerformanceTracker(100, incentives),
            new ClassicalMemoryBank(10, new Random(3)),
            new DecisionParameters());

        eventBus = new ControlLoopEventBus();
        runner = new WarpSequenceRunner(agent,
            () -> {
                ticks.incrementAndGet();
                return load.get();
            },
            vts, WarpConfig.defaults(), eventBus, new ControlLoopFlowLogger());
    }

    @AfterEach
    void tearDown() {
        runner.stop();
        vts.dispose();
    }

    private void allTeamsEfficient() {
        for (Phase p : Phase.values()) agent.warp().setTeamEfficiency(p, 1.0);
    }

    // ── sequence() ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("sequence()")
    class SequenceTests {

        @Test
        @DisplayName("efficient teams reach WARP_DRIVE_ENGAGED and the loop completes")
        void reachesWarpDrive() {
            allTeamsEfficient();

            StepVerifier.withVirtualTime(() -> runner.sequence(false), () -> vts, Long.MAX_VALUE)
                .thenAwait(Duration.ofSeconds(20))
                .expectNext(TickOutcome.WARP_DRIVE_ENGAGED)
                .verifyComplete();

            assertTrue(agent.warp().isLightSpeed());
            assertEquals(5, agent.warp().activeTeams().size());
        }

        @Test
        @DisplayName("overloaded host → one tick per 1 s backoff")
        void throttleBackoff() {
            load.set(new ResourceSample(99, 10));

            StepVerifier.withVirtualTime(() -> runner.sequence(false), () -> vts, Long.MAX_VALUE)
                .thenAwait(Duration.ofMillis(2500))
                .then(() -> assertEquals(3, ticks.get()))
                .thenCancel()
                .verify();

            assertEquals(Phase.INIT, agent.warp().phase());
        }

        @Test
        @DisplayName("idle ticks repeat every 100 ms poll interval")
        void pollInterval() {
            StepVerifier.withVirtualTime(() -> runner.sequence(false), () -> vts, Long.MAX_VALUE)
                .thenAwait(Duration.ofMillis(950))
                .then(() -> assertEquals(10, ticks.get()))
                .thenCancel()
                .verify();
        }

        @Test
        @DisplayName("delay after each outcome: backoff, immediate, poll")
        void delays() {
            assertEquals(Duration.ofSeconds(1), runner.delayAfter(TickOutcome.THROTTLED));
            assertEquals(Duration.ZERO, runner.delayAfter(TickOutcome.REVERTED));
            assertEquals(Duration.ofMillis(100), runner.delayAfter(TickOutcome.IDLE));
            assertEquals(Duration.ofMillis(100), runner.delayAfter(TickOutcome.ADVANCED));
        }
    }

    // ── start / stop / restart ────────────────────────────────────────────

    @Nested
    @DisplayName("start() / stop() / restart()")
    class LifecycleTests {

        @Test
        @DisplayName("stop cancels the pending delay; no tick runs afterwards")
        void stopCancels() {
            List<ControlLoopEvent> events = new CopyOnWriteArrayList<>();
            Disposable listener = eventBus.stream().subscribe(events::add);

            assertTrue(runner.start());
            vts.advanceTimeBy(Duration.ofMillis(450));
            assertEquals(5, ticks.get());
            assertTrue(runner.isRunning());

            runner.stop();
            vts.advanceTimeBy(Duration.ofSeconds(5));

            assertEquals(5, ticks.get());
            assertFalse(runner.isRunning());
            List<ControlLoopEventType> types = events.stream().map(ControlLoopEvent::type).toList();
            assertEquals(List.of(ControlLoopEventType.WARP_STARTED, ControlLoopEventType.WARP_STOPPED), types);
            listener.dispose();
        }

        @Test
        @DisplayName("stop during throttle backoff cancels the backoff")
        void stopDuringBackoff() {
            load.set(new ResourceSample(99, 99));
            runner.start();
            vts.advanceTimeBy(Duration.ofMillis(500));
            assertEquals(1, ticks.get());

            runner.stop();
            vts.advanceTimeBy(Duration.ofSeconds(3));
            assertEquals(1, ticks.get());
        }

        @Test
        @DisplayName("second start while running is ignored")
        void startIsIdempotent() {
            assertTrue(runner.start());
            assertFalse(runner.start());
        }

        @Test
        @DisplayName("restart after the terminal state resets and runs again")
        void restartAfterTerminal() {
            allTeamsEfficient();
            runner.start();
            vts.advanceTimeBy(Duration.ofSeconds(20));
            assertFalse(runner.isRunning());
            assertTrue(agent.warp().isLightSpeed());

            runner.restart();

            assertTrue(runner.isRunning());
            assertEquals(Phase.INIT, agent.warp().phase());
            assertFalse(agent.warp().isLightSpeed());
            assertEquals(1, agent.warp().activeTeams().size());

            vts.advanceTimeBy(Duration.ofSeconds(20));
            assertTrue(agent.warp().isLightSpeed());
        }
    }
}
