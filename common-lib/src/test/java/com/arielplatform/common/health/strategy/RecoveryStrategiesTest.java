package com.arielplatform.common.health.strategy;

import com.arielplatform.common.decision.DecisionParameters;
import com.arielplatform.common.emotion.Emotion;
import com.arielplatform.common.emotion.EmotionalState;
import com.arielplatform.common.health.RecoveryStrategy;
import com.arielplatform.common.health.StrategyRegistry;
import com.arielplatform.common.support.ArrayMemoryStore;
import com.arielplatform.common.support.TestRecoveryContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class RecoveryStrategiesTest {

    private static final double EPS = 1e-9;

    // ── registry ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("standard registry")
    class RegistryTests {

        private final StrategyRegistry registry = RecoveryStrategies.standard(new Random(1), Schedulers.parallel());

        @Test
        @DisplayName("five strategies in fixed selection order")
        void order() {
            List<String> keys = registry.getAll().stream().map(RecoveryStrategy::key).toList();
            assertEquals(List.of("memory_corruption", "emotional_instability", "resource_depletion",
                                 "decision_paralysis", "communication_failure"), keys);
        }

        @Test
        @DisplayName("selection by substring of the subject")
        void substringSelection() {
            assertEquals("resource_depletion", registry.select("resource_depletion").orElseThrow().key());
            assertEquals("memory_corruption", registry.select("severe_memory_corruption_burst").orElseThrow().key());
        }

        @Test
        @DisplayName("metric keys and unrelated error types select nothing")
        void noMatch() {
            assertTrue(registry.select("memory_integrity").isEmpty());
            assertTrue(registry.select("memory_leak").isEmpty());
        }
    }

    // ── memory_corruption ─────────────────────────────────────────────────

    @Nested
    @DisplayName("memory_corruption")
    class MemoryTests {

        @Test
        @DisplayName("severity ≤ 7 → layout pass only, gain min(15, 2s)")
        void shallow() {
            ArrayMemoryStore memory = new ArrayMemoryStore(4);
            memory.store(1, 50);
            TestRecoveryContext ctx = new TestRecoveryContext(new EmotionalState(), memory, new DecisionParameters());

            StepVerifier.create(new MemoryCorruptionStrategy(new Random(1)).apply(5.0, ctx))
                .assertNext(outcome -> {
                    assertEquals("Memory layout optimization performed", outcome.description());
                    assertEquals(10.0, outcome.metricGain(), EPS);
                })
                .verifyComplete();

            assertEquals(1, memory.layoutPasses());
            assertEquals(0.5, memory.peek(1), EPS);
        }

        @Test
        @DisplayName("severity 10 → slots above 0.7 survive, every other slot is zeroed")
        void deep() {
            ArrayMemoryStore memory = new ArrayMemoryStore(4);
            memory.store(0, 90);
            memory.store(1, 50);
            memory.store(2, 71);
            memory.store(3, 70);
            TestRecoveryContext ctx = new TestRecoveryContext(new EmotionalState(), memory, new DecisionParameters());

            StepVerifier.create(new MemoryCorruptionStrategy(new Random(1)).apply(10.0, ctx))
                .assertNext(outcome -> {
                    assertEquals("Deep memory healing performed", outcome.description());
                    assertEquals(30.0, outcome.metricGain(), EPS);
                })
                .verifyComplete();

            assertEquals(0.90, memory.peek(0), EPS);
            assertEquals(0.0, memory.peek(1), EPS);
            assertEquals(0.71, memory.peek(2), EPS);
            assertEquals(0.0, memory.peek(3), EPS);
        }
    }

    // ── emotional_instability ─────────────────────────────────────────────

    @Test
    @DisplayName("emotional_instability pulls the three most deviant emotions toward the median")
    void emotionalRebalancing() {
        EmotionalState state = EmotionalState.of(90, 50, 50, 50, 50, 50, 50, 10);
        TestRecoveryContext ctx = new TestRecoveryContext(state, new ArrayMemoryStore(1), new DecisionParameters());

        StepVerifier.create(new EmotionalInstabilityStrategy().apply(10.0, ctx))
            .assertNext(outcome -> {
                assertEquals("Emotional rebalancing performed on [joy, surprise, sadness]", outcome.description());
                assertEquals(25.0, outcome.metricGain(), EPS);
            })
            .verifyComplete();

        // joy 90→70; surprise (decayed to 9) → 29.5; sadness (decayed to 40.5) → 45.25; decay after each step
        assertEquals(56.7, state.intensity(Emotion.JOY), EPS);
        assertEquals(26.55, state.intensity(Emotion.SURPRISE), EPS);
        assertEquals(45.25, state.intensity(Emotion.SADNESS), EPS);
    }

    @Test
    @DisplayName("median of eight intensities averages the middle pair")
    void median() {
        assertEquals(45.0, EmotionalInstabilityStrategy.median(EmotionalState.of(0, 10, 20, 40, 50, 60, 80, 100)), EPS);
    }

    // ── decision_paralysis ────────────────────────────────────────────────

    @Nested
    @DisplayName("decision_paralysis")
    class DecisionTests {

        @Test
        @DisplayName("severity > 6 → threshold reset, exploration raised and capped at 0.3")
        void severe() {
            DecisionParameters params = new DecisionParameters();
            params.setDecisionThreshold(0.95);
            TestRecoveryContext ctx = new TestRecoveryContext(new EmotionalState(), new ArrayMemoryStore(1), params);

            StepVerifier.create(new DecisionParalysisStrategy().apply(8.0, ctx))
                .assertNext(outcome -> {
                    assertEquals("Decision system reset with increased exploration", outcome.description());
                    assertEquals(24.0, outcome.metricGain(), EPS);
                })
                .verifyComplete();

            assertEquals(0.6, params.decisionThreshold(), EPS);
            assertEquals(0.3, params.explorationRate(), EPS);
        }

        @Test
        @DisplayName("severity ≤ 6 → threshold reset only")
        void mild() {
            DecisionParameters params = new DecisionParameters();
            params.setDecisionThreshold(0.2);
            TestRecoveryContext ctx = new TestRecoveryContext(new EmotionalState(), new ArrayMemoryStore(1), params);

            StepVerifier.create(new DecisionParalysisStrategy().apply(4.0, ctx))
                .assertNext(outcome -> {
                    assertEquals("Decision thresholds reset", outcome.description());
                    assertEquals(6.0, outcome.metricGain(), EPS);
                })
                .verifyComplete();

            assertEquals(0.6, params.decisionThreshold(), EPS);
            assertEquals(0.1, params.explorationRate(), EPS);
        }
    }

    // ── suspending strategies ─────────────────────────────────────────────

    @Nested
    @DisplayName("suspending strategies")
    class SuspendingTests {

        @Test
        @DisplayName("major resource reallocation suspends 10 ms")
        void resourceMajor() {
            VirtualTimeScheduler vts = VirtualTimeScheduler.create();
            ResourceDepletionStrategy strategy = new ResourceDepletionStrategy(vts);

            StepVerifier.withVirtualTime(() -> strategy.apply(6.0, TestRecoveryContext.fresh()), () -> vts, Long.MAX_VALUE)
                .expectSubscription()
                .expectNoEvent(Duration.ofMillis(9))
                .thenAwait(Duration.ofMillis(1))
                .assertNext(outcome -> {
                    assertEquals("Major resource reallocation performed", outcome.description());
                    assertEquals(12.0, outcome.metricGain(), EPS);
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("minor resource optimisation suspends 5 ms, gain min(10, s)")
        void resourceMinor() {
            VirtualTimeScheduler vts = VirtualTimeScheduler.create();
            ResourceDepletionStrategy strategy = new ResourceDepletionStrategy(vts);

            StepVerifier.withVirtualTime(() -> strategy.apply(5.0, TestRecoveryContext.fresh()), () -> vts, Long.MAX_VALUE)
                .thenAwait(Duration.ofMillis(5))
                .assertNext(outcome -> {
                    assertEquals("Resource usage optimization performed", outcome.description());
                    assertEquals(5.0, outcome.metricGain(), EPS);
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("communication reset suspends 20 ms, gain capped at 25")
        void communication() {
            VirtualTimeScheduler vts = VirtualTimeScheduler.create();
            CommunicationFailureStrategy strategy = new CommunicationFailureStrategy(vts);

            StepVerifier.withVirtualTime(() -> strategy.apply(12.0, TestRecoveryContext.fresh()), () -> vts, Long.MAX_VALUE)
                .expectSubscription()
                .expectNoEvent(Duration.ofMillis(19))
                .thenAwait(Duration.ofMillis(1))
                .assertNext(outcome -> {
                    assertEquals("Communication protocols reset and reinitialized", outcome.description());
                    assertEquals(25.0, outcome.metricGain(), EPS);
                })
                .verifyComplete();
        }
    }
}
