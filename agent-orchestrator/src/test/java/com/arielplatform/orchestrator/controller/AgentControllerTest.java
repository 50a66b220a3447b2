package com.arielplatform.orchestrator.controller;

import com.arielplatform.common.agent.ArielAgent;
import com.arielplatform.common.decision.DecisionParameters;
import com.arielplatform.common.emotion.EmotionalState;
import com.arielplatform.common.exception.OutOfRangeException;
import com.arielplatform.common.health.HealthConfig;
import com.arielplatform.common.health.HealthDiagnosticEngine;
import com.arielplatform.common.health.strategy.RecoveryStrategies;
import com.arielplatform.common.incentive.IncentiveConfig;
import com.arielplatform.common.incentive.IncentiveSystem;
import com.arielplatform.common.performance.PerformanceTracker;
import com.arielplatform.common.warp.ResourceSample;
import com.arielplatform.common.warp.WarpConfig;
import com.arielplatform.common.warp.WarpSystem;
import com.arielplatform.orchestrator.event.ControlLoopEventBus;
import com.arielplatform.orchestrator.logger.ControlLoopFlowLogger;
import com.arielplatform.orchestrator.loop.WarpSequenceRunner;
import com.arielplatform.orchestrator.memory.ClassicalMemoryBank;
import com.arielplatform.orchestrator.service.AgentControlService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Controller and error mapping against a real agent, without a Spring context.
 */
class AgentControllerTest {

    private Scheduler scheduler;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        scheduler = Schedulers.newSingle("ariel-agent-test");
        Clock clock = Clock.systemUTC();
        IncentiveSystem incentives = new IncentiveSystem(IncentiveConfig.defaults(), clock);
        ArielAgent agent = new ArielAgent("ariel-test",
            new WarpSystem(WarpConfig.defaults()),
            new HealthDiagnosticEngine(HealthConfig.defaults(), RecoveryStrategies.standard(new Random(5), scheduler), clock),
            new EmotionalState(),
            incentives,
            new PerformanceTracker(100, incentives),
            new ClassicalMemoryBank(10, new Random(5)),
            new DecisionParameters());

        ControlLoopEventBus eventBus = new ControlLoopEventBus();
        ControlLoopFlowLogger flowLogger = new ControlLoopFlowLogger();
        WarpSequenceRunner runner = new WarpSequenceRunner(agent, () -> new ResourceSample(0, 0),
            scheduler, WarpConfig.defaults(), eventBus, flowLogger);
        AgentControlService service = new AgentControlService(agent, runner, scheduler, eventBus, flowLogger, clock);

        client = WebTestClient.bindToController(new AgentController(service))
            .controllerAdvice(new ApiExceptionHandler())
            .build();
    }

    @AfterEach
    void tearDown() {
        scheduler.dispose();
    }

    // ── health ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("health endpoints")
    class HealthEndpointTests {

        @Test
        @DisplayName("three logged errors show up in /diagnose, recurring first")
        void diagnose() {
            for (int i = 0; i < 3; i++) {
                client.post().uri("/api/v1/agent/errors")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("type", "memory_corruption", "severity", 20))
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody().jsonPath("$.healed").isEqualTo(false);
            }

            client.get().uri("/api/v1/agent/diagnose")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].label").isEqualTo("recurring_memory_corruption")
                .jsonPath("$[0].occurrenceCount").isEqualTo(3)
                .jsonPath("$[1].label").isEqualTo("critical_memory_integrity");
        }

        @Test
        @DisplayName("null detail values are accepted and echoed back")
        void nullDetailValue() {
            client.post().uri("/api/v1/agent/errors")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"type\":\"memory_corruption\",\"severity\":5,\"details\":{\"component\":null}}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.type").isEqualTo("memory_corruption")
                .jsonPath("$.details.component").doesNotExist();
        }

        @Test
        @DisplayName("/heal on a healthy agent → HEALTHY with no actions")
        void healHealthy() {
            client.post().uri("/api/v1/agent/heal")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("HEALTHY")
                .jsonPath("$.actionsTaken").isEmpty();
        }

        @Test
        @DisplayName("negative severity → 400")
        void negativeSeverity() {
            client.post().uri("/api/v1/agent/errors")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("type", "memory_leak", "severity", -1))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody().jsonPath("$.component").isEqualTo("health");
        }
    }

    // ── emotion and incentives ────────────────────────────────────────────

    @Nested
    @DisplayName("emotion and incentive endpoints")
    class EmotionEndpointTests {

        @Test
        @DisplayName("joy +20 → snapshot with joy 70 and stability 12.5")
        void updateEmotion() {
            client.post().uri("/api/v1/agent/emotions/joy")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("delta", 20, "decay", 0.9))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.intensities.joy").isEqualTo(70.0)
                .jsonPath("$.stability").isEqualTo(12.5);
        }

        @Test
        @DisplayName("decay above 1 → 400 and intensities unchanged")
        void decayOutOfRange() {
            client.post().uri("/api/v1/agent/emotions/joy")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("delta", 0, "decay", 2.0))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.component").isEqualTo("emotion")
                .jsonPath("$.message").isEqualTo("Decay factor must be in [0, 1]: 2.0");

            client.get().uri("/api/v1/agent/status")
                .exchange()
                .expectStatus().isOk()
                .expectBody().jsonPath("$.emotions.intensities.sadness").isEqualTo(50.0);
        }

        @Test
        @DisplayName("unknown emotion → 400")
        void unknownEmotion() {
            client.post().uri("/api/v1/agent/emotions/boredom")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("delta", 5))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody().jsonPath("$.error").isEqualTo("invalid_argument");
        }

        @Test
        @DisplayName("penalty category on the rewards path → 400")
        void wrongKind() {
            client.post().uri("/api/v1/agent/rewards/conflict")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("magnitude", 1))
                .exchange()
                .expectStatus().isBadRequest();
        }

        @Test
        @DisplayName("reward then /rewards/recent includes it in the total")
        void recentRewards() {
            client.post().uri("/api/v1/agent/rewards/innovation")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("magnitude", 2))
                .exchange()
                .expectStatus().isOk()
                .expectBody().jsonPath("$.scaledValue").isEqualTo(12.0);

            client.get().uri("/api/v1/agent/rewards/recent?windowSeconds=60")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.records.length()").isEqualTo(1)
                .jsonPath("$.totalReward").isEqualTo(12.0);
        }
    }

    // ── warp ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("warp endpoints")
    class WarpEndpointTests {

        @Test
        @DisplayName("processing before start → 409")
        void processBeforeStart() {
            client.post().uri("/api/v1/agent/warp/process")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("input", new double[]{1, 2}))
                .exchange()
                .expectStatus().isEqualTo(HttpStatus.CONFLICT);
        }

        @Test
        @DisplayName("efficiency outside [0, 1] → 400; unknown phase → 400")
        void efficiencyValidation() {
            client.put().uri("/api/v1/agent/teams/INIT/efficiency")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("efficiency", 1.5))
                .exchange()
                .expectStatus().isBadRequest();

            client.put().uri("/api/v1/agent/teams/HYPERDRIVE/efficiency")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("efficiency", 0.9))
                .exchange()
                .expectStatus().isBadRequest();
        }

        @Test
        @DisplayName("start then status reports a running loop in INIT")
        void startAndStatus() {
            client.post().uri("/api/v1/agent/warp/start")
                .exchange()
                .expectStatus().isOk()
                .expectBody().jsonPath("$.accepted").isEqualTo(true);

            client.get().uri("/api/v1/agent/status")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.running").isEqualTo(true)
                .jsonPath("$.warp.phase").isEqualTo("INIT")
                .jsonPath("$.health.memory_integrity").isEqualTo(100.0);

            client.post().uri("/api/v1/agent/warp/stop")
                .exchange()
                .expectStatus().isOk()
                .expectBody().jsonPath("$.running").isEqualTo(false);
        }
    }

    @Test
    @DisplayName("out-of-range maps to 422")
    void outOfRangeMapping() {
        ResponseEntity<Map<String, Object>> response =
            new ApiExceptionHandler().handleOutOfRange(new OutOfRangeException("memory", 12, 10));
        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, response.getStatusCode());
        assertEquals("out_of_range", response.getBody().get("error"));
        assertEquals("memory", response.getBody().get("component"));
        assertEquals("Index 12 out of range [0, 9]", response.getBody().get("message"));
    }
}
