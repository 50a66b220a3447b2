package com.arielplatform.orchestrator.controller;

import com.arielplatform.common.emotion.EmotionSnapshot;
import com.arielplatform.common.health.ErrorRecord;
import com.arielplatform.common.health.HealingReport;
import com.arielplatform.common.health.Issue;
import com.arielplatform.common.warp.TeamStatus;
import com.arielplatform.common.warp.WarpProcessResult;
import com.arielplatform.orchestrator.dto.AgentStatusResponse;
import com.arielplatform.orchestrator.dto.EfficiencyRequest;
import com.arielplatform.orchestrator.dto.EmotionUpdateRequest;
import com.arielplatform.orchestrator.dto.EmotionalDistanceResponse;
import com.arielplatform.orchestrator.dto.ErrorReportRequest;
import com.arielplatform.orchestrator.dto.IncentiveRequest;
import com.arielplatform.orchestrator.dto.IncentiveResponse;
import com.arielplatform.orchestrator.dto.PerformanceRequest;
import com.arielplatform.orchestrator.dto.PerformanceResponse;
import com.arielplatform.orchestrator.dto.ProcessRequest;
import com.arielplatform.orchestrator.dto.RecentRewardsResponse;
import com.arielplatform.orchestrator.dto.WarpCommandResponse;
import com.arielplatform.orchestrator.event.ControlLoopEvent;
import com.arielplatform.orchestrator.service.AgentControlService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/agent")
public class AgentController {

    private static final Logger log = LoggerFactory.getLogger(AgentController.class);

    private final AgentControlService agentService;

    public AgentController(AgentControlService agentService) {
        this.agentService = agentService;
    }

    @GetMapping("/status")
    public Mono<ResponseEntity<AgentStatusResponse>> status() {
        return agentService.status().map(ResponseEntity::ok);
    }

    // ── warp sequence ─────────────────────────────────────────────────────────

    @PostMapping("/warp/start")
    public Mono<ResponseEntity<WarpCommandResponse>> startWarp() {
        return agentService.startWarp().map(ResponseEntity::ok);
    }

    @PostMapping("/warp/stop")
    public Mono<ResponseEntity<WarpCommandResponse>> stopWarp() {
        return agentService.stopWarp().map(ResponseEntity::ok);
    }

    @PostMapping("/warp/restart")
    public Mono<ResponseEntity<WarpCommandResponse>> restartWarp() {
        return agentService.restartWarp().map(ResponseEntity::ok);
    }

    @PostMapping("/warp/process")
    public Mono<ResponseEntity<WarpProcessResult>> process(@RequestBody ProcessRequest request) {
        return agentService.process(request.input()).map(ResponseEntity::ok);
    }

    @PutMapping("/teams/{phase}/efficiency")
    public Mono<ResponseEntity<TeamStatus>> setTeamEfficiency(@PathVariable String phase,
                                                              @RequestBody EfficiencyRequest request) {
        log.info("Team efficiency update. phase={} efficiency={}", phase, request.efficiency());
        return agentService.setTeamEfficiency(phase, request.efficiency()).map(ResponseEntity::ok);
    }

    // ── health ────────────────────────────────────────────────────────────────

    @PostMapping("/errors")
    public Mono<ResponseEntity<ErrorRecord>> logError(@RequestBody ErrorReportRequest request) {
        return agentService.logError(request).map(ResponseEntity::ok);
    }

    @GetMapping("/diagnose")
    public Mono<ResponseEntity<List<Issue>>> diagnose() {
        return agentService.diagnose().map(ResponseEntity::ok);
    }

    @PostMapping("/heal")
    public Mono<ResponseEntity<HealingReport>> heal() {
        log.info("Healing requested");
        return agentService.heal().map(ResponseEntity::ok);
    }

    // ── emotion and incentives ────────────────────────────────────────────────

    @PostMapping("/emotions/{name}")
    public Mono<ResponseEntity<EmotionSnapshot>> updateEmotion(@PathVariable String name,
                                                               @RequestBody EmotionUpdateRequest request) {
        return agentService.updateEmotion(name, request.delta(), request.decay()).map(ResponseEntity::ok);
    }

    @GetMapping("/emotions/distance")
    public Mono<ResponseEntity<EmotionalDistanceResponse>> emotionalDistance(@RequestParam List<Double> intensities) {
        return agentService.emotionalDistance(intensities).map(ResponseEntity::ok);
    }

    @PostMapping("/rewards/{category}")
    public Mono<ResponseEntity<IncentiveResponse>> reward(@PathVariable String category,
                                                          @RequestBody IncentiveRequest request) {
        return agentService.applyReward(category, request.magnitude()).map(ResponseEntity::ok);
    }

    @PostMapping("/penalties/{category}")
    public Mono<ResponseEntity<IncentiveResponse>> penalty(@PathVariable String category,
                                                           @RequestBody IncentiveRequest request) {
        return agentService.applyPenalty(category, request.magnitude()).map(ResponseEntity::ok);
    }

    @GetMapping("/rewards/recent")
    public Mono<ResponseEntity<RecentRewardsResponse>> recentRewards(
            @RequestParam(defaultValue = "3600") long windowSeconds) {
        return agentService.recentRewards(windowSeconds).map(ResponseEntity::ok);
    }

    @PostMapping("/performance")
    public Mono<ResponseEntity<PerformanceResponse>> recordPerformance(@RequestBody PerformanceRequest request) {
        return agentService.recordPerformance(request.value()).map(ResponseEntity::ok);
    }

    // ── events ────────────────────────────────────────────────────────────────

    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<ControlLoopEvent>> events() {
        log.info("SSE control-loop client connected");
        return agentService.events()
            .map(event -> ServerSentEvent.<ControlLoopEvent>builder()
                .event(event.type().name())
                .data(event)
                .build());
    }
}
