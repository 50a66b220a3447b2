package com.arielplatform.orchestrator.loop;

import com.arielplatform.orchestrator.logger.ControlLoopFlowLogger;
import com.arielplatform.orchestrator.service.AgentControlService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Optional fixed cadence for {@code heal()}. Disabled when {@code agent.recovery.interval}
 * is zero. Each cycle reschedules the next one whatever its result, so a failing
 * strategy never stops the cadence.
 */
@Component
public class RecoveryScheduler {

    private static final Logger log = LoggerFactory.getLogger(RecoveryScheduler.class);

    private final AgentControlService agentService;
    private final ControlLoopFlowLogger flowLogger;
    private final String agentId;
    private final Duration interval;

    private volatile boolean stopped;
    private volatile Disposable pending;

    public RecoveryScheduler(AgentControlService agentService,
                             ControlLoopFlowLogger flowLogger,
                             @Value("${agent.id:ariel-1}") String agentId,
                             @Value("${agent.recovery.interval:0s}") Duration interval) {
        this.agentService = agentService;
        this.flowLogger   = flowLogger;
        this.agentId      = agentId;
        this.interval     = interval;
    }

    @PostConstruct
    public void startCadence() {
        if (interval.isZero() || interval.isNegative()) {
            log.info("Recovery cadence disabled. agentId={}", agentId);
            return;
        }
        log.info("Recovery cadence started. intervalSeconds={} agentId={}", interval.toSeconds(), agentId);
        scheduleNextCycle();
    }

    @PreDestroy
    public void stopCadence() {
        stopped = true;
        Disposable current = pending;
        if (current != null) {
            current.dispose();
        }
    }

    public boolean isEnabled() {
        return !interval.isZero() && !interval.isNegative();
    }

    private void scheduleNextCycle() {
        if (stopped) return;
        pending = Mono.delay(interval)
            .then(agentService.heal())
            .subscribe(
                report -> {
                    flowLogger.logHealing(report, agentId);
                    scheduleNextCycle();
                },
                err -> {
                    log.error("Recovery cycle failed. agentId={} rescheduling", agentId, err);
                    scheduleNextCycle();
                }
            );
    }
}
