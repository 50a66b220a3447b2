package com.arielplatform.orchestrator.logger;

import com.arielplatform.common.health.HealingReport;
import com.arielplatform.common.trace.AgentContextUtil;
import com.arielplatform.common.warp.TickResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logging side-effects for the agent's control loop. Carries no logic of its own.
 *
 * <p>Stages:
 * <ol>
 *   <li>{@link #WARP_STARTED}      phase loop subscribed</li>
 *   <li>{@link #TICK}              one phase-engine step with a non-idle outcome</li>
 *   <li>{@link #WARP_STOPPED}      loop cancelled by the host</li>
 *   <li>{@link #HEALING_COMPLETED} recovery pass returned a report</li>
 * </ol>
 *
 * <p>In a reactive chain the agent id is read from the Reactor Context:
 * <pre>
 *     .doOnEach(flowLogger.stage(ControlLoopFlowLogger.HEALING_COMPLETED))
 * </pre>
 */
@Component
public class ControlLoopFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(ControlLoopFlowLogger.class);

    public static final String WARP_STARTED      = "WARP_STARTED";
    public static final String TICK              = "TICK";
    public static final String WARP_STOPPED      = "WARP_STOPPED";
    public static final String HEALING_COMPLETED = "HEALING_COMPLETED";

    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String agentId = AgentContextUtil.getAgentId(signal.getContextView());
            AgentContextUtil.withMdc(agentId, () ->
                log.info("[ControlLoop] stage={} agentId={}", stageName, agentId)
            );
        };
    }

    public void logStage(String stageName, String agentId) {
        AgentContextUtil.withMdc(agentId, () ->
            log.info("[ControlLoop] stage={} agentId={}", stageName, agentId)
        );
    }

    /**
     * Idle ticks run every poll interval and are logged at debug only.
     */
    public void logTick(TickResult result, String agentId) {
        AgentContextUtil.withMdc(agentId, () -> {
            switch (result.outcome()) {
                case IDLE, HALTED -> log.debug("[ControlLoop] stage={} outcome={} phase={} agentId={}",
                                               TICK, result.outcome(), result.phase(), agentId);
                case THROTTLED    -> log.warn("[ControlLoop] stage={} outcome=THROTTLED phase={} agentId={}",
                                              TICK, result.phase(), agentId);
                case REVERTED     -> log.error("[ControlLoop] stage={} outcome=REVERTED phase={} agentId={} "
                                               + "reason=instability", TICK, result.phase(), agentId);
                default           -> log.info("[ControlLoop] stage={} outcome={} phase={} agentId={}",
                                              TICK, result.outcome(), result.phase(), agentId);
            }
            if (result.complexityExceeded()) {
                log.warn("[ControlLoop] High complexity detected. phase={} agentId={}", result.phase(), agentId);
            }
        });
    }

    public void logHealing(HealingReport report, String agentId) {
        AgentContextUtil.withMdc(agentId, () ->
            log.info("[ControlLoop] stage={} status={} actions={} agentId={}",
                     HEALING_COMPLETED, report.status(), report.actionsTaken().size(), agentId)
        );
    }
}
