package com.arielplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Carries the agent id through reactive pipelines for log attribution.
 *
 * <p>The Reactor Context holds the id inside a pipeline. MDC is written only for the
 * duration of a single log call through {@link #withMdc}.
 */
public final class AgentContextUtil {

    public static final String AGENT_ID_KEY = "agentId";

    private AgentContextUtil() {}

    /**
     * Stores {@code agentId} in the Reactor Context. {@code contextWrite} propagates
     * upstream, so apply it last when assembling the pipeline.
     */
    public static <T> Mono<T> withAgentId(Mono<T> mono, String agentId) {
        return mono.contextWrite(ctx -> ctx.put(AGENT_ID_KEY, agentId));
    }

    /** The agent id from {@code ctx}, or {@code "unknown"}; never {@code null}. */
    public static String getAgentId(ContextView ctx) {
        return ctx.getOrDefault(AGENT_ID_KEY, "unknown");
    }

    /**
     * Bridges {@code agentId} into MDC while {@code logAction} runs, then removes it.
     */
    public static void withMdc(String agentId, Runnable logAction) {
        MDC.put(AGENT_ID_KEY, agentId);
        try {
            logAction.run();
        } finally {
            MDC.remove(AGENT_ID_KEY);
        }
    }
}
