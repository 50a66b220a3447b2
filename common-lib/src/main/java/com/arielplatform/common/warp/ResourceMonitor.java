package com.arielplatform.common.warp;

/**
 * Read-only view of host load. Implementations must not block for long.
 */
@FunctionalInterface
public interface ResourceMonitor {

    ResourceSample sample();
}
