package com.arielplatform.orchestrator.monitor;

import com.arielplatform.common.warp.ResourceMonitor;
import com.arielplatform.common.warp.ResourceSample;
import org.springframework.stereotype.Component;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;

/**
 * CPU load from the platform {@link OperatingSystemMXBean}; memory pressure from the
 * JVM heap, used bytes over the maximum heap.
 *
 * <p>Host free memory is not used: on Linux it excludes reclaimable page cache, which
 * keeps a long-running host permanently above the admission threshold. A load the JVM
 * reports as unavailable reads as 0.
 */
@Component
public class JvmResourceMonitor implements ResourceMonitor {

    private final OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
    private final Runtime runtime = Runtime.getRuntime();

    @Override
    public ResourceSample sample() {
        double cpuPercent = 0.0;
        if (os instanceof com.sun.management.OperatingSystemMXBean ext) {
            double cpu = ext.getCpuLoad();
            cpuPercent = cpu < 0 ? 0.0 : cpu * 100.0;
        }
        double memPercent = heapUsagePercent(runtime.maxMemory(), runtime.totalMemory(), runtime.freeMemory());
        return new ResourceSample(cpuPercent, memPercent);
    }

    /**
     * Heap in use as a percentage of the maximum heap, in [0, 100].
     * {@code max} is {@link Long#MAX_VALUE} when the heap is unbounded; the committed
     * size is the limit then.
     */
    static double heapUsagePercent(long max, long total, long free) {
        long limit = max == Long.MAX_VALUE || max <= 0 ? total : max;
        if (limit <= 0) {
            return 0.0;
        }
        long used = Math.max(0L, total - free);
        return Math.min(100.0, (double) used / limit * 100.0);
    }
}
