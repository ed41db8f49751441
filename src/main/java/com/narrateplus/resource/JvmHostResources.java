package com.narrateplus.resource;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Probes backed by the running JVM. Battery state is not visible from the JVM.
 */
public final class JvmHostResources implements HostResources
{
    private static final double BYTES_PER_GB = 1024d * 1024d * 1024d;

    private final boolean mobile;

    public JvmHostResources(boolean mobile)
    {
        this.mobile = mobile;
    }

    @Override
    public OptionalDouble memoryGb()
    {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        if (os instanceof com.sun.management.OperatingSystemMXBean)
        {
            long total = ((com.sun.management.OperatingSystemMXBean) os).getTotalMemorySize();
            if (total > 0)
            {
                return OptionalDouble.of(total / BYTES_PER_GB);
            }
        }
        return OptionalDouble.empty();
    }

    @Override
    public boolean isMobile()
    {
        return mobile;
    }

    @Override
    public Optional<PowerStatus> powerStatus()
    {
        return Optional.empty();
    }

    @Override
    public OptionalDouble heapUtilization()
    {
        Runtime rt = Runtime.getRuntime();
        long max = rt.maxMemory();
        if (max <= 0 || max == Long.MAX_VALUE)
        {
            return OptionalDouble.empty();
        }
        long used = rt.totalMemory() - rt.freeMemory();
        return OptionalDouble.of(used / (double) max);
    }
}
