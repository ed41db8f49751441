package com.narrateplus.resource;

import com.narrateplus.NarratePlusConfig;
import java.util.Optional;
import java.util.OptionalDouble;
import javax.inject.Inject;
import javax.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

/**
 * Classifies the host and decides, at the moment of asking, whether background
 * quality upgrades may run.
 */
@Slf4j
@Singleton
public class ResourceMonitor
{
    static final double WEAK_MEMORY_GB = 4d;
    static final double STRONG_MEMORY_GB = 8d;

    private final HostResources host;
    private final NarratePlusConfig config;

    @Inject
    public ResourceMonitor(HostResources host, NarratePlusConfig config)
    {
        this.host = host;
        this.config = config;
    }

    public DeviceClass classifyDevice()
    {
        try
        {
            if (host.isMobile())
            {
                return DeviceClass.WEAK;
            }
        }
        catch (RuntimeException e)
        {
            log.warn("Mobile probe failed: {}", e.toString());
        }

        OptionalDouble mem = probeMemory();
        if (mem.isEmpty())
        {
            return DeviceClass.MEDIUM;
        }
        if (mem.getAsDouble() <= WEAK_MEMORY_GB)
        {
            return DeviceClass.WEAK;
        }
        if (mem.getAsDouble() >= STRONG_MEMORY_GB)
        {
            return DeviceClass.STRONG;
        }
        return DeviceClass.MEDIUM;
    }

    /**
     * Every chapter starts at the fastest tier.
     */
    public int startingTier()
    {
        return 0;
    }

    public int targetTier()
    {
        return targetTier(classifyDevice());
    }

    public static int targetTier(DeviceClass deviceClass)
    {
        switch (deviceClass)
        {
            case WEAK:
                return 1;
            case STRONG:
                return 3;
            default:
                return 2;
        }
    }

    /**
     * Evaluated fresh on every call; nothing is cached between ticks.
     */
    public boolean canRunUpgradeNow()
    {
        OptionalDouble mem = probeMemory();
        if (mem.isPresent() && mem.getAsDouble() <= config.memoryFloorGb())
        {
            log.debug("Upgrade blocked: {} GB memory", mem.getAsDouble());
            return false;
        }

        Optional<PowerStatus> power = probePower();
        if (power.isPresent()
                && power.get().getLevel() < config.lowBatteryThreshold()
                && !power.get().isCharging())
        {
            log.debug("Upgrade blocked: battery at {}", power.get().getLevel());
            return false;
        }

        OptionalDouble heap = probeHeap();
        if (heap.isPresent() && heap.getAsDouble() > config.heapUtilizationCeiling())
        {
            log.debug("Upgrade blocked: heap utilization {}", heap.getAsDouble());
            return false;
        }

        return true;
    }

    private OptionalDouble probeMemory()
    {
        try
        {
            return host.memoryGb();
        }
        catch (RuntimeException e)
        {
            log.warn("Memory probe failed: {}", e.toString());
            return OptionalDouble.empty();
        }
    }

    private Optional<PowerStatus> probePower()
    {
        try
        {
            return host.powerStatus();
        }
        catch (RuntimeException e)
        {
            log.warn("Power probe failed: {}", e.toString());
            return Optional.empty();
        }
    }

    private OptionalDouble probeHeap()
    {
        try
        {
            return host.heapUtilization();
        }
        catch (RuntimeException e)
        {
            log.warn("Heap probe failed: {}", e.toString());
            return OptionalDouble.empty();
        }
    }
}
