package com.narrateplus.resource;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Host probes. Any probe may be unsupported (empty result) or fail by throwing;
 * the resource monitor treats both as "no restriction".
 */
public interface HostResources
{
    /**
     * Total physical memory in GB.
     */
    OptionalDouble memoryGb();

    boolean isMobile();

    Optional<PowerStatus> powerStatus();

    /**
     * Used fraction of the maximum heap, 0..1.
     */
    OptionalDouble heapUtilization();
}
