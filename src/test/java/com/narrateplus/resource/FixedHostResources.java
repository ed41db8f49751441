package com.narrateplus.resource;

import java.util.Optional;
import java.util.OptionalDouble;

public class FixedHostResources implements HostResources
{
    public volatile Double memoryGb;
    public volatile boolean mobile;
    public volatile PowerStatus power;
    public volatile Double heap;
    public volatile boolean failing;

    public static FixedHostResources withMemory(double gb)
    {
        FixedHostResources r = new FixedHostResources();
        r.memoryGb = gb;
        return r;
    }

    @Override
    public OptionalDouble memoryGb()
    {
        check();
        return memoryGb == null ? OptionalDouble.empty() : OptionalDouble.of(memoryGb);
    }

    @Override
    public boolean isMobile()
    {
        check();
        return mobile;
    }

    @Override
    public Optional<PowerStatus> powerStatus()
    {
        check();
        return Optional.ofNullable(power);
    }

    @Override
    public OptionalDouble heapUtilization()
    {
        check();
        return heap == null ? OptionalDouble.empty() : OptionalDouble.of(heap);
    }

    private void check()
    {
        if (failing)
        {
            throw new UnsupportedOperationException("probe unavailable");
        }
    }
}
