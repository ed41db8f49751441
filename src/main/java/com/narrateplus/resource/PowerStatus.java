package com.narrateplus.resource;

import lombok.Value;

@Value
public class PowerStatus
{
    /**
     * Charge level, 0..1.
     */
    double level;

    boolean charging;
}
