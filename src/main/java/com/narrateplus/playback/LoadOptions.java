package com.narrateplus.playback;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class LoadOptions
{
    public static final LoadOptions DEFAULT = LoadOptions.builder().build();

    @Builder.Default
    int startSegmentIndex = 0;

    @Builder.Default
    boolean startPlaying = true;

    @Builder.Default
    double speed = 1.0d;
}
