package com.narrateplus.generation;

import lombok.NonNull;
import lombok.Value;

/**
 * Identity of a generation request: one segment of one chapter.
 */
@Value
public class SegmentKey
{
    @NonNull
    String chapterId;

    int index;

    @Override
    public String toString()
    {
        return chapterId + "#" + index;
    }
}
