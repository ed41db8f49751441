package com.narrateplus.progress;

import com.narrateplus.model.Segment;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Generation state of one chapter in the current session.
 *
 * First results are stored set-if-absent; upgrades replace an entry only when the
 * quality tier strictly increases. All access is synchronized on the instance.
 */
@Slf4j
public final class ChapterProgress
{
    @Getter
    private final String chapterId;

    @Getter
    private final int totalSegments;

    private final Map<Integer, String> segmentTexts = new TreeMap<>();
    private final Map<Integer, Segment> generatedSegments = new TreeMap<>();
    private final Map<Integer, Integer> segmentQuality = new TreeMap<>();

    private boolean generating;
    private int processingIndex = -1;

    ChapterProgress(String chapterId, List<Segment> segments)
    {
        this.chapterId = chapterId;
        this.totalSegments = segments.size();
        for (Segment s : segments)
        {
            segmentTexts.put(s.getIndex(), s.getText());
        }
    }

    /**
     * Base segments (text only) in index order.
     */
    public synchronized List<Segment> segments()
    {
        List<Segment> out = new ArrayList<>(segmentTexts.size());
        for (Map.Entry<Integer, String> e : segmentTexts.entrySet())
        {
            out.add(Segment.of(e.getKey(), e.getValue()));
        }
        return out;
    }

    public synchronized Optional<String> segmentText(int index)
    {
        return Optional.ofNullable(segmentTexts.get(index));
    }

    /**
     * Records the first generated result for an index.
     *
     * @return false when the index already had a result
     */
    public synchronized boolean markGenerated(Segment segment)
    {
        if (generatedSegments.containsKey(segment.getIndex()))
        {
            return false;
        }
        put(segment);
        return true;
    }

    /**
     * Replaces the result for an index with a higher-quality one.
     *
     * @return false when the existing entry is at the same or a higher tier
     */
    public synchronized boolean replaceUpgraded(Segment segment)
    {
        Segment existing = generatedSegments.get(segment.getIndex());
        if (existing != null && existing.getQualityTier() >= segment.getQualityTier())
        {
            log.debug("Ignoring upgrade of {}#{} to tier {}, already at {}", chapterId, segment.getIndex(),
                    segment.getQualityTier(), existing.getQualityTier());
            return false;
        }
        put(segment);
        return true;
    }

    private void put(Segment segment)
    {
        generatedSegments.put(segment.getIndex(), segment);
        segmentQuality.put(segment.getIndex(), segment.getQualityTier());
    }

    public synchronized Optional<Segment> getSegment(int index)
    {
        return Optional.ofNullable(generatedSegments.get(index));
    }

    public synchronized boolean isGenerated(int index)
    {
        return generatedSegments.containsKey(index);
    }

    /**
     * Current tier of an index, or {@link Segment#UNDEFINED_TIER}.
     */
    public synchronized int qualityOf(int index)
    {
        Integer q = segmentQuality.get(index);
        return q == null ? Segment.UNDEFINED_TIER : q;
    }

    public synchronized Set<Integer> getGeneratedIndices()
    {
        return Collections.unmodifiableSet(new TreeSet<>(generatedSegments.keySet()));
    }

    public synchronized Map<Integer, Integer> getSegmentQuality()
    {
        return Collections.unmodifiableMap(new TreeMap<>(segmentQuality));
    }

    public synchronized int generatedCount()
    {
        return generatedSegments.size();
    }

    public synchronized int percentComplete()
    {
        if (totalSegments <= 0)
        {
            return 0;
        }
        return (int) Math.round(generatedSegments.size() * 100d / totalSegments);
    }

    public synchronized boolean isGenerating()
    {
        return generating;
    }

    public synchronized void setGenerating(boolean generating)
    {
        this.generating = generating;
    }

    public synchronized void markGenerationComplete()
    {
        generating = false;
        processingIndex = -1;
    }

    public synchronized int getProcessingIndex()
    {
        return processingIndex;
    }

    public synchronized void setProcessingIndex(int index)
    {
        this.processingIndex = index;
    }

    /**
     * Resets the processing index to -1 if it still points at {@code index}.
     */
    public synchronized void clearProcessingIndex(int index)
    {
        if (processingIndex == index)
        {
            processingIndex = -1;
        }
    }
}
