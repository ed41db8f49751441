package com.narrateplus.progress;

import com.narrateplus.model.Segment;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import javax.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

/**
 * Session-wide chapter progress, keyed by chapter id.
 */
@Slf4j
@Singleton
public class ChapterProgressRegistry
{
    private final Map<String, ChapterProgress> chapters = new ConcurrentHashMap<>();

    /**
     * Starts a fresh record for a chapter about to be generated, replacing any previous one.
     */
    public ChapterProgress init(String chapterId, List<Segment> segments)
    {
        ChapterProgress progress = new ChapterProgress(chapterId, segments);
        progress.setGenerating(true);
        chapters.put(chapterId, progress);
        return progress;
    }

    /**
     * Rebuilds a record from persisted segments: every stored index counts as
     * generated at its stored tier, and nothing is generating.
     */
    public ChapterProgress loadFromStorage(String chapterId, List<Segment> stored)
    {
        ChapterProgress progress = new ChapterProgress(chapterId, stored);
        for (Segment s : stored)
        {
            if (s.hasAudio() && s.getQualityTier() != Segment.UNDEFINED_TIER)
            {
                progress.markGenerated(s);
            }
        }
        chapters.put(chapterId, progress);
        log.debug("Hydrated {} with {}/{} stored segments", chapterId, progress.generatedCount(), stored.size());
        return progress;
    }

    public Optional<ChapterProgress> get(String chapterId)
    {
        return Optional.ofNullable(chapters.get(chapterId));
    }

    public int percentComplete(String chapterId)
    {
        ChapterProgress p = chapters.get(chapterId);
        return p == null ? 0 : p.percentComplete();
    }

    public void clear(String chapterId)
    {
        chapters.remove(chapterId);
    }

    public void clearAll()
    {
        chapters.clear();
    }
}
