package com.narrateplus.storage;

import com.narrateplus.model.Segment;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Process-local store. Contents last as long as the instance.
 */
public class InMemorySegmentStore implements SegmentStore
{
    private final Map<String, NavigableMap<Integer, Segment>> segments = new ConcurrentHashMap<>();
    private final Map<String, byte[]> chapterAudio = new ConcurrentHashMap<>();

    @Override
    public void putSegment(String bookId, String chapterId, Segment segment)
    {
        segments.computeIfAbsent(key(bookId, chapterId), k -> new ConcurrentSkipListMap<>())
                .put(segment.getIndex(), segment);
    }

    @Override
    public List<Segment> getSegments(String bookId, String chapterId)
    {
        NavigableMap<Integer, Segment> stored = segments.get(key(bookId, chapterId));
        return stored == null ? new ArrayList<>() : new ArrayList<>(stored.values());
    }

    @Override
    public void putChapterAudio(String bookId, String chapterId, byte[] audio)
    {
        chapterAudio.put(key(bookId, chapterId), audio);
    }

    @Override
    public Optional<byte[]> getChapterAudio(String bookId, String chapterId)
    {
        return Optional.ofNullable(chapterAudio.get(key(bookId, chapterId)));
    }

    private static String key(String bookId, String chapterId)
    {
        return bookId + "/" + chapterId;
    }
}
