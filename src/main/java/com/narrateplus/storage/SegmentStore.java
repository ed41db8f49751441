package com.narrateplus.storage;

import com.narrateplus.model.Segment;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Persistent audio storage keyed by (book, chapter, segment index).
 */
public interface SegmentStore
{
    /**
     * Inserts or replaces the segment at its index.
     */
    void putSegment(String bookId, String chapterId, Segment segment) throws IOException;

    /**
     * Stored segments of a chapter in index order; empty when nothing is stored.
     */
    List<Segment> getSegments(String bookId, String chapterId) throws IOException;

    void putChapterAudio(String bookId, String chapterId, byte[] audio) throws IOException;

    Optional<byte[]> getChapterAudio(String bookId, String chapterId) throws IOException;
}
