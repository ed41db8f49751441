package com.narrateplus.chapter;

import com.narrateplus.model.Chapter;
import java.io.IOException;
import java.util.List;

/**
 * Source of parsed chapters.
 */
public interface ChapterProvider
{
    /**
     * @throws IOException when the chapter cannot be read
     * @throws IllegalArgumentException when the id is unknown
     */
    Chapter getChapter(String chapterId) throws IOException;

    List<String> chapterIds();
}
