package com.narrateplus.model;

import lombok.NonNull;
import lombok.Value;

/**
 * A chapter as handed over by the document parser.
 */
@Value
public class Chapter
{
    public static final String DEFAULT_LANGUAGE = "en";

    @NonNull
    String id;

    String title;

    @NonNull
    String text;

    /**
     * ISO 639-1 code, optionally with a region ("en", "de-DE").
     */
    String language;

    public static Chapter of(String id, String title, String text)
    {
        return new Chapter(id, title, text, DEFAULT_LANGUAGE);
    }

    public String getLanguageOrDefault()
    {
        return language == null || language.trim().isEmpty() ? DEFAULT_LANGUAGE : language.trim();
    }
}
