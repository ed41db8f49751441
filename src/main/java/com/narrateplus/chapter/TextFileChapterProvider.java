package com.narrateplus.chapter;

import com.narrateplus.model.Chapter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Plain UTF-8 text files as chapters: a single file, or every {@code .txt} file of a
 * directory in name order. The chapter id is the file name without extension.
 */
public class TextFileChapterProvider implements ChapterProvider
{
    private final Path source;
    private final String language;

    public TextFileChapterProvider(Path source, String language)
    {
        this.source = source;
        this.language = language;
    }

    @Override
    public Chapter getChapter(String chapterId) throws IOException
    {
        for (Path file : files())
        {
            if (idOf(file).equals(chapterId))
            {
                String text = Files.readString(file, StandardCharsets.UTF_8);
                return new Chapter(chapterId, titleOf(text, chapterId), text, language);
            }
        }
        throw new IllegalArgumentException("Unknown chapter: " + chapterId);
    }

    @Override
    public List<String> chapterIds()
    {
        List<String> ids = new ArrayList<>();
        try
        {
            for (Path file : files())
            {
                ids.add(idOf(file));
            }
        }
        catch (IOException e)
        {
            throw new IllegalStateException("Cannot list chapters in " + source, e);
        }
        return ids;
    }

    private List<Path> files() throws IOException
    {
        if (!Files.isDirectory(source))
        {
            return Collections.singletonList(source);
        }

        try (Stream<Path> s = Files.list(source))
        {
            List<Path> out = new ArrayList<>();
            s.filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".txt"))
                    .sorted()
                    .forEach(out::add);
            return out;
        }
    }

    private static String idOf(Path file)
    {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static String titleOf(String text, String fallback)
    {
        for (String line : text.split("\\R"))
        {
            if (!line.trim().isEmpty())
            {
                String t = line.trim();
                return t.length() > 80 ? t.substring(0, 80) : t;
            }
        }
        return fallback;
    }
}
