package com.narrateplus.text;

import com.narrateplus.model.Segment;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits chapter text into sentence-like segments with stable, zero-based indices.
 *
 * Pure and deterministic: identical input always yields an identical sequence.
 */
public final class TextSegmenter
{
    // A run closed by sentence punctuation, or a trailing run closed by a line break or the end.
    private static final Pattern SENTENCE = Pattern.compile("[^.!?\\n]*[.!?]+|[^.!?\\n]+");
    private static final Pattern SPEAKABLE = Pattern.compile("[\\p{L}\\p{N}]");

    private TextSegmenter()
    {
    }

    public static List<Segment> split(String text)
    {
        List<String> sentences = sentences(text);
        List<Segment> segments = new ArrayList<>(sentences.size());
        for (int i = 0; i < sentences.size(); i++)
        {
            segments.add(Segment.of(i, sentences.get(i)));
        }
        return Collections.unmodifiableList(segments);
    }

    public static List<String> sentences(String text)
    {
        final List<String> out = new ArrayList<>();
        if (text == null)
        {
            return out;
        }

        String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
        if (normalized.trim().isEmpty())
        {
            return out;
        }

        Matcher m = SENTENCE.matcher(normalized);
        while (m.find())
        {
            String piece = m.group().trim();
            if (SPEAKABLE.matcher(piece).find())
            {
                out.add(piece);
            }
        }

        // Punctuation-only input: keep it whole.
        if (out.isEmpty())
        {
            out.add(normalized.trim());
        }
        return out;
    }

    /**
     * Word count per segment, in index order.
     */
    public static int[] wordCounts(List<Segment> segments)
    {
        int[] counts = new int[segments.size()];
        for (int i = 0; i < counts.length; i++)
        {
            counts[i] = TextStats.countWords(segments.get(i).getText());
        }
        return counts;
    }
}
