package com.narrateplus.progress;

import com.narrateplus.model.Segment;
import com.narrateplus.text.TextStats;
import java.util.List;

/**
 * Chapter duration before and while audio arrives: the words-per-minute estimate,
 * refined with each measured segment, exact once every segment is measured.
 */
public final class ChapterDurationTracker
{
    private final int[] words;
    private final double[] known;
    private final double wordsPerMinute;
    private int knownCount;

    public ChapterDurationTracker(List<Segment> segments, double wordsPerMinute)
    {
        this.words = new int[segments.size()];
        this.known = new double[segments.size()];
        this.wordsPerMinute = wordsPerMinute;

        for (int i = 0; i < segments.size(); i++)
        {
            words[i] = TextStats.countWords(segments.get(i).getText());
            known[i] = Double.NaN;
        }
        for (Segment s : segments)
        {
            s.getDurationSeconds().ifPresent(d -> record(s.getIndex(), d));
        }
    }

    /**
     * Records a measured duration. Later measurements (an upgraded segment) replace earlier ones.
     */
    public synchronized void record(int index, double seconds)
    {
        if (index < 0 || index >= known.length || !(seconds > 0))
        {
            return;
        }
        if (Double.isNaN(known[index]))
        {
            knownCount++;
        }
        known[index] = seconds;
    }

    public synchronized double totalSeconds()
    {
        return sumBefore(known.length);
    }

    public synchronized boolean isExact()
    {
        return knownCount == known.length;
    }

    /**
     * Position of the start of a segment within the chapter.
     */
    public synchronized double startOffsetOf(int index)
    {
        return sumBefore(Math.max(0, Math.min(index, known.length)));
    }

    public synchronized double durationOf(int index)
    {
        if (index < 0 || index >= known.length)
        {
            return 0d;
        }
        return Double.isNaN(known[index])
                ? TextStats.estimateSpeechDurationSeconds(words[index], wordsPerMinute)
                : known[index];
    }

    private double sumBefore(int end)
    {
        double measured = 0d;
        int remainingWords = 0;
        for (int i = 0; i < end; i++)
        {
            if (Double.isNaN(known[i]))
            {
                remainingWords += words[i];
            }
            else
            {
                measured += known[i];
            }
        }
        return measured + TextStats.estimateSpeechDurationSeconds(remainingWords, wordsPerMinute);
    }
}
