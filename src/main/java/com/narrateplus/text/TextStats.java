package com.narrateplus.text;

/**
 * Word counting and the words-per-minute duration heuristic used before any real
 * audio exists.
 */
public final class TextStats
{
    public static final int DEFAULT_WORDS_PER_MINUTE = 160;

    private TextStats()
    {
    }

    public static int countWords(String text)
    {
        if (text == null)
        {
            return 0;
        }

        String cleaned = text.trim();
        if (cleaned.isEmpty())
        {
            return 0;
        }
        return cleaned.split("\\s+").length;
    }

    public static double estimateSpeechDurationSeconds(double words)
    {
        return estimateSpeechDurationSeconds(words, DEFAULT_WORDS_PER_MINUTE);
    }

    /**
     * @return estimated seconds, or 0 when either argument is non-positive or not finite
     */
    public static double estimateSpeechDurationSeconds(double words, double wordsPerMinute)
    {
        if (!Double.isFinite(words) || words <= 0)
        {
            return 0;
        }
        if (!Double.isFinite(wordsPerMinute) || wordsPerMinute <= 0)
        {
            return 0;
        }
        return words / (wordsPerMinute / 60d);
    }

    /**
     * Compact duration label: "45s", "2m 5s", "1h 3m".
     */
    public static String formatDurationShort(double seconds)
    {
        if (!Double.isFinite(seconds) || seconds <= 0)
        {
            return "0s";
        }

        long total = Math.round(seconds);
        long hours = total / 3600;
        long minutes = (total % 3600) / 60;
        long secs = total % 60;

        if (hours > 0)
        {
            return minutes > 0 ? hours + "h " + minutes + "m" : hours + "h";
        }
        if (minutes > 0)
        {
            return secs > 0 ? minutes + "m " + secs + "s" : minutes + "m";
        }
        return secs + "s";
    }
}
