package com.narrateplus.quality;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * One installed Piper voice.
 */
@Value
@Slf4j
public class PiperVoice
{
    String key;

    /**
     * Normalized language code, e.g. "de" or "pt-br".
     */
    String language;

    VoiceQuality quality;

    /**
     * Parses {@code key:language:quality} entries separated by commas. Malformed
     * entries are logged and skipped.
     */
    public static List<PiperVoice> parseCatalog(String catalog)
    {
        if (catalog == null || catalog.trim().isEmpty())
        {
            return Collections.emptyList();
        }

        List<PiperVoice> out = new ArrayList<>();
        for (String entry : catalog.split(","))
        {
            String e = entry.trim();
            if (e.isEmpty())
            {
                continue;
            }

            String[] parts = e.split(":");
            if (parts.length != 3 || parts[0].trim().isEmpty())
            {
                log.warn("Ignoring malformed Piper voice entry '{}'", e);
                continue;
            }

            try
            {
                VoiceQuality q = VoiceQuality.valueOf(parts[2].trim().toUpperCase(Locale.ROOT));
                out.add(new PiperVoice(parts[0].trim(), TierLadderResolver.normalizeLanguageCode(parts[1]), q));
            }
            catch (IllegalArgumentException ex)
            {
                log.warn("Ignoring Piper voice '{}' with unknown quality '{}'", parts[0].trim(), parts[2].trim());
            }
        }
        return out;
    }
}
