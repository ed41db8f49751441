package com.narrateplus.quality;

import com.narrateplus.NarratePlusConfig;
import com.narrateplus.model.EngineKind;
import com.narrateplus.model.ExecutionDevice;
import com.narrateplus.model.Quantization;
import com.narrateplus.model.TierConfig;
import com.narrateplus.model.TierLadder;
import com.narrateplus.tts.SpeechEngineFactory;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import javax.inject.Inject;
import javax.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds the tier ladder for a chapter language.
 *
 * Kokoro languages: system voice, then Kokoro at increasing precision.
 * Everything else: system voice, then the installed Piper voices by quality,
 * with a gap wherever no voice of that quality exists.
 */
@Slf4j
@Singleton
public class TierLadderResolver
{
    private static final Set<String> KOKORO_LANGUAGES = Set.of("en", "en-us", "en-gb");

    private final NarratePlusConfig config;
    private final SpeechEngineFactory engineFactory;

    @Inject
    public TierLadderResolver(NarratePlusConfig config, SpeechEngineFactory engineFactory)
    {
        this.config = config;
        this.engineFactory = engineFactory;
    }

    public TierLadder resolve(String language)
    {
        String lang = normalizeLanguageCode(language);
        Set<EngineKind> supported = engineFactory.supportedEngines();

        List<TierConfig> tiers = new ArrayList<>(4);
        tiers.add(supported.contains(EngineKind.SYSTEM) ? TierConfig.systemVoice() : null);

        if (KOKORO_LANGUAGES.contains(lang) && supported.contains(EngineKind.KOKORO))
        {
            String voice = config.kokoroVoice();
            tiers.add(TierConfig.kokoro(voice, Quantization.Q4, ExecutionDevice.CPU));
            tiers.add(TierConfig.kokoro(voice, Quantization.Q8, ExecutionDevice.CPU));
            tiers.add(TierConfig.kokoro(voice, Quantization.FP16, ExecutionDevice.AUTO));
        }
        else
        {
            List<PiperVoice> catalog = PiperVoice.parseCatalog(config.piperVoices());
            for (VoiceQuality q : VoiceQuality.values())
            {
                PiperVoice voice = supported.contains(EngineKind.PIPER) ? findVoice(catalog, lang, q) : null;
                tiers.add(voice == null ? null : TierConfig.piper(voice.getKey()));
            }
        }

        TierLadder ladder = new TierLadder(tiers);
        log.debug("Tier ladder for '{}': {}", lang, ladder);
        return ladder;
    }

    /**
     * Exact language match first, then the base language ("pt-br" falls back to "pt").
     */
    private static PiperVoice findVoice(List<PiperVoice> catalog, String lang, VoiceQuality quality)
    {
        String base = baseLanguage(lang);
        PiperVoice fallback = null;
        for (PiperVoice v : catalog)
        {
            if (v.getQuality() != quality)
            {
                continue;
            }
            if (v.getLanguage().equals(lang))
            {
                return v;
            }
            if (fallback == null && baseLanguage(v.getLanguage()).equals(base))
            {
                fallback = v;
            }
        }
        return fallback;
    }

    /**
     * Lower case, underscores to hyphens, blank to the default language.
     */
    public static String normalizeLanguageCode(String language)
    {
        if (language == null || language.trim().isEmpty())
        {
            return "en";
        }
        return language.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    private static String baseLanguage(String lang)
    {
        int dash = lang.indexOf('-');
        return dash < 0 ? lang : lang.substring(0, dash);
    }
}
