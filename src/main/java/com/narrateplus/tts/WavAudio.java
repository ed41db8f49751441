package com.narrateplus.tts;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public final class WavAudio
{
    private WavAudio()
    {
    }

    /**
     * Playable length of WAV bytes, or 0 when the header cannot be read.
     */
    public static double durationSeconds(byte[] wavBytes)
    {
        if (wavBytes == null || wavBytes.length == 0)
        {
            return 0d;
        }

        try (AudioInputStream ais = AudioSystem.getAudioInputStream(new ByteArrayInputStream(wavBytes)))
        {
            AudioFormat format = ais.getFormat();
            long frames = ais.getFrameLength();
            if (frames <= 0 || format.getFrameRate() <= 0)
            {
                return 0d;
            }
            return frames / (double) format.getFrameRate();
        }
        catch (UnsupportedAudioFileException | IOException e)
        {
            log.debug("Cannot read WAV header: {}", e.toString());
            return 0d;
        }
    }
}
