package com.phillippitts.radflow.service.external.impl;

import com.phillippitts.radflow.service.external.AudioCuePlayer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.SourceDataLine;

/**
 * Plays sine-wave cues through Java Sound. A missing or busy output device is logged and
 * the cue is skipped.
 */
@Component
class JavaSoundCuePlayer implements AudioCuePlayer {

    private static final Logger LOG = LogManager.getLogger(JavaSoundCuePlayer.class);

    static final float SAMPLE_RATE = 44_100f;
    private static final int FADE_MS = 5;

    @Override
    public void play(int frequencyHz, int durationMs, double volume) {
        byte[] pcm = tone(frequencyHz, durationMs, volume);
        AudioFormat format = new AudioFormat(SAMPLE_RATE, 16, 1, true, false);
        try (SourceDataLine line = AudioSystem.getSourceDataLine(format)) {
            line.open(format);
            line.start();
            line.write(pcm, 0, pcm.length);
            line.drain();
        } catch (LineUnavailableException e) {
            LOG.warn("Audio output unavailable: {}", e.getMessage());
        } catch (SecurityException | IllegalArgumentException e) {
            LOG.warn("Cue playback failed: {}", e.toString());
        }
    }

    /**
     * 16-bit little-endian mono PCM sine with a short linear fade at both ends to avoid clicks.
     */
    static byte[] tone(int frequencyHz, int durationMs, double volume) {
        int samples = (int) (SAMPLE_RATE * durationMs / 1000);
        int fadeSamples = Math.min(samples / 2, (int) (SAMPLE_RATE * FADE_MS / 1000));
        double amplitude = Math.max(0.0, Math.min(1.0, volume)) * Short.MAX_VALUE;
        byte[] out = new byte[samples * 2];
        for (int i = 0; i < samples; i++) {
            double envelope = 1.0;
            if (i < fadeSamples) {
                envelope = (double) i / fadeSamples;
            } else if (i >= samples - fadeSamples) {
                envelope = (double) (samples - i) / fadeSamples;
            }
            short value = (short) (Math.sin(2 * Math.PI * frequencyHz * i / SAMPLE_RATE) * amplitude * envelope);
            out[2 * i] = (byte) value;
            out[2 * i + 1] = (byte) (value >> 8);
        }
        return out;
    }
}
