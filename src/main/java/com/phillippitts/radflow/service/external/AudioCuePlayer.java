package com.phillippitts.radflow.service.external;

/**
 * Plays a short feedback tone. Implementations block for the tone's duration.
 */
public interface AudioCuePlayer {

    void play(int frequencyHz, int durationMs, double volume);
}
