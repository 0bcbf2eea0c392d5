package com.phillippitts.radflow.service.dictation;

/**
 * Audio feedback for recording state changes. Implementations return immediately.
 */
public interface FeedbackCues {

    void recordingStarted();

    void recordingStopped();
}
