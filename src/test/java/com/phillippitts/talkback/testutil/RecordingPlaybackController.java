package com.phillippitts.talkback.testutil;

import com.phillippitts.talkback.service.playback.PlaybackController;

import java.util.concurrent.atomic.AtomicInteger;

/** Counts stop requests. */
public class RecordingPlaybackController implements PlaybackController {
    private final AtomicInteger stops = new AtomicInteger();

    @Override
    public void stopImmediately() {
        stops.incrementAndGet();
    }

    public int stopCount() {
        return stops.get();
    }
}
