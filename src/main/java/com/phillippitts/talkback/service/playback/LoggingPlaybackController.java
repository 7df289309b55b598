package com.phillippitts.talkback.service.playback;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Default {@link PlaybackController} used when no playback integration is configured.
 * Only logs the request.
 */
public class LoggingPlaybackController implements PlaybackController {

    private static final Logger LOG = LogManager.getLogger(LoggingPlaybackController.class);

    @Override
    public void stopImmediately() {
        LOG.info("Stop requested; no playback integration configured");
    }
}
