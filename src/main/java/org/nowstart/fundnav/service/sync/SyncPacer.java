package org.nowstart.fundnav.service.sync;

import java.time.Duration;

/**
 * Waits between outbound calls so external sources are not hammered.
 */
public interface SyncPacer {

    void pause(Duration delay) throws InterruptedException;
}
