package org.nowstart.fundnav.service.sync;

import java.time.Duration;
import org.springframework.stereotype.Component;

@Component
public class SleepingSyncPacer implements SyncPacer {

    @Override
    public void pause(Duration delay) throws InterruptedException {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return;
        }
        Thread.sleep(delay.toMillis());
    }
}
