package org.nowstart.fundnav.service.source;

import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.fundnav.data.dto.MfApiSchemeResponse;
import org.nowstart.fundnav.data.exception.NavSourceException;
import org.nowstart.fundnav.data.property.NavSyncProperties;
import org.nowstart.fundnav.repository.AmfiFeignClient;
import org.nowstart.fundnav.repository.MfApiFeignClient;
import org.nowstart.fundnav.service.sync.SyncPacer;
import org.springframework.stereotype.Service;

/**
 * Fetches raw NAV documents from the external sources, retrying each call up to
 * {@code fetchAttempts} times with a fixed backoff.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NavSourceService {

    private static final String BULK_FEED = "bulk";

    private final AmfiFeignClient amfiFeignClient;
    private final MfApiFeignClient mfApiFeignClient;
    private final NavSyncProperties navSyncProperties;
    private final SyncPacer syncPacer;

    public String fetchBulkFeed() {
        return withRetry(BULK_FEED, () -> {
            String body = amfiFeignClient.getNavAll();
            if (body == null || body.isBlank()) {
                throw new NavSourceException(null, "Bulk NAV feed was empty");
            }
            return body;
        });
    }

    public MfApiSchemeResponse fetchScheme(String schemeCode) {
        return withRetry(schemeCode, () -> {
            MfApiSchemeResponse response = mfApiFeignClient.getScheme(schemeCode);
            if (response == null) {
                throw new NavSourceException(schemeCode, "Scheme document was empty");
            }
            if (!response.isSuccess()) {
                throw new NavSourceException(schemeCode, "Scheme document status=" + response.status());
            }
            return response;
        });
    }

    private <T> T withRetry(String target, Supplier<T> call) {
        int attempts = Math.max(1, navSyncProperties.fetchAttempts());
        RuntimeException lastFailure = null;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return call.get();
            } catch (RuntimeException e) {
                lastFailure = e;
                log.warn("NAV source call failed. target={} attempt={}/{} reason={}", target, attempt, attempts, e.getMessage());
            }

            if (attempt < attempts) {
                try {
                    syncPacer.pause(navSyncProperties.retryBackoff());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new NavSourceException(schemeCodeOf(target), "Interrupted while waiting to retry", e);
                }
            }
        }

        throw new NavSourceException(
                schemeCodeOf(target),
                "Fetch failed after " + attempts + " attempts: " + lastFailure.getMessage(),
                lastFailure
        );
    }

    private String schemeCodeOf(String target) {
        return BULK_FEED.equals(target) ? null : target;
    }
}
