package org.nowstart.fundnav.data.property;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import org.nowstart.fundnav.data.type.SourceMode;

public final class NavSyncPropertiesFixture {

    private NavSyncPropertiesFixture() {
    }

    public static NavSyncProperties defaults() {
        return with(SourceMode.PER_SCHEME, 20, 2, List.of(), false);
    }

    public static NavSyncProperties with(
            SourceMode sourceMode,
            int batchSize,
            int fetchAttempts,
            List<String> seedSchemeCodes,
            boolean registerUnknownSchemes
    ) {
        return new NavSyncProperties(
                "https://amfi.test",
                "https://mfapi.test",
                "fundnav-test/1.0",
                sourceMode,
                batchSize,
                2,
                Duration.ofMillis(500),
                fetchAttempts,
                Duration.ofSeconds(1),
                4000,
                ZoneId.of("Asia/Kolkata"),
                seedSchemeCodes,
                registerUnknownSchemes,
                new BigDecimal("6.0")
        );
    }
}
