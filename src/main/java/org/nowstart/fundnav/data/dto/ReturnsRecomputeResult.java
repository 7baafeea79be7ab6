package org.nowstart.fundnav.data.dto;

import java.util.List;

public record ReturnsRecomputeResult(
        int computedCount,
        List<SchemeFailure> failures
) {
}
