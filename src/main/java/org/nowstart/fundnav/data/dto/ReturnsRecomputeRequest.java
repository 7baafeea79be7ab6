package org.nowstart.fundnav.data.dto;

import jakarta.validation.constraints.NotEmpty;
import java.util.List;

public record ReturnsRecomputeRequest(
        @NotEmpty(message = "schemeCodes is required") List<String> schemeCodes
) {
}
