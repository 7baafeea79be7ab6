package org.nowstart.fundnav.data.dto;

import org.nowstart.fundnav.data.type.SyncErrorKind;

public record SchemeFailure(
        String schemeCode,
        SyncErrorKind errorKind,
        String message
) {
}
