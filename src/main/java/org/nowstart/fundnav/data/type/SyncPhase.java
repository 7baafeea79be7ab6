package org.nowstart.fundnav.data.type;

public enum SyncPhase {
    PENDING,
    FETCHING,
    PERSISTING,
    COMPUTING,
    COMPLETED,
    PARTIALLY_FAILED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == PARTIALLY_FAILED || this == FAILED;
    }
}
