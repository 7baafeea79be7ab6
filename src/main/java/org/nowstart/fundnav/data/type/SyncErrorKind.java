package org.nowstart.fundnav.data.type;

public enum SyncErrorKind {
    TRANSIENT_FETCH,
    NO_VALID_RECORDS,
    PERSISTENCE,
    COMPUTATION,
    STOPPED,
    FATAL
}
