package org.nowstart.fundnav.data.type;

public enum SourceMode {
    BULK,
    PER_SCHEME
}
