package org.nowstart.fundnav.service.registry;

import java.util.List;

/**
 * Source of the scheme codes a sync run targets.
 */
public interface SchemeRegistry {

    /**
     * Distinct, non-blank scheme codes to sync. Any failure here is fatal for the run.
     */
    List<String> resolveTargets();

    /**
     * Records catalogue details learned from a source document. Unknown schemes are ignored.
     */
    void describe(String schemeCode, String schemeName, String category);
}
