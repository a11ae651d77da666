package com.netlink.osp.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.netlink.osp.splice.SpliceType;

import lombok.Data;

/**
 * Per-session technician defaults. Passed explicitly into the operations that
 * use them rather than read from shared state.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SessionPreferences {
    private String technicianName = "";
    private Long lastProjectId;
    private SpliceType defaultSpliceType = SpliceType.FUSION;
    private int defaultCableCount = 144;
    private boolean showHelpTooltips = true;

    public static SessionPreferences defaults() {
        return new SessionPreferences();
    }

    public static SessionPreferences forTechnician(String name) {
        SessionPreferences p = new SessionPreferences();
        p.setTechnicianName(name);
        return p;
    }

    /** {@code requested} when non-blank, otherwise this session's technician. */
    public String technicianOr(String requested) {
        return requested != null && !requested.isBlank() ? requested : technicianName;
    }

    public SpliceType spliceTypeOr(SpliceType requested) {
        return requested != null ? requested : defaultSpliceType;
    }
}
