package io.smsclient.core;

/**
 * GNSS fix status reported with a position report.
 */
public enum GnssFixStatus {
    UNKNOWN("Unknown"),
    NOT_FIX("NotFix"),
    FIX_2D("Fix2D"),
    FIX_3D("Fix3D");

    private final String wireName;

    GnssFixStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Unknown or missing names map to {@link #UNKNOWN}. */
    public static GnssFixStatus fromWire(String name) {
        for (GnssFixStatus s : values()) {
            if (s.wireName.equals(name)) return s;
        }
        return UNKNOWN;
    }
}
