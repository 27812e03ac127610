package io.smsclient.core;

/**
 * An unsolicited GNSS position report pushed by the gateway.
 *
 * <p>Optional numeric fields are {@code null} when the receiver has no value for them.
 */
public record GnssPositionReport(
        boolean runStatus,
        boolean fixStatus,
        String utcTime,
        Double latitude,
        Double longitude,
        Double mslAltitude,
        Float groundSpeed,
        Float groundCourse,
        String fixMode,
        Float hdop,
        Float pdop,
        Float vdop,
        Integer gpsInView,
        Integer gnssUsed,
        Integer glonassInView
) {

    public GnssFixStatus fixModeStatus() {
        return GnssFixStatus.fromWire(fixMode);
    }
}
