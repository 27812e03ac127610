package io.smsclient.core;

/**
 * SMS gateway protocol constants (routes, query keys, header names, JSON envelope keys and event tags).
 *
 * <p>This module intentionally contains no HTTP or WebSocket bindings.
 * It only models protocol-level concerns shared by the event and request channels.
 */
public final class Protocol {
    private Protocol() {}

    // Query parameter keys
    public static final String Q_EVENTS = "events";

    // Sent verbatim, no scheme prefix
    public static final String H_AUTHORIZATION = "authorization";

    // Database routes
    public static final String R_FRIENDLY_NAME_SET = "/db/friendly-names/set";
    public static final String R_FRIENDLY_NAME_GET = "/db/friendly-names/get";
    public static final String R_MESSAGES = "/db/sms";
    public static final String R_LATEST_NUMBERS = "/db/latest-numbers";
    public static final String R_DELIVERY_REPORTS = "/db/delivery-reports";

    // Modem routes
    public static final String R_SEND_SMS = "/sms/send";
    public static final String R_MODEM_PREFIX = "/sms/";

    // System routes
    public static final String R_PHONE_NUMBER = "/sys/phone-number";
    public static final String R_VERSION = "/sys/version";

    // JSON envelope keys (as JSON pointers)
    public static final String P_SUCCESS = "/success";
    public static final String P_ERROR = "/error";
    public static final String P_RESPONSE = "/response";
    public static final String P_RESPONSE_TYPE = "/response/type";
    public static final String P_RESPONSE_DATA = "/response/data";
    public static final String P_TYPE = "/type";
    public static final String P_DATA = "/data";

    // Event channel message tags
    public static final String EV_INCOMING = "incoming";
    public static final String EV_OUTGOING = "outgoing";
    public static final String EV_DELIVERY = "delivery";
    public static final String EV_MODEM_STATUS = "modem_status_update";
    public static final String EV_GNSS_POSITION = "gnss_position_report";

    /** Default page size used when a paginator is created without an explicit limit. */
    public static final long DEFAULT_PAGE_SIZE = 50;
}
