package io.smsclient.core;

/**
 * Connection state of the gateway's modem, as reported in modem status updates.
 */
public enum ModemState {
    STARTUP("Startup"),
    ONLINE("Online"),
    SHUTTING_DOWN("ShuttingDown"),
    OFFLINE("Offline");

    private final String wireName;

    ModemState(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Maps the gateway's wire name to a state.
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public static ModemState fromWire(String name) {
        for (ModemState s : values()) {
            if (s.wireName.equals(name)) return s;
        }
        throw new IllegalArgumentException("unknown modem state: " + name);
    }
}
