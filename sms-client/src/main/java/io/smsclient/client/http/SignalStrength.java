package io.smsclient.client.http;

/**
 * @param rssi received signal strength indicator, 0..31 or 99 when unknown
 * @param ber bit error rate, 0..7 or 99 when unknown
 */
public record SignalStrength(int rssi, int ber) {}
