package io.smsclient.client.http;

/**
 * @param status 0 not charging, 1 charging, 2 no battery
 * @param charge charge percentage
 * @param voltage battery voltage in volts
 */
public record BatteryLevel(int status, int charge, float voltage) {}
