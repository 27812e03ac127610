package io.smsclient.client.http;

/**
 * @param registration registration status (0 not registered, 1 home network, 5 roaming)
 * @param technology access technology in use
 */
public record NetworkStatus(int registration, int technology) {}
