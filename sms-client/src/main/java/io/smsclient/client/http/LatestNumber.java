package io.smsclient.client.http;

/**
 * A phone number that recently sent or received a message, with its friendly name if one is set.
 */
public record LatestNumber(String phoneNumber, String friendlyName) {}
