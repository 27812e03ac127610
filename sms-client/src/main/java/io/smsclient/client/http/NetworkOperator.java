package io.smsclient.client.http;

/**
 * @param status operator selection mode (0 automatic, 1 manual)
 * @param format format of {@code operator} (0 long name, 1 short name, 2 numeric)
 * @param operator the operator name or code
 */
public record NetworkOperator(int status, int format, String operator) {}
