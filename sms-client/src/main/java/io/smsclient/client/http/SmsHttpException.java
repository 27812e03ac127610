package io.smsclient.client.http;

import io.smsclient.transport.spi.HttpTimeoutException;

/**
 * Failure of a gateway HTTP command.
 *
 * <p>Subclasses distinguish transport failures, HTTP status failures, errors reported by the gateway
 * in its JSON envelope, and responses that do not have the expected shape.
 */
public abstract class SmsHttpException extends Exception {

    protected SmsHttpException(String message) {
        super(message);
    }

    protected SmsHttpException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * The request did not complete: connection failure, timeout or interruption.
     */
    public static class RequestFailed extends SmsHttpException {
        public RequestFailed(String message, Throwable cause) {
            super(message, cause);
        }

        public boolean isTimeout() {
            return getCause() instanceof HttpTimeoutException;
        }
    }

    /**
     * A non-JSON response with a non-2xx status.
     */
    public static class Status extends SmsHttpException {
        private final int status;
        private final String body;

        public Status(int status, String body) {
            super("HTTP " + status + ": " + body);
            this.status = status;
            this.body = body;
        }

        public int status() {
            return status;
        }

        public String body() {
            return body;
        }
    }

    /**
     * The gateway answered {@code success: false}.
     */
    public static class ApiError extends SmsHttpException {
        private final String error;

        public ApiError(String error) {
            super("API responded with success=false: " + error);
            this.error = error;
        }

        public String error() {
            return error;
        }
    }

    /**
     * A required envelope field ({@code response}, {@code type} or {@code data}) is absent.
     */
    public static class MissingField extends SmsHttpException {
        private final String field;

        public MissingField(String field) {
            super("Missing '" + field + "' field in API response");
            this.field = field;
        }

        public String field() {
            return field;
        }
    }

    /**
     * A modem response carried a different {@code type} than the route produces.
     */
    public static class TypeMismatch extends SmsHttpException {
        private final String expected;
        private final String actual;

        public TypeMismatch(String expected, String actual) {
            super("Type mismatch: expected '" + expected + "', got '" + actual + "'");
            this.expected = expected;
            this.actual = actual;
        }

        public String expected() {
            return expected;
        }

        public String actual() {
            return actual;
        }
    }

    /**
     * The body could not be encoded or decoded as JSON.
     */
    public static class Decode extends SmsHttpException {
        public Decode(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
