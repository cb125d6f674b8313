package com.justtrades.exception;

/**
 * Transport-level broker failure (timeout, connection reset, 5xx). The outcome of
 * the call is unknown, so only read-only queries are retried on it.
 */
public class BrokerException extends BaseException {

    public BrokerException(String message) {
        super(ErrorCode.BROKER_ERROR, message);
    }

    public BrokerException(String message, Throwable cause) {
        super(ErrorCode.BROKER_ERROR, message, cause);
    }
}
