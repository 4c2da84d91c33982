package com.jonathantong.SensorRelay.consumer;

/**
 * A binlog session ended with an error. The stream supervisor decides whether to retry.
 */
public class StreamFailureException extends Exception {

    public StreamFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
