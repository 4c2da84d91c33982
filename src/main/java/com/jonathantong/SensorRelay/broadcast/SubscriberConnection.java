package com.jonathantong.SensorRelay.broadcast;

import java.io.IOException;

/**
 * A live channel to one subscriber
 */
public interface SubscriberConnection {

    String getId();

    /**
     * Deliver one text message. Any exception means the subscriber is gone.
     */
    void send(String message) throws IOException;
}
