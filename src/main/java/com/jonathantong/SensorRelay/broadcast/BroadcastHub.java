package com.jonathantong.SensorRelay.broadcast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jonathantong.SensorRelay.model.ChangeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of live subscribers and best-effort fan-out of change events to them.
 * A subscriber whose send fails is dropped for good.
 */
@Component
public class BroadcastHub {

    private static final Logger logger = LoggerFactory.getLogger(BroadcastHub.class);

    private final ObjectMapper objectMapper;

    private final Set<SubscriberConnection> subscribers = ConcurrentHashMap.newKeySet();

    @Autowired
    public BroadcastHub(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void subscribe(SubscriberConnection connection) {
        if (subscribers.add(connection)) {
            logger.info("Subscriber {} connected ({} active)", connection.getId(), subscribers.size());
        }
    }

    public void unsubscribe(SubscriberConnection connection) {
        if (subscribers.remove(connection)) {
            logger.info("Subscriber {} disconnected ({} active)", connection.getId(), subscribers.size());
        }
    }

    /**
     * Send an event to every subscriber registered right now
     *
     * @return the number of subscribers that received it
     */
    public int publish(ChangeEvent event) {
        String message;
        try {
            message = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            logger.error("Could not serialize {}: {}", event, e.getMessage());
            return 0;
        }

        int delivered = 0;
        List<SubscriberConnection> dead = new ArrayList<>();

        // Subscribers registered during this call are not reached
        for (SubscriberConnection connection : List.copyOf(subscribers)) {
            try {
                connection.send(message);
                delivered++;
            } catch (Exception e) {
                logger.debug("Send to subscriber {} failed: {}", connection.getId(), e.getMessage());
                dead.add(connection);
            }
        }

        for (SubscriberConnection connection : dead) {
            unsubscribe(connection);
        }

        return delivered;
    }

    public int getSubscriberCount() {
        return subscribers.size();
    }

    public boolean isSubscribed(SubscriberConnection connection) {
        return subscribers.contains(connection);
    }
}
