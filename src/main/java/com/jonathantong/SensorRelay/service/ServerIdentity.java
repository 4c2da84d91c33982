package com.jonathantong.SensorRelay.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Server id presented to the replication master. It has to be unique among all replicas
 * of the database; a new random one is drawn whenever the master reports a duplicate.
 */
@Component
public class ServerIdentity {

    private static final Logger logger = LoggerFactory.getLogger(ServerIdentity.class);

    private final long minId;
    private final long maxId;
    private final AtomicLong current;

    @Autowired
    public ServerIdentity(
            @Value("${sensorrelay.stream.server-id:0}") long configuredId,
            @Value("${sensorrelay.stream.server-id-min:100}") long minId,
            @Value("${sensorrelay.stream.server-id-max:65535}") long maxId) {
        if (minId < 1 || maxId < minId) {
            throw new IllegalArgumentException("Invalid server id range [" + minId + ", " + maxId + "]");
        }
        this.minId = minId;
        this.maxId = maxId;
        this.current = new AtomicLong(configuredId > 0 ? configuredId : randomId());
    }

    public long current() {
        return current.get();
    }

    /**
     * Draw a new id. Only the next stream acquisition sees it.
     */
    public long regenerate() {
        long next = randomId();
        long previous = current.getAndSet(next);
        logger.info("Server id regenerated: {} -> {}", previous, next);
        return next;
    }

    private long randomId() {
        return ThreadLocalRandom.current().nextLong(minId, maxId + 1);
    }
}
