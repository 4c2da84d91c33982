package com.jonathantong.SensorRelay.supervisor;

import com.jonathantong.SensorRelay.consumer.ChangeStream;
import com.jonathantong.SensorRelay.consumer.ServerIdConflictException;
import com.jonathantong.SensorRelay.consumer.StreamFailureException;
import com.jonathantong.SensorRelay.model.ChangeEvent;
import com.jonathantong.SensorRelay.service.EntityCache;
import com.jonathantong.SensorRelay.service.ServerIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.function.Consumer;

/**
 * Keeps the binlog stream open with a bounded retry budget.
 * <p>
 * A clean end of stream resets the budget and reopens at once. A server id conflict draws a new
 * id and waits the short conflict delay; any other failure waits the longer failure delay.
 * Once {@code maxRetryAttempts} consecutive failures have been seen the run gives up and
 * returns {@link SupervisorState#GIVE_UP}.
 */
@Component
public class StreamSupervisor {

    private static final Logger logger = LoggerFactory.getLogger(StreamSupervisor.class);
    private static final Marker CRITICAL = MarkerFactory.getMarker("CRITICAL");

    private final ChangeStream changeStream;
    private final EntityCache entityCache;
    private final ServerIdentity serverIdentity;
    private final int maxRetryAttempts;
    private final long conflictDelayMs;
    private final long failureDelayMs;

    private volatile SupervisorState state = SupervisorState.INITIALIZING;
    private volatile int retryCount;
    private volatile boolean stopRequested;

    @Autowired
    public StreamSupervisor(
            ChangeStream changeStream,
            EntityCache entityCache,
            ServerIdentity serverIdentity,
            @Value("${sensorrelay.stream.max-retry-attempts:3}") int maxRetryAttempts,
            @Value("${sensorrelay.stream.conflict-delay-ms:2000}") long conflictDelayMs,
            @Value("${sensorrelay.stream.failure-delay-ms:5000}") long failureDelayMs) {
        this.changeStream = changeStream;
        this.entityCache = entityCache;
        this.serverIdentity = serverIdentity;
        this.maxRetryAttempts = maxRetryAttempts;
        this.conflictDelayMs = conflictDelayMs;
        this.failureDelayMs = failureDelayMs;
    }

    /**
     * Supervise the stream on the calling thread until the retry budget is exhausted
     * or a stop is requested
     *
     * @param emit receives every accepted change, on the calling thread
     * @return {@link SupervisorState#GIVE_UP} or {@link SupervisorState#STOPPED}
     */
    public SupervisorState run(Consumer<ChangeEvent> emit) {
        retryCount = 0;
        transition(SupervisorState.INITIALIZING);
        entityCache.load();

        boolean firstAcquisition = true;
        while (!stopRequested) {
            transition(SupervisorState.STREAMING);
            if (!firstAcquisition) {
                // Events may have been missed while disconnected
                entityCache.load();
            }
            firstAcquisition = false;

            long serverId = serverIdentity.current();
            try {
                logger.info("Starting binlog stream with server id {}", serverId);
                changeStream.run(entityCache, serverId, emit);
                retryCount = 0;
                continue;
            } catch (ServerIdConflictException e) {
                retryCount++;
                logger.warn("Server id {} is already used by another replica (attempt {}/{})",
                        e.getServerId(), retryCount, maxRetryAttempts);
                serverIdentity.regenerate();
                if (retryCount < maxRetryAttempts) {
                    backOff(conflictDelayMs);
                }
            } catch (StreamFailureException | RuntimeException e) {
                retryCount++;
                logger.error("Binlog stream failed (attempt {}/{}): {}",
                        retryCount, maxRetryAttempts, e.getMessage(), e);
                if (retryCount < maxRetryAttempts) {
                    backOff(failureDelayMs);
                }
            }

            if (retryCount >= maxRetryAttempts) {
                transition(SupervisorState.GIVE_UP);
                logger.error(CRITICAL, "Binlog listener gave up after {} consecutive failed attempts", retryCount);
                return SupervisorState.GIVE_UP;
            }
        }

        transition(SupervisorState.STOPPED);
        return SupervisorState.STOPPED;
    }

    /**
     * Ask the current run to end after the active stream returns. Interrupting the running
     * thread cuts a back-off wait short.
     */
    public void requestStop() {
        stopRequested = true;
    }

    /**
     * Clear a previous stop request so the next {@link #run} streams again
     */
    public void resume() {
        stopRequested = false;
    }

    public SupervisorState getState() {
        return state;
    }

    public int getRetryCount() {
        return retryCount;
    }

    private void backOff(long delayMs) {
        transition(SupervisorState.RETRY_BACKOFF);
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Back-off interrupted, stopping");
            stopRequested = true;
        }
    }

    private void transition(SupervisorState next) {
        if (state != next) {
            logger.debug("Supervisor {} -> {}", state, next);
            state = next;
        }
    }
}
