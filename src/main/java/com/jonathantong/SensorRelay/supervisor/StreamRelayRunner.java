package com.jonathantong.SensorRelay.supervisor;

import com.jonathantong.SensorRelay.broadcast.BroadcastHub;
import com.jonathantong.SensorRelay.consumer.ChangeStream;
import com.jonathantong.SensorRelay.model.ChangeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs the stream supervisor on a dedicated reader thread and relaunches it, after a delay,
 * every time it gives up. Accepted changes are handed to the fan-out executor so the reader
 * never waits on subscribers.
 */
@Component
public class StreamRelayRunner implements SmartLifecycle {

    private static final Logger logger = LoggerFactory.getLogger(StreamRelayRunner.class);

    private static final long READER_JOIN_TIMEOUT_MS = 10000;

    private final StreamSupervisor streamSupervisor;
    private final ChangeStream changeStream;
    private final BroadcastHub broadcastHub;
    private final Executor fanOutExecutor;
    private final long restartDelayMs;
    private final boolean enabled;

    private volatile boolean running;
    private Thread readerThread;

    @Autowired
    public StreamRelayRunner(
            StreamSupervisor streamSupervisor,
            ChangeStream changeStream,
            BroadcastHub broadcastHub,
            @Qualifier("fanOutExecutor") Executor fanOutExecutor,
            @Value("${sensorrelay.stream.restart-delay-ms:5000}") long restartDelayMs,
            @Value("${sensorrelay.stream.enabled:true}") boolean enabled) {
        this.streamSupervisor = streamSupervisor;
        this.changeStream = changeStream;
        this.broadcastHub = broadcastHub;
        this.fanOutExecutor = fanOutExecutor;
        this.restartDelayMs = restartDelayMs;
        this.enabled = enabled;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        if (!enabled) {
            logger.info("Binlog relay disabled by configuration");
            return;
        }

        // A previous stop() leaves both in the stopped state
        streamSupervisor.resume();
        changeStream.resume();

        running = true;
        readerThread = new Thread(this::superviseForever, "binlog-reader");
        readerThread.setDaemon(true);
        readerThread.start();
        logger.info("Binlog relay started");
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        streamSupervisor.requestStop();
        changeStream.stop();
        if (readerThread != null) {
            readerThread.interrupt();
            awaitReaderExit(readerThread);
            readerThread = null;
        }
        logger.info("Binlog relay stopped");
    }

    private void awaitReaderExit(Thread thread) {
        if (thread == Thread.currentThread()) {
            return;
        }
        try {
            thread.join(READER_JOIN_TIMEOUT_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (thread.isAlive()) {
            logger.warn("Binlog reader thread did not exit within {} ms", READER_JOIN_TIMEOUT_MS);
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    void superviseForever() {
        while (running) {
            try {
                SupervisorState outcome = streamSupervisor.run(this::emit);
                if (outcome == SupervisorState.STOPPED || !running) {
                    break;
                }
                logger.info("Binlog listener exited, restarting in {} ms", restartDelayMs);
            } catch (RuntimeException e) {
                logger.error("Binlog listener crashed, restarting in {} ms: {}", restartDelayMs, e.getMessage(), e);
            }

            try {
                Thread.sleep(restartDelayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        logger.debug("Binlog reader thread exiting");
    }

    void emit(ChangeEvent event) {
        try {
            fanOutExecutor.execute(() -> broadcastHub.publish(event));
        } catch (RejectedExecutionException e) {
            logger.warn("Fan-out rejected {}: {}", event, e.getMessage());
        }
    }
}
