package com.jonathantong.SensorRelay.consumer;

import com.jonathantong.SensorRelay.model.ChangeEvent;
import com.jonathantong.SensorRelay.service.EntityCache;

import java.util.function.Consumer;

/**
 * A blocking source of accepted entity changes
 */
public interface ChangeStream {

    /**
     * Open one streaming session and process it until it ends.
     *
     * @param cache    metadata cache, read and updated while streaming
     * @param serverId replication server id for this session
     * @param emit     called once per accepted change, on the reading thread
     * @throws ServerIdConflictException when the server id is already taken
     * @throws StreamFailureException    on any other session failure
     */
    void run(EntityCache cache, long serverId, Consumer<ChangeEvent> emit) throws StreamFailureException;

    /**
     * Close the active session, if any, and refuse new ones
     */
    void stop();

    /**
     * Accept new sessions again after {@link #stop()}
     */
    void resume();
}
