package com.jonathantong.SensorRelay.consumer;

/**
 * The master rejected the session because another replica uses the same server id
 */
public class ServerIdConflictException extends StreamFailureException {

    private final long serverId;

    public ServerIdConflictException(long serverId, Throwable cause) {
        super("Server id " + serverId + " is already in use by another replica", cause);
        this.serverId = serverId;
    }

    public long getServerId() {
        return serverId;
    }
}
