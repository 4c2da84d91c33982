package com.jonathantong.SensorRelay.consumer;

import com.github.shyiko.mysql.binlog.BinaryLogClient;
import com.github.shyiko.mysql.binlog.event.deserialization.EventDeserializer;
import com.jonathantong.SensorRelay.model.ConnectionDescriptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Builds binlog clients for the source database
 */
@Component
public class BinaryLogClientFactory {

    private final ConnectionDescriptor descriptor;
    private final long connectTimeoutMs;

    @Autowired
    public BinaryLogClientFactory(
            ConnectionDescriptor descriptor,
            @Value("${sensorrelay.stream.connect-timeout-ms:10000}") long connectTimeoutMs) {
        this.descriptor = descriptor;
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public BinaryLogClient create(long serverId) {
        BinaryLogClient client = new BinaryLogClient(
                descriptor.getHost(),
                descriptor.getPort(),
                descriptor.getSchema(),
                descriptor.getUsername(),
                descriptor.getPassword());

        client.setServerId(serverId);
        client.setBlocking(true);
        // Reconnection is owned by the stream supervisor
        client.setKeepAlive(false);
        client.setConnectTimeout(connectTimeoutMs);

        // Text columns arrive as raw bytes so that ValueDecoding picks the charset
        EventDeserializer eventDeserializer = new EventDeserializer();
        eventDeserializer.setCompatibilityMode(EventDeserializer.CompatibilityMode.CHAR_AND_BINARY_AS_BYTE_ARRAY);
        client.setEventDeserializer(eventDeserializer);

        return client;
    }

    public ConnectionDescriptor getDescriptor() {
        return descriptor;
    }
}
