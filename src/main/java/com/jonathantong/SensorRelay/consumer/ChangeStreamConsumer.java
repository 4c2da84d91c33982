package com.jonathantong.SensorRelay.consumer;

import com.github.shyiko.mysql.binlog.BinaryLogClient;
import com.github.shyiko.mysql.binlog.network.ServerException;
import com.jonathantong.SensorRelay.model.ChangeEvent;
import com.jonathantong.SensorRelay.model.ConnectionDescriptor;
import com.jonathantong.SensorRelay.model.TableMetadata;
import com.jonathantong.SensorRelay.service.EntityCache;
import com.jonathantong.SensorRelay.service.TableSchemaService;
import com.jonathantong.SensorRelay.service.WatchedEntities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Binlog consumer for the Home Assistant states and states_meta tables.
 * Each {@link #run} call is one replication session on the calling thread.
 */
@Component
public class ChangeStreamConsumer implements ChangeStream {

    private static final Logger logger = LoggerFactory.getLogger(ChangeStreamConsumer.class);

    // MariaDB ER_SLAVE_SAME_ID
    static final int SAME_SERVER_ID_ERROR = 4052;
    // MySQL reports the same condition as ER_MASTER_FATAL_ERROR_READING_BINLOG with this message
    static final String SAME_SERVER_ID_MESSAGE = "same server_uuid/server_id";

    private final BinaryLogClientFactory clientFactory;
    private final TableSchemaService tableSchemaService;
    private final WatchedEntities watchedEntities;
    private final Clock clock;

    private final AtomicReference<BinaryLogClient> activeClient = new AtomicReference<>();
    private volatile boolean stopped;

    @Autowired
    public ChangeStreamConsumer(
            BinaryLogClientFactory clientFactory,
            TableSchemaService tableSchemaService,
            WatchedEntities watchedEntities,
            Clock clock) {
        this.clientFactory = clientFactory;
        this.tableSchemaService = tableSchemaService;
        this.watchedEntities = watchedEntities;
        this.clock = clock;
    }

    @Override
    public void run(EntityCache cache, long serverId, Consumer<ChangeEvent> emit) throws StreamFailureException {
        if (stopped) {
            return;
        }

        ConnectionDescriptor descriptor = clientFactory.getDescriptor();
        // A reconnect may follow a schema migration
        tableSchemaService.invalidate();
        RowEventProcessor processor = new RowEventProcessor(
                descriptor.getSchema(),
                tableLayout(descriptor.getSchema(), RowEventProcessor.STATES_TABLE),
                tableLayout(descriptor.getSchema(), RowEventProcessor.STATES_META_TABLE),
                cache,
                watchedEntities,
                clock,
                emit);

        BinaryLogClient client = clientFactory.create(serverId);
        AtomicReference<Exception> failure = new AtomicReference<>();

        client.registerEventListener(processor::onEvent);
        client.registerLifecycleListener(new BinaryLogClient.AbstractLifecycleListener() {
            @Override
            public void onCommunicationFailure(BinaryLogClient binaryLogClient, Exception ex) {
                failure.compareAndSet(null, ex);
            }

            @Override
            public void onEventDeserializationFailure(BinaryLogClient binaryLogClient, Exception ex) {
                logger.warn("Skipping undecodable binlog event: {}", ex.getMessage());
            }
        });

        activeClient.set(client);
        logger.info("Opening binlog stream on {}:{} with server id {}",
                descriptor.getHost(), descriptor.getPort(), serverId);

        try {
            if (!stopped) {
                // Blocks until the session ends
                client.connect();
            }
        } catch (IOException | RuntimeException e) {
            failure.compareAndSet(null, e);
        } finally {
            activeClient.compareAndSet(client, null);
            disconnect(client);
        }

        Exception cause = failure.get();
        if (cause != null && !stopped) {
            throw classify(cause, serverId);
        }

        logger.info("Binlog stream with server id {} ended", serverId);
    }

    @Override
    public void stop() {
        stopped = true;
        BinaryLogClient client = activeClient.getAndSet(null);
        if (client != null) {
            logger.info("Closing active binlog stream");
            disconnect(client);
        }
    }

    @Override
    public void resume() {
        stopped = false;
    }

    private TableMetadata tableLayout(String schema, String table) throws StreamFailureException {
        try {
            return tableSchemaService.getTableMetadata(schema, table);
        } catch (RuntimeException e) {
            throw new StreamFailureException("Could not read the layout of table " + table, e);
        }
    }

    private void disconnect(BinaryLogClient client) {
        try {
            client.disconnect();
        } catch (IOException e) {
            logger.warn("Error while closing the binlog stream: {}", e.getMessage());
        }
    }

    /**
     * Tell a server id collision apart from every other session failure
     */
    static StreamFailureException classify(Throwable cause, long serverId) {
        for (Throwable t = cause; t != null; t = t.getCause()) {
            if (t instanceof ServerException && isServerIdConflict((ServerException) t)) {
                return new ServerIdConflictException(serverId, cause);
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return new StreamFailureException("Binlog stream failed: " + cause.getMessage(), cause);
    }

    private static boolean isServerIdConflict(ServerException e) {
        if (e.getErrorCode() == SAME_SERVER_ID_ERROR) {
            return true;
        }
        String message = e.getMessage();
        return message != null && message.contains(SAME_SERVER_ID_MESSAGE);
    }
}
