package com.jonathantong.SensorRelay.consumer;

import com.github.shyiko.mysql.binlog.BinaryLogClient;
import com.github.shyiko.mysql.binlog.event.Event;
import com.github.shyiko.mysql.binlog.event.EventHeaderV4;
import com.github.shyiko.mysql.binlog.event.EventType;
import com.github.shyiko.mysql.binlog.event.TableMapEventData;
import com.github.shyiko.mysql.binlog.event.WriteRowsEventData;
import com.github.shyiko.mysql.binlog.network.ServerException;
import com.jonathantong.SensorRelay.model.ChangeEvent;
import com.jonathantong.SensorRelay.model.ConnectionDescriptor;
import com.jonathantong.SensorRelay.model.TableMetadata;
import com.jonathantong.SensorRelay.service.EntityCache;
import com.jonathantong.SensorRelay.service.TableSchemaService;
import com.jonathantong.SensorRelay.service.WatchedEntities;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.jdbc.core.JdbcTemplate;

import java.io.IOException;
import java.io.Serializable;
import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ChangeStreamConsumerTest {

    private static final String SCHEMA = "homeassistant";

    @Mock
    private BinaryLogClientFactory clientFactory;

    @Mock
    private TableSchemaService tableSchemaService;

    @Mock
    private BinaryLogClient client;

    private final AtomicReference<BinaryLogClient.EventListener> eventListener = new AtomicReference<>();
    private final AtomicReference<BinaryLogClient.LifecycleListener> lifecycleListener = new AtomicReference<>();

    private EntityCache entityCache;
    private ChangeStreamConsumer consumer;

    @BeforeEach
    void setUp() {
        entityCache = new EntityCache(mock(JdbcTemplate.class));
        consumer = new ChangeStreamConsumer(clientFactory, tableSchemaService,
                new WatchedEntities(new String[]{"sensor.esptemp_temperature"}), Clock.systemUTC());

        when(clientFactory.getDescriptor())
                .thenReturn(new ConnectionDescriptor("localhost", 3306, "ha", "secret", SCHEMA));
        when(clientFactory.create(anyLong())).thenReturn(client);
        when(tableSchemaService.getTableMetadata(SCHEMA, "states"))
                .thenReturn(new TableMetadata("states", List.of("state_id", "state", "last_updated_ts", "metadata_id")));
        when(tableSchemaService.getTableMetadata(SCHEMA, "states_meta"))
                .thenReturn(new TableMetadata("states_meta", List.of("metadata_id", "entity_id")));

        doAnswer(invocation -> {
            eventListener.set(invocation.getArgument(0));
            return null;
        }).when(client).registerEventListener(any());
        doAnswer(invocation -> {
            lifecycleListener.set(invocation.getArgument(0));
            return null;
        }).when(client).registerLifecycleListener(any());
    }

    @Test
    void run_shouldEmitWatchedChanges_andReturnOnCleanEnd() throws Exception {
        // Arrange
        entityCache.update(7, "sensor.esptemp_temperature");
        doAnswer(invocation -> {
            eventListener.get().onEvent(tableMap(11, "states"));
            eventListener.get().onEvent(writeRows(11, new Serializable[]{
                    1L, "21.5".getBytes(StandardCharsets.UTF_8), 1700000000.0d, 7}));
            return null;
        }).when(client).connect();
        List<ChangeEvent> emitted = new ArrayList<>();

        // Act
        consumer.run(entityCache, 1234L, emitted::add);

        // Assert
        verify(clientFactory).create(1234L);
        verify(tableSchemaService).invalidate();
        verify(client).disconnect();
        assertThat(emitted).containsExactly(
                new ChangeEvent("sensor.esptemp_temperature", "21.5", Instant.parse("2023-11-14T22:13:20Z")));
    }

    @Test
    void run_shouldRaiseConflict_whenMasterReportsDuplicateServerId() throws Exception {
        doAnswer(invocation -> {
            lifecycleListener.get().onCommunicationFailure(client, new ServerException(
                    "A slave with the same server_uuid/server_id as this slave has connected to the master",
                    4052, "HY000"));
            return null;
        }).when(client).connect();

        assertThatThrownBy(() -> consumer.run(entityCache, 77L, event -> { }))
                .isInstanceOf(ServerIdConflictException.class)
                .satisfies(e -> assertThat(((ServerIdConflictException) e).getServerId()).isEqualTo(77L));
    }

    @Test
    void run_shouldRaiseGenericFailure_whenConnectFails() throws Exception {
        doThrow(new ConnectException("Connection refused")).when(client).connect();

        assertThatThrownBy(() -> consumer.run(entityCache, 77L, event -> { }))
                .isInstanceOf(StreamFailureException.class)
                .isNotInstanceOf(ServerIdConflictException.class)
                .hasCauseInstanceOf(ConnectException.class);
    }

    @Test
    void run_shouldFailBeforeConnecting_whenTableLayoutUnavailable() throws Exception {
        when(tableSchemaService.getTableMetadata(SCHEMA, "states"))
                .thenThrow(new IllegalStateException("No column information found"));

        assertThatThrownBy(() -> consumer.run(entityCache, 77L, event -> { }))
                .isInstanceOf(StreamFailureException.class);
        verify(client, never()).connect();
    }

    @Test
    void stop_shouldPreventFurtherSessions() throws Exception {
        consumer.stop();

        consumer.run(entityCache, 77L, event -> { });

        verify(clientFactory, never()).create(eq(77L));
    }

    @Test
    void resume_shouldAllowSessionsAgain_afterStop() throws Exception {
        consumer.stop();
        consumer.resume();

        consumer.run(entityCache, 77L, event -> { });

        verify(clientFactory).create(77L);
        verify(client).connect();
    }

    @Test
    void classify_shouldRecogniseMysqlDuplicateServerIdMessage() {
        ServerException mysqlError = new ServerException(
                "A replica with the same server_uuid/server_id as this replica has connected to the source",
                1236, "HY000");

        assertThat(ChangeStreamConsumer.classify(new IOException("wrapped", mysqlError), 5L))
                .isInstanceOf(ServerIdConflictException.class);
    }

    @Test
    void classify_shouldTreatOtherServerErrorsAsGenericFailures() {
        ServerException accessDenied = new ServerException("Access denied", 1045, "28000");

        assertThat(ChangeStreamConsumer.classify(accessDenied, 5L))
                .isExactlyInstanceOf(StreamFailureException.class);
    }

    private static Event tableMap(long tableId, String table) {
        EventHeaderV4 header = new EventHeaderV4();
        header.setEventType(EventType.TABLE_MAP);
        TableMapEventData data = new TableMapEventData();
        data.setTableId(tableId);
        data.setDatabase(SCHEMA);
        data.setTable(table);
        return new Event(header, data);
    }

    private static Event writeRows(long tableId, Serializable[] row) {
        EventHeaderV4 header = new EventHeaderV4();
        header.setEventType(EventType.EXT_WRITE_ROWS);
        WriteRowsEventData data = new WriteRowsEventData();
        data.setTableId(tableId);
        BitSet included = new BitSet();
        included.set(0, row.length);
        data.setIncludedColumns(included);
        List<Serializable[]> rows = new ArrayList<>();
        rows.add(row);
        data.setRows(rows);
        return new Event(header, data);
    }
}
