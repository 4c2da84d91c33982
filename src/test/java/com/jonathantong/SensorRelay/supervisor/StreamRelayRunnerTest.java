package com.jonathantong.SensorRelay.supervisor;

import com.jonathantong.SensorRelay.broadcast.BroadcastHub;
import com.jonathantong.SensorRelay.consumer.ChangeStream;
import com.jonathantong.SensorRelay.model.ChangeEvent;
import com.jonathantong.SensorRelay.service.EntityCache;
import com.jonathantong.SensorRelay.service.ServerIdentity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StreamRelayRunnerTest {

    private static final ChangeEvent EVENT =
            new ChangeEvent("sensor.esptemp_temperature", "21.5", Instant.ofEpochSecond(1700000000L));

    @Mock
    private StreamSupervisor streamSupervisor;

    @Mock
    private ChangeStream changeStream;

    @Mock
    private BroadcastHub broadcastHub;

    @Mock
    private Executor fanOutExecutor;

    @Mock
    private EntityCache entityCache;

    @Mock
    private ServerIdentity serverIdentity;

    @Test
    void emit_shouldHandEventToFanOutExecutor() {
        // Arrange
        StreamRelayRunner runner = runner(true);
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);

        // Act
        runner.emit(EVENT);

        // Assert
        verify(fanOutExecutor).execute(task.capture());
        verify(broadcastHub, never()).publish(any());
        task.getValue().run();
        verify(broadcastHub).publish(EVENT);
    }

    @Test
    void emit_shouldSurviveRejectedFanOut() {
        StreamRelayRunner runner = runner(true);
        doThrow(new RejectedExecutionException("shut down")).when(fanOutExecutor).execute(any());

        assertThatCode(() -> runner.emit(EVENT)).doesNotThrowAnyException();
    }

    @Test
    void start_shouldRelaunchSupervisorAfterGiveUp() {
        // Arrange
        when(streamSupervisor.run(any()))
                .thenReturn(SupervisorState.GIVE_UP, SupervisorState.GIVE_UP, SupervisorState.STOPPED);
        StreamRelayRunner runner = runner(true);

        // Act
        runner.start();

        // Assert
        verify(streamSupervisor, timeout(2000).times(3)).run(any());
        runner.stop();
    }

    @Test
    void stop_shouldStopSupervisorAndCloseStream() {
        // the reader thread may or may not reach the supervisor before stop()
        lenient().when(streamSupervisor.run(any())).thenReturn(SupervisorState.STOPPED);
        StreamRelayRunner runner = runner(true);
        runner.start();
        assertThat(runner.isRunning()).isTrue();

        runner.stop();

        assertThat(runner.isRunning()).isFalse();
        verify(streamSupervisor).requestStop();
        verify(changeStream).stop();
    }

    @Test
    void start_shouldStreamAgain_afterStop() throws Exception {
        // Arrange
        StreamSupervisor supervisor = new StreamSupervisor(changeStream, entityCache, serverIdentity, 3, 0, 0);
        doAnswer(invocation -> {
            Thread.sleep(10);
            return null;
        }).when(changeStream).run(any(), anyLong(), any());
        StreamRelayRunner runner = new StreamRelayRunner(supervisor, changeStream, broadcastHub, fanOutExecutor, 0, true);

        runner.start();
        verify(changeStream, timeout(2000).atLeastOnce()).run(any(), anyLong(), any());
        runner.stop();
        clearInvocations(changeStream);

        // Act
        runner.start();

        // Assert
        verify(changeStream).resume();
        verify(changeStream, timeout(2000).atLeastOnce()).run(any(), anyLong(), any());
        assertThat(supervisor.getState()).isNotEqualTo(SupervisorState.STOPPED);
        assertThat(runner.isRunning()).isTrue();
        runner.stop();
    }

    @Test
    void start_shouldResumeSupervisorAndStream() {
        lenient().when(streamSupervisor.run(any())).thenReturn(SupervisorState.STOPPED);
        StreamRelayRunner runner = runner(true);

        runner.start();
        runner.stop();
        runner.start();
        runner.stop();

        verify(streamSupervisor, times(2)).resume();
        verify(changeStream, times(2)).resume();
    }

    @Test
    void start_shouldDoNothing_whenDisabled() {
        StreamRelayRunner runner = runner(false);

        runner.start();

        assertThat(runner.isRunning()).isFalse();
        verifyNoInteractions(streamSupervisor, changeStream);
        runner.stop();
        verify(changeStream, times(0)).stop();
    }

    private StreamRelayRunner runner(boolean enabled) {
        return new StreamRelayRunner(streamSupervisor, changeStream, broadcastHub, fanOutExecutor, 0, enabled);
    }
}
