package com.meshlink.room.application;

import com.meshlink.room.core.dto.RoomMessage;
import com.meshlink.room.core.dto.RoomMessageType;
import com.meshlink.room.transport.udp.UdpMessenger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class KeepAliveTest {

    private RoomService roomService;
    private UdpMessenger messenger;
    private KeepAlive keepAlive;

    @BeforeEach
    void setUp() {
        roomService = mock(RoomService.class);
        messenger = mock(UdpMessenger.class);
        when(roomService.listRoomNames()).thenReturn(List.of("R"));
        when(messenger.isReady()).thenReturn(true);
        keepAlive = new KeepAlive(roomService, messenger);
        keepAlive.setEnabled(true);
        keepAlive.setMaxMissed(2);
    }

    private List<RoomMessageType> sentTypes() {
        ArgumentCaptor<RoomMessage> captor = ArgumentCaptor.forClass(RoomMessage.class);
        verify(messenger, atLeastOnce()).onMessage(captor.capture());
        return captor.getAllValues().stream().map(RoomMessage::getType).toList();
    }

    @Test
    void pingsEveryOpenRoom() {
        keepAlive.pingAll();

        assertThat(sentTypes()).containsExactly(RoomMessageType.PING);
        assertThat(keepAlive.missed("R")).isEqualTo(1);
    }

    @Test
    void pongResetsMissedCounter() {
        keepAlive.pingAll();
        keepAlive.onPong("R");
        keepAlive.pingAll();

        assertThat(sentTypes()).doesNotContain(RoomMessageType.JOIN);
        assertThat(keepAlive.missed("R")).isEqualTo(1);
    }

    @Test
    void rejoinsAfterTooManyMissedPongs() {
        keepAlive.pingAll();
        keepAlive.pingAll();

        assertThat(sentTypes()).containsExactly(RoomMessageType.PING, RoomMessageType.PING, RoomMessageType.JOIN);
        assertThat(keepAlive.missed("R")).isZero();
    }

    @Test
    void doesNothingWhenChannelNotReady() {
        when(messenger.isReady()).thenReturn(false);

        keepAlive.pingAll();

        verify(messenger, never()).onMessage(any());
    }

    @Test
    void doesNothingWhenDisabled() {
        keepAlive.setEnabled(false);

        keepAlive.pingAll();

        verify(messenger, never()).onMessage(any());
    }

    @Test
    void forgetsCountersOfRoomsLeftBetweenPings() {
        when(roomService.listRoomNames()).thenReturn(List.of("R", "S"));
        keepAlive.pingAll();
        assertThat(keepAlive.trackedRooms()).isEqualTo(2);

        when(roomService.listRoomNames()).thenReturn(List.of("R"));
        keepAlive.pingAll();

        assertThat(keepAlive.missed("S")).isZero();
        assertThat(keepAlive.trackedRooms()).isEqualTo(1);
    }
}
