package com.meshlink.room;

import com.meshlink.room.application.ConnectionFactory;
import com.meshlink.room.application.MeshRoom;
import com.meshlink.room.application.RoomService;
import com.meshlink.room.core.model.IceConfig;
import com.meshlink.room.transport.udp.SignalingClient;
import com.meshlink.room.transport.udp.UdpMessenger;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

@SpringBootTest(properties = {
        "app.peer.id=A",
        "app.signaling.enabled=false",
        "app.keepalive.enabled=false",
        "app.ice.servers=stun:one.example.com, stun:two.example.com"
})
class MeshLinkApplicationTests {

    @TestConfiguration
    static class Factories {
        @Bean
        ConnectionFactory connectionFactory() {
            return mock(ConnectionFactory.class);
        }
    }

    @Autowired private RoomService roomService;
    @Autowired private IceConfig iceConfig;
    @Autowired private SignalingClient signalingClient;
    @Autowired private UdpMessenger messenger;

    @Test
    void contextWiresRoomServiceWithConfiguredIceServers() {
        assertThat(iceConfig.getIceServers()).containsExactly("stun:one.example.com", "stun:two.example.com");
        assertThat(signalingClient.isRunning()).isFalse();
        assertThat(messenger.isReady()).isFalse();

        MeshRoom room = roomService.joinRoom("R");

        assertThat(room.getPeerId()).isEqualTo("A");
        assertThat(room.getIceConfig()).isSameAs(iceConfig);
        assertThat(roomService.listRoomNames()).containsExactly("R");

        // istemci başlamadığında iş çağıranın iş parçacığında çalışır
        signalingClient.submit(room::close);
        assertThat(room.isClosed()).isTrue();
    }
}
