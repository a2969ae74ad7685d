package com.meshlink.room.application;

import com.meshlink.room.core.dto.RoomMessage;
import com.meshlink.room.core.dto.RoomMessageType;
import com.meshlink.room.transport.udp.UdpMessenger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Açık her oda için relay'e periyodik PING.
 * maxMissed kadar PONG gelmezse relay üyeliği unutmuş sayılır ve JOIN yeniden gönderilir.
 */
@Component
public class KeepAlive {

    private static final Logger log = LoggerFactory.getLogger(KeepAlive.class);

    private final RoomService roomService;
    private final UdpMessenger messenger;
    private final ProbeTracker tracker = new ProbeTracker();

    @Value("${app.keepalive.enabled:true}") private boolean enabled;
    @Value("${app.keepalive.maxMissed:3}") private int maxMissed;

    public KeepAlive(RoomService roomService, UdpMessenger messenger) {
        this.roomService = roomService;
        this.messenger = messenger;
    }

    @Scheduled(fixedDelayString = "${app.keepalive.intervalMs:25000}")
    public void pingAll() {
        if (!enabled || !messenger.isReady()) return;

        List<String> roomNames = roomService.listRoomNames();
        // ping'ler arasında bırakılan odalar
        tracker.retainOnly(roomNames);

        for (String roomName : roomNames) {
            messenger.onMessage(RoomMessage.of(RoomMessageType.PING, roomName));
            tracker.onProbeSent(roomName);

            if (tracker.shouldRejoin(roomName, maxMissed)) {
                log.warn("No PONG from relay for room '{}' after {} pings, re-sending JOIN", roomName, maxMissed);
                messenger.onMessage(RoomMessage.of(RoomMessageType.JOIN, roomName));
                tracker.clear(roomName);
            }
        }
    }

    /** Handler PONG gördüğünde burayı çağırır. */
    public void onPong(String roomName) {
        tracker.onPong(roomName);
    }

    int missed(String roomName) { return tracker.missed(roomName); }
    int trackedRooms() { return tracker.size(); }

    void setEnabled(boolean enabled) { this.enabled = enabled; }
    void setMaxMissed(int maxMissed) { this.maxMissed = maxMissed; }
}
