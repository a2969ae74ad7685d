package com.meshlink.room.application.impl;

import com.meshlink.room.application.ConnectionFactory;
import com.meshlink.room.application.MeshRoom;
import com.meshlink.room.application.RoomService;
import com.meshlink.room.core.dto.RoomMessage;
import com.meshlink.room.core.dto.RoomMessageType;
import com.meshlink.room.core.event.RoomMessageListener;
import com.meshlink.room.core.exception.RoomNotFoundException;
import com.meshlink.room.core.model.IceConfig;
import com.meshlink.room.core.model.MediaStream;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Yerel eşin oda üyelikleri.
 * - Aynı ada ikinci join açık odayı döner (idempotent), JOIN tekrar gönderilmez.
 * - Oda kapanınca kayıttan düşer; aynı adla yeniden join yeni oda oluşturur.
 */
@Service
public class RoomServiceImpl implements RoomService {

    private static final Logger log = LoggerFactory.getLogger(RoomServiceImpl.class);

    private final ObjectProvider<ConnectionFactory> connectionFactory;
    private final RoomMessageListener messageListener;
    private final IceConfig iceConfig;
    private final String localPeerId;
    private final Map<String, MeshRoom> rooms = new ConcurrentHashMap<>();

    public RoomServiceImpl(ObjectProvider<ConnectionFactory> connectionFactory,
                           RoomMessageListener messageListener,
                           IceConfig iceConfig,
                           @Value("${app.peer.id}") String localPeerId) {
        this.connectionFactory = connectionFactory;
        this.messageListener = messageListener;
        this.iceConfig = iceConfig;
        this.localPeerId = localPeerId;
    }

    @Override
    public MeshRoom joinRoom(String roomName) {
        return joinRoom(roomName, null);
    }

    @Override
    public MeshRoom joinRoom(String roomName, MediaStream stream) {
        if (roomName == null || roomName.isBlank()) {
            throw new IllegalArgumentException("roomName must not be blank");
        }

        MeshRoom existing = rooms.get(roomName);
        if (existing != null && !existing.isClosed()) {
            log.debug("joinRoom: already joined (room={})", roomName);
            return existing;
        }

        ConnectionFactory factory = connectionFactory.getIfAvailable();
        if (factory == null) {
            throw new IllegalStateException("No ConnectionFactory bean configured");
        }

        MeshRoom room = new MeshRoom(roomName, localPeerId, stream, iceConfig, factory, messageListener);
        rooms.put(roomName, room);
        messageListener.onMessage(RoomMessage.of(RoomMessageType.JOIN, roomName));
        log.info("Joined room '{}' as peer '{}'", roomName, localPeerId);
        return room;
    }

    @Override
    public Optional<MeshRoom> getRoom(String roomName) {
        MeshRoom room = rooms.get(roomName);
        return room == null || room.isClosed() ? Optional.empty() : Optional.of(room);
    }

    @Override
    public MeshRoom requireRoom(String roomName) {
        return getRoom(roomName).orElseThrow(() -> new RoomNotFoundException(roomName));
    }

    @Override
    public void leaveRoom(String roomName) {
        MeshRoom room = rooms.remove(roomName);
        if (room == null) return; // oda yoksa yapılacak iş yok
        room.close();
    }

    @Override
    public List<String> listRoomNames() {
        return rooms.values().stream()
                .filter(r -> !r.isClosed())
                .map(MeshRoom::getName)
                .sorted()
                .collect(Collectors.toList());
    }

    @Override
    @PreDestroy
    public void closeAll() {
        for (String name : List.copyOf(rooms.keySet())) {
            leaveRoom(name);
        }
    }

    @Override
    public String getLocalPeerId() { return localPeerId; }
}
