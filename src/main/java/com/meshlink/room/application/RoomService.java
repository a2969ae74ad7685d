package com.meshlink.room.application;

import com.meshlink.room.core.model.MediaStream;

import java.util.List;
import java.util.Optional;

public interface RoomService {
    /**
     * roomName: Oda adı (açık oda yoksa oluşturulur ve relay'e JOIN gönderilir)
     * stream: Yerel medya akışı, opsiyonel
     */
    MeshRoom joinRoom(String roomName, MediaStream stream);

    MeshRoom joinRoom(String roomName);

    Optional<MeshRoom> getRoom(String roomName);

    /** Oda yoksa RoomNotFoundException. */
    MeshRoom requireRoom(String roomName);

    /** Odayı kapatır ve unutur. Bilinmeyen ad için bir şey yapmaz. */
    void leaveRoom(String roomName);

    List<String> listRoomNames();

    void closeAll();

    String getLocalPeerId();
}
