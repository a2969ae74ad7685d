package com.meshlink.room.core.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.meshlink.room.core.dto.DataMessage;
import com.meshlink.room.core.dto.PeerStream;
import com.meshlink.room.core.model.DataConnection;
import com.meshlink.room.core.model.MediaConnection;

/**
 * Uygulamanın dinlediği oda olayları. Tüm metotlar boş varsayılanlıdır;
 * yalnızca ilgilenilen olay override edilir.
 */
public interface RoomEventListener {

    default void onPeerJoin(String peerId) { }

    default void onPeerLeave(String peerId) { }

    /** Uzak eşten gelen medya çağrısı. */
    default void onCall(MediaConnection call) { }

    /** Uzak eşten gelen veri bağlantısı. */
    default void onConnection(DataConnection connection) { }

    default void onStream(PeerStream stream) { }

    default void onData(DataMessage message) { }

    default void onClose() { }

    default void onLog(JsonNode log) { }
}
