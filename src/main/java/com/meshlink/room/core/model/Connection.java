package com.meshlink.room.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.meshlink.room.core.event.ConnectionListener;

/**
 * Tek bir uzak eşe açılmış, müzakeresi alt katmanda yürüyen kanal.
 * Oda yalnızca bu yüzeyi görür; ICE/SDP ayrıntıları somut sınıftadır.
 */
public interface Connection {

    /** Müzakere katmanının ürettiği, oda genelinde benzersiz kimlik. */
    String getId();

    ConnectionType getType();

    String getRemotePeerId();

    boolean isOpen();

    /** offer/answer/candidate olayları için tek dinleyici; yenisi eskisinin yerine geçer. */
    void setConnectionListener(ConnectionListener listener);

    void handleAnswer(JsonNode answer);

    void handleCandidate(JsonNode candidate);

    void close();
}
