package com.meshlink.room.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * ConnectionFactory girdisi.
 * - Yerel başlatmada: yalnızca iceConfig (+ media için yerel akış).
 * - Gelen offer'da: ayrıca connectionId, offer payload ve metadata.
 */
public class ConnectionOptions {
    private final IceConfig iceConfig;
    private final MediaStream stream;       // data bağlantısında her zaman null
    private final String connectionId;      // null → müzakere katmanı üretir
    private final JsonNode offer;
    private final JsonNode metadata;

    private ConnectionOptions(IceConfig iceConfig, MediaStream stream,
                              String connectionId, JsonNode offer, JsonNode metadata) {
        this.iceConfig = iceConfig;
        this.stream = stream;
        this.connectionId = connectionId;
        this.offer = offer;
        this.metadata = metadata;
    }

    public static ConnectionOptions forMedia(IceConfig iceConfig, MediaStream stream) {
        return new ConnectionOptions(iceConfig, stream, null, null, null);
    }

    public static ConnectionOptions forData(IceConfig iceConfig) {
        return new ConnectionOptions(iceConfig, null, null, null, null);
    }

    /** Gelen offer'a yanıt verecek bağlantı için aynı ayarın kopyası. */
    public ConnectionOptions withOffer(String connectionId, JsonNode offer, JsonNode metadata) {
        return new ConnectionOptions(iceConfig, stream, connectionId, offer, metadata);
    }

    public IceConfig getIceConfig() { return iceConfig; }
    public MediaStream getStream() { return stream; }
    public String getConnectionId() { return connectionId; }
    public JsonNode getOffer() { return offer; }
    public JsonNode getMetadata() { return metadata; }

    /** Uzak offer'a yanıt olarak mı kuruluyor? */
    public boolean isIncoming() { return offer != null; }
}
