package com.meshlink.room.application;

import com.fasterxml.jackson.databind.JsonNode;
import com.meshlink.room.core.dto.DataMessage;
import com.meshlink.room.core.dto.PeerStream;
import com.meshlink.room.core.dto.RoomMessage;
import com.meshlink.room.core.dto.RoomMessageType;
import com.meshlink.room.core.dto.SignalingMessage;
import com.meshlink.room.core.event.ConnectionListener;
import com.meshlink.room.core.event.RoomEventListener;
import com.meshlink.room.core.event.RoomMessageListener;
import com.meshlink.room.core.exception.RoomClosedException;
import com.meshlink.room.core.model.Connection;
import com.meshlink.room.core.model.ConnectionOptions;
import com.meshlink.room.core.model.ConnectionType;
import com.meshlink.room.core.model.DataConnection;
import com.meshlink.room.core.model.IceConfig;
import com.meshlink.room.core.model.MediaConnection;
import com.meshlink.room.core.model.MediaStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Tam örgü (full-mesh) oda çekirdeği.
 * - Odadaki diğer her eşe bir bağlantı kurar, kendine kurmaz.
 * - Gelen offer'ları (peerId, connectionId) ile tekilleştirir.
 * - Bağlantı olaylarını oda adıyla damgalayıp taşıma katmanına iletir,
 *   akış/veri olaylarını uygulamaya yayınlar.
 *
 * Tek iş parçacıklıdır: tüm çağrılar (niyetler ve gelen mesajlar) aynı olay döngüsünden gelmelidir.
 */
public class MeshRoom {

    private static final Logger log = LoggerFactory.getLogger(MeshRoom.class);

    private final String name;
    private final String peerId;
    private final IceConfig iceConfig;
    private final ConnectionFactory connectionFactory;
    private final RoomMessageListener messageListener;
    private final ConnectionRegistry connections = new ConnectionRegistry();
    private final List<RoomEventListener> eventListeners = new CopyOnWriteArrayList<>();

    private MediaStream localStream;
    // zamanlayıcı iş parçacığı da okur (RoomServiceImpl.listRoomNames)
    private volatile boolean closed;

    public MeshRoom(String name, String peerId, MediaStream localStream, IceConfig iceConfig,
                    ConnectionFactory connectionFactory, RoomMessageListener messageListener) {
        this.name = Objects.requireNonNull(name, "name");
        this.peerId = Objects.requireNonNull(peerId, "peerId");
        this.localStream = localStream;
        this.iceConfig = iceConfig == null ? IceConfig.empty() : iceConfig;
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
        this.messageListener = Objects.requireNonNull(messageListener, "messageListener");
    }

    public void addEventListener(RoomEventListener listener) { eventListeners.add(listener); }
    public void removeEventListener(RoomEventListener listener) { eventListeners.remove(listener); }

    // --- niyetler ---

    /** Medya için eş keşfi ister; bağlantılar yanıt gelince makeMediaConnections ile kurulur. */
    public void call() {
        call(null);
    }

    public void call(MediaStream stream) {
        ensureOpen();
        if (stream != null) localStream = stream;
        send(RoomMessage.getPeers(name, ConnectionType.MEDIA));
    }

    public void connect() {
        ensureOpen();
        send(RoomMessage.getPeers(name, ConnectionType.DATA));
    }

    public void makeMediaConnections(Collection<String> peerIds) {
        ensureOpen();
        ConnectionOptions options = ConnectionOptions.forMedia(iceConfig, localStream);
        for (String remoteId : peerIds) {
            if (peerId.equals(remoteId)) continue; // kendine bağlanma
            register(remoteId, connectionFactory.createMediaConnection(remoteId, options));
        }
    }

    public void makeDataConnections(Collection<String> peerIds) {
        ensureOpen();
        ConnectionOptions options = ConnectionOptions.forData(iceConfig);
        for (String remoteId : peerIds) {
            if (peerId.equals(remoteId)) continue;
            register(remoteId, connectionFactory.createDataConnection(remoteId, options));
        }
    }

    /** Dağıtım taşıma sunucusunun işidir; oda bağlantıları dolaşmaz. */
    public void sendByWS(Object data) {
        ensureOpen();
        send(RoomMessage.broadcast(RoomMessageType.BROADCAST_BY_WS, name, data));
    }

    /** Dağıtım her veri bağlantısının işidir. */
    public void sendByDC(Object data) {
        ensureOpen();
        send(RoomMessage.broadcast(RoomMessageType.BROADCAST_BY_DC, name, data));
    }

    /** Yerel akışı değiştirir ve açık medya bağlantılarına iletir. */
    public void replaceStream(MediaStream stream) {
        ensureOpen();
        localStream = stream;
        for (Connection c : connections.allConnections()) {
            if (c.getType() == ConnectionType.MEDIA) {
                ((MediaConnection) c).replaceStream(stream);
            }
        }
    }

    public void getLog() {
        ensureOpen();
        send(RoomMessage.of(RoomMessageType.GET_LOG, name));
    }

    /**
     * Kayıtlı her bağlantıyı kayıt sırasıyla bir kez kapatır, kaydı boşaltır,
     * LEAVE gönderir ve tek bir onClose yayınlar. İkinci çağrı etkisizdir.
     */
    public void close() {
        if (closed) return;
        closed = true;

        List<Connection> all = connections.allConnections();
        connections.clear();
        for (Connection c : all) {
            try {
                c.close();
            } catch (RuntimeException e) {
                log.warn("close failed (room={}, peer={}, connectionId={})",
                        name, c.getRemotePeerId(), c.getId(), e);
            }
        }
        log.info("Room '{}' closed ({} connection(s))", name, all.size());

        send(RoomMessage.of(RoomMessageType.LEAVE, name));
        for (RoomEventListener l : eventListeners) l.onClose();
    }

    // --- gelen sinyalleşme ---

    public void handleJoin(SignalingMessage message) {
        if (dropIfClosed("join", message)) return;
        String src = message.getSrc();
        for (RoomEventListener l : eventListeners) l.onPeerJoin(src);
    }

    /** Eşin kaydını unutur; bağlantıları kapatmaz (gerekirse uygulama onPeerLeave'de kapatır). */
    public void handleLeave(SignalingMessage message) {
        if (dropIfClosed("leave", message)) return;
        String src = message.getSrc();
        List<Connection> removed = connections.remove(src);
        log.debug("peer left (room={}, peer={}, forgotten={})", name, src, removed.size());
        for (RoomEventListener l : eventListeners) l.onPeerLeave(src);
    }

    public void handleOffer(SignalingMessage message) {
        if (dropIfClosed("offer", message)) return;
        String src = message.getSrc();
        String connectionId = message.getConnectionId();

        // Tekrarlanan ya da yerel bağlantıyla yarışan offer: yeni nesne üretme
        if (connections.get(src, connectionId).isPresent()) {
            log.debug("duplicate offer ignored (room={}, peer={}, connectionId={})", name, src, connectionId);
            return;
        }

        Optional<ConnectionType> type = ConnectionType.fromLabel(message.getConnectionType());
        if (type.isEmpty()) {
            log.debug("offer with unknown connection type '{}' ignored (room={}, peer={})",
                    message.getConnectionType(), name, src);
            return;
        }

        switch (type.get()) {
            case MEDIA -> {
                ConnectionOptions options = ConnectionOptions.forMedia(iceConfig, localStream)
                        .withOffer(connectionId, message.getPayload(), message.getMetadata());
                MediaConnection call = connectionFactory.createMediaConnection(src, options);
                register(src, call);
                for (RoomEventListener l : eventListeners) l.onCall(call);
            }
            case DATA -> {
                ConnectionOptions options = ConnectionOptions.forData(iceConfig)
                        .withOffer(connectionId, message.getPayload(), message.getMetadata());
                DataConnection dc = connectionFactory.createDataConnection(src, options);
                register(src, dc);
                for (RoomEventListener l : eventListeners) l.onConnection(dc);
            }
        }
    }

    public void handleAnswer(SignalingMessage message) {
        if (dropIfClosed("answer", message)) return;
        Optional<Connection> connection = connections.get(message.getSrc(), message.getConnectionId());
        if (connection.isEmpty()) {
            log.debug("answer for unknown connection dropped (room={}, peer={}, connectionId={})",
                    name, message.getSrc(), message.getConnectionId());
            return;
        }
        connection.get().handleAnswer(message.getPayload());
    }

    public void handleCandidate(SignalingMessage message) {
        if (dropIfClosed("candidate", message)) return;
        Optional<Connection> connection = connections.get(message.getSrc(), message.getConnectionId());
        if (connection.isEmpty()) {
            log.debug("candidate for unknown connection dropped (room={}, peer={}, connectionId={})",
                    name, message.getSrc(), message.getConnectionId());
            return;
        }
        connection.get().handleCandidate(message.getPayload());
    }

    public void handleData(DataMessage message) {
        if (closed) return;
        for (RoomEventListener l : eventListeners) l.onData(message);
    }

    public void handleLog(JsonNode entry) {
        if (closed) return;
        for (RoomEventListener l : eventListeners) l.onLog(entry);
    }

    // --- kayıt + bağlama ---

    /** Önce kayıt, sonra dinleyiciler: bağlantının ilk offer'ına gelen yanıt kaydı bulabilsin. */
    private void register(String remoteId, Connection connection) {
        connections.add(remoteId, connection);
        setupMessageHandlers(remoteId, connection);
        log.debug("connection registered (room={}, peer={}, type={}, connectionId={})",
                name, remoteId, connection.getType(), connection.getId());
    }

    private void setupMessageHandlers(String remoteId, Connection connection) {
        connection.setConnectionListener(new ConnectionListener() {
            @Override
            public void onOffer(SignalingMessage offer) {
                if (closed) return;
                send(RoomMessage.signal(RoomMessageType.OFFER, name, offer));
            }

            @Override
            public void onAnswer(SignalingMessage answer) {
                if (closed) return;
                send(RoomMessage.signal(RoomMessageType.ANSWER, name, answer));
            }

            @Override
            public void onCandidate(SignalingMessage candidate) {
                if (closed) return;
                send(RoomMessage.signal(RoomMessageType.CANDIDATE, name, candidate));
            }
        });

        switch (connection.getType()) {
            case MEDIA -> ((MediaConnection) connection).setMediaListener(stream -> {
                if (closed) return; // kapanmış odanın bağlantısından geç gelen akış
                PeerStream peerStream = new PeerStream(remoteId, stream);
                for (RoomEventListener l : eventListeners) l.onStream(peerStream);
            });
            case DATA -> ((DataConnection) connection).setDataListener(this::handleData);
        }
    }

    private void send(RoomMessage message) {
        messageListener.onMessage(message);
    }

    private void ensureOpen() {
        if (closed) throw new RoomClosedException(name);
    }

    private boolean dropIfClosed(String kind, SignalingMessage message) {
        if (!closed) return false;
        log.debug("{} after close dropped (room={}, src={})", kind, name, message.getSrc());
        return true;
    }

    // --- getters ---
    public String getName() { return name; }
    public String getPeerId() { return peerId; }
    public MediaStream getLocalStream() { return localStream; }
    public IceConfig getIceConfig() { return iceConfig; }
    public boolean isClosed() { return closed; }

    /** Salt okunur görünüm. */
    public List<Connection> getConnections() { return connections.allConnections(); }

    public List<Connection> getConnections(String remotePeerId) { return connections.get(remotePeerId); }

    public Optional<Connection> getConnection(String remotePeerId, String connectionId) {
        return connections.get(remotePeerId, connectionId);
    }
}
