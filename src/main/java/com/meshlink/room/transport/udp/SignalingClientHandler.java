package com.meshlink.room.transport.udp;

import com.fasterxml.jackson.databind.JsonNode;
import com.meshlink.room.application.KeepAlive;
import com.meshlink.room.application.MeshRoom;
import com.meshlink.room.application.RoomService;
import com.meshlink.room.core.exception.RoomClosedException;
import com.meshlink.room.core.exception.SignalingCodecException;
import com.meshlink.room.core.model.ConnectionType;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.DatagramPacket;
import io.netty.util.CharsetUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

import static com.meshlink.room.transport.udp.SignalingCodec.text;

/**
 * Relay'den gelen zarfı çözer ve ilgili odanın handler'ına iletir.
 * Olay döngüsü tek iş parçacıklıdır; odalar bu iş parçacığında çalışır.
 * Bozuk/bilinmeyen mesajlar loglanır ve düşürülür, relay'e hata dönülmez.
 */
public class SignalingClientHandler extends SimpleChannelInboundHandler<DatagramPacket> {

    private static final Logger log = LoggerFactory.getLogger(SignalingClientHandler.class);

    private final RoomService roomService;
    private final SignalingCodec codec;
    private final KeepAlive keepAlive;

    public SignalingClientHandler(RoomService roomService, SignalingCodec codec, KeepAlive keepAlive) {
        this.roomService = roomService;
        this.codec = codec;
        this.keepAlive = keepAlive;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet) {
        String msg = packet.content().toString(CharsetUtil.UTF_8).trim();
        if (msg.isEmpty()) {
            log.debug("empty datagram from {} dropped", packet.sender());
            return;
        }

        try {
            dispatch(codec.parse(msg));
        } catch (SignalingCodecException e) {
            log.warn("bad signaling message from {}: {}", packet.sender(), e.getMessage());
        } catch (RoomClosedException e) {
            log.debug("message for closed room dropped: {}", e.getMessage());
        } catch (Exception e) {
            log.error("signaling handler error", e);
        }
    }

    void dispatch(JsonNode node) {
        Optional<InboundType> type = InboundType.parse(text(node, "type"));
        if (type.isEmpty()) {
            log.debug("unknown signaling type '{}' dropped", text(node, "type"));
            return;
        }

        String roomName = text(node, "roomName");
        if (type.get() == InboundType.PONG) {
            if (keepAlive != null && roomName != null) keepAlive.onPong(roomName);
            return;
        }

        Optional<MeshRoom> roomOpt = roomName == null ? Optional.empty() : roomService.getRoom(roomName);
        if (roomOpt.isEmpty()) {
            log.debug("{} for unknown room '{}' dropped", type.get(), roomName);
            return;
        }
        MeshRoom room = roomOpt.get();

        switch (type.get()) {
            case ROOM_USER_JOIN -> room.handleJoin(codec.toSignal(node));
            case ROOM_USER_LEAVE -> room.handleLeave(codec.toSignal(node));
            case ROOM_USERS -> handleUsers(room, node);
            case OFFER -> room.handleOffer(codec.toSignal(node));
            case ANSWER -> room.handleAnswer(codec.toSignal(node));
            case CANDIDATE -> room.handleCandidate(codec.toSignal(node));
            case ROOM_DATA -> room.handleData(codec.toData(node));
            case ROOM_LOGS -> room.handleLog(node.get("log"));
            default -> log.debug("{} not handled", type.get());
        }
    }

    /** GET_PEERS yanıtı: istenen türde bağlantılar kurulur. */
    private void handleUsers(MeshRoom room, JsonNode node) {
        List<String> peerIds = codec.peerIds(node);
        Optional<ConnectionType> kind = ConnectionType.fromLabel(text(node, "kind"));
        if (kind.isEmpty()) {
            throw new SignalingCodecException("ROOM_USERS without valid kind");
        }
        switch (kind.get()) {
            case MEDIA -> room.makeMediaConnections(peerIds);
            case DATA -> room.makeDataConnections(peerIds);
        }
    }
}
