package com.meshlink.room.transport.udp;

import com.meshlink.room.core.dto.RoomMessage;
import com.meshlink.room.core.event.RoomMessageListener;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.socket.DatagramPacket;
import io.netty.util.CharsetUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.InetSocketAddress;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Odaların giden mesajlarını relay sunucusuna yollar.
 * Kanal henüz hazır değilse mesaj düşürülür (relay'e ulaşılamıyorsa zaten teslim edilemez).
 */
@Component
public class UdpMessenger implements RoomMessageListener {

    private static final Logger log = LoggerFactory.getLogger(UdpMessenger.class);

    private final AtomicReference<Channel> channelRef = new AtomicReference<>();
    private final SignalingCodec codec;
    private final String localPeerId;
    private final InetSocketAddress relay;

    public UdpMessenger(SignalingCodec codec,
                        @Value("${app.peer.id}") String localPeerId,
                        @Value("${app.signaling.host:127.0.0.1}") String relayHost,
                        @Value("${app.signaling.port:9876}") int relayPort) {
        this.codec = codec;
        this.localPeerId = localPeerId;
        this.relay = new InetSocketAddress(relayHost, relayPort);
    }

    void setChannel(Channel ch) { channelRef.set(ch); }

    public boolean isReady() {
        Channel ch = channelRef.get();
        return ch != null && ch.isActive();
    }

    @Override
    public void onMessage(RoomMessage message) {
        Channel ch = channelRef.get();
        if (ch == null || !ch.isActive()) {
            log.debug("signaling channel not ready, dropped {}", message);
            return;
        }
        String text = codec.encode(message, localPeerId);
        ch.writeAndFlush(new DatagramPacket(
                Unpooled.copiedBuffer(text, CharsetUtil.UTF_8),
                relay
        ));
    }

    public InetSocketAddress getRelay() { return relay; }
}
