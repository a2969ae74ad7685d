package com.meshlink.room.transport.udp;

import com.meshlink.room.application.KeepAlive;
import com.meshlink.room.application.RoomService;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioDatagramChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;

/**
 * Relay ile konuşan UDP soketi.
 * Tek iş parçacıklı olay döngüsü: gelen mesajlar ve submit() ile verilen işler aynı sırada çalışır.
 */
@Component
public class SignalingClient {

    private static final Logger log = LoggerFactory.getLogger(SignalingClient.class);

    @Value("${app.signaling.enabled:true}")
    private boolean enabled;
    @Value("${app.signaling.localPort:0}")
    private int localPort;

    private final RoomService roomService;
    private final UdpMessenger messenger;
    private final SignalingCodec codec;
    private final KeepAlive keepAlive;
    private EventLoopGroup group;
    private Channel channel;

    public SignalingClient(RoomService roomService, UdpMessenger messenger,
                           SignalingCodec codec, KeepAlive keepAlive) {
        this.roomService = roomService;
        this.messenger = messenger;
        this.codec = codec;
        this.keepAlive = keepAlive;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() throws InterruptedException {
        if (!enabled) {
            log.info("Signaling client disabled (app.signaling.enabled=false)");
            return;
        }
        // Zaten çalışıyorsa tekrar başlatma
        if (channel != null && channel.isActive()) {
            log.info("Signaling client already bound to {}", channel.localAddress());
            return;
        }

        // Odalar kilitsiz çalışır; tek iş parçacığı şart
        group = new NioEventLoopGroup(1);

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_BROADCAST, false)
                .handler(new ChannelInitializer<NioDatagramChannel>() {
                    @Override
                    protected void initChannel(NioDatagramChannel ch) {
                        ch.pipeline().addLast(new SignalingClientHandler(roomService, codec, keepAlive));
                    }
                });

        ChannelFuture bindFuture = bootstrap.bind(localPort).sync();
        channel = bindFuture.channel();

        // Odaların giden mesajları bu kanaldan çıkar
        messenger.setChannel(channel);

        log.info("Signaling client bound to {}, relay={}", channel.localAddress(), messenger.getRelay());
    }

    /**
     * Uygulama niyetlerini (call, connect, close...) olay döngüsünde çalıştırır.
     * İstemci başlamamışsa iş çağıranın iş parçacığında hemen çalışır.
     */
    public void submit(Runnable task) {
        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            task.run();
            return;
        }
        ch.eventLoop().execute(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("submitted task failed", e);
            }
        });
    }

    public boolean isRunning() {
        return channel != null && channel.isActive();
    }

    @PreDestroy
    public void stop() {
        try {
            if (channel != null) {
                log.info("Stopping signaling client...");
                channel.close().syncUninterruptibly();
            }
        } finally {
            if (group != null) group.shutdownGracefully();
        }
    }
}
