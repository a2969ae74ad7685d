package com.meshlink.room.infrastructure.config;

import com.meshlink.room.core.model.IceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.Arrays;
import java.util.List;

/**
 * Odaların paylaştığı bağlantı ayarı ve zamanlayıcı.
 * - app.ice.servers: virgülle ayrılmış STUN/TURN adresleri (boş olabilir)
 * - app.keepalive.* zamanlanmış PING için
 */
@Configuration
@EnableScheduling
public class SignalingConfig {

    private static final Logger log = LoggerFactory.getLogger(SignalingConfig.class);

    @Value("${app.ice.servers:}")
    private String iceServers;

    @Bean
    public IceConfig iceConfig() {
        List<String> servers = Arrays.stream(iceServers.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
        log.info("ICE servers: {}", servers.isEmpty() ? "none (host candidates only)" : servers);
        return new IceConfig(servers);
    }
}
