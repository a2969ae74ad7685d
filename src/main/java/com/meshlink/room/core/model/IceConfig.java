package com.meshlink.room.core.model;

import java.util.List;

/**
 * Her yeni bağlantıya aynen verilen taşıma ayarı (ICE sunucuları).
 * Değişmezdir; oda boyunca tek bir örnek paylaşılır.
 */
public class IceConfig {
    private final List<String> iceServers;

    public IceConfig(List<String> iceServers) {
        this.iceServers = iceServers == null ? List.of() : List.copyOf(iceServers);
    }

    public static IceConfig empty() { return new IceConfig(List.of()); }

    public List<String> getIceServers() { return iceServers; }

    @Override public String toString() { return "IceConfig" + iceServers; }
}
