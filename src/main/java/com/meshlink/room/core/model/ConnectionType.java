package com.meshlink.room.core.model;

import java.util.Optional;

/** Bağlantı türü etiketi. Telde küçük harfli etiketle taşınır ("media" / "data"). */
public enum ConnectionType {
    MEDIA("media"),
    DATA("data");

    private final String label;

    ConnectionType(String label) {
        this.label = label;
    }

    public String getLabel() { return label; }

    /** Bilinmeyen ya da null etiket için boş döner, hata fırlatmaz. */
    public static Optional<ConnectionType> fromLabel(String label) {
        if (label == null) return Optional.empty();
        String s = label.trim();
        for (ConnectionType t : values()) {
            if (t.label.equalsIgnoreCase(s)) return Optional.of(t);
        }
        return Optional.empty();
    }

    @Override public String toString() { return label; }
}
