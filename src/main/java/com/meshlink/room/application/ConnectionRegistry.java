package com.meshlink.room.application;

import com.meshlink.room.core.model.Connection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * peerId → o eşle açık bağlantılar (eklenme sırasıyla).
 * - Bir anahtar yalnızca en az bir bağlantı varken bulunur; boş liste bırakılmaz.
 * - Tek iş parçacığından kullanılır, kilit yok.
 */
public class ConnectionRegistry {

    private final Map<String, List<Connection>> connections = new LinkedHashMap<>();
    // eşler arası genel kayıt sırası; kapatma bu sırayla yapılır
    private final List<Connection> registrationOrder = new ArrayList<>();

    public void add(String peerId, Connection connection) {
        connections.computeIfAbsent(peerId, k -> new ArrayList<>()).add(connection);
        registrationOrder.add(connection);
    }

    /** Eş başına liste küçüktür (tür başına en fazla bir-iki bağlantı), doğrusal tarama yeterli. */
    public Optional<Connection> get(String peerId, String connectionId) {
        List<Connection> list = connections.get(peerId);
        if (list == null || connectionId == null) return Optional.empty();
        for (Connection c : list) {
            if (connectionId.equals(c.getId())) return Optional.of(c);
        }
        return Optional.empty();
    }

    public List<Connection> get(String peerId) {
        List<Connection> list = connections.get(peerId);
        return list == null ? List.of() : Collections.unmodifiableList(list);
    }

    /** Eşin tüm kaydını siler; kapatma yapmaz. Silinenleri döner. */
    public List<Connection> remove(String peerId) {
        List<Connection> removed = connections.remove(peerId);
        if (removed == null) return List.of();
        registrationOrder.removeIf(c -> removed.stream().anyMatch(r -> r == c));
        return removed;
    }

    public boolean contains(String peerId) { return connections.containsKey(peerId); }

    /** Tüm eşlerdeki bağlantılar, kayıt sırasıyla düzleştirilmiş kopya. */
    public List<Connection> allConnections() {
        return new ArrayList<>(registrationOrder);
    }

    public Set<String> peerIds() { return Collections.unmodifiableSet(connections.keySet()); }

    public int size() {
        return registrationOrder.size();
    }

    public boolean isEmpty() { return connections.isEmpty(); }

    public void clear() {
        connections.clear();
        registrationOrder.clear();
    }
}
