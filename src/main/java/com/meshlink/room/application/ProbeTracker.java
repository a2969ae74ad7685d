package com.meshlink.room.application;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Oda başına yanıtsız kalan PING sayısı. */
public class ProbeTracker {
    private final Map<String, Integer> missed = new ConcurrentHashMap<>();
    public void onProbeSent(String roomName) { missed.merge(roomName, 1, Integer::sum); }
    public void onPong(String roomName) { missed.remove(roomName); }
    public boolean shouldRejoin(String roomName, int maxMissed) {
        return missed.getOrDefault(roomName, 0) >= maxMissed;
    }
    public int missed(String roomName) { return missed.getOrDefault(roomName, 0); }
    public void clear(String roomName) { missed.remove(roomName); }
    /** Artık açık olmayan odaların sayaçlarını atar. */
    public void retainOnly(Collection<String> roomNames) { missed.keySet().retainAll(roomNames); }
    public int size() { return missed.size(); }
}
