package com.meshlink.room.core.dto;

import com.meshlink.room.core.model.MediaStream;

/** Uzak akış + geldiği eşin kimliği. */
public class PeerStream {
    private final String peerId;
    private final MediaStream stream;

    public PeerStream(String peerId, MediaStream stream) {
        this.peerId = peerId;
        this.stream = stream;
    }
    public String getPeerId() { return peerId; }
    public MediaStream getStream() { return stream; }
    @Override public String toString() { return peerId + "/" + (stream == null ? null : stream.getId()); }
}
