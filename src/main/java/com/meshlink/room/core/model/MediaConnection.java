package com.meshlink.room.core.model;

import com.meshlink.room.core.event.MediaConnectionListener;

public interface MediaConnection extends Connection {

    @Override
    default ConnectionType getType() { return ConnectionType.MEDIA; }

    void setMediaListener(MediaConnectionListener listener);

    /** Giden akışı bağlantıyı yeniden kurmadan değiştirir. */
    void replaceStream(MediaStream stream);
}
