package com.meshlink.room.application;

import com.meshlink.room.core.event.MediaConnectionListener;
import com.meshlink.room.core.model.ConnectionOptions;
import com.meshlink.room.core.model.MediaConnection;
import com.meshlink.room.core.model.MediaStream;

import java.util.ArrayList;
import java.util.List;

class FakeMediaConnection extends FakeConnection implements MediaConnection {

    MediaConnectionListener mediaListener;
    final List<MediaStream> replacedStreams = new ArrayList<>();

    FakeMediaConnection(String id, String remotePeerId, ConnectionOptions options) {
        super(id, remotePeerId, options);
    }

    @Override
    public void setMediaListener(MediaConnectionListener listener) { this.mediaListener = listener; }

    @Override
    public void replaceStream(MediaStream stream) { replacedStreams.add(stream); }

    void emitStream(MediaStream stream) { mediaListener.onStream(stream); }
}
