package com.meshlink.room.core.event;

import com.meshlink.room.core.model.MediaStream;

public interface MediaConnectionListener {
    void onStream(MediaStream stream);
}
