package com.meshlink.room.core.event;

import com.meshlink.room.core.dto.DataMessage;

public interface DataConnectionListener {
    void onData(DataMessage message);
}
