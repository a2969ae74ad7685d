package com.meshlink.room.core.model;

import com.meshlink.room.core.event.DataConnectionListener;

public interface DataConnection extends Connection {

    @Override
    default ConnectionType getType() { return ConnectionType.DATA; }

    void setDataListener(DataConnectionListener listener);
}
