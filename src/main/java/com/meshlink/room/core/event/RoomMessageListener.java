package com.meshlink.room.core.event;

import com.meshlink.room.core.dto.RoomMessage;

/** Odanın dışarı giden sinyalleşme kanalı; taşıma katmanı uygular. */
@FunctionalInterface
public interface RoomMessageListener {
    void onMessage(RoomMessage message);
}
