package com.meshlink.room.application;

import com.meshlink.room.core.model.ConnectionOptions;
import com.meshlink.room.core.model.DataConnection;
import com.meshlink.room.core.model.MediaConnection;

/**
 * Somut bağlantıları (ICE/SDP müzakeresini yürüten nesneleri) üretir.
 * Oda bu arayüz dışında bağlantının iç yapısına bakmaz.
 */
public interface ConnectionFactory {

    MediaConnection createMediaConnection(String remotePeerId, ConnectionOptions options);

    DataConnection createDataConnection(String remotePeerId, ConnectionOptions options);
}
