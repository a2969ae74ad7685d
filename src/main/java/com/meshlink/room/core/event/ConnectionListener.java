package com.meshlink.room.core.event;

import com.meshlink.room.core.dto.SignalingMessage;

/**
 * Bağlantının müzakere olayları (ilk kurulum ve yeniden müzakere).
 * Zarflarda connectionId, connectionType, dst ve payload dolu gelir; oda adını oda ekler.
 */
public interface ConnectionListener {
    void onOffer(SignalingMessage offer);
    void onAnswer(SignalingMessage answer);
    void onCandidate(SignalingMessage candidate);
}
