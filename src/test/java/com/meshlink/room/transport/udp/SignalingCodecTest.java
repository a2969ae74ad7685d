package com.meshlink.room.transport.udp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.meshlink.room.core.dto.DataMessage;
import com.meshlink.room.core.dto.RoomMessage;
import com.meshlink.room.core.dto.RoomMessageType;
import com.meshlink.room.core.dto.SignalingMessage;
import com.meshlink.room.core.exception.SignalingCodecException;
import com.meshlink.room.core.model.ConnectionType;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SignalingCodecTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final SignalingCodec codec = new SignalingCodec(mapper);

    private JsonNode encoded(RoomMessage message) throws Exception {
        return mapper.readTree(codec.encode(message, "A"));
    }

    @Test
    void getPeersCarriesKind() throws Exception {
        JsonNode node = encoded(RoomMessage.getPeers("R", ConnectionType.MEDIA));

        assertThat(node.get("type").asText()).isEqualTo("GET_PEERS");
        assertThat(node.get("roomName").asText()).isEqualTo("R");
        assertThat(node.get("src").asText()).isEqualTo("A");
        assertThat(node.get("kind").asText()).isEqualTo("media");
    }

    @Test
    void offerCarriesEnvelopeFields() throws Exception {
        SignalingMessage offer = new SignalingMessage("c1", "media", null, TextNode.valueOf("v=0"));
        offer.setDst("B");

        JsonNode node = encoded(RoomMessage.signal(RoomMessageType.OFFER, "R", offer));

        assertThat(node.get("type").asText()).isEqualTo("OFFER");
        assertThat(node.get("connectionId").asText()).isEqualTo("c1");
        assertThat(node.get("connectionType").asText()).isEqualTo("media");
        assertThat(node.get("dst").asText()).isEqualTo("B");
        assertThat(node.get("payload").asText()).isEqualTo("v=0");
        assertThat(node.has("metadata")).isFalse();
    }

    @Test
    void broadcastSerializesArbitraryData() throws Exception {
        JsonNode node = encoded(RoomMessage.broadcast(RoomMessageType.BROADCAST_BY_WS, "R", Map.of("n", 1)));

        assertThat(node.get("data").get("n").asInt()).isEqualTo(1);
    }

    @Test
    void inboundOfferIsReadIgnoringTransportFields() {
        JsonNode node = codec.parse("{\"type\":\"OFFER\",\"roomName\":\"R\",\"connectionId\":\"c1\","
                + "\"connectionType\":\"data\",\"src\":\"B\",\"payload\":{\"sdp\":\"v=0\"},\"extra\":true}");

        SignalingMessage m = codec.toSignal(node);

        assertThat(m.getRoomName()).isEqualTo("R");
        assertThat(m.getConnectionId()).isEqualTo("c1");
        assertThat(m.getConnectionType()).isEqualTo("data");
        assertThat(m.getSrc()).isEqualTo("B");
        assertThat(m.getPayload().get("sdp").asText()).isEqualTo("v=0");
    }

    @Test
    void inboundDataIsRead() {
        DataMessage m = codec.toData(codec.parse("{\"type\":\"ROOM_DATA\",\"roomName\":\"R\",\"src\":\"B\",\"data\":\"hi\"}"));

        assertThat(m.getSrc()).isEqualTo("B");
        assertThat(m.getData().asText()).isEqualTo("hi");
    }

    @Test
    void peerIdsMustBeAnArray() {
        assertThat(codec.peerIds(codec.parse("{\"peerIds\":[\"A\",\"B\"]}"))).containsExactly("A", "B");
        assertThatThrownBy(() -> codec.peerIds(codec.parse("{\"peerIds\":\"A\"}")))
                .isInstanceOf(SignalingCodecException.class);
    }

    @Test
    void malformedInputIsRejected() {
        assertThatThrownBy(() -> codec.parse("not json")).isInstanceOf(SignalingCodecException.class);
        assertThatThrownBy(() -> codec.parse("[1,2]")).isInstanceOf(SignalingCodecException.class);
    }
}
