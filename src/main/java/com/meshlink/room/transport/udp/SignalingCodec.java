package com.meshlink.room.transport.udp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.meshlink.room.core.dto.DataMessage;
import com.meshlink.room.core.dto.RoomMessage;
import com.meshlink.room.core.dto.SignalingMessage;
import com.meshlink.room.core.exception.SignalingCodecException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Datagram başına tek JSON zarf (UTF-8).
 * Giden: {"type":..., "roomName":..., "src":<yerel eş>, ...türe özgü alanlar}
 * Gelen: "type" alanı zorunlu, kalan alanlar türe göre okunur.
 */
@Component
public class SignalingCodec {

    private final ObjectMapper mapper;

    public SignalingCodec(ObjectMapper mapper) {
        this.mapper = mapper.copy().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public String encode(RoomMessage message, String localPeerId) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", message.getType().name());
        node.put("roomName", message.getRoomName());
        node.put("src", localPeerId);

        switch (message.getType()) {
            case GET_PEERS -> node.put("kind", message.getKind().getLabel());
            case OFFER, ANSWER, CANDIDATE -> {
                SignalingMessage s = message.getSignal();
                putIfPresent(node, "connectionId", s.getConnectionId());
                putIfPresent(node, "connectionType", s.getConnectionType());
                putIfPresent(node, "dst", s.getDst());
                if (s.getPayload() != null) node.set("payload", s.getPayload());
                if (s.getMetadata() != null) node.set("metadata", s.getMetadata());
            }
            case BROADCAST_BY_WS, BROADCAST_BY_DC -> node.set("data", mapper.valueToTree(message.getData()));
            default -> { }
        }

        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new SignalingCodecException("cannot encode " + message.getType(), e);
        }
    }

    public JsonNode parse(String text) {
        JsonNode node;
        try {
            node = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new SignalingCodecException("malformed JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new SignalingCodecException("envelope must be a JSON object");
        }
        return node;
    }

    public SignalingMessage toSignal(JsonNode node) {
        return convert(node, SignalingMessage.class);
    }

    public DataMessage toData(JsonNode node) {
        return convert(node, DataMessage.class);
    }

    public List<String> peerIds(JsonNode node) {
        JsonNode arr = node.get("peerIds");
        if (arr == null || !arr.isArray()) throw new SignalingCodecException("peerIds must be an array");
        List<String> ids = new ArrayList<>();
        arr.forEach(n -> ids.add(n.asText()));
        return ids;
    }

    public static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }

    private <T> T convert(JsonNode node, Class<T> type) {
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new SignalingCodecException("cannot read " + type.getSimpleName(), e);
        }
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null) node.put(field, value);
    }
}
