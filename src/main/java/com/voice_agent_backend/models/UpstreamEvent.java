package com.voice_agent_backend.models;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;

/**
 * A single event received from the realtime model service. The raw payload is kept
 * so it can be forwarded to the client unchanged.
 */
@Getter
public class UpstreamEvent {

    private final UpstreamEventType type;
    private final String wireType;
    private final JsonNode payload;

    private UpstreamEvent(UpstreamEventType type, String wireType, JsonNode payload) {
        this.type = type;
        this.wireType = wireType;
        this.payload = payload;
    }

    public static UpstreamEvent of(JsonNode payload) {
        String wireType = payload.path("type").asText(null);
        return new UpstreamEvent(UpstreamEventType.fromWireType(wireType), wireType, payload);
    }

    public String getEventId() {
        return textOrNull(payload.get("event_id"));
    }

    public String getCallId() {
        return textOrNull(payload.get("call_id"));
    }

    public String getFunctionName() {
        return textOrNull(payload.get("name"));
    }

    /**
     * The accumulated argument string of a function call, as sent by the model.
     */
    public String getArguments() {
        JsonNode arguments = payload.get("arguments");
        if (arguments == null || arguments.isNull()) {
            return null;
        }
        return arguments.isTextual() ? arguments.asText() : arguments.toString();
    }

    public String getErrorType() {
        return payload.path("error").path("type").asText("unknown");
    }

    public String getErrorMessage() {
        return payload.path("error").path("message").asText("Unknown error");
    }

    /**
     * Call id of a {@code function_call_output} item echoed back in {@code conversation.item.created}.
     */
    public String getFunctionCallOutputId() {
        JsonNode item = payload.path("item");
        if (!"function_call_output".equals(item.path("type").asText())) {
            return null;
        }
        return textOrNull(item.get("call_id"));
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }

    @Override
    public String toString() {
        return "UpstreamEvent{" + wireType + "}";
    }
}
