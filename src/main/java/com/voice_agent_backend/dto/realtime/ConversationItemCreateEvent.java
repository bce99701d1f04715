package com.voice_agent_backend.dto.realtime;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Hands a locally executed function result back to the model.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConversationItemCreateEvent {
    private String type = "conversation.item.create";
    private Item item;

    public static ConversationItemCreateEvent functionCallOutput(String callId, String output) {
        ConversationItemCreateEvent event = new ConversationItemCreateEvent();
        event.setItem(new Item("function_call_output", callId, output));
        return event;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Item {
        private String type;
        @JsonProperty("call_id")
        private String callId;
        private String output; // JSON-encoded tool result
    }
}
