package com.convolog.chat.conversation;

import com.convolog.chat.conversation.ConversationEvent.AssistantChunkReceived;
import com.convolog.chat.conversation.ConversationEvent.AssistantStreamCompleted;
import com.convolog.chat.conversation.ConversationEvent.AssistantStreamFailed;
import com.convolog.chat.conversation.ConversationEvent.AssistantStreamStarted;
import com.convolog.chat.conversation.ConversationEvent.ConversationArchived;
import com.convolog.chat.conversation.ConversationEvent.ConversationCreated;
import com.convolog.chat.conversation.ConversationEvent.ConversationForked;
import com.convolog.chat.conversation.ConversationEvent.ConversationTitleUpdated;
import com.convolog.chat.conversation.ConversationEvent.ToolCallCompleted;
import com.convolog.chat.conversation.ConversationEvent.ToolCallStarted;
import com.convolog.chat.conversation.ConversationEvent.UserMessageAdded;
import com.convolog.eventmodel.EventData;
import com.convolog.eventmodel.EventTypeRegistry;
import com.convolog.eventmodel.StoredEvent;

/**
 * Event type tags of the conversation stream and their payload classes.
 */
public final class ConversationEvents {

    public static final String CONVERSATION_CREATED = "ConversationCreated";
    public static final String CONVERSATION_FORKED = "ConversationForked";
    public static final String USER_MESSAGE_ADDED = "UserMessageAdded";
    public static final String ASSISTANT_STREAM_STARTED = "AssistantStreamStarted";
    public static final String ASSISTANT_CHUNK_RECEIVED = "AssistantChunkReceived";
    public static final String ASSISTANT_STREAM_COMPLETED = "AssistantStreamCompleted";
    public static final String ASSISTANT_STREAM_FAILED = "AssistantStreamFailed";
    public static final String TOOL_CALL_STARTED = "ToolCallStarted";
    public static final String TOOL_CALL_COMPLETED = "ToolCallCompleted";
    public static final String CONVERSATION_TITLE_UPDATED = "ConversationTitleUpdated";
    public static final String CONVERSATION_ARCHIVED = "ConversationArchived";

    private static final EventTypeRegistry<ConversationEvent> REGISTRY = new EventTypeRegistry<ConversationEvent>()
            .register(CONVERSATION_CREATED, ConversationCreated.class)
            .register(CONVERSATION_FORKED, ConversationForked.class)
            .register(USER_MESSAGE_ADDED, UserMessageAdded.class)
            .register(ASSISTANT_STREAM_STARTED, AssistantStreamStarted.class)
            .register(ASSISTANT_CHUNK_RECEIVED, AssistantChunkReceived.class)
            .register(ASSISTANT_STREAM_COMPLETED, AssistantStreamCompleted.class)
            .register(ASSISTANT_STREAM_FAILED, AssistantStreamFailed.class)
            .register(TOOL_CALL_STARTED, ToolCallStarted.class)
            .register(TOOL_CALL_COMPLETED, ToolCallCompleted.class)
            .register(CONVERSATION_TITLE_UPDATED, ConversationTitleUpdated.class)
            .register(CONVERSATION_ARCHIVED, ConversationArchived.class);

    private ConversationEvents() {
        // utility class
    }

    public static EventData encode(ConversationEvent event) {
        return REGISTRY.encode(event);
    }

    /**
     * @throws IllegalStateException for an event type that does not belong to a conversation
     */
    public static ConversationEvent decode(StoredEvent event) {
        return REGISTRY.decode(event);
    }

    public static EventTypeRegistry<ConversationEvent> registry() {
        return REGISTRY;
    }
}
