/**
 * The conversation aggregate: commands, events, state and the service that runs them.
 *
 * <p>A conversation lives on its own stream, {@code conversation-<uuid>}. Every change is an
 * event appended there by {@link com.convolog.chat.conversation.ConversationService}; state is
 * never stored, only rebuilt from the stream (optionally starting at a snapshot).
 *
 * @see com.convolog.chat.conversation.ConversationAggregate
 * @see com.convolog.chat.conversation.ConversationEvents
 */
package com.convolog.chat.conversation;
