/**
 * Read models of conversations, messages, chunks and tool calls, kept up to date by
 * {@link com.convolog.chat.projection.ChatProjector}.
 */
package com.convolog.chat.projection;
