package com.plainer.collab.message;

// Body of chat-send (content) and chat-reaction (messageId, emoji).
public record ChatPayload(String messageId, String content, String emoji) {}
