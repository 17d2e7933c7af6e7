package com.flamingo.ai.knowledgedesk.service.rag.completion;

/**
 * A prompt for the chat completion service.
 *
 * @param system instructions for the model
 * @param user the user turn, including any retrieved context
 */
public record CompletionPrompt(String system, String user) {}
