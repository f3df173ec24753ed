package com.flamingo.ai.studymind.service.reply;

/**
 * The assistant's answer in two renderings.
 *
 * @param storedMessage text persisted as the assistant turn, markers included
 * @param displayMessage the same text with markers removed, for people to read
 */
public record SynthesizedReply(String storedMessage, String displayMessage) {}
