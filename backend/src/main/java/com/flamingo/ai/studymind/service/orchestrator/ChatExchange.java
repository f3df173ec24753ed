package com.flamingo.ai.studymind.service.orchestrator;

import com.flamingo.ai.studymind.domain.entity.ChatSession;
import com.flamingo.ai.studymind.domain.entity.LibraryItem;
import com.flamingo.ai.studymind.service.reply.SynthesizedReply;
import java.util.List;

/** Outcome of one successful pipeline run. */
public record ChatExchange(
    ChatSession session, SynthesizedReply reply, List<LibraryItem> createdItems) {}
