package com.flamingo.ai.studymind.api.dto.response;

import java.util.List;

/** A session with its turns in chronological order. */
public record SessionDetailResponse(SessionResponse session, List<ChatTurnResponse> turns) {}
