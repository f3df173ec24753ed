package com.flamingo.ai.studymind.service.intent;

import com.flamingo.ai.studymind.domain.enums.Intent;

/** Validated classifier output: the intent plus a derived session title and description. */
public record ClassifiedIntent(Intent intent, String title, String description) {}
