package com.flamingo.ai.knowledgedesk.service.supervisor;

import com.flamingo.ai.knowledgedesk.domain.enums.SpecialistTag;

/** Confidence that a query belongs to a specialist. */
public record TagScore(SpecialistTag tag, double confidence) {}
