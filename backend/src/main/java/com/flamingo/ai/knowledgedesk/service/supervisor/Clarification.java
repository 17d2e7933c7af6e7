package com.flamingo.ai.knowledgedesk.service.supervisor;

import com.flamingo.ai.knowledgedesk.domain.enums.SpecialistTag;
import java.util.List;

/**
 * A question back to the user when the supervisor cannot pick a specialist.
 *
 * @param question text to show
 * @param options specialists the user can choose from, most likely first
 */
public record Clarification(String question, List<SpecialistTag> options) {}
