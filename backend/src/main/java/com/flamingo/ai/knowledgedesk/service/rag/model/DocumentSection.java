package com.flamingo.ai.knowledgedesk.service.rag.model;

import java.util.List;

/**
 * A section of a parsed document, bounded by headings.
 *
 * @param title heading text
 * @param level heading depth (1 = H1 ... 6 = H6, 0 = text before the first heading)
 * @param breadcrumb heading path from the root to this section
 * @param content body text owned by this section, excluding sub-sections
 * @param children nested sub-sections
 */
public record DocumentSection(
    String title,
    int level,
    List<String> breadcrumb,
    String content,
    List<DocumentSection> children) {}
