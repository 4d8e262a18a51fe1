package com.docweaver.core.model;

import java.io.Serializable;

/**
 * One piece of research returned by the research role.
 *
 * @param question    the research question this note answers
 * @param source      where the content came from (URL or citation)
 * @param content     summarized content
 * @param credibility source credibility in [0, 1]
 */
public record ResearchNote(
    String question,
    String source,
    String content,
    double credibility
) implements Serializable {
}
