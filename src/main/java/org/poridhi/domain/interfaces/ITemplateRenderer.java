package org.poridhi.domain.interfaces;

import java.util.Map;

public interface ITemplateRenderer {
    /**
     * Renders the named template. Problems (missing template, missing key)
     * show up as visible markers in the output instead of exceptions.
     */
    String render(String templateId, Map<String, ?> context);
}
