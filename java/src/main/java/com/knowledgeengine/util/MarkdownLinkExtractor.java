package com.knowledgeengine.util;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds markdown links to graph nodes, e.g. {@code [Parser](concept://local/compiler/parser)}.
 */
public final class MarkdownLinkExtractor {

    private static final Pattern NODE_LINK = Pattern.compile("\\[([^\\]]*)\\]\\(((?:concept|resource)://[^)\\s]+)\\)");

    private MarkdownLinkExtractor() {
    }

    /**
     * Distinct link targets in order of first appearance, excluding {@code selfUri}.
     */
    public static List<String> extractTargets(String content, String selfUri) {
        if (content == null || content.isEmpty()) {
            return List.of();
        }
        Set<String> targets = new LinkedHashSet<>();
        Matcher matcher = NODE_LINK.matcher(content);
        while (matcher.find()) {
            String target = matcher.group(2);
            if (!target.equals(selfUri)) {
                targets.add(target);
            }
        }
        return new ArrayList<>(targets);
    }
}
