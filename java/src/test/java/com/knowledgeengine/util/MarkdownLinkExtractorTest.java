package com.knowledgeengine.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for MarkdownLinkExtractor.
 */
class MarkdownLinkExtractorTest {

    @Test
    void extractTargets_FindsConceptAndResourceLinksInOrder() {
        String content = "Uses the [parser](concept://local/parser) and reads "
                + "[the grammar](resource://local/grammar.g4). See [parser again](concept://local/parser).";

        assertThat(MarkdownLinkExtractor.extractTargets(content, "concept://local/compiler"))
                .containsExactly("concept://local/parser", "resource://local/grammar.g4");
    }

    @Test
    void extractTargets_IgnoresOtherSchemesAndSelfLinks() {
        String content = "[web](https://example.com) [me](concept://local/self) [plain](concept-like)";

        assertThat(MarkdownLinkExtractor.extractTargets(content, "concept://local/self")).isEmpty();
    }

    @Test
    void extractTargets_NullContent() {
        assertThat(MarkdownLinkExtractor.extractTargets(null, "concept://local/x")).isEmpty();
    }
}
