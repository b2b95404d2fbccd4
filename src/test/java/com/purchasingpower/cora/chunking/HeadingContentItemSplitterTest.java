package com.purchasingpower.cora.chunking;

import com.purchasingpower.cora.model.parse.ContentItem;
import com.purchasingpower.cora.model.parse.Language;
import com.purchasingpower.cora.util.TextLines;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Heading Splitter Tests")
class HeadingContentItemSplitterTest {

    private final HeadingContentItemSplitter splitter = new HeadingContentItemSplitter();

    @Test
    @DisplayName("Headings inside fenced code blocks are not section boundaries")
    void split_shouldIgnoreHeadingsInFences() {
        String markdown = """
                # Setup
                ```bash
                # install deps
                npm install
                ```
                ## Running
                npm start
                """;

        List<ContentItem> items = splitter.split(TextLines.of(markdown), Language.MARKDOWN);

        assertThat(items).extracting(ContentItem::name).containsExactly("Setup", "Running");
        assertThat(items.get(0).endLine()).isEqualTo(5);
        assertThat(items.get(1).endLine()).isEqualTo(7);
    }

    @Test
    @DisplayName("Text without headings yields no items")
    void split_withoutHeadings_shouldBeEmpty() {
        assertThat(splitter.split(TextLines.of("just prose\nmore prose\n"), Language.MARKDOWN)).isEmpty();
    }

    @Test
    @DisplayName("Slugs follow GitHub anchors")
    void slug_shouldMatchAnchorFormat() {
        assertThat(HeadingContentItemSplitter.slug("Getting Started!")).isEqualTo("getting-started");
        assertThat(HeadingContentItemSplitter.slug("  API v2 ")).isEqualTo("api-v2");
    }
}
