package io.github.stephanpirnbaum.mermaid.export.discovery;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link MarkdownBlockExtractor}.
 */
class MarkdownBlockExtractorTest {

    private final MarkdownBlockExtractor extractor = new MarkdownBlockExtractor();

    @Test
    void extract_findsBlocksInDocumentOrder() {
        String markdown = "# Title\n"
                + "\n"
                + "```mermaid\n"
                + "graph TD\n"
                + "  A --> B\n"
                + "```\n"
                + "\n"
                + "```java\n"
                + "class Foo {}\n"
                + "```\n"
                + "\n"
                + "```mermaid\n"
                + "sequenceDiagram\n"
                + "  Alice->>Bob: Hi\n"
                + "```\n";

        List<MarkdownBlockExtractor.Block> blocks = extractor.extract(markdown);

        assertThat(blocks).extracting(MarkdownBlockExtractor.Block::getText)
                .containsExactly("graph TD\n  A --> B", "sequenceDiagram\n  Alice->>Bob: Hi");
        assertThat(blocks).extracting(MarkdownBlockExtractor.Block::getStartLine).containsExactly(3, 12);
    }

    @Test
    void extract_acceptsIndentedAndUpperCaseFences() {
        String markdown = "- item\n"
                + "    ```Mermaid\n"
                + "    graph LR\n"
                + "      A --> B\n"
                + "    ```\n";

        List<MarkdownBlockExtractor.Block> blocks = extractor.extract(markdown);

        assertThat(blocks).singleElement()
                .extracting(MarkdownBlockExtractor.Block::getText)
                .isEqualTo("graph LR\n  A --> B");
    }

    @Test
    void extract_trimsTrailingWhitespacePerLine() {
        String markdown = "```mermaid\r\ngraph TD   \r\n  A --> B\t\r\n```\r\n";

        assertThat(extractor.extract(markdown)).singleElement()
                .extracting(MarkdownBlockExtractor.Block::getText)
                .isEqualTo("graph TD\n  A --> B");
    }

    @Test
    void extract_dropsBlankBlocks() {
        String markdown = "```mermaid\n\n   \n```\n";

        assertThat(extractor.extract(markdown)).isEmpty();
    }

    @Test
    void extract_ignoresUnterminatedBlock() {
        String markdown = "```mermaid\ngraph TD\n  A --> B\n";

        assertThat(extractor.extract(markdown)).isEmpty();
    }

    @Test
    void extract_withoutMermaidBlocks_returnsEmptyList() {
        assertThat(extractor.extract("# Just text\n\n```\nplain\n```\n")).isEmpty();
    }

}
