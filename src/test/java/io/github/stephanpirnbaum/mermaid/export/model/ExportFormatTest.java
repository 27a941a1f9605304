package io.github.stephanpirnbaum.mermaid.export.model;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the option enums and value types of the model.
 */
class ExportFormatTest {

    @Test
    void fromValue_isCaseInsensitive() {
        assertThat(ExportFormat.fromValue(" PNG ")).isEqualTo(ExportFormat.PNG);
        assertThat(MermaidTheme.fromValue("Forest")).isEqualTo(MermaidTheme.FOREST);
        assertThat(NamingMode.fromValue("OVERWRITE")).isEqualTo(NamingMode.OVERWRITE);
    }

    @Test
    void fromValue_withUnknownValue_throws() {
        assertThatThrownBy(() -> ExportFormat.fromValue("tiff"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("tiff");
    }

    @Test
    void jpgAndJpegAreDistinctExtensions() {
        assertThat(ExportFormat.JPG.getExtension()).isEqualTo("jpg");
        assertThat(ExportFormat.JPEG.getExtension()).isEqualTo("jpeg");
        assertThat(ExportFormat.SVG.isRaster()).isFalse();
        assertThat(ExportFormat.WEBP.isRaster()).isTrue();
    }

    @Test
    void renderOptions_transparentBackgroundIsCaseInsensitive() {
        assertThat(RenderOptions.defaults().isTransparent()).isTrue();
        assertThat(RenderOptions.builder().backgroundColor(" Transparent ").build().isTransparent()).isTrue();
        assertThat(RenderOptions.builder().backgroundColor("#fff").build().isTransparent()).isFalse();
    }

    @Test
    void diagramSource_describeAddsBlockNumber() {
        DiagramSource block = DiagramSource.builder()
                .path(Path.of("docs", "guide.md"))
                .rawText("graph TD")
                .kind(SourceKind.EMBEDDED_BLOCK)
                .blockIndex(1)
                .documentBlockCount(2)
                .build();

        assertThat(block.describe()).isEqualTo(Path.of("docs", "guide.md") + "#2");
        assertThat(DiagramSource.standalone(Path.of("a.mmd"), "graph TD").describe()).isEqualTo("a.mmd");
    }

}
