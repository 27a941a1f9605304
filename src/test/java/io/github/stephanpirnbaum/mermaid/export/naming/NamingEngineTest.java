package io.github.stephanpirnbaum.mermaid.export.naming;

import io.github.stephanpirnbaum.mermaid.export.ExportFileSystemException;
import io.github.stephanpirnbaum.mermaid.export.model.ExportFormat;
import io.github.stephanpirnbaum.mermaid.export.model.NamingMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link NamingEngine}. Artifacts are simulated by creating files at the resolved paths.
 */
class NamingEngineTest {

    @TempDir
    Path outputDir;

    private final NamingEngine engine = new NamingEngine();

    @Test
    void versioned_exampleScenario() throws Exception {
        String first = "flow A->B";
        String second = "flow A->B->C";
        String hashA = HashingUtil.shortHash(first);
        String hashB = HashingUtil.shortHash(second);

        NamingRecord r1 = export(first);
        assertThat(r1.getOutputPath().getFileName().toString()).isEqualTo("diagram-01-" + hashA + ".svg");
        assertThat(r1.isReused()).isFalse();

        NamingRecord r2 = export(first);
        assertThat(r2.getOutputPath()).isEqualTo(r1.getOutputPath());
        assertThat(r2.isReused()).isTrue();

        NamingRecord r3 = export(second);
        assertThat(r3.getOutputPath().getFileName().toString()).isEqualTo("diagram-02-" + hashB + ".svg");
        assertThat(r3.isReused()).isFalse();

        NamingRecord r4 = export(first);
        assertThat(r4.getOutputPath()).isEqualTo(r1.getOutputPath());
        assertThat(r4.isReused()).isTrue();
    }

    @Test
    void versioned_distinctContents_yieldStrictlyIncreasingSequences() throws Exception {
        assertThat(export("graph TD\nA-->B").getSequenceNumber()).isEqualTo(1);
        assertThat(export("graph TD\nA-->C").getSequenceNumber()).isEqualTo(2);
        assertThat(export("graph TD\nA-->D").getSequenceNumber()).isEqualTo(3);
    }

    @Test
    void versioned_contentDifferingOnlyInSurroundingWhitespace_isReused() throws Exception {
        NamingRecord first = export("graph TD\nA-->B");

        NamingRecord second = export("\n  graph TD\nA-->B  \n");

        assertThat(second.getOutputPath()).isEqualTo(first.getOutputPath());
        assertThat(second.isReused()).isTrue();
    }

    @Test
    void versioned_withEmptyContent_namesDeterministically() throws Exception {
        NamingRecord record = export("");

        assertThat(record.getOutputPath().getFileName().toString()).isEqualTo("diagram-01-e3b0c442.svg");
        assertThat(export("   ").isReused()).isTrue();
    }

    @Test
    void versioned_sequencesAreScopedPerBaseNameAndFormat() throws Exception {
        export("graph TD\nA-->B");
        export("graph TD\nA-->C");

        NamingRecord otherFormat = engine.resolve(outputDir, "diagram", ExportFormat.PNG, "graph TD\nA-->B", NamingMode.VERSIONED);
        NamingRecord otherBase = engine.resolve(outputDir, "flow", ExportFormat.SVG, "graph TD\nA-->B", NamingMode.VERSIONED);

        assertThat(otherFormat.getSequenceNumber()).isEqualTo(1);
        assertThat(otherBase.getSequenceNumber()).isEqualTo(1);
    }

    @Test
    void versioned_continuesAfterHighestExistingSequence() throws Exception {
        Files.createFile(outputDir.resolve("diagram-07-0badc0de.svg"));
        Files.createFile(outputDir.resolve("diagram-notes.svg"));

        NamingRecord record = export("graph LR\nX-->Y");

        assertThat(record.getSequenceNumber()).isEqualTo(8);
    }

    @Test
    void versioned_ignoresNamesWithOversizedSequence() throws Exception {
        Files.createFile(outputDir.resolve("diagram-99999999999-0123abcd.svg"));
        Files.createFile(outputDir.resolve("diagram-2147483647-0123abcd.svg"));

        NamingRecord first = export("graph TD\nA-->B");
        NamingRecord again = export("graph TD\nA-->B");

        assertThat(first.getSequenceNumber()).isEqualTo(1);
        assertThat(again.getOutputPath()).isEqualTo(first.getOutputPath());
        assertThat(again.isReused()).isTrue();
    }

    @Test
    void versioned_atHighestSequence_reusesButRefusesToAllocate() throws Exception {
        String content = "graph TD\nA-->B";
        Path last = outputDir.resolve(String.format("diagram-%d-%s.svg", VersionedNamingPolicy.MAX_SEQUENCE, HashingUtil.shortHash(content)));
        Files.createFile(last);

        NamingRecord reused = export(content);

        assertThat(reused.getOutputPath()).isEqualTo(last);
        assertThat(reused.isReused()).isTrue();
        assertThatThrownBy(() -> export("graph TD\nA-->C"))
                .isInstanceOf(ExportFileSystemException.class)
                .hasMessageContaining("No sequence number left");
    }

    @Test
    void versioned_withMissingDirectory_startsAtOne() throws Exception {
        Path missing = outputDir.resolve("not-yet-created");

        NamingRecord record = engine.resolve(missing, "diagram", ExportFormat.SVG, "graph TD", NamingMode.VERSIONED);

        assertThat(record.getSequenceNumber()).isEqualTo(1);
        assertThat(record.getOutputPath().getParent()).isEqualTo(missing);
    }

    @Test
    void overwrite_pathIsStableAcrossContents() throws Exception {
        NamingRecord first = engine.resolve(outputDir, "diagram", ExportFormat.SVG, "flow A->B", NamingMode.OVERWRITE);
        Files.createFile(first.getOutputPath());

        NamingRecord second = engine.resolve(outputDir, "diagram", ExportFormat.SVG, "flow A->B->C", NamingMode.OVERWRITE);

        assertThat(second.getOutputPath()).isEqualTo(first.getOutputPath());
        assertThat(first.getOutputPath().getFileName().toString()).isEqualTo("diagram1.svg");
        assertThat(second.getSequenceNumber()).isNull();
    }

    @Test
    void overwrite_neverSkips() throws Exception {
        NamingRecord first = engine.resolve(outputDir, "diagram", ExportFormat.SVG, "flow A->B", NamingMode.OVERWRITE);
        Files.createFile(first.getOutputPath());

        NamingRecord again = engine.resolve(outputDir, "diagram", ExportFormat.SVG, "flow A->B", NamingMode.OVERWRITE);

        assertThat(again.isReused()).isFalse();
        assertThat(engine.shouldSkipExport(first.getOutputPath(), "flow A->B", NamingMode.OVERWRITE)).isFalse();
    }

    @Test
    void overwrite_carriesTrailingNumberOfBaseName() throws Exception {
        NamingRecord record = engine.resolve(outputDir, "guide-2", ExportFormat.PNG, "graph TD", NamingMode.OVERWRITE);

        assertThat(record.getOutputPath().getFileName().toString()).isEqualTo("guide2.png");
    }

    @Test
    void shouldSkipExport_versioned_requiresExistingFileWithMatchingName() throws IOException {
        String content = "graph TD";
        String hash = HashingUtil.shortHash(content);
        Path versioned = outputDir.resolve("diagram-01-" + hash + ".svg");
        Path unversioned = outputDir.resolve("diagram.svg");

        assertThat(engine.shouldSkipExport(versioned, content, NamingMode.VERSIONED)).isFalse();

        Files.createFile(versioned);
        Files.createFile(unversioned);

        assertThat(engine.shouldSkipExport(versioned, content, NamingMode.VERSIONED)).isTrue();
        assertThat(engine.shouldSkipExport(unversioned, content, NamingMode.VERSIONED)).isFalse();
        assertThat(engine.shouldSkipExport(versioned, "graph LR", NamingMode.VERSIONED)).isFalse();
    }

    @Test
    void resolve_withUnsanitizedBaseName_throws() {
        assertThatThrownBy(() -> engine.resolve(outputDir, "../evil", ExportFormat.SVG, "graph TD", NamingMode.VERSIONED))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void acquire_sameTriple_isExclusiveAcrossThreads() throws Exception {
        AtomicBoolean otherAcquired = new AtomicBoolean();
        Thread other;
        try (NamingEngine.SequenceLock held = engine.acquire(outputDir, "diagram", ExportFormat.SVG)) {
            other = new Thread(() -> {
                try (NamingEngine.SequenceLock sameTriple = engine.acquire(outputDir.resolve("x").resolve(".."), "diagram", ExportFormat.SVG)) {
                    otherAcquired.set(true);
                }
            });
            other.start();
            other.join(200);

            assertThat(otherAcquired).isFalse();
        }
        other.join(5_000);

        assertThat(otherAcquired).isTrue();
    }

    @Test
    void acquire_releasedLocks_areForgotten() {
        try (NamingEngine.SequenceLock svg = engine.acquire(outputDir, "diagram", ExportFormat.SVG);
             NamingEngine.SequenceLock svgAgain = engine.acquire(outputDir, "diagram", ExportFormat.SVG);
             NamingEngine.SequenceLock png = engine.acquire(outputDir, "diagram", ExportFormat.PNG)) {
            assertThat(engine.lockCount()).isEqualTo(2);
        }

        assertThat(engine.lockCount()).isZero();
    }

    private NamingRecord export(String content) throws Exception {
        NamingRecord record = engine.resolve(outputDir, "diagram", ExportFormat.SVG, content, NamingMode.VERSIONED);
        if (!record.isReused()) {
            Files.writeString(record.getOutputPath(), content);
        }
        return record;
    }

}
