package io.github.stephanpirnbaum.mermaid.export.batch;

import io.github.stephanpirnbaum.mermaid.export.ExportFileSystemException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Persists rendered artifacts. Bytes are written to a hidden sibling file first and moved into place, so the final
 * file name never refers to a partially written artifact.
 *
 * @author Stephan Pirnbaum
 */
@Slf4j
public class ArtifactWriter {

    public void write(Path target, byte[] bytes) throws ExportFileSystemException {
        Path directory = target.toAbsolutePath().getParent();
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new ExportFileSystemException("Failed to create output directory " + directory, e);
        }

        Path temp = null;
        try {
            temp = Files.createTempFile(directory, "." + target.getFileName(), ".tmp");
            Files.write(temp, bytes);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Wrote {} bytes to {}", bytes.length, target);
        } catch (IOException e) {
            throw new ExportFileSystemException("Failed to write " + target, e);
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
    }

    private static void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to delete temporary file {}: {}", temp, e.getMessage());
        }
    }

}
