package work.lcod.specdoc.render;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import work.lcod.specdoc.shared.SpecDocException;

/**
 * Publishes the serialized artifact: bytes go to a temporary file next to the target, which is
 * then moved into place. Readers never observe a partially written file.
 */
public final class ArtifactWriter {
    private ArtifactWriter() {}

    public static Path write(Path target, byte[] bytes) {
        var destination = target.toAbsolutePath().normalize();
        var directory = destination.getParent();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, "." + destination.getFileName(), ".tmp");
            Files.write(temp, bytes);
            move(temp, destination);
            return destination;
        } catch (IOException ex) {
            throw new SpecDocException("write_error", "Unable to write " + destination + ": " + ex.getMessage(), ex);
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
    }

    private static void move(Path source, Path destination) throws IOException {
        try {
            Files.move(source, destination, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(source, destination, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException ignored) {
            // the temp file is hidden and carries a .tmp suffix; a leftover is harmless
        }
    }
}
