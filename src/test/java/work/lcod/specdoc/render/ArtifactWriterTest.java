package work.lcod.specdoc.render;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.specdoc.shared.SpecDocException;

class ArtifactWriterTest {
    @TempDir
    Path tempDir;

    @Test
    void createsParentDirectories() throws Exception {
        var target = tempDir.resolve("out/nested/doc.docx");
        var written = ArtifactWriter.write(target, new byte[] { 1, 2, 3 });

        assertEquals(target.toAbsolutePath().normalize(), written);
        assertArrayEquals(new byte[] { 1, 2, 3 }, Files.readAllBytes(target));
    }

    @Test
    void replacesExistingFileWithoutLeftovers() throws Exception {
        var target = tempDir.resolve("doc.docx");
        Files.write(target, new byte[] { 9 });

        ArtifactWriter.write(target, new byte[] { 4, 5 });

        assertArrayEquals(new byte[] { 4, 5 }, Files.readAllBytes(target));
        assertEquals(List.of("doc.docx"), listing(tempDir));
    }

    @Test
    void failedMoveCleansUpTemporaryFile() throws Exception {
        var target = tempDir.resolve("occupied");
        Files.createDirectories(target);
        Files.write(target.resolve("keep.txt"), new byte[] { 1 });

        var ex = assertThrows(SpecDocException.class, () -> ArtifactWriter.write(target, new byte[] { 7 }));

        assertEquals("write_error", ex.code());
        assertEquals(List.of("occupied"), listing(tempDir));
    }

    private static List<String> listing(Path directory) throws Exception {
        try (var files = Files.list(directory)) {
            return files.map(path -> path.getFileName().toString()).sorted().collect(Collectors.toList());
        }
    }
}
