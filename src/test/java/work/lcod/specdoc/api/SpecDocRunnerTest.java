package work.lcod.specdoc.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.specdoc.chapter.DocumentManifest;
import work.lcod.specdoc.support.SpecDocTestSupport;

class SpecDocRunnerTest {
    @TempDir
    Path tempDir;

    @Test
    void writesDocumentAndReportsStructure() throws Exception {
        var output = tempDir.resolve("abc.docx");
        var config = GenerationConfiguration.builder()
            .outputPath(output)
            .manifest(SpecDocTestSupport.abcManifest(List.of(5000, 4000)))
            .style(SpecDocTestSupport.narrowStyle())
            .logLevel(LogLevel.INFO)
            .build();

        var result = new SpecDocRunner().run(config);

        assertEquals(RunResult.Status.SUCCESS, result.status());
        assertTrue(Files.size(output) > 0);
        assertEquals(3L, result.metadata().get("sections"));
        assertEquals(3L, result.sections().getAsLong());
        assertEquals(output.toAbsolutePath().normalize(), result.output().orElseThrow());
        assertTrue(result.warnings().isEmpty());
        assertTrue(result.errorCode().isEmpty());
        assertEquals(3, result.metadata().get("chapters"));
        assertEquals(output.toAbsolutePath().normalize().toString(), result.metadata().get("output"));
        assertEquals(List.of(), result.metadata().get("warnings"));
        try (var document = SpecDocTestSupport.open(Files.readAllBytes(output))) {
            assertEquals(3, SpecDocTestSupport.sectionCount(document));
        }
    }

    @Test
    void tooWideTableFailsWithoutWritingAnything() {
        var output = tempDir.resolve("abc.docx");
        var config = GenerationConfiguration.builder()
            .outputPath(output)
            .manifest(SpecDocTestSupport.abcManifest(List.of(5000, 5000)))
            .style(SpecDocTestSupport.narrowStyle())
            .build();

        var result = new SpecDocRunner().run(config);

        assertEquals(RunResult.Status.FAILURE, result.status());
        assertEquals(1, result.status().exitCode());
        assertEquals("authoring_error", result.metadata().get("code"));
        assertEquals("ChapterB", result.metadata().get("chapter"));
        assertEquals("ChapterB", result.failedChapter().orElseThrow());
        assertEquals(1, result.failedChapterIndex().getAsInt());
        assertTrue(result.sections().isEmpty());
        assertEquals("table", result.metadata().get("nodeType"));
        assertTrue(String.valueOf(result.metadata().get("error")).contains("ChapterB"));
        assertFalse(Files.exists(output));
    }

    @Test
    void failingBuilderLeavesPreviousArtifactUntouched() throws Exception {
        var output = tempDir.resolve("doc.docx");
        Files.write(output, new byte[] { 42 });
        var manifest = DocumentManifest.builder(SpecDocTestSupport.metadata())
            .chapter("ok", lib -> lib.p("fine"))
            .chapter("broken", lib -> {
                throw new IllegalStateException("boom");
            })
            .build();
        var config = GenerationConfiguration.builder().outputPath(output).manifest(manifest).build();

        var result = new SpecDocRunner().run(config);

        assertEquals("assembly_error", result.errorCode().orElseThrow());
        assertEquals(1, result.metadata().get("chapterIndex"));
        assertEquals(1, Files.readAllBytes(output).length);
    }

    @Test
    void reportSerializesToJson() {
        var config = GenerationConfiguration.builder()
            .outputPath(tempDir.resolve("doc.docx"))
            .manifest(SpecDocTestSupport.abcManifest(List.of(4680, 4680)))
            .build();

        var json = new SpecDocRunner().run(config).toPrettyJson();

        assertTrue(json.contains("\"status\" : \"success\""));
        assertTrue(json.contains("\"sections\" : 3"));
    }
}
