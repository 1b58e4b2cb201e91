package work.lcod.specdoc.api;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.specdoc.assembly.AssembledDocument;
import work.lcod.specdoc.assembly.Assembler;
import work.lcod.specdoc.assembly.AssemblyException;
import work.lcod.specdoc.node.AuthoringException;
import work.lcod.specdoc.primitives.Primitives;
import work.lcod.specdoc.render.ArtifactWriter;
import work.lcod.specdoc.render.DocxSerializer;
import work.lcod.specdoc.render.SerializationException;
import work.lcod.specdoc.shared.SpecDocException;

/**
 * Public entry point for embedding the generator: assemble the manifest, serialize it, write the
 * artifact. Nothing is written unless every step succeeds.
 */
public final class SpecDocRunner {
    private static final Logger LOG = LoggerFactory.getLogger(SpecDocRunner.class);

    public RunResult run(GenerationConfiguration configuration) {
        var started = Instant.now();
        var manifest = configuration.manifest();
        var style = configuration.style();
        try {
            var primitives = new Primitives(style);
            AssembledDocument assembled = new Assembler(style).assemble(manifest, primitives);
            var bytes = new DocxSerializer(manifest.metadata()).serialize(assembled.nodes(), style);
            var written = ArtifactWriter.write(configuration.outputPath(), bytes);

            var metadata = new LinkedHashMap<String, Object>();
            metadata.put(RunResult.OUTPUT, written.toString());
            metadata.put("title", manifest.metadata().title());
            metadata.put("chapters", manifest.size());
            metadata.put("nodes", assembled.nodes().size());
            metadata.put(RunResult.SECTIONS, assembled.pageBreakCount() + 1);
            metadata.put("bytes", bytes.length);
            metadata.put(RunResult.WARNINGS, warnings(assembled));
            metadata.put("logLevel", configuration.logLevel().name());
            LOG.info("Wrote {} ({} bytes, {} sections)", written, bytes.length, assembled.pageBreakCount() + 1);
            return RunResult.success(metadata, started);
        } catch (RuntimeException ex) {
            var errorMeta = describe(ex);
            errorMeta.put(RunResult.OUTPUT, configuration.outputPath().toString());
            LOG.info("Generation failed: {}", ex.getMessage());
            if (Boolean.getBoolean("specdoc.debug")) {
                ex.printStackTrace();
            }
            return RunResult.failure(ex.getMessage(), errorMeta, started);
        }
    }

    private static List<String> warnings(AssembledDocument assembled) {
        return assembled.warnings().stream().map(Object::toString).collect(Collectors.toList());
    }

    private static Map<String, Object> describe(RuntimeException ex) {
        var meta = new LinkedHashMap<String, Object>();
        meta.put(RunResult.CODE, ex instanceof SpecDocException failure ? failure.code() : "internal_error");
        if (ex instanceof AssemblyException assembly) {
            meta.put(RunResult.CHAPTER_INDEX, assembly.chapterIndex());
            meta.put(RunResult.CHAPTER, assembly.chapterId());
            assembly.nodeType().ifPresent(type -> meta.put("nodeType", type));
        } else if (ex instanceof AuthoringException authoring) {
            authoring.chapterIndex().ifPresent(index -> meta.put(RunResult.CHAPTER_INDEX, index));
            if (authoring.chapterId() != null) {
                meta.put(RunResult.CHAPTER, authoring.chapterId());
            }
            meta.put("nodeType", authoring.nodeType());
        } else if (ex instanceof SerializationException serialization) {
            meta.put("nodeIndex", serialization.nodeIndex());
            meta.put("nodeType", serialization.nodeType());
        }
        if (ex.getMessage() != null && !ex.getMessage().isBlank()) {
            meta.put(RunResult.ERROR, ex.getMessage());
        }
        return meta;
    }
}
