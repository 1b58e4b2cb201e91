package work.lcod.specdoc.render;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.specdoc.chapter.DocumentMetadata;
import work.lcod.specdoc.node.ContentNode;
import work.lcod.specdoc.style.StyleConstants;

/**
 * Turns an assembled node stream into the bytes of a {@code .docx} package. Each page break closes
 * one section, so a stream with {@code n} page breaks yields {@code n + 1} sections sharing the
 * page geometry, header and footer.
 *
 * <p>Output depends only on the nodes, the style and the metadata: package timestamps are pinned
 * to {@link DocumentMetadata#issued()} and the archive is normalized.
 */
public final class DocxSerializer {
    private static final Logger LOG = LoggerFactory.getLogger(DocxSerializer.class);
    private static final String DEFAULT_CREATOR = "specdoc";

    private final DocumentMetadata metadata;

    public DocxSerializer(DocumentMetadata metadata) {
        this.metadata = Objects.requireNonNull(metadata, "metadata");
    }

    public byte[] serialize(List<ContentNode> nodes, StyleConstants style) {
        Objects.requireNonNull(nodes, "nodes");
        Objects.requireNonNull(style, "style");
        var outline = Outline.of(nodes, metadata.numberHeadings());
        try (var document = new XWPFDocument()) {
            var emitter = new DocxEmitter(document, style, outline);
            try {
                emitter.prepare(metadata);
            } catch (RuntimeException ex) {
                throw new SerializationException(-1, "document", "unable to set up page layout: " + ex.getMessage(), ex);
            }
            for (int index = 0; index < nodes.size(); index++) {
                var node = nodes.get(index);
                try {
                    emitter.emit(node, index);
                } catch (RuntimeException ex) {
                    throw new SerializationException(index, node.type(), reason(ex), ex);
                }
            }
            applyProperties(document);

            var raw = new ByteArrayOutputStream();
            document.write(raw);
            var bytes = ArchiveNormalizer.normalize(raw.toByteArray());
            LOG.debug("Serialized {} nodes ({} outline entries) into {} bytes", nodes.size(), outline.entries().size(), bytes.length);
            return bytes;
        } catch (IOException ex) {
            throw new SerializationException(-1, "document", "unable to write package: " + ex.getMessage(), ex);
        }
    }

    private void applyProperties(XWPFDocument document) {
        var core = document.getProperties().getCoreProperties();
        var issued = Date.from(metadata.issued().atStartOfDay(ZoneOffset.UTC).toInstant());
        core.setTitle(metadata.title());
        if (!metadata.subtitle().isEmpty()) {
            core.setSubjectProperty(metadata.subtitle());
        }
        core.setCreator(metadata.author().isEmpty() ? DEFAULT_CREATOR : metadata.author());
        if (!metadata.version().isEmpty()) {
            core.setDescription("Version " + metadata.version());
        }
        core.setCreated(Optional.of(issued));
        core.setModified(Optional.of(issued));
    }

    private static String reason(RuntimeException ex) {
        return ex.getMessage() == null || ex.getMessage().isBlank() ? ex.getClass().getSimpleName() : ex.getMessage();
    }
}
