package work.lcod.specdoc.render;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.zip.ZipEntry;
import org.apache.commons.compress.archivers.zip.Zip64Mode;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveInputStream;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;

/**
 * Rewrites a ZIP package with every entry stamped at the same fixed time, keeping entry order and
 * content. The document library stamps entries with the wall clock, which would make two runs
 * over the same input differ.
 */
final class ArchiveNormalizer {
    private static final LocalDateTime FIXED_TIME = LocalDateTime.of(1980, 1, 1, 0, 0);

    private ArchiveNormalizer() {}

    static byte[] normalize(byte[] archive) throws IOException {
        long stamp = FIXED_TIME.atZone(ZoneId.systemDefault()).toInstant().toEpochMilli();
        var out = new ByteArrayOutputStream(archive.length);
        try (
            ZipArchiveInputStream in = new ZipArchiveInputStream(new ByteArrayInputStream(archive));
            ZipArchiveOutputStream zip = new ZipArchiveOutputStream(out)
        ) {
            zip.setUseZip64(Zip64Mode.Never);
            ZipArchiveEntry entry;
            while ((entry = in.getNextZipEntry()) != null) {
                var copy = new ZipArchiveEntry(entry.getName());
                copy.setTime(stamp);
                copy.setMethod(ZipEntry.DEFLATED);
                zip.putArchiveEntry(copy);
                in.transferTo(zip);
                zip.closeArchiveEntry();
            }
            zip.finish();
        }
        return out.toByteArray();
    }
}
