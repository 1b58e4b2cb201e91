package work.lcod.specdoc.api;

import java.nio.file.Path;
import java.util.Objects;
import work.lcod.specdoc.chapter.DocumentManifest;
import work.lcod.specdoc.style.StyleConstants;

/**
 * Immutable configuration of one generation run.
 */
public record GenerationConfiguration(
    Path outputPath,
    DocumentManifest manifest,
    StyleConstants style,
    LogLevel logLevel
) {
    public GenerationConfiguration {
        Objects.requireNonNull(outputPath, "outputPath");
        Objects.requireNonNull(manifest, "manifest");
        Objects.requireNonNull(style, "style");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path outputPath;
        private DocumentManifest manifest;
        private StyleConstants style = StyleConstants.defaults();
        private LogLevel logLevel = LogLevel.WARN;

        public Builder outputPath(Path outputPath) {
            this.outputPath = outputPath;
            return this;
        }

        public Builder manifest(DocumentManifest manifest) {
            this.manifest = manifest;
            return this;
        }

        public Builder style(StyleConstants style) {
            this.style = style;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public GenerationConfiguration build() {
            return new GenerationConfiguration(outputPath, manifest, style, logLevel);
        }
    }
}
