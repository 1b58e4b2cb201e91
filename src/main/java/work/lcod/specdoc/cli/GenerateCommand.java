package work.lcod.specdoc.cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.specdoc.api.GenerationConfiguration;
import work.lcod.specdoc.api.LogLevel;
import work.lcod.specdoc.api.RunResult;
import work.lcod.specdoc.api.SpecDocRunner;
import work.lcod.specdoc.chapter.reference.ReferenceManifest;
import work.lcod.specdoc.style.StyleLoader;

@CommandLine.Command(
    name = "specdoc",
    description = "Assemble the reference chapters and write them as a .docx document.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class GenerateCommand implements Callable<Integer> {
    @CommandLine.Option(
        names = {"-o", "--output"},
        paramLabel = "PATH",
        description = "Destination of the generated document.",
        defaultValue = "specdoc.docx"
    )
    private String output;

    @CommandLine.Option(
        names = "--style",
        paramLabel = "TOML",
        description = "TOML file overriding the default style constants.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String style;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Option(
        names = "--no-front-matter",
        description = "Skip the cover page and the table of contents."
    )
    private boolean noFrontMatter;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        LogLevel logLevel = resolveLogLevel();
        logLevel.install();

        Path stylePath = null;
        if (style != null && !style.isBlank()) {
            stylePath = Paths.get(style).toAbsolutePath().normalize();
            if (!Files.isRegularFile(stylePath)) {
                throw new CommandLine.ParameterException(spec.commandLine(), "Style file not found: " + stylePath);
            }
        }

        GenerationConfiguration configuration = GenerationConfiguration.builder()
            .outputPath(Paths.get(output).toAbsolutePath().normalize())
            .manifest(ReferenceManifest.create(!noFrontMatter))
            .style(StyleLoader.load(stylePath))
            .logLevel(logLevel)
            .build();

        RunResult result = new SpecDocRunner().run(configuration);
        spec.commandLine().getOut().println(result.toPrettyJson());
        spec.commandLine().getOut().flush();
        return result.status().exitCode();
    }

    private LogLevel resolveLogLevel() {
        try {
            return LogLevel.from(logLevelRaw);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
    }
}
