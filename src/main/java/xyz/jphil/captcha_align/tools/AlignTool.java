package xyz.jphil.captcha_align.tools;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import xyz.jphil.captcha_align.tools.align.CancellationToken;
import xyz.jphil.captcha_align.tools.folder.FolderAlignCommand;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;

/**
 * Command-line slider captcha aligner.
 * Finds the background offset at which the glyph strokes line up and writes the composite.
 */
@Command(
    name = "captcha-align",
    mixinStandardHelpOptions = true,
    version = "1.0",
    description = "Align the background layer of a slider captcha under its foreground glyphs",
    subcommands = {FolderAlignCommand.class}
)
public class AlignTool implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_CANCELLED = 2;

    @Parameters(index = "0", arity = "0..1",
        description = "Captcha JSON (img/bg as base64 PNG) or foreground image")
    private File inputFile;

    @Option(names = {"--bg"}, description = "Background image, when the input is a foreground image")
    private File backgroundFile;

    @Option(names = {"--offset"}, description = "Skip the search and composite at this offset (truncated toward zero)")
    private Float customOffset;

    @Option(names = {"--replay"}, description = "Re-composite at the offset stored in an earlier result JSON")
    private File replayFile;

    @Option(names = {"-o", "--output"}, description = "Composite PNG (default: input.ext.aligned.png)")
    private File pngFile;

    @Option(names = {"--json"}, description = "Result JSON (default: input.ext.aligned.json)")
    private File jsonFile;

    @Option(names = {"--no-defaults"}, description = "Don't generate default outputs, only specified files")
    private boolean noDefaults;

    @Option(names = {"-t", "--threads"}, description = "Worker threads for folder mode (default: ${DEFAULT-VALUE})", defaultValue = "1")
    private int threads;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new AlignTool()).execute(args);
        System.exit(exitCode);
    }

    public int getThreads() {
        return Math.max(1, threads);
    }

    @Override
    public Integer call() throws Exception {
        var log = LogFormatter.standard(verbose);
        try {
            if (inputFile == null) {
                System.err.println("Error: Missing input file");
                return EXIT_ERROR;
            }
            if (customOffset != null && replayFile != null) {
                System.err.println("Error: --offset and --replay are mutually exclusive");
                return EXIT_ERROR;
            }

            Float offset = customOffset;
            if (replayFile != null) {
                var replayed = AlignmentJsonSerializer.fromJson(Files.readString(replayFile.toPath()));
                offset = replayed.replayOffset();
                log.info("REPLAY", "Using offset " + replayed.offset() + " from " + replayFile.getName());
            }

            var request = new AlignmentRunner.Request(
                inputFile.toPath(),
                backgroundFile != null ? backgroundFile.toPath() : null,
                offset,
                replayFile != null,
                outputPath(pngFile, "png"),
                outputPath(jsonFile, "json"));

            var record = new AlignmentRunner(log).run(request, CancellationToken.none());

            System.out.printf("offset=%d disorder=%.4f size=%dx%d%n",
                record.offset(), record.disorder(), record.width(), record.height());
            return EXIT_OK;

        } catch (CancellationException e) {
            System.err.println("Cancelled: " + e.getMessage());
            return EXIT_CANCELLED;
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            if (verbose) {
                e.printStackTrace();
            }
            return EXIT_ERROR;
        }
    }

    /**
     * Explicit file, else input.ext.aligned.{extension} unless defaults are disabled
     */
    private Path outputPath(File explicit, String extension) {
        if (explicit != null) return explicit.toPath();
        if (noDefaults) return null;
        return defaultOutput(inputFile.toPath(), extension);
    }

    public static Path defaultOutput(Path input, String extension) {
        return input.resolveSibling(input.getFileName() + ".aligned." + extension);
    }
}
