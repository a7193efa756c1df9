package xyz.jphil.captcha_align.tools.folder;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import xyz.jphil.captcha_align.tools.AlignTool;
import xyz.jphil.captcha_align.tools.AlignmentRecord;
import xyz.jphil.captcha_align.tools.AlignmentRunner;
import xyz.jphil.captcha_align.tools.LogFormatter;
import xyz.jphil.captcha_align.tools.ProgressTracker;
import xyz.jphil.captcha_align.tools.align.CancellationToken;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Folder subcommand for AlignTool.
 * Aligns every captcha descriptor in a folder on a worker pool, one independent search per captcha.
 */
@Command(
    name = "folder",
    description = "Align all captcha JSON files in a folder",
    mixinStandardHelpOptions = true
)
public class FolderAlignCommand implements Callable<Integer> {

    @ParentCommand
    private AlignTool parentCommand;

    @Parameters(index = "0", description = "Input folder containing captcha JSON files")
    private File inputFolder;

    @Option(names = {"-r", "--recursive"}, description = "Process files in subfolders recursively")
    private boolean recursive = false;

    @Option(names = {"-o", "--output"},
        description = "Output root directory. Preserves input folder structure (default: same as input)")
    private File outputFolder;

    @Option(names = {"--timeout"},
        description = "Give up on a captcha after this many seconds, fractions allowed (default: ${DEFAULT-VALUE})")
    private double timeoutSeconds = 30;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose = false;

    private int getThreads() {
        return parentCommand != null ? parentCommand.getThreads() : 1;
    }

    @Override
    public Integer call() throws Exception {
        if (!inputFolder.exists() || !inputFolder.isDirectory()) {
            System.err.println("Error: Input folder does not exist or is not a directory: " + inputFolder);
            return 1;
        }
        if (!(timeoutSeconds > 0)) {
            System.err.println("Error: --timeout must be a positive number of seconds: " + timeoutSeconds);
            return 1;
        }
        var timeout = timeout();

        Path outputPath = outputFolder != null ? outputFolder.toPath() : inputFolder.toPath();
        Files.createDirectories(outputPath);

        var fileProcessor = new FileProcessor(inputFolder.toPath(), recursive);
        var files = fileProcessor.discoverFiles();
        if (files.isEmpty()) {
            System.err.println("No captcha JSON files found in " + inputFolder);
            return 0;
        }

        var log = LogFormatter.timestamped(verbose);
        log.info("FOLDER", String.format("Found %d captcha files, %d threads", files.size(), getThreads()));

        var progress = new ProgressTracker("Captcha alignment", files.size(), verbose).start();
        var runner = new AlignmentRunner(log);
        ExecutorService executor = Executors.newFixedThreadPool(getThreads());

        int successCount = 0;
        int errorCount = 0;
        try {
            List<Future<AlignmentRecord>> futures = new ArrayList<>();
            for (Path file : files) {
                var request = new AlignmentRunner.Request(
                    file, null, null, false,
                    fileProcessor.outputPath(file, outputPath, ".aligned.png"),
                    fileProcessor.outputPath(file, outputPath, ".aligned.json"));
                futures.add(executor.submit(() -> runner.run(request, deadline(timeout))));
            }

            for (int i = 0; i < futures.size(); i++) {
                var name = files.get(i).getFileName();
                try {
                    futures.get(i).get();
                    successCount++;
                } catch (ExecutionException e) {
                    var cause = e.getCause();
                    if (cause instanceof CancellationException) {
                        progress.err(String.format("%s timed out after %s", name, LogFormatter.formatDuration(timeout)));
                    } else {
                        progress.err(String.format("Failed to process %s: %s", name, cause.getMessage()));
                    }
                    errorCount++;
                }
                progress.inc();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.println("Interrupted, stopping workers");
            errorCount++;
        } finally {
            executor.shutdownNow();
            if (!Thread.currentThread().isInterrupted()) {
                executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
            }
        }

        progress.done();
        System.out.printf("📊 Alignment complete: %d success, %d errors%n", successCount, errorCount);
        return errorCount > 0 ? 1 : 0;
    }

    private Duration timeout() {
        return Duration.ofNanos(Math.max(1L, (long) (timeoutSeconds * 1_000_000_000L)));
    }

    /**
     * Token that expires {@code timeout} after the worker picks the captcha up.
     * The search polls it before every candidate; workers are never interrupted for a timeout.
     */
    private static CancellationToken deadline(Duration timeout) {
        var expiry = Instant.now().plus(timeout);
        return () -> Instant.now().isAfter(expiry);
    }
}
