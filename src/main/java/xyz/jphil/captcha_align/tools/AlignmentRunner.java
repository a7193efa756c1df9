package xyz.jphil.captcha_align.tools;

import lombok.RequiredArgsConstructor;
import xyz.jphil.captcha_align.tools.align.CaptchaAssets;
import xyz.jphil.captcha_align.tools.align.CancellationToken;
import xyz.jphil.captcha_align.tools.align.OffsetSearch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

/**
 * Load one captcha, align it and write the requested outputs.
 * Shared by the single-file command and the folder command.
 */
@RequiredArgsConstructor
public class AlignmentRunner {

    private final LogFormatter log;

    /**
     * Where the input comes from and where results go. Null outputs are skipped.
     */
    public record Request(
        Path input,
        Path background,
        Float customOffset,
        boolean replayed,
        Path pngOutput,
        Path jsonOutput
    ) {}

    public AlignmentRecord run(Request request, CancellationToken cancellation) throws IOException {
        var assets = loadAssets(request.input(), request.background());

        var start = Instant.now();
        var result = new OffsetSearch(log).findBestAlignment(assets, request.customOffset(), cancellation);
        var record = AlignmentRecord.create(
            request.input().getFileName().toString(), result,
            Duration.between(start, Instant.now()), request.replayed());

        if (request.pngOutput() != null) {
            ImageLayers.writePng(result, request.pngOutput());
            log.debug("OUTPUT", "Composite written to " + request.pngOutput().getFileName());
        }
        if (request.jsonOutput() != null) {
            var json = AlignmentJsonSerializer.toJson(record);
            if (request.jsonOutput().getParent() != null) {
                Files.createDirectories(request.jsonOutput().getParent());
            }
            Files.writeString(request.jsonOutput(), json);
            log.debug("OUTPUT", String.format("Result written to %s (%d bytes)",
                request.jsonOutput().getFileName(), json.length()));
        }

        log.success("ALIGN", String.format("%s: offset=%d disorder=%.4f (%s)",
            request.input().getFileName(), record.offset(), record.disorder(),
            LogFormatter.formatDuration(Duration.ofMillis(record.durationMs()))));
        return record;
    }

    /**
     * A .json input is a captcha descriptor unless a separate background image is given;
     * anything else is read as the foreground image.
     */
    CaptchaAssets loadAssets(Path input, Path background) throws IOException {
        if (background == null && isJson(input)) {
            return new CaptchaJsonLoader(log).load(input).assets();
        }
        log.step("LOAD", "Reading foreground " + input.getFileName());
        var foreground = ImageLayers.read(input);
        if (background == null) {
            return CaptchaAssets.foregroundOnly(foreground);
        }
        log.step("LOAD", "Reading background " + background.getFileName());
        return CaptchaAssets.of(foreground, ImageLayers.read(background));
    }

    static boolean isJson(Path file) {
        return file.getFileName().toString().toLowerCase().endsWith(".json");
    }
}
