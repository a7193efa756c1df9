package xyz.jphil.captcha_align.tools.folder;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import xyz.jphil.captcha_align.tools.AlignTool;
import xyz.jphil.captcha_align.tools.AlignmentJsonSerializer;
import xyz.jphil.captcha_align.tools.TestImages;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static xyz.jphil.captcha_align.tools.align.TestCaptchas.*;

public class FolderAlignCommandTest {

    @TempDir
    Path dir;

    private Path input;
    private Path output;

    @BeforeEach
    void setup() throws Exception {
        input = Files.createDirectories(dir.resolve("in"));
        output = dir.resolve("out");
    }

    private static int run(String... args) {
        return new CommandLine(new AlignTool()).execute(args);
    }

    /** Runs the command and returns everything it printed to stderr */
    private static String runCapturingErr(int expectedExit, String... args) {
        var captured = new ByteArrayOutputStream();
        var original = System.err;
        System.setErr(new PrintStream(captured, true, StandardCharsets.UTF_8));
        try {
            assertEquals(expectedExit, run(args));
        } finally {
            System.setErr(original);
        }
        return captured.toString(StandardCharsets.UTF_8);
    }

    @Test
    void alignsEveryCaptchaIntoTheOutputTree() throws Exception {
        TestImages.writeCaptcha(input.resolve("one.json"), strokeForeground(), strokeBackground());
        TestImages.writeCaptcha(input.resolve("nested").resolve("two.json"), strokeForeground(), plainBackground());

        assertEquals(0, run("-t", "2", "folder", "-r", "-o", output.toString(), input.toString()));

        var one = AlignmentJsonSerializer.fromJson(Files.readString(output.resolve("one.json.aligned.json")));
        var two = AlignmentJsonSerializer.fromJson(Files.readString(output.resolve("nested").resolve("two.json.aligned.json")));
        assertEquals(STROKE_OFFSET, one.offset());
        assertEquals(0, two.offset());
        assertTrue(Files.exists(output.resolve("one.json.aligned.png")));
    }

    @Test
    void failedCaptchasFailTheRunButOthersStillComplete() throws Exception {
        TestImages.writeCaptcha(input.resolve("good.json"), strokeForeground(), strokeBackground());
        Files.writeString(input.resolve("limited.json"), "{\"error\":\"You have to wait a while\",\"cd\":30}");

        var err = runCapturingErr(1, "folder", input.toString());

        assertTrue(Files.exists(input.resolve("good.json.aligned.json")));
        assertFalse(Files.exists(input.resolve("limited.json.aligned.json")));
        assertTrue(err.contains("(2 processed, 1 failed)"), err);
    }

    @Test
    void captchaExceedingTheTimeoutIsCancelled() throws Exception {
        TestImages.writeCaptcha(input.resolve("slow.json"), strokeForeground(), strokeBackground());

        // one microsecond expires while the descriptor is still being decoded
        var err = runCapturingErr(1, "folder", "--timeout", "0.000001", input.toString());

        assertFalse(Files.exists(input.resolve("slow.json.aligned.json")));
        assertFalse(Files.exists(input.resolve("slow.json.aligned.png")));
        assertTrue(err.contains("slow.json timed out"), err);
    }

    @Test
    void nonPositiveTimeoutIsRejected() throws Exception {
        TestImages.writeCaptcha(input.resolve("one.json"), strokeForeground(), strokeBackground());

        var zero = runCapturingErr(1, "folder", "--timeout", "0", input.toString());
        var negative = runCapturingErr(1, "folder", "--timeout=-5", input.toString());

        assertTrue(zero.startsWith("Error: --timeout"), zero);
        assertTrue(negative.startsWith("Error: --timeout"), negative);
        assertFalse(Files.exists(input.resolve("one.json.aligned.json")));
    }

    @Test
    void emptyFolderIsNotAnError() {
        assertEquals(0, run("folder", input.toString()));
        assertEquals(1, run("folder", input.resolve("missing").toString()));
    }
}
