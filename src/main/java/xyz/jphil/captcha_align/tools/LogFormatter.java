package xyz.jphil.captcha_align.tools;

import java.io.PrintStream;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Categorized console logging shared by the aligner, the loaders and the commands.
 * Verbose-only levels are dropped unless verbose is on; errors and completions always print.
 */
public class LogFormatter {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");

    private final boolean verbose;
    private final boolean includeTimestamp;
    private final PrintStream out;

    public LogFormatter(boolean verbose, boolean includeTimestamp, PrintStream out) {
        this.verbose = verbose;
        this.includeTimestamp = includeTimestamp;
        this.out = out;
    }

    public LogFormatter(boolean verbose) {
        this(verbose, false, System.err);
    }

    /**
     * Log info message with consistent formatting
     */
    public void info(String category, String message) {
        if (!verbose) return;
        print("", category, message);
    }

    /**
     * Log debug details (only in verbose mode)
     */
    public void debug(String category, String message) {
        if (!verbose) return;
        print("🔍 ", category, message);
    }

    /**
     * Log step/progress information
     */
    public void step(String category, String message) {
        if (!verbose) return;
        print("▶️ ", category, message);
    }

    /**
     * Log success message with consistent formatting
     */
    public void success(String category, String message) {
        if (!verbose) return;
        print("✅ ", category, message);
    }

    /**
     * Log warning message, e.g. a size mismatch in a captcha descriptor
     */
    public void warning(String category, String message) {
        if (!verbose) return;
        print("⚠️ ", category, message);
    }

    /**
     * Log error message with consistent formatting (always shown regardless of verbose)
     */
    public void error(String category, String message) {
        print("❌ ", category, message);
    }

    /**
     * Log completion information, always shown
     */
    public void complete(String category, String message) {
        print("🏁 ", category, message);
    }

    /**
     * Human readable duration: 850ms, 3.2s, 2m 05s
     */
    public static String formatDuration(Duration d) {
        long ms = d.toMillis();
        if (ms < 1000) return ms + "ms";
        if (ms < 60_000) return String.format("%.1fs", ms / 1000.0);
        return "%dm %02ds".formatted(d.toMinutes(), d.toSecondsPart());
    }

    private void print(String marker, String category, String message) {
        // single printf per line, folder workers log concurrently
        out.printf("%s%s[%s] %s%n", timestamp(), marker, category, message);
    }

    private String timestamp() {
        if (!includeTimestamp) return "";
        return "[" + LocalDateTime.now().format(TIME_FORMAT) + "] ";
    }

    // Convenience factory methods
    public static LogFormatter standard(boolean verbose) {
        return new LogFormatter(verbose, false, System.err);
    }

    public static LogFormatter timestamped(boolean verbose) {
        return new LogFormatter(verbose, true, System.err);
    }

    /** Verbose off; only errors and completions reach stderr */
    public static LogFormatter quiet() {
        return standard(false);
    }
}
