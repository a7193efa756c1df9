package xyz.jphil.captcha_align.tools;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single-line progress bar on stderr, sized to the terminal reported by JLine.
 * Safe to update from several worker threads.
 */
@Getter
@Accessors(fluent = true)
public class ProgressTracker {
    private final String task;
    private final int total;
    private final boolean verbose;
    private final Instant startedAt = Instant.now();
    private final AtomicInteger completed = new AtomicInteger(0);
    private final AtomicInteger failed = new AtomicInteger(0);
    @Getter(AccessLevel.NONE)
    private final Terminal terminal;

    public ProgressTracker(String task, int total, boolean verbose) {
        this.task = task;
        this.total = total;
        this.verbose = verbose;
        this.terminal = openTerminal();
    }

    public ProgressTracker start() {
        if (verbose) System.err.printf("▶ Starting %s (%d items)%n", task, total);
        show();
        return this;
    }

    public ProgressTracker inc() {
        completed.incrementAndGet();
        show();
        return this;
    }

    public ProgressTracker err(String msg) {
        failed.incrementAndGet();
        synchronized (this) {
            clearLine();
            System.err.printf("✗ Error in %s: %s%n", task, msg);
        }
        return this;
    }

    public ProgressTracker done() {
        var elapsed = Duration.between(startedAt, Instant.now());
        synchronized (this) {
            clearLine();
            System.err.printf("✓ %s completed (%d processed, %d failed) in %s%n",
                task, completed.get(), failed.get(), LogFormatter.formatDuration(elapsed));
        }
        close();
        return this;
    }

    public double percent() {
        return total == 0 ? 100.0 : completed.get() * 100.0 / total;
    }

    private synchronized void show() {
        if (total == 0) return;
        int current = completed.get();
        int termWidth = terminalWidth();
        if (termWidth > 50) {
            System.err.printf("\r%s %5.1f%% (%d/%d)", bar(percent(), Math.min(25, termWidth - 30)), percent(), current, total);
            if (current == total) System.err.println();
        } else if (current % Math.max(1, total / 10) == 0 || current == total) {
            System.err.printf("  Progress: %d/%d (%.1f%%)%n", current, total, percent());
        }
    }

    private void clearLine() {
        int termWidth = terminalWidth();
        if (termWidth > 50) {
            System.err.printf("\r%s\r", " ".repeat(termWidth));
        }
    }

    static String bar(double pct, int width) {
        int filled = (int) (pct / 100 * width);
        var sb = new StringBuilder("[");
        for (int i = 0; i < width; i++) {
            sb.append(i < filled ? "█" : "░");
        }
        return sb.append("]").toString();
    }

    private int terminalWidth() {
        if (terminal == null) return 80;
        int width = terminal.getWidth();
        // dumb terminals report 0
        return width > 20 ? width : 80;
    }

    private static Terminal openTerminal() {
        try {
            return TerminalBuilder.builder().system(true).dumb(true).build();
        } catch (IOException e) {
            return null;
        }
    }

    private void close() {
        if (terminal == null) return;
        try {
            terminal.close();
        } catch (IOException e) {
            System.err.println("Failed to close terminal: " + e.getMessage());
        }
    }
}
