package xyz.jphil.captcha_align.tools;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import xyz.jphil.captcha_align.tools.align.AlignmentResult;

/**
 * Summary of one alignment run, written next to the composite PNG
 */
public record AlignmentRecord(
    String file,
    int width, int height,
    String timestampUTCISO,
    long durationMs,
    int offset,
    float disorder,
    boolean replayed
) {

    /**
     * Create a record for a finished run with the current UTC timestamp
     */
    public static AlignmentRecord create(String file, AlignmentResult result, Duration duration, boolean replayed) {
        var utcTimestamp = Instant.now()
            .atOffset(ZoneOffset.UTC)
            .format(DateTimeFormatter.ISO_INSTANT);

        return new AlignmentRecord(
            file,
            result.width(), result.height(),
            utcTimestamp,
            duration.toMillis(),
            result.bestOffset(),
            result.disorder(),
            replayed
        );
    }

    /**
     * The customOffset that makes a new search evaluate the same internal offset again
     */
    public float replayOffset() {
        return -offset;
    }
}
