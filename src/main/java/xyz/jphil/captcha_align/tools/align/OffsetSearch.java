package xyz.jphil.captcha_align.tools.align;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.stream.IntStream;
import xyz.jphil.captcha_align.tools.LogFormatter;

/**
 * Finds the background offset whose composite has the lowest disorder.
 * <p>
 * Candidates are evaluated sequentially from offset 0 downwards and the first
 * strictly-lowest score wins, so ties keep the candidate closest to zero. Every
 * invocation builds its own canvas and working buffers, so separate threads may run
 * searches concurrently on one instance.
 */
public class OffsetSearch {

    static final float INITIAL_BEST_DISORDER = 999f;

    private final LogFormatter log;

    public OffsetSearch(LogFormatter log) {
        this.log = log;
    }

    public OffsetSearch() {
        this(LogFormatter.quiet());
    }

    public AlignmentResult findBestAlignment(CaptchaAssets assets, Float customOffset) {
        return findBestAlignment(assets, customOffset, CancellationToken.none());
    }

    /**
     * @param customOffset when non-null, the only candidate is this value truncated toward zero
     * @param cancellation polled before each candidate; thread interruption counts as a request too
     * @throws CaptchaInputException when the foreground layer or its size is missing
     * @throws CancellationException when cancelled; no partial result is returned
     */
    public AlignmentResult findBestAlignment(CaptchaAssets assets, Float customOffset, CancellationToken cancellation) {
        if (assets == null || assets.foreground() == null) {
            throw new CaptchaInputException("Foreground layer is required");
        }
        var start = Instant.now();

        var compositor = new Compositor(assets);
        var scorer = new DisorderScorer();
        int[] offsets = candidateOffsets(compositor.geometry(), assets, customOffset);

        float bestDisorder = INITIAL_BEST_DISORDER;
        int[] bestPixels = null;
        int bestOffset = 0;

        for (int offset : offsets) {
            if (cancellation.isCancellationRequested() || Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Alignment cancelled before offset " + offset);
            }

            int[] pixels = compositor.composite(offset);
            float disorder = scorer.score(pixels, compositor.width(), compositor.height());

            if (disorder < bestDisorder) {
                bestDisorder = disorder;
                bestPixels = pixels.clone();
                bestOffset = offset;
            }
        }

        if (bestPixels == null) {
            throw new IllegalStateException("No candidate scored below " + INITIAL_BEST_DISORDER);
        }

        log.debug("ALIGN", String.format("%d candidates in %s, bestOffset=%d, bestDisorder=%.4f",
            offsets.length, LogFormatter.formatDuration(Duration.between(start, Instant.now())),
            bestOffset, bestDisorder));

        return new AlignmentResult(-bestOffset, bestDisorder, compositor.width(), compositor.height(), bestPixels);
    }

    /**
     * Internal offsets in evaluation order.
     */
    static int[] candidateOffsets(CanvasGeometry geometry, CaptchaAssets assets, Float customOffset) {
        if (customOffset != null) {
            return new int[]{customOffset.intValue()};
        }
        int maxShift = assets.backgroundLayer()
            .map(bg -> geometry.maxShift(bg.width()))
            .orElse(0);
        return IntStream.rangeClosed(0, maxShift).map(i -> -i).toArray();
    }
}
