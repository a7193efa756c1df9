package xyz.jphil.captcha_align.tools.align;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static xyz.jphil.captcha_align.tools.align.TestCaptchas.*;

public class OffsetSearchTest {

    private final OffsetSearch search = new OffsetSearch();

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void findsTheOffsetThatJoinsTheStroke() {
        var result = search.findBestAlignment(strokeCaptcha(), null);

        assertEquals(STROKE_OFFSET, result.bestOffset());
        // one 20-row stroke, 3 columns wide: 6 transitions over 60 signal pixels
        assertEquals(0.1f, result.disorder());
        assertEquals(80, result.width());
        assertEquals(52, result.height());
        assertEquals(DARK, result.pixel(41, 16));
        assertEquals(DARK, result.pixel(41, 35));
        assertEquals(LIGHT, result.pixel(41, 36));
    }

    @Test
    void candidatesRunFromZeroDownwards() {
        var assets = strokeCaptcha();
        var geometry = CanvasGeometry.of(assets.foreground());

        assertArrayEquals(new int[]{0, -1, -2, -3, -4, -5},
            OffsetSearch.candidateOffsets(geometry, assets, null));
        assertArrayEquals(new int[]{0},
            OffsetSearch.candidateOffsets(geometry, CaptchaAssets.foregroundOnly(assets.foreground()), null));
        assertArrayEquals(new int[]{-2},
            OffsetSearch.candidateOffsets(geometry, assets, -2.7f));
    }

    @Test
    void tiesKeepTheCandidateClosestToZero() {
        // a blank background scores the same at every offset
        var result = search.findBestAlignment(CaptchaAssets.of(strokeForeground(), plainBackground()), null);

        assertEquals(0, result.bestOffset());
        assertEquals(0.2f, result.disorder());
    }

    @Test
    void customOffsetIsReportedNegated() {
        assertEquals(-3, search.findBestAlignment(strokeCaptcha(), 3f).bestOffset());
        assertEquals(-2, search.findBestAlignment(strokeCaptcha(), 2.9f).bestOffset());
        assertEquals(2, search.findBestAlignment(strokeCaptcha(), -2.9f).bestOffset());
        assertEquals(0, search.findBestAlignment(strokeCaptcha(), 0f).bestOffset());
    }

    @Test
    void negatedReportedOffsetReplaysTheSameComposite() {
        var searched = search.findBestAlignment(strokeCaptcha(), null);
        var replayed = search.findBestAlignment(strokeCaptcha(), (float) -searched.bestOffset());

        assertEquals(searched, replayed);
    }

    @Test
    void repeatedSearchesAreDeterministic() {
        assertEquals(search.findBestAlignment(strokeCaptcha(), null), search.findBestAlignment(strokeCaptcha(), null));

        var compositor = new Compositor(strokeCaptcha());
        var scorer = new DisorderScorer();
        int[] first = compositor.composite(-3).clone();
        float firstScore = scorer.score(first, 80, 52);
        int[] second = compositor.composite(-3).clone();

        assertArrayEquals(first, second);
        assertEquals(firstScore, scorer.score(second, 80, 52));
    }

    @Test
    void missingBackgroundAlignsForegroundAlone() {
        var result = search.findBestAlignment(CaptchaAssets.foregroundOnly(strokeForeground()), null);

        assertEquals(0, result.bestOffset());
        assertEquals(0.2f, result.disorder());
    }

    @Test
    void missingForegroundIsFatal() {
        assertThrows(CaptchaInputException.class, () -> search.findBestAlignment(null, null));
    }

    @Test
    void cancellationBeforeFirstCandidateYieldsNoResult() {
        var source = new CancellationToken.Source();
        source.cancel();

        assertThrows(CancellationException.class, () -> search.findBestAlignment(strokeCaptcha(), null, source));
    }

    @Test
    void cancellationMidSearchDiscardsTheBestSoFar() {
        var checks = new AtomicInteger();
        CancellationToken token = () -> checks.incrementAndGet() > 2;

        assertThrows(CancellationException.class, () -> search.findBestAlignment(strokeCaptcha(), null, token));
        assertEquals(3, checks.get());
    }

    @Test
    void interruptedThreadCancelsTheSearch() {
        Thread.currentThread().interrupt();
        assertThrows(CancellationException.class, () -> search.findBestAlignment(strokeCaptcha(), null));
    }

    @Test
    void concurrentSearchesDoNotInterfere() throws Exception {
        var expected = search.findBestAlignment(strokeCaptcha(), null);
        var expectedBlank = search.findBestAlignment(CaptchaAssets.of(strokeForeground(), plainBackground()), null);

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<AlignmentResult>> stroke = new ArrayList<>();
            List<Future<AlignmentResult>> blank = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                stroke.add(executor.submit(() -> search.findBestAlignment(strokeCaptcha(), null)));
                blank.add(executor.submit(() -> search.findBestAlignment(CaptchaAssets.of(strokeForeground(), plainBackground()), null)));
            }
            for (int i = 0; i < 8; i++) {
                assertEquals(expected, stroke.get(i).get(30, TimeUnit.SECONDS));
                assertEquals(expectedBlank, blank.get(i).get(30, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
