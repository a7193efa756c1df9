package xyz.jphil.captcha_align.tools.align;

import java.util.Arrays;

/**
 * Scores how fragmented the dark pixels of a composite are.
 * <p>
 * Dark pixels are grouped into 4-connected components with a flood fill over the
 * flat buffer. Components smaller than {@link #MIN_COMPONENT_SIZE} are dropped as
 * noise. The score is the number of vertical signal/non-signal transitions divided
 * by the number of signal pixels; lower means more coherent vertical strokes.
 * <p>
 * Neighbours are {@code idx +- 1} and {@code idx +- width} without a row-boundary
 * check, so a component touching the right edge continues at the left edge of the
 * next row. Scores are calibrated with that behaviour and it is kept as is.
 * <p>
 * Working buffers are reused between calls on the same instance, so one instance
 * serves one thread.
 */
public class DisorderScorer {

    public static final int DARK_THRESHOLD = 64;
    public static final int MIN_COMPONENT_SIZE = 24;

    private boolean[] visited = new boolean[0];
    private boolean[] signal = new boolean[0];
    private int[] stack = new int[0];
    private int[] members = new int[0];

    public static boolean isDark(int argb) {
        return ((argb >>> 16) & 0xFF) < DARK_THRESHOLD;
    }

    public float score(int[] pixels, int width, int height) {
        int total = width * height;
        if (pixels.length < total) {
            throw new IllegalArgumentException(String.format(
                "Buffer of %d pixels is smaller than %dx%d", pixels.length, width, height));
        }
        prepare(total);

        for (int idx = 0; idx < total; idx++) {
            if (visited[idx] || !isDark(pixels[idx])) continue;

            int size = fill(pixels, idx, width, total);
            if (size >= MIN_COMPONENT_SIZE) {
                for (int i = 0; i < size; i++) {
                    signal[members[i]] = true;
                }
            }
        }

        int transitions = 0;
        for (int idx = 0; idx < total - width; idx++) {
            if (signal[idx] != signal[idx + width]) {
                transitions++;
            }
        }

        int signalCount = 0;
        for (int idx = 0; idx < total; idx++) {
            if (signal[idx]) signalCount++;
        }
        if (signalCount == 0) {
            signalCount = 1;
        }

        return (float) transitions / (float) signalCount;
    }

    /**
     * Flood fill from {@code start}, recording members into {@link #members}.
     *
     * @return component size
     */
    private int fill(int[] pixels, int start, int width, int total) {
        int top = 0;
        int size = 0;
        stack[top++] = start;

        while (top > 0) {
            int cc = stack[--top];
            if (cc < 0 || cc >= total || visited[cc]) continue;
            visited[cc] = true;

            if (isDark(pixels[cc])) {
                members[size++] = cc;
                top = push(top, cc + 1);
                top = push(top, cc - 1);
                top = push(top, cc + width);
                top = push(top, cc - width);
            }
        }
        return size;
    }

    private int push(int top, int idx) {
        if (top == stack.length) {
            stack = Arrays.copyOf(stack, stack.length * 2);
        }
        stack[top] = idx;
        return top + 1;
    }

    private void prepare(int total) {
        if (visited.length != total) {
            visited = new boolean[total];
            signal = new boolean[total];
            members = new int[total];
            stack = new int[Math.max(16, total)];
        } else {
            Arrays.fill(visited, false);
            Arrays.fill(signal, false);
        }
    }
}
