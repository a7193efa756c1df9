package xyz.jphil.captcha_align.tools.align;

import java.util.Arrays;

/**
 * Best alignment found by {@link OffsetSearch}.
 *
 * @param bestOffset reported offset, the negation of the internal search offset
 * @param disorder   disorder score of the retained composite
 * @param width      composite width in pixels
 * @param height     composite height in pixels
 * @param pixels     composite, row-major ARGB
 */
public record AlignmentResult(int bestOffset, float disorder, int width, int height, int[] pixels) {

    public AlignmentResult {
        pixels = pixels.clone();
    }

    @Override
    public int[] pixels() {
        return pixels.clone();
    }

    public int pixel(int x, int y) {
        return pixels[y * width + x];
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AlignmentResult other
            && bestOffset == other.bestOffset
            && Float.compare(disorder, other.disorder) == 0
            && width == other.width
            && height == other.height
            && Arrays.equals(pixels, other.pixels);
    }

    @Override
    public int hashCode() {
        int h = 31 * bestOffset + Float.hashCode(disorder);
        h = 31 * h + 31 * width + height;
        return 31 * h + Arrays.hashCode(pixels);
    }

    @Override
    public String toString() {
        return String.format("AlignmentResult[offset=%d, disorder=%.4f, %dx%d]", bestOffset, disorder, width, height);
    }
}
