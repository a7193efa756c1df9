package xyz.jphil.captcha_align.tools.align;

import java.util.Arrays;

/**
 * Immutable row-major ARGB pixel buffer, one int per pixel
 */
public record Layer(int[] pixels, int width, int height) {

    public Layer {
        if (pixels == null) {
            throw new CaptchaInputException("Layer pixel data is missing");
        }
        if (width <= 0 || height <= 0) {
            throw new CaptchaInputException(
                String.format("Layer size must be positive, got %dx%d", width, height));
        }
        if (pixels.length < width * height) {
            throw new CaptchaInputException(String.format(
                "Layer of %dx%d needs %d pixels, got %d", width, height, width * height, pixels.length));
        }
        pixels = pixels.clone();
    }

    public int pixel(int x, int y) {
        return pixels[y * width + x];
    }

    @Override
    public int[] pixels() {
        return pixels.clone();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Layer other
            && width == other.width
            && height == other.height
            && Arrays.equals(pixels, other.pixels);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(pixels);
    }

    @Override
    public String toString() {
        return "Layer[" + width + "x" + height + "]";
    }
}
