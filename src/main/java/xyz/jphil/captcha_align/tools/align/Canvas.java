package xyz.jphil.captcha_align.tools.align;

import java.awt.geom.AffineTransform;
import java.awt.geom.NoninvertibleTransformException;
import java.awt.geom.Rectangle2D;
import java.util.Arrays;

/**
 * Mutable opaque ARGB drawing surface. Every draw call takes its own local-to-canvas
 * transform; the canvas keeps no transform state between calls.
 * <p>
 * Sampling is nearest-neighbour at pixel centres and layers are blended source-over.
 * The canvas is always fully opaque once reset, so blending only ever targets opaque pixels.
 */
final class Canvas {

    private final int width;
    private final int height;
    private final int[] pixels;
    private final double[] point = new double[2];

    Canvas(int width, int height) {
        this.width = width;
        this.height = height;
        this.pixels = new int[width * height];
    }

    int width() {
        return width;
    }

    int height() {
        return height;
    }

    /** Live pixel buffer, overwritten by the next reset. */
    int[] pixels() {
        return pixels;
    }

    void reset(int argb) {
        Arrays.fill(pixels, argb | 0xFF000000);
    }

    /**
     * Fill the local rectangle [x0, x1) x [y0, y1) with an opaque color.
     */
    void fillRect(AffineTransform toCanvas, double x0, double y0, double x1, double y1, int argb) {
        if (x1 <= x0 || y1 <= y0) return;
        var inverse = invert(toCanvas);
        var bounds = canvasBounds(toCanvas, new Rectangle2D.Double(x0, y0, x1 - x0, y1 - y0));
        int opaque = argb | 0xFF000000;

        for (int cy = bounds[1]; cy < bounds[3]; cy++) {
            for (int cx = bounds[0]; cx < bounds[2]; cx++) {
                toLocal(inverse, cx, cy);
                if (point[0] >= x0 && point[0] < x1 && point[1] >= y0 && point[1] < y1) {
                    pixels[cy * width + cx] = opaque;
                }
            }
        }
    }

    /**
     * Draw the first {@code clipWidth} x {@code clipHeight} pixels of a layer placed at the
     * local origin.
     */
    void drawLayer(AffineTransform toCanvas, Layer layer, int clipWidth, int clipHeight) {
        int w = Math.min(clipWidth, layer.width());
        int h = Math.min(clipHeight, layer.height());
        if (w <= 0 || h <= 0) return;

        var inverse = invert(toCanvas);
        var bounds = canvasBounds(toCanvas, new Rectangle2D.Double(0, 0, w, h));

        for (int cy = bounds[1]; cy < bounds[3]; cy++) {
            for (int cx = bounds[0]; cx < bounds[2]; cx++) {
                toLocal(inverse, cx, cy);
                int lx = (int) Math.floor(point[0]);
                int ly = (int) Math.floor(point[1]);
                if (lx < 0 || lx >= w || ly < 0 || ly >= h) continue;

                int idx = cy * width + cx;
                pixels[idx] = blendOver(layer.pixel(lx, ly), pixels[idx]);
            }
        }
    }

    /**
     * Non-premultiplied source-over onto an opaque destination.
     */
    static int blendOver(int src, int dst) {
        int a = src >>> 24;
        if (a == 0xFF) return src;
        if (a == 0) return dst;

        int inv = 0xFF - a;
        int r = (((src >> 16) & 0xFF) * a + ((dst >> 16) & 0xFF) * inv + 127) / 255;
        int g = (((src >> 8) & 0xFF) * a + ((dst >> 8) & 0xFF) * inv + 127) / 255;
        int b = ((src & 0xFF) * a + (dst & 0xFF) * inv + 127) / 255;
        return 0xFF000000 | (r << 16) | (g << 8) | b;
    }

    private void toLocal(AffineTransform inverse, int cx, int cy) {
        point[0] = cx + 0.5;
        point[1] = cy + 0.5;
        inverse.transform(point, 0, point, 0, 1);
    }

    /** Canvas pixel range [minX, minY, maxX, maxY) covered by a local rectangle, clamped. */
    private int[] canvasBounds(AffineTransform toCanvas, Rectangle2D local) {
        var box = toCanvas.createTransformedShape(local).getBounds2D();
        int minX = Math.max(0, (int) Math.floor(box.getMinX()));
        int minY = Math.max(0, (int) Math.floor(box.getMinY()));
        int maxX = Math.min(width, (int) Math.ceil(box.getMaxX()));
        int maxY = Math.min(height, (int) Math.ceil(box.getMaxY()));
        return new int[]{minX, minY, maxX, maxY};
    }

    private static AffineTransform invert(AffineTransform toCanvas) {
        try {
            return toCanvas.createInverse();
        } catch (NoninvertibleTransformException e) {
            throw new IllegalStateException("Canvas transform is not invertible: " + toCanvas, e);
        }
    }
}
