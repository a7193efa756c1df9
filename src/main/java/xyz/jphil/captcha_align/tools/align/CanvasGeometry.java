package xyz.jphil.captcha_align.tools.align;

import java.awt.geom.AffineTransform;

/**
 * Fixed output geometry of the composite, derived once from the foreground size.
 * <p>
 * The canvas is a tall thumbnail: {@code canvasWidth} is the thumbnail height and
 * {@code canvasHeight} is the scaled foreground width plus padding on both ends.
 * Drawing happens in a local frame that is flipped, scaled and rotated by 90 degrees
 * onto the canvas, so local x runs down the canvas rows.
 */
public record CanvasGeometry(
    int foregroundWidth, int foregroundHeight,
    int scale,
    int canvasWidth, int canvasHeight
) {

    public static final int THUMBNAIL_HEIGHT = 80;
    public static final int PADDING = 16;

    public static CanvasGeometry of(Layer foreground) {
        if (foreground == null) {
            throw new CaptchaInputException("Foreground layer is required to size the canvas");
        }
        return of(foreground.width(), foreground.height());
    }

    public static CanvasGeometry of(int foregroundWidth, int foregroundHeight) {
        if (foregroundWidth <= 0 || foregroundHeight <= 0) {
            throw new CaptchaInputException(String.format(
                "Foreground intrinsic size is missing or invalid: %dx%d", foregroundWidth, foregroundHeight));
        }
        // integer division, a 40px tall foreground gets scale 2, a 100px one gets 0
        int scale = THUMBNAIL_HEIGHT / foregroundHeight;
        if (scale == 0) {
            throw new CaptchaInputException(String.format(
                "Foreground height %d exceeds thumbnail height %d", foregroundHeight, THUMBNAIL_HEIGHT));
        }
        int canvasHeight = foregroundWidth * scale + PADDING * 2;
        return new CanvasGeometry(foregroundWidth, foregroundHeight, scale, THUMBNAIL_HEIGHT, canvasHeight);
    }

    /** Canvas height minus foreground width; the background is clipped by this much. */
    public int backgroundWidthDiff() {
        return canvasHeight - foregroundWidth;
    }

    /** Width of each cleared margin, also the foreground's local x position. */
    public double halfDiff() {
        return backgroundWidthDiff() / 2.0;
    }

    /** Number of background columns drawn for a background of the given width. */
    public int backgroundClipWidth(int backgroundWidth) {
        return backgroundWidth - backgroundWidthDiff();
    }

    /** Most negative search offset that keeps the background inside the canvas, never positive. */
    public int maxShift(int backgroundWidth) {
        return Math.max(0, backgroundWidth - canvasHeight);
    }

    /**
     * Horizontal flip with scale, then a quarter turn. Maps local (x, y) to canvas
     * (scale * y, scale * x).
     */
    public AffineTransform baseTransform() {
        var transform = new AffineTransform();
        transform.scale(-scale, scale);
        transform.quadrantRotate(1);
        return transform;
    }

    /** Base transform followed by a horizontal translation in the local frame. */
    public AffineTransform translated(double localX) {
        var transform = baseTransform();
        transform.translate(localX, 0);
        return transform;
    }

    public int pixelCount() {
        return canvasWidth * canvasHeight;
    }
}
