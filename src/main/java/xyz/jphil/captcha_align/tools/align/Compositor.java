package xyz.jphil.captcha_align.tools.align;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Composites the background layer, shifted by a candidate offset, under the centred
 * foreground layer and clears the left and right margins.
 * <p>
 * One compositor owns one canvas; it is reset on every call and must not be shared
 * between concurrent searches.
 */
@Getter
@Accessors(fluent = true)
public class Compositor {

    public static final int BACKGROUND_COLOR = 0xFFEEEEEE;

    private final CaptchaAssets assets;
    private final CanvasGeometry geometry;
    @Getter(AccessLevel.NONE)
    private final Canvas canvas;

    public Compositor(CaptchaAssets assets) {
        if (assets == null) {
            throw new CaptchaInputException("Captcha assets are required");
        }
        this.assets = assets;
        this.geometry = CanvasGeometry.of(assets.foreground());
        this.canvas = new Canvas(geometry.canvasWidth(), geometry.canvasHeight());
    }

    /**
     * Composite both layers at the given background offset.
     *
     * @return the canvas pixels, row-major, {@code canvasWidth x canvasHeight};
     *         the buffer is reused and overwritten by the next call
     */
    public int[] composite(int offset) {
        var foreground = assets.foreground();
        double halfDiff = geometry.halfDiff();

        canvas.reset(BACKGROUND_COLOR);

        assets.backgroundLayer().ifPresent(background ->
            canvas.drawLayer(
                geometry.translated(halfDiff + offset),
                background,
                geometry.backgroundClipWidth(background.width()),
                foreground.height()));

        canvas.drawLayer(geometry.translated(halfDiff), foreground, foreground.width(), foreground.height());

        // margins hold no glyph strokes, only background noise
        var base = geometry.baseTransform();
        int localHeight = geometry.canvasHeight();
        int localWidth = geometry.canvasWidth();
        canvas.fillRect(base, 0, 0, halfDiff, localWidth, BACKGROUND_COLOR);
        canvas.fillRect(base, localHeight - halfDiff, 0, localHeight, localWidth, BACKGROUND_COLOR);

        return canvas.pixels();
    }

    public int width() {
        return geometry.canvasWidth();
    }

    public int height() {
        return geometry.canvasHeight();
    }
}
