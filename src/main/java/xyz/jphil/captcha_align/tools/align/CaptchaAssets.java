package xyz.jphil.captcha_align.tools.align;

import java.util.Optional;

/**
 * The two layers of one slider captcha. The background is optional,
 * the foreground never is.
 */
public record CaptchaAssets(Layer foreground, Layer background) {

    public CaptchaAssets {
        if (foreground == null) {
            throw new CaptchaInputException("Foreground layer is required");
        }
    }

    public static CaptchaAssets of(Layer foreground, Layer background) {
        return new CaptchaAssets(foreground, background);
    }

    public static CaptchaAssets foregroundOnly(Layer foreground) {
        return new CaptchaAssets(foreground, null);
    }

    public Optional<Layer> backgroundLayer() {
        return Optional.ofNullable(background);
    }
}
