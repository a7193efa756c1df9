package xyz.jphil.captcha_align.tools;

import org.json.JSONException;
import org.json.JSONObject;
import xyz.jphil.captcha_align.tools.align.CaptchaAssets;
import xyz.jphil.captcha_align.tools.align.CaptchaInputException;
import xyz.jphil.captcha_align.tools.align.Layer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;

/**
 * Reads captcha descriptors saved from the board's captcha endpoint.
 * <p>
 * Expected shape: {@code {"challenge":"...","ttl":120,"img":"<base64 png>","img_width":300,
 * "img_height":80,"bg":"<base64 png>","bg_width":349}}. The background fields are optional.
 * A rate-limited response carries {@code error} and {@code cd} instead.
 */
public class CaptchaJsonLoader {

    static final String NO_CAPTCHA_CHALLENGE = "noop";

    private final LogFormatter log;

    public CaptchaJsonLoader(LogFormatter log) {
        this.log = log;
    }

    public CaptchaDescriptor load(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new CaptchaInputException("Captcha file does not exist: " + file);
        }
        log.step("LOAD", "Reading " + file.getFileName());
        return parse(Files.readString(file));
    }

    public CaptchaDescriptor parse(String json) {
        JSONObject root;
        try {
            root = new JSONObject(json);
        } catch (JSONException e) {
            throw new CaptchaInputException("Malformed captcha JSON: " + e.getMessage(), e);
        }

        if (root.has("error")) {
            var message = root.optString("error", "unknown error");
            if (root.has("cd")) {
                message += " (retry in " + root.optInt("cd") + "s)";
            }
            throw new CaptchaInputException("Captcha endpoint returned an error: " + message);
        }

        var challenge = root.optString("challenge", "");
        if (NO_CAPTCHA_CHALLENGE.equals(challenge)) {
            throw new CaptchaInputException("No captcha required for this challenge");
        }

        var img = root.optString("img", "");
        if (img.isBlank()) {
            throw new CaptchaInputException("Captcha JSON has no foreground image (img)");
        }
        var foreground = decodeLayer(img, "foreground image");
        checkSize(root, "img_width", foreground.width(), "foreground width");
        checkSize(root, "img_height", foreground.height(), "foreground height");

        Layer background = null;
        var bg = root.optString("bg", "");
        if (!bg.isBlank()) {
            background = decodeLayer(bg, "background image");
            checkSize(root, "bg_width", background.width(), "background width");
        }

        log.debug("LOAD", String.format("Foreground %dx%d, background %s",
            foreground.width(), foreground.height(),
            background == null ? "none" : background.width() + "x" + background.height()));

        return new CaptchaDescriptor(challenge, root.optInt("ttl", 0), CaptchaAssets.of(foreground, background));
    }

    private static Layer decodeLayer(String base64, String what) {
        byte[] bytes;
        try {
            bytes = Base64.getMimeDecoder().decode(base64);
        } catch (IllegalArgumentException e) {
            throw new CaptchaInputException("Invalid base64 in " + what, e);
        }
        return ImageLayers.decode(bytes, what);
    }

    private void checkSize(JSONObject root, String key, int actual, String what) {
        if (!root.has(key)) return;
        int declared = root.optInt(key, actual);
        if (declared != actual) {
            log.warning("LOAD", String.format("Declared %s %d differs from decoded %d, using decoded",
                what, declared, actual));
        }
    }
}
