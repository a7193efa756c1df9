package xyz.jphil.captcha_align.tools;

import org.json.JSONObject;
import xyz.jphil.captcha_align.tools.align.Layer;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;

/**
 * PNG and captcha JSON fixtures built from layers
 */
public final class TestImages {

    private TestImages() {
    }

    public static BufferedImage toImage(Layer layer) {
        var image = new BufferedImage(layer.width(), layer.height(), BufferedImage.TYPE_INT_ARGB);
        image.setRGB(0, 0, layer.width(), layer.height(), layer.pixels(), 0, layer.width());
        return image;
    }

    public static byte[] png(Layer layer) throws IOException {
        var out = new ByteArrayOutputStream();
        ImageIO.write(toImage(layer), "png", out);
        return out.toByteArray();
    }

    public static void writePng(Layer layer, Path file) throws IOException {
        Files.write(file, png(layer));
    }

    public static JSONObject captchaJson(Layer foreground, Layer background) throws IOException {
        var json = new JSONObject()
            .put("challenge", "test-challenge")
            .put("ttl", 120)
            .put("img", Base64.getEncoder().encodeToString(png(foreground)))
            .put("img_width", foreground.width())
            .put("img_height", foreground.height());
        if (background != null) {
            json.put("bg", Base64.getEncoder().encodeToString(png(background)))
                .put("bg_width", background.width());
        }
        return json;
    }

    public static Path writeCaptcha(Path file, Layer foreground, Layer background) throws IOException {
        Files.createDirectories(file.getParent());
        Files.writeString(file, captchaJson(foreground, background).toString());
        return file;
    }
}
