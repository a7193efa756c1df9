package xyz.jphil.captcha_align.tools;

import xyz.jphil.captcha_align.tools.align.AlignmentResult;
import xyz.jphil.captcha_align.tools.align.CaptchaInputException;
import xyz.jphil.captcha_align.tools.align.Layer;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Conversions between ImageIO images and ARGB layers
 */
public class ImageLayers {

    private ImageLayers() {
    }

    public static Layer fromImage(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        int[] argb = image.getRGB(0, 0, width, height, null, 0, width);
        return new Layer(argb, width, height);
    }

    public static Layer read(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new CaptchaInputException("Image file does not exist: " + file);
        }
        BufferedImage image = ImageIO.read(file.toFile());
        if (image == null) {
            throw new CaptchaInputException("Unable to read image file: " + file);
        }
        return fromImage(image);
    }

    public static Layer decode(byte[] encoded, String what) {
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(encoded));
            if (image == null) {
                throw new CaptchaInputException("Unsupported image format for " + what);
            }
            return fromImage(image);
        } catch (IOException e) {
            throw new CaptchaInputException("Unable to decode " + what + ": " + e.getMessage(), e);
        }
    }

    public static BufferedImage toImage(AlignmentResult result) {
        var image = new BufferedImage(result.width(), result.height(), BufferedImage.TYPE_INT_ARGB);
        image.setRGB(0, 0, result.width(), result.height(), result.pixels(), 0, result.width());
        return image;
    }

    public static void writePng(AlignmentResult result, Path file) throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        if (!ImageIO.write(toImage(result), "png", file.toFile())) {
            throw new IOException("No PNG writer available for " + file);
        }
    }
}
