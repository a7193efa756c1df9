package xyz.jphil.captcha_align.tools.align;

/**
 * Unrecoverable problem with the captcha assets handed to the aligner.
 * No partial result is ever produced once this is thrown.
 */
public class CaptchaInputException extends RuntimeException {

    public CaptchaInputException(String message) {
        super(message);
    }

    public CaptchaInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
