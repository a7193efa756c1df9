package xyz.jphil.captcha_align.tools;

import xyz.jphil.captcha_align.tools.align.CaptchaAssets;

/**
 * A captcha as served by the board: challenge id, lifetime and the decoded layers
 */
public record CaptchaDescriptor(
    String challenge,
    int ttlSeconds,
    CaptchaAssets assets
) {}
