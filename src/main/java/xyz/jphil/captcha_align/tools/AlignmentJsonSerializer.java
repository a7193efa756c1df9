package xyz.jphil.captcha_align.tools;

import static java.lang.Integer.parseInt;

import org.json.JSONException;
import org.json.JSONObject;
import xyz.jphil.captcha_align.tools.align.CaptchaInputException;

/**
 * Compact single-line JSON for alignment records using org.json
 */
public class AlignmentJsonSerializer {

    /**
     * @return e.g. {@code {"meta":{"file":"c.json","canvasSize":"80x332",...},"offset":17,"disorder":0.113,"replayed":false}}
     */
    public static String toJson(AlignmentRecord record) {
        var meta = new JSONObject()
            .put("file", record.file())
            .put("canvasSize", record.width() + "x" + record.height())
            .put("timestampUTCISO", record.timestampUTCISO())
            .put("durationMs", record.durationMs());

        return new JSONObject()
            .put("meta", meta)
            .put("offset", record.offset())
            .put("disorder", formatDisorder(record.disorder()))
            .put("replayed", record.replayed())
            .toString();
    }

    public static AlignmentRecord fromJson(String json) {
        try {
            var root = new JSONObject(json);
            var meta = root.getJSONObject("meta");

            int width = -1, height = -1;
            var size = meta.optString("canvasSize", "");
            if (!size.isBlank()) {
                var parts = size.split("x");
                if (parts.length == 2) {
                    width = parseInt(parts[0].trim());
                    height = parseInt(parts[1].trim());
                }
            }

            return new AlignmentRecord(
                meta.optString("file", ""),
                width, height,
                meta.optString("timestampUTCISO", ""),
                meta.optLong("durationMs", 0),
                root.getInt("offset"),
                (float) root.optDouble("disorder", Double.NaN),
                root.optBoolean("replayed", false)
            );
        } catch (JSONException | NumberFormatException e) {
            throw new CaptchaInputException("Not an alignment result: " + e.getMessage(), e);
        }
    }

    /**
     * Round to 4 decimals, enough to compare runs by eye
     */
    private static Number formatDisorder(float disorder) {
        if (disorder == Math.floor(disorder)) {
            return (int) disorder;
        }
        return Math.round(disorder * 10_000d) / 10_000d;
    }
}
