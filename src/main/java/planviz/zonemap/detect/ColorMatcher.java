package planviz.zonemap.detect;

import java.awt.Color;

/**
 * Perceptual color distance ("redmean" weighted Euclidean) plus the pixel classes the
 * scanner and the boundary walk agree on.
 */
public final class ColorMatcher {

    private ColorMatcher() {}

    /**
     * Redmean distance: red and blue weights shift with the mean red level.
     * Symmetric, non-negative, 0 only for equal colors.
     */
    public static double distance(int r1, int g1, int b1, int r2, int g2, int b2) {
        double rMean = (r1 + r2) / 2.0;
        int dr = r1 - r2;
        int dg = g1 - g2;
        int db = b1 - b2;
        return Math.sqrt(
                (2 + rMean / 256.0) * dr * dr
                        + 4.0 * dg * dg
                        + (2 + (255 - rMean) / 256.0) * db * db
        );
    }

    public static double distance(int argb, Color ref) {
        return distance((argb >> 16) & 0xFF, (argb >> 8) & 0xFF, argb & 0xFF,
                ref.getRed(), ref.getGreen(), ref.getBlue());
    }

    /** Background, roads and text. */
    public static boolean isNearWhite(int r, int g, int b) {
        return r > 245 && g > 245 && b > 245;
    }

    /** Outlines and labels; never a seed. */
    public static boolean isNearBlack(int r, int g, int b) {
        return r < 25 && g < 25 && b < 25;
    }

    /** Dark opaque block border; counts as inside while walking a boundary. */
    public static boolean isBorder(int r, int g, int b, int a) {
        return r < 70 && g < 70 && b < 70 && a > 200;
    }
}
