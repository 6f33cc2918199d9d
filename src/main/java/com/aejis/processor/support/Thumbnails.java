package com.aejis.processor.support;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Base64;

/**
 * Downscaled PNG previews returned as data URIs. Requires {@code java.awt.headless=true},
 * which the entrypoint sets.
 */
public final class Thumbnails {

    public static final int MAX_DIMENSION = 800;

    private Thumbnails() {}

    public static String pngDataUri(BufferedImage image) throws IOException {
        return pngDataUri(image, MAX_DIMENSION);
    }

    public static String pngDataUri(BufferedImage image, int maxDimension) throws IOException {
        BufferedImage scaled = scale(image, maxDimension);
        var out = new ByteArrayOutputStream();
        if (!ImageIO.write(scaled, "png", out)) {
            throw new IOException("No PNG writer available");
        }
        return "data:image/png;base64," + Base64.getEncoder().encodeToString(out.toByteArray());
    }

    static BufferedImage scale(BufferedImage image, int maxDimension) {
        int w = image.getWidth();
        int h = image.getHeight();
        double factor = Math.min(1.0, (double) maxDimension / Math.max(w, h));
        int tw = Math.max(1, (int) Math.round(w * factor));
        int th = Math.max(1, (int) Math.round(h * factor));
        int type = image.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        BufferedImage target = new BufferedImage(tw, th, type);
        Graphics2D g = target.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.drawImage(image, 0, 0, tw, th, null);
        } finally {
            g.dispose();
        }
        return target;
    }
}
