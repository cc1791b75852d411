package Model;

import org.imgscalr.Scalr;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.imageio.ImageIO;

/**
 * Pixel helpers shared by the hash calculator and the region analyzer.
 */
final class Images {

    private Images() {}

    /**
     * Decodes an image file.
     *
     * @throws IOException when the file is missing, empty, undecodable or has no pixels
     */
    static BufferedImage read(Path path) throws IOException {
        if (!Files.isRegularFile(path)) throw new IOException("Not a regular file");
        if (Files.size(path) == 0) throw new IOException("Empty file");

        BufferedImage img = ImageIO.read(path.toFile());
        if (img == null) throw new IOException("No decoder for image format");
        if (img.getWidth() <= 0 || img.getHeight() <= 0) throw new IOException("Zero dimension image");
        return img;
    }

    static BufferedImage toRgb(BufferedImage src) {
        if (src.getType() == BufferedImage.TYPE_INT_RGB) return src;

        BufferedImage rgb = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.drawImage(src, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }

    static BufferedImage resize(BufferedImage src, int width, int height) {
        if (src.getWidth() == width && src.getHeight() == height) return src;
        return Scalr.resize(src, Scalr.Method.ULTRA_QUALITY, Scalr.Mode.FIT_EXACT, width, height);
    }

    static double luminance(int rgb) {
        int r = (rgb >> 16) & 0xFF;
        int g = (rgb >> 8) & 0xFF;
        int b = rgb & 0xFF;
        return 0.299 * r + 0.587 * g + 0.114 * b;
    }

    /** Grayscale copy encoded as RGB with equal channels, ready for resampling. */
    static BufferedImage toLuminance(BufferedImage src) {
        int w = src.getWidth();
        int h = src.getHeight();
        BufferedImage gray = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int l = (int) Math.round(luminance(src.getRGB(x, y)));
                gray.setRGB(x, y, (l << 16) | (l << 8) | l);
            }
        }
        return gray;
    }

    /**
     * Numeric gradient of a matrix: central differences inside, one-sided differences at the
     * borders, zero along an axis of length one.
     *
     * @param alongRows {@code true} for the vertical (row) axis, {@code false} for columns
     */
    static double[][] gradient(double[][] m, boolean alongRows) {
        int h = m.length;
        int w = h == 0 ? 0 : m[0].length;
        double[][] out = new double[h][w];
        int n = alongRows ? h : w;
        if (n < 2) return out;

        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int i = alongRows ? y : x;
                double prev;
                double next;
                double span;
                if (i == 0) {
                    prev = m[y][x];
                    next = alongRows ? m[y + 1][x] : m[y][x + 1];
                    span = 1;
                } else if (i == n - 1) {
                    prev = alongRows ? m[y - 1][x] : m[y][x - 1];
                    next = m[y][x];
                    span = 1;
                } else {
                    prev = alongRows ? m[y - 1][x] : m[y][x - 1];
                    next = alongRows ? m[y + 1][x] : m[y][x + 1];
                    span = 2;
                }
                out[y][x] = (next - prev) / span;
            }
        }
        return out;
    }
}
