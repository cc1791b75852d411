package Model;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;

/**
 * Scores localized differences between two images over a fixed grid.
 *
 * <p>Each cell gets three scores: mean absolute pixel difference (0..255), L1 distance of
 * normalized luminance histograms (0..2) and mean absolute difference of the two-axis
 * luminance gradient. Their weighted sum is compared against the region threshold.</p>
 */
public class RegionAnalyzer {

    private final int gridSize;
    private final int bins;
    private final double threshold;
    private final DetectionConfig.RegionWeights weights;

    public RegionAnalyzer(DetectionConfig config) {
        this.gridSize = config.gridSize();
        this.bins = config.histogramBins();
        this.threshold = config.regionThreshold();
        this.weights = config.regionWeights();
    }

    /**
     * Returns the flagged cells in row-major order. The candidate is resampled to the
     * incoming image's size when the two differ; the incoming image is never resampled.
     */
    public List<RegionDifference> analyze(BufferedImage incoming, BufferedImage candidate) {
        BufferedImage a = Images.toRgb(incoming);
        BufferedImage b = Images.toRgb(Images.resize(Images.toRgb(candidate), a.getWidth(), a.getHeight()));

        int w = a.getWidth();
        int h = a.getHeight();
        int cellW = w / gridSize;
        int cellH = h / gridSize;

        List<RegionDifference> flagged = new ArrayList<>();
        for (int row = 0; row < gridSize; row++) {
            int y0 = row * cellH;
            int y1 = row == gridSize - 1 ? h : y0 + cellH;
            for (int col = 0; col < gridSize; col++) {
                int x0 = col * cellW;
                int x1 = col == gridSize - 1 ? w : x0 + cellW;
                if (x1 <= x0 || y1 <= y0) continue;

                double score = cellScore(a, b, x0, y0, x1, y1);
                if (score > threshold) {
                    flagged.add(new RegionDifference(row, col, score));
                }
            }
        }
        return flagged;
    }

    double cellScore(BufferedImage a, BufferedImage b, int x0, int y0, int x1, int y1) {
        int cw = x1 - x0;
        int ch = y1 - y0;

        double[][] grayA = new double[ch][cw];
        double[][] grayB = new double[ch][cw];
        double[] histA = new double[bins];
        double[] histB = new double[bins];
        double absSum = 0;

        for (int y = 0; y < ch; y++) {
            for (int x = 0; x < cw; x++) {
                int pa = a.getRGB(x0 + x, y0 + y);
                int pb = b.getRGB(x0 + x, y0 + y);

                absSum += Math.abs(((pa >> 16) & 0xFF) - ((pb >> 16) & 0xFF))
                        + Math.abs(((pa >> 8) & 0xFF) - ((pb >> 8) & 0xFF))
                        + Math.abs((pa & 0xFF) - (pb & 0xFF));

                grayA[y][x] = Images.luminance(pa);
                grayB[y][x] = Images.luminance(pb);
                histA[bin(grayA[y][x])]++;
                histB[bin(grayB[y][x])]++;
            }
        }

        int pixels = cw * ch;
        double pixelScore = absSum / (3.0 * pixels);
        double histogramScore = histogramDistance(histA, histB, pixels);
        double edgeScore = edgeDifference(grayA, grayB);

        return weights.pixel() * pixelScore
                + weights.histogram() * histogramScore
                + weights.edge() * edgeScore;
    }

    private int bin(double level) {
        int b = (int) (level * bins / 256.0);
        return Math.min(Math.max(b, 0), bins - 1);
    }

    // both histograms hold the same pixel count, so one divisor normalizes both to sum 1
    private static double histogramDistance(double[] a, double[] b, int total) {
        double d = 0;
        for (int i = 0; i < a.length; i++) {
            d += Math.abs(a[i] / total - b[i] / total);
        }
        return d;
    }

    private static double edgeDifference(double[][] a, double[][] b) {
        double[][] ay = Images.gradient(a, true);
        double[][] ax = Images.gradient(a, false);
        double[][] by = Images.gradient(b, true);
        double[][] bx = Images.gradient(b, false);

        double sumY = 0;
        double sumX = 0;
        int n = 0;
        for (int y = 0; y < a.length; y++) {
            for (int x = 0; x < a[y].length; x++) {
                sumY += Math.abs(ay[y][x] - by[y][x]);
                sumX += Math.abs(ax[y][x] - bx[y][x]);
                n++;
            }
        }
        return (sumY / n + sumX / n) / 2.0;
    }
}
