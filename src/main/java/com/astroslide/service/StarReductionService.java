package com.astroslide.service;

import com.astroslide.model.PixelBuffer;
import com.astroslide.model.Star;
import com.astroslide.model.StarDetectionSettings;
import com.astroslide.model.StarMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shrinks or removes detected stars by inpainting their circular masks from the
 * surrounding background. Overlapping masks are merged into one region and filled
 * together; pixels outside every mask are never written.
 */
public class StarReductionService {

    private static final Logger log = LoggerFactory.getLogger(StarReductionService.class);

    private static final int[] NX = {-1, 0, 1, -1, 1, -1, 0, 1};
    private static final int[] NY = {-1, -1, -1, 0, 0, 1, 1, 1};

    private final StarDetectionService detector;

    public StarReductionService(StarDetectionService detector) {
        this.detector = detector;
    }

    /** Detects stars and reduces them by {@code reductionAmount} (0 untouched, 1 removed). */
    public PixelBuffer reduceStars(PixelBuffer buffer, double reductionAmount) {
        checkAmount(reductionAmount);
        if (reductionAmount == 0) return buffer.copy();
        return reduce(buffer, detector.detect(buffer), reductionAmount);
    }

    public PixelBuffer reduce(PixelBuffer buffer, StarMap stars, double reductionAmount) {
        checkAmount(reductionAmount);
        if (stars.width != buffer.getWidth() || stars.height != buffer.getHeight()) {
            throw new IllegalArgumentException("Star map was detected on a different image size");
        }
        PixelBuffer out = buffer.copy();
        if (reductionAmount == 0 || stars.isEmpty()) return out;

        StarDetectionSettings settings = detector.getSettings();
        List<MaskCircle> circles = new ArrayList<>();
        for (Star s : stars.getStars()) {
            circles.add(new MaskCircle(s.x, s.y, s.radius * settings.maskScale + settings.maskPadding));
        }
        List<List<MaskCircle>> regions = mergeOverlapping(circles);

        int width = buffer.getWidth(), height = buffer.getHeight();
        boolean[] masked = new boolean[width * height];
        List<int[]> regionPixels = new ArrayList<>();
        for (List<MaskCircle> region : regions) {
            int[] pixels = rasterize(region, width, height, masked);
            if (pixels.length > 0) regionPixels.add(pixels);
        }

        for (int[] pixels : regionPixels) {
            List<int[]> layers = peelLayers(pixels, masked, width, height);
            for (int c = 0; c < out.getChannels(); c++) {
                inpaint(buffer.plane(c), out.plane(c), layers, masked, width, height, reductionAmount);
            }
        }
        log.debug("Reduced {} stars in {} mask regions by {}", stars.size(), regionPixels.size(), reductionAmount);
        return out;
    }

    static List<List<MaskCircle>> mergeOverlapping(List<MaskCircle> circles) {
        int n = circles.size();
        int[] parent = new int[n];
        for (int i = 0; i < n; i++) parent[i] = i;

        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) order[i] = i;
        Arrays.sort(order, Comparator.comparingDouble(i -> circles.get(i).x));
        double maxRadius = 0;
        for (MaskCircle c : circles) maxRadius = Math.max(maxRadius, c.r);

        for (int a = 0; a < n; a++) {
            MaskCircle ca = circles.get(order[a]);
            for (int b = a + 1; b < n; b++) {
                MaskCircle cb = circles.get(order[b]);
                if (cb.x - ca.x > ca.r + maxRadius) break;
                if (ca.overlaps(cb)) union(parent, order[a], order[b]);
            }
        }

        Map<Integer, List<MaskCircle>> groups = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            groups.computeIfAbsent(find(parent, i), k -> new ArrayList<>()).add(circles.get(i));
        }
        return new ArrayList<>(groups.values());
    }

    private static int find(int[] parent, int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }

    private static void union(int[] parent, int a, int b) {
        int ra = find(parent, a), rb = find(parent, b);
        if (ra != rb) parent[Math.max(ra, rb)] = Math.min(ra, rb);
    }

    private static int[] rasterize(List<MaskCircle> region, int width, int height, boolean[] masked) {
        List<Integer> pixels = new ArrayList<>();
        for (MaskCircle c : region) {
            int x0 = Math.max(0, (int) Math.floor(c.x - c.r)), x1 = Math.min(width - 1, (int) Math.ceil(c.x + c.r));
            int y0 = Math.max(0, (int) Math.floor(c.y - c.r)), y1 = Math.min(height - 1, (int) Math.ceil(c.y + c.r));
            for (int y = y0; y <= y1; y++) {
                for (int x = x0; x <= x1; x++) {
                    int i = y * width + x;
                    if (!masked[i] && c.contains(x, y)) {
                        masked[i] = true;
                        pixels.add(i);
                    }
                }
            }
        }
        int[] result = new int[pixels.size()];
        for (int i = 0; i < result.length; i++) result[i] = pixels.get(i);
        return result;
    }

    /**
     * Orders a region's pixels from its border inward. Each layer holds the still unfilled
     * pixels touching a known one, where known means outside every mask or in an earlier
     * layer. Pixels never reached (region enclosed by other masks) are left out.
     */
    private static List<int[]> peelLayers(int[] pixels, boolean[] masked, int width, int height) {
        boolean[] filled = new boolean[masked.length];
        List<int[]> layers = new ArrayList<>();
        int[] remaining = pixels;
        while (remaining.length > 0) {
            int[] layer = new int[remaining.length];
            int[] rest = new int[remaining.length];
            int nl = 0, nr = 0;
            for (int i : remaining) {
                if (hasKnownNeighbour(i, masked, filled, width, height)) layer[nl++] = i;
                else rest[nr++] = i;
            }
            if (nl == 0) break;
            layer = Arrays.copyOf(layer, nl);
            for (int i : layer) filled[i] = true;
            layers.add(layer);
            remaining = Arrays.copyOf(rest, nr);
        }
        return layers;
    }

    private static boolean hasKnownNeighbour(int i, boolean[] masked, boolean[] filled, int width, int height) {
        int x = i % width, y = i / width;
        for (int k = 0; k < NX.length; k++) {
            int nx = x + NX[k], ny = y + NY[k];
            if (nx < 0 || ny < 0 || nx >= width || ny >= height) continue;
            int n = ny * width + nx;
            if (!masked[n] || filled[n]) return true;
        }
        return false;
    }

    private static void inpaint(float[] source, float[] target, List<int[]> layers, boolean[] masked,
                                int width, int height, double amount) {
        float[] fill = new float[source.length];
        boolean[] known = new boolean[source.length];
        for (int[] layer : layers) {
            float[] values = new float[layer.length];
            for (int k = 0; k < layer.length; k++) {
                int i = layer[k];
                int x = i % width, y = i / width;
                double sum = 0;
                int n = 0;
                for (int d = 0; d < NX.length; d++) {
                    int nx = x + NX[d], ny = y + NY[d];
                    if (nx < 0 || ny < 0 || nx >= width || ny >= height) continue;
                    int j = ny * width + nx;
                    if (!masked[j]) {
                        sum += source[j];
                        n++;
                    } else if (known[j]) {
                        sum += fill[j];
                        n++;
                    }
                }
                values[k] = (float) (sum / n);
            }
            for (int k = 0; k < layer.length; k++) {
                int i = layer[k];
                fill[i] = values[k];
                known[i] = true;
                target[i] = (float) (source[i] + amount * (values[k] - source[i]));
            }
        }
    }

    private static void checkAmount(double amount) {
        if (!(amount >= 0 && amount <= 1)) {
            throw new IllegalArgumentException("Reduction amount must be in [0,1]: " + amount);
        }
    }

    static final class MaskCircle {
        final double x, y, r;

        MaskCircle(double x, double y, double r) {
            this.x = x;
            this.y = y;
            this.r = r;
        }

        boolean overlaps(MaskCircle o) {
            double dx = x - o.x, dy = y - o.y;
            double reach = r + o.r;
            return dx * dx + dy * dy < reach * reach;
        }

        boolean contains(int px, int py) {
            double dx = px - x, dy = py - y;
            return dx * dx + dy * dy <= r * r;
        }
    }
}
