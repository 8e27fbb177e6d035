package com.astrofiler.service;

import com.astrofiler.exception.FitsReadException;
import ij.process.FloatProcessor;
import ij.process.ImageStatistics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;

/**
 * Pixel-level sanity check of master frames: the primary image must decode and
 * contain finite data.
 */
public class MasterIntegrityService {
    private static final Logger LOG = LogManager.getLogger(MasterIntegrityService.class);

    private final FitsHeaderService headerService;

    public MasterIntegrityService(FitsHeaderService headerService) {
        this.headerService = headerService;
    }

    public boolean hasImageData(Path file) throws FitsReadException {
        FloatProcessor ip = toFloatProcessor(headerService.readImageData(file));
        if (ip == null) {
            LOG.warn("No 2D image data in {}", file);
            return false;
        }
        ImageStatistics stats = ip.getStatistics();
        boolean ok = stats.pixelCount > 0 && !Double.isNaN(stats.mean) && !Double.isInfinite(stats.mean);
        LOG.debug("{}: pixels={}, mean={}, stdDev={}", file, stats.pixelCount, stats.mean, stats.stdDev);
        return ok;
    }

    /** First plane of the image as floats, or null when the HDU holds no image. */
    static FloatProcessor toFloatProcessor(Object kernel) {
        if (kernel instanceof Object[] && ((Object[]) kernel).length > 0 && ((Object[]) kernel)[0] instanceof Object[]) {
            return toFloatProcessor(((Object[]) kernel)[0]);
        }
        float[][] rows = toFloatRows(kernel);
        if (rows == null || rows.length == 0 || rows[0].length == 0) return null;
        int height = rows.length;
        int width = rows[0].length;
        FloatProcessor ip = new FloatProcessor(width, height);
        float[] px = (float[]) ip.getPixels();
        for (int y = 0; y < height; y++) {
            System.arraycopy(rows[y], 0, px, y * width, width);
        }
        return ip;
    }

    private static float[][] toFloatRows(Object k) {
        if (k instanceof float[][]) {
            return (float[][]) k;
        }
        if (k instanceof short[][]) {
            short[][] s = (short[][]) k;
            float[][] f = new float[s.length][s.length == 0 ? 0 : s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[i].length; j++) f[i][j] = s[i][j];
            return f;
        }
        if (k instanceof int[][]) {
            int[][] s = (int[][]) k;
            float[][] f = new float[s.length][s.length == 0 ? 0 : s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[i].length; j++) f[i][j] = s[i][j];
            return f;
        }
        if (k instanceof double[][]) {
            double[][] s = (double[][]) k;
            float[][] f = new float[s.length][s.length == 0 ? 0 : s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[i].length; j++) f[i][j] = (float) s[i][j];
            return f;
        }
        if (k instanceof byte[][]) {
            byte[][] s = (byte[][]) k;
            float[][] f = new float[s.length][s.length == 0 ? 0 : s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[i].length; j++) f[i][j] = s[i][j] & 0xFF;
            return f;
        }
        return null;
    }
}
