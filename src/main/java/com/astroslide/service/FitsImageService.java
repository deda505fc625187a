package com.astroslide.service;

import com.astroslide.model.PixelBuffer;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.lang.reflect.Array;

/**
 * Reads the primary image of a FITS file into a normalized buffer. Accepts 2-D mono images
 * and 3 x h x w colour cubes of any BITPIX. Physical values are {@code BZERO + BSCALE * raw},
 * then stretched min-max to [0,1] across all planes.
 */
public class FitsImageService {

    private static final Logger log = LoggerFactory.getLogger(FitsImageService.class);

    public PixelBuffer read(File file) throws IOException {
        return read(file, false);
    }

    /** @param replicateGray expand mono images to three identical RGB planes */
    public PixelBuffer read(File file, boolean replicateGray) throws IOException {
        try (Fits fits = new Fits(file)) {
            BasicHDU<?> hdu = fits.getHDU(0);
            if (hdu == null) throw new IOException("No HDU in " + file.getName());
            Header header = hdu.getHeader();
            double bzero = header.getDoubleValue("BZERO", 0.0);
            double bscale = header.getDoubleValue("BSCALE", 1.0);

            Object kernel = hdu.getKernel();
            float[][] planes = toPlanes(kernel, file);
            int height = rowsOf(kernel).length;
            int width = planes[0].length / height;

            float min = Float.POSITIVE_INFINITY, max = Float.NEGATIVE_INFINITY;
            for (float[] plane : planes) {
                for (int i = 0; i < plane.length; i++) {
                    float v = (float) (bzero + bscale * plane[i]);
                    if (Float.isNaN(v)) v = 0f;
                    plane[i] = v;
                    if (v < min) min = v;
                    if (v > max) max = v;
                }
            }
            float range = max - min;
            for (float[] plane : planes) {
                for (int i = 0; i < plane.length; i++) {
                    plane[i] = range > 0 ? (plane[i] - min) / range : 0f;
                }
            }
            log.debug("Read {} as {}x{}x{} (BZERO={}, BSCALE={}, range {}..{})",
                    file.getName(), width, height, planes.length, bzero, bscale, min, max);

            if (planes.length == 1 && replicateGray) {
                return PixelBuffer.ofPlanes(width, height, planes[0], planes[0].clone(), planes[0].clone());
            }
            return PixelBuffer.ofPlanes(width, height, planes);
        } catch (FitsException e) {
            throw new IOException("Cannot read FITS " + file.getName() + ": " + e.getMessage(), e);
        }
    }

    private float[][] toPlanes(Object kernel, File file) throws IOException {
        if (!(kernel instanceof Object[]) || ((Object[]) kernel).length == 0) {
            throw new IOException("Primary HDU of " + file.getName() + " holds no 2-D or 3-D image");
        }
        Object[] outer = (Object[]) kernel;
        if (outer[0] instanceof Object[]) {
            if (outer.length != 1 && outer.length != 3) {
                throw new IOException("Expected 1 or 3 planes in " + file.getName() + ", found " + outer.length);
            }
            float[][] planes = new float[outer.length][];
            for (int c = 0; c < outer.length; c++) planes[c] = flatten((Object[]) outer[c]);
            return planes;
        }
        return new float[][] { flatten(outer) };
    }

    private static Object[] rowsOf(Object kernel) {
        Object[] outer = (Object[]) kernel;
        return outer[0] instanceof Object[] ? (Object[]) outer[0] : outer;
    }

    private static float[] flatten(Object[] rows) {
        int height = rows.length;
        int width = Array.getLength(rows[0]);
        float[] out = new float[width * height];
        for (int y = 0; y < height; y++) {
            Object row = rows[y];
            if (row instanceof byte[]) {
                byte[] b = (byte[]) row;
                for (int x = 0; x < width; x++) out[y * width + x] = b[x] & 0xFF;
            } else {
                for (int x = 0; x < width; x++) out[y * width + x] = (float) Array.getDouble(row, x);
            }
        }
        return out;
    }
}
