package com.astroslide.service;

import com.astroslide.model.AppConfig;
import com.astroslide.model.OutputFormat;
import com.astroslide.model.PixelBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.BufferedImage;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;
import java.awt.image.WritableRaster;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.util.Iterator;

/**
 * Raster codecs through {@code javax.imageio}: decodes 8 or 16 bit JPEG/PNG/TIFF into
 * normalized buffers and encodes buffers as 8 bit images.
 */
public class ImageCodecService {

    private static final Logger log = LoggerFactory.getLogger(ImageCodecService.class);

    private final float jpegQuality;

    public ImageCodecService() {
        this(AppConfig.getJpegQuality());
    }

    public ImageCodecService(float jpegQuality) {
        this.jpegQuality = jpegQuality;
    }

    public PixelBuffer read(File file) throws IOException {
        BufferedImage image = ImageIO.read(file);
        if (image == null) throw new IOException("Unsupported image format: " + file.getName());
        return toBuffer(image);
    }

    public PixelBuffer toBuffer(BufferedImage image) {
        int w = image.getWidth(), h = image.getHeight();
        Raster raster = image.getRaster();
        int bands = raster.getNumBands();
        if (image.getColorModel() instanceof IndexColorModel || raster.getSampleModel().getSampleSize(0) > 16) {
            return PixelBuffer.fromPackedRgb(w, h, image.getRGB(0, 0, w, h, null, 0, w));
        }
        int channels = bands >= 3 ? PixelBuffer.RGB : PixelBuffer.GRAY;
        PixelBuffer out = PixelBuffer.create(w, h, channels);
        for (int c = 0; c < channels; c++) {
            int bits = raster.getSampleModel().getSampleSize(c);
            float max = (float) ((1L << bits) - 1);
            float[] plane = out.plane(c);
            int[] samples = raster.getSamples(0, 0, w, h, c, (int[]) null);
            for (int i = 0; i < samples.length; i++) {
                plane[i] = (samples[i] & 0xFFFF) / max;
            }
        }
        return out.clamp();
    }

    public BufferedImage toImage(PixelBuffer buffer) {
        int w = buffer.getWidth(), h = buffer.getHeight();
        BufferedImage image = new BufferedImage(w, h,
                buffer.isColor() ? BufferedImage.TYPE_3BYTE_BGR : BufferedImage.TYPE_BYTE_GRAY);
        WritableRaster raster = image.getRaster();
        if (buffer.isColor()) {
            int[] packed = new int[w * h];
            float[] r = buffer.plane(0), g = buffer.plane(1), b = buffer.plane(2);
            for (int i = 0; i < packed.length; i++) {
                packed[i] = (to8(r[i]) << 16) | (to8(g[i]) << 8) | to8(b[i]);
            }
            image.setRGB(0, 0, w, h, packed, 0, w);
        } else {
            float[] gray = buffer.plane(0);
            int[] samples = new int[w * h];
            for (int i = 0; i < samples.length; i++) samples[i] = to8(gray[i]);
            raster.setSamples(0, 0, w, h, 0, samples);
        }
        return image;
    }

    public byte[] encode(PixelBuffer buffer, OutputFormat format) throws IOException {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            write(toImage(buffer), format, baos);
            return baos.toByteArray();
        }
    }

    public void write(PixelBuffer buffer, OutputFormat format, File file) throws IOException {
        try (OutputStream out = Files.newOutputStream(file.toPath())) {
            write(toImage(buffer), format, out);
        }
        log.info("Wrote {} ({}x{}, {})", file.getName(), buffer.getWidth(), buffer.getHeight(), format);
    }

    private void write(BufferedImage image, OutputFormat format, OutputStream out) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(format.formatName);
        if (!writers.hasNext()) throw new IOException("No ImageIO writer for " + format);
        ImageWriter writer = writers.next();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
            ImageWriteParam param = writer.getDefaultWriteParam();
            if (format == OutputFormat.JPEG) {
                param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                param.setCompressionQuality(jpegQuality);
            } else if (format == OutputFormat.TIFF && param.canWriteCompressed()) {
                param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                param.setCompressionType("LZW");
            }
            writer.setOutput(ios);
            writer.write(null, new IIOImage(image, null, null), param);
        } finally {
            writer.dispose();
        }
    }

    private static int to8(float v) {
        return Math.max(0, Math.min(255, Math.round(v * 255f)));
    }
}
