package com.astroslide.main;

import com.astroslide.model.AppConfig;
import com.astroslide.model.EnhancementException;
import com.astroslide.model.HistogramResult;
import com.astroslide.model.OutputFormat;
import com.astroslide.model.PixelBuffer;
import com.astroslide.model.PresetCatalog;
import com.astroslide.model.PresetDefinition;
import com.astroslide.service.EnhancementService;
import com.astroslide.service.FitsImageService;
import com.astroslide.service.ImageCodecService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;

/**
 * Command line front end:
 * {@code <input> <output> [--preset id] [--intensity x] [--format jpeg|png|tiff]
 * [--preview [size]] [--stars amount] [--histogram] [--list-presets]}.
 */
public class AstroSlideApp {

    private static final Logger log = LoggerFactory.getLogger(AstroSlideApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 2;
    static final int EXIT_FAILED = 1;

    static final class Options {
        File input;
        File output;
        String preset = PresetCatalog.GENERAL;
        double intensity = 1.0;
        OutputFormat format;
        int previewSize;
        Double starAmount;
        boolean histogram;
        boolean listPresets;
    }

    public static void main(String[] args) {
        System.exit(new AstroSlideApp().run(args, System.out, System.err));
    }

    int run(String[] args, PrintStream out, PrintStream err) {
        Options options;
        try {
            options = parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(usage());
            return EXIT_USAGE;
        }
        if (options.listPresets) {
            for (PresetDefinition p : PresetCatalog.all()) {
                out.printf("%-20s %s: %s (best for: %s)%n", p.id, p.name, p.description, p.bestFor);
            }
            if (options.input == null) return EXIT_OK;
        }

        try (EnhancementService service = new EnhancementService()) {
            PixelBuffer image = load(options.input);
            log.info("Loaded {} as {}", options.input.getName(), image);

            if (options.histogram) printHistogram(service.computeHistogram(image), out);

            PixelBuffer result;
            if (options.starAmount != null) {
                result = service.reduceStars(image, options.starAmount);
            } else if (options.previewSize > 0) {
                result = service.generatePreview(image, options.preset, options.previewSize);
            } else {
                result = service.enhance(image, options.preset, options.intensity);
            }
            new ImageCodecService().write(result, options.format, options.output);
            return EXIT_OK;
        } catch (EnhancementException e) {
            err.println("Enhancement failed [" + e.getKind() + "]: " + e.getMessage());
            return EXIT_FAILED;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    static Options parse(String[] args) {
        Options o = new Options();
        int positional = 0;
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "--preset":
                    o.preset = value(args, ++i, a);
                    break;
                case "--intensity":
                    o.intensity = number(value(args, ++i, a), a);
                    break;
                case "--format":
                    o.format = OutputFormat.parse(value(args, ++i, a));
                    break;
                case "--preview":
                    if (i + 1 < args.length && args[i + 1].matches("\\d+")) {
                        o.previewSize = Integer.parseInt(args[++i]);
                    } else {
                        o.previewSize = AppConfig.getPreviewSize();
                    }
                    if (o.previewSize <= 0) throw new IllegalArgumentException("--preview needs a positive size");
                    break;
                case "--stars":
                    o.starAmount = number(value(args, ++i, a), a);
                    break;
                case "--histogram":
                    o.histogram = true;
                    break;
                case "--list-presets":
                    o.listPresets = true;
                    break;
                default:
                    if (a.startsWith("--")) throw new IllegalArgumentException("Unknown option " + a);
                    if (positional == 0) o.input = new File(a);
                    else if (positional == 1) o.output = new File(a);
                    else throw new IllegalArgumentException("Unexpected argument " + a);
                    positional++;
            }
        }
        if (o.listPresets && positional == 0) return o;
        if (o.input == null || o.output == null) throw new IllegalArgumentException("Input and output files are required");
        if (o.format == null) o.format = formatFromName(o.output.getName());
        return o;
    }

    static OutputFormat formatFromName(String name) {
        int dot = name.lastIndexOf('.');
        if (dot < 0) return OutputFormat.JPEG;
        String ext = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        if (ext.equals("tiff") || ext.equals("tif")) return OutputFormat.TIFF;
        if (ext.equals("png")) return OutputFormat.PNG;
        return OutputFormat.JPEG;
    }

    private static PixelBuffer load(File input) throws IOException {
        String name = input.getName().toLowerCase(Locale.ROOT);
        if (name.endsWith(".fits") || name.endsWith(".fit") || name.endsWith(".fts")) {
            return new FitsImageService().read(input, true);
        }
        return new ImageCodecService().read(input);
    }

    private static void printHistogram(HistogramResult h, PrintStream out) {
        out.printf("pixels=%d%n", HistogramResult.total(h.luminance));
        out.printf("luminance: median bin %d, peak bin %d%n", medianBin(h.luminance), peakBin(h.luminance));
        out.printf("red peak %d, green peak %d, blue peak %d%n", peakBin(h.red), peakBin(h.green), peakBin(h.blue));
    }

    static int peakBin(long[] counts) {
        int best = 0;
        for (int i = 1; i < counts.length; i++) if (counts[i] > counts[best]) best = i;
        return best;
    }

    static int medianBin(long[] counts) {
        long half = (HistogramResult.total(counts) + 1) / 2, seen = 0;
        for (int i = 0; i < counts.length; i++) {
            seen += counts[i];
            if (seen >= half) return i;
        }
        return counts.length - 1;
    }

    private static String value(String[] args, int i, String option) {
        if (i >= args.length) throw new IllegalArgumentException(option + " needs a value");
        return args[i];
    }

    private static double number(String value, String option) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(option + " expects a number, got '" + value + "'", e);
        }
    }

    static String usage() {
        return "Usage: astroslide <input> <output> [--preset id] [--intensity x] [--format jpeg|png|tiff]"
                + " [--preview [size]] [--stars amount] [--histogram] [--list-presets]";
    }
}
