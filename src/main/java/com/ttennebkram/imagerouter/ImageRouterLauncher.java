package com.ttennebkram.imagerouter;

import com.ttennebkram.imagerouter.exceptions.ImageRouterException;
import com.ttennebkram.imagerouter.model.CropRect;
import com.ttennebkram.imagerouter.model.ImageFormat;
import com.ttennebkram.imagerouter.model.OperationNames;
import com.ttennebkram.imagerouter.processing.Session;
import com.ttennebkram.imagerouter.serialization.CapabilityGraphSerializer;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command-line front end: decode an image, apply the requested transformations and
 * write it in the format named by the output file's extension.
 *
 * <pre>
 * image-router &lt;input&gt; &lt;output&gt; [--resize WxH] [--crop l,t,r,b] [--rotate deg]
 *              [--quality q] [--explain] [--dump-graph]
 * </pre>
 * Transformations run in the order crop, resize, rotate.
 */
public class ImageRouterLauncher {

    private static final Logger LOG = Logger.getLogger(ImageRouterLauncher.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = "Usage: image-router <input> <output> [--resize WxH] [--crop l,t,r,b]"
        + " [--rotate deg] [--quality q] [--explain] [--dump-graph]";

    /**
     * Parsed command line.
     */
    static class Options {
        Path input;
        Path output;
        int[] resize;
        CropRect crop;
        Integer rotate;
        Integer quality;
        boolean explain;
        boolean dumpGraph;

        static Options parse(String[] args) {
            Options options = new Options();
            int positional = 0;
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--resize" -> options.resize = parseInts(value(args, ++i, arg), "x", 2, arg);
                    case "--crop" -> {
                        int[] edges = parseInts(value(args, ++i, arg), ",", 4, arg);
                        options.crop = new CropRect(edges[0], edges[1], edges[2], edges[3]);
                    }
                    case "--rotate" -> options.rotate = parseInts(value(args, ++i, arg), ",", 1, arg)[0];
                    case "--quality" -> options.quality = parseInts(value(args, ++i, arg), ",", 1, arg)[0];
                    case "--explain" -> options.explain = true;
                    case "--dump-graph" -> options.dumpGraph = true;
                    default -> {
                        if (arg.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown option " + arg);
                        }
                        if (positional == 0) {
                            options.input = Path.of(arg);
                        } else if (positional == 1) {
                            options.output = Path.of(arg);
                        } else {
                            throw new IllegalArgumentException("Unexpected argument " + arg);
                        }
                        positional++;
                    }
                }
            }
            if (options.input == null || options.output == null) {
                throw new IllegalArgumentException("Input and output files are required");
            }
            return options;
        }

        private static String value(String[] args, int index, String option) {
            if (index >= args.length) {
                throw new IllegalArgumentException(option + " needs a value");
            }
            return args[index];
        }

        private static int[] parseInts(String value, String separator, int count, String option) {
            String[] parts = value.split(separator);
            if (parts.length != count) {
                throw new IllegalArgumentException("Invalid " + option + " value: " + value);
            }
            int[] result = new int[count];
            try {
                for (int i = 0; i < count; i++) {
                    result[i] = Integer.parseInt(parts[i].trim());
                }
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid " + option + " value: " + value, e);
            }
            return result;
        }
    }

    public static void main(String[] args) {
        int code = run(args, ImageRouter.getDefault(), System.out, System.err);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    /**
     * Run one conversion. Results and {@code --explain} output go to {@code out},
     * usage and failure messages to {@code err}.
     */
    static int run(String[] args, ImageRouter imageRouter, PrintStream out, PrintStream err) {
        Options options;
        try {
            options = Options.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }

        ImageFormat outputFormat = ImageFormat.fromFileName(options.output.getFileName().toString());
        if (outputFormat == null) {
            err.println("Cannot tell the output format from " + options.output);
            return EXIT_USAGE;
        }

        if (options.dumpGraph) {
            out.println(CapabilityGraphSerializer.toJson(imageRouter.getRegistry().getGraph()));
        }

        Session session = null;
        try {
            session = imageRouter.open(options.input);
            if (options.crop != null) {
                explain(options, out, session, OperationNames.CROP);
                session = replace(session, session.crop(options.crop.getLeft(), options.crop.getTop(),
                    options.crop.getRight(), options.crop.getBottom()));
            }
            if (options.resize != null) {
                explain(options, out, session, OperationNames.RESIZE);
                session = replace(session, session.resize(options.resize[0], options.resize[1]));
            }
            if (options.rotate != null) {
                explain(options, out, session, OperationNames.ROTATE);
                session = replace(session, session.rotate(options.rotate));
            }

            String saveOperation = outputFormat.getSaveOperation();
            explain(options, out, session, saveOperation);
            // Encode fully before touching the output file
            ByteArrayOutputStream encoded = new ByteArrayOutputStream();
            if (options.quality != null && (outputFormat == ImageFormat.JPEG || outputFormat == ImageFormat.WEBP)) {
                session.invoke(saveOperation, encoded, options.quality, false);
            } else {
                session.invoke(saveOperation, encoded);
            }
            Files.write(options.output, encoded.toByteArray());
            LOG.info("Wrote " + options.output + " (" + Files.size(options.output) + " bytes)");
            return EXIT_OK;
        } catch (ImageRouterException | IOException e) {
            LOG.log(Level.SEVERE, "Failed to process " + options.input + ": " + e.getMessage(), e);
            err.println("Error: " + e.getMessage());
            return EXIT_FAILED;
        } finally {
            if (session != null) {
                session.release();
            }
        }
    }

    private static Session replace(Session previous, Session next) {
        previous.release();
        return next;
    }

    private static void explain(Options options, PrintStream out, Session session, String operation)
            throws ImageRouterException {
        if (options.explain) {
            out.println(operation + ": " + session.getRouter().resolve(session.getRepresentation(), operation));
        }
    }
}
