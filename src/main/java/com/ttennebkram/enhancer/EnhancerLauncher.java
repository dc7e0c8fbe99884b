package com.ttennebkram.enhancer;

import com.ttennebkram.enhancer.config.EnhancerConfig;
import com.ttennebkram.enhancer.processing.EnhancementException;
import com.ttennebkram.enhancer.processing.ImageEnhancer;
import com.ttennebkram.enhancer.processors.EnhancementProcessorRegistry;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line entry point: enhance one image file and write the JPEG result.
 *
 * <pre>
 * java -jar landscape-enhancer.jar input.jpg output.jpg [ContrastGamma|ToneMapDrago] [--config enhancer.json]
 * </pre>
 */
public class EnhancerLauncher {

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILED = 2;

    public static void main(String[] args) {
        // Load OpenCV native library
        nu.pattern.OpenCV.loadLocally();

        System.exit(run(args, System.out, System.err));
    }

    /**
     * Run the tool without exiting the JVM. OpenCV must already be loaded.
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        List<String> positional = new ArrayList<>();
        Path configPath = null;

        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    printUsage(err);
                    return EXIT_USAGE;
                }
                configPath = Paths.get(args[++i]);
            } else if ("--help".equals(args[i]) || "-h".equals(args[i])) {
                printUsage(out);
                return EXIT_OK;
            } else {
                positional.add(args[i]);
            }
        }

        if (positional.size() < 2 || positional.size() > 3) {
            printUsage(err);
            return EXIT_USAGE;
        }

        Path input = Paths.get(positional.get(0));
        Path output = Paths.get(positional.get(1));

        try {
            EnhancerConfig config = configPath != null ? EnhancerConfig.load(configPath) : EnhancerConfig.loadDefault();
            if (positional.size() == 3) {
                config = config.withAlgorithm(positional.get(2));
            }

            ImageEnhancer enhancer;
            try {
                enhancer = new ImageEnhancer(config);
            } catch (IllegalArgumentException e) {
                err.println("Invalid configuration: " + e.getMessage());
                return EXIT_FAILED;
            }
            byte[] result = enhancer.enhance(Files.readAllBytes(input));
            Files.write(output, result);

            out.printf("%s -> %s (%s, %d bytes)%n", input, output,
                EnhancementProcessorRegistry.getDisplayName(config.getAlgorithm()), result.length);
            return EXIT_OK;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return EXIT_FAILED;
        } catch (EnhancementException e) {
            err.println("Enhancement failed: " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    private static void printUsage(PrintStream stream) {
        stream.println("Usage: EnhancerLauncher <input> <output> [algorithm] [--config <file>]");
        stream.println("Algorithms: " + String.join(", ", EnhancementProcessorRegistry.getRegisteredAlgorithms()));
    }
}
