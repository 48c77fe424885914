package fr.lapetina.pixelator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.pixelator.api.dto.PixelationReport;
import fr.lapetina.pixelator.disruptor.exception.PixelationException;
import fr.lapetina.pixelator.domain.grid.GridValidator;
import fr.lapetina.pixelator.domain.model.PixelateOptions;
import fr.lapetina.pixelator.domain.model.PixelatedImage;
import fr.lapetina.pixelator.infrastructure.config.ConfigLoader;
import fr.lapetina.pixelator.infrastructure.io.ImageSources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command-line entry point: pixelates one image file into a PNG.
 *
 * <pre>
 * pixelator &lt;input&gt; &lt;output.png&gt; &lt;xCells&gt; &lt;yCells&gt;
 *           [--grayscale] [--executors N] [--config path] [--report path]
 * </pre>
 */
public class PixelatorApplication {

    private static final Logger log = LoggerFactory.getLogger(PixelatorApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = "Usage: pixelator <input> <output.png> <xCells> <yCells>"
            + " [--grayscale] [--executors N] [--config path] [--report path]";

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Runs the command and returns the process exit code.
     */
    public int run(String... args) {
        Arguments arguments;
        try {
            arguments = Arguments.parse(args);
        } catch (IllegalArgumentException e) {
            log.error("{}", e.getMessage());
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            return EXIT_USAGE;
        }

        try (PixelatorFactory factory = PixelatorFactory.create(arguments.configPath())) {
            Pixelator pixelator = factory.forSource(ImageSources.fromPath(arguments.input()));

            int xCells = GridValidator.toCellCount(arguments.xCells(), "x");
            int yCells = GridValidator.toCellCount(arguments.yCells(), "y");

            PixelateOptions options = PixelateOptions.defaults()
                    .withGrayscale(arguments.grayscale() || factory.getConfig().getOutput().isGrayscale());
            if (arguments.executors() != null) {
                options = options.withConcurrencyLimit(arguments.executors());
            }

            PixelatedImage image = pixelator.pixelateSync(xCells, yCells, options);
            Files.write(arguments.output(), pixelator.toPng());

            log.info("Wrote {}x{} pixelated image to {} ({}x{} cells, executors={}, elapsedMs={})",
                    image.width(), image.height(), arguments.output(), xCells, yCells,
                    image.executors(), image.elapsed().toMillis());

            if (arguments.report() != null) {
                PixelationReport report = PixelationReport.from(image,
                        arguments.input().toString(), arguments.output().toString());
                objectMapper.writeValue(arguments.report().toFile(), report);
                log.info("Wrote report to {}", arguments.report());
            }
            return EXIT_OK;

        } catch (PixelationException e) {
            log.error("Pixelation failed: errorType={}, error={}", e.getErrorType(), e.getMessage());
            return EXIT_FAILURE;
        } catch (ConfigLoader.ConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return EXIT_FAILURE;
        } catch (IOException e) {
            log.error("Failed to write output", e);
            return EXIT_FAILURE;
        }
    }

    public static void main(String[] args) {
        System.exit(new PixelatorApplication().run(args));
    }

    /**
     * Parsed command line.
     */
    record Arguments(
            Path input,
            Path output,
            String xCells,
            String yCells,
            boolean grayscale,
            Integer executors,
            String configPath,
            Path report
    ) {
        static Arguments parse(String... args) {
            String[] positional = new String[4];
            int count = 0;
            boolean grayscale = false;
            Integer executors = null;
            String configPath = ConfigLoader.DEFAULT_CONFIG;
            Path report = null;

            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--grayscale" -> grayscale = true;
                    case "--executors" -> executors = parseExecutors(valueOf(args, ++i, arg));
                    case "--config" -> configPath = valueOf(args, ++i, arg);
                    case "--report" -> report = Paths.get(valueOf(args, ++i, arg));
                    default -> {
                        if (arg.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown option: " + arg);
                        }
                        if (count == positional.length) {
                            throw new IllegalArgumentException("Unexpected argument: " + arg);
                        }
                        positional[count++] = arg;
                    }
                }
            }

            if (count < positional.length) {
                throw new IllegalArgumentException("Expected 4 arguments, got " + count);
            }
            return new Arguments(Paths.get(positional[0]), Paths.get(positional[1]),
                    positional[2], positional[3], grayscale, executors, configPath, report);
        }

        private static String valueOf(String[] args, int index, String option) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + option);
            }
            return args[index];
        }

        private static Integer parseExecutors(String value) {
            try {
                int executors = Integer.parseInt(value);
                if (executors <= 0) {
                    throw new IllegalArgumentException("--executors must be positive: " + value);
                }
                return executors;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("--executors must be an integer: " + value);
            }
        }
    }
}
