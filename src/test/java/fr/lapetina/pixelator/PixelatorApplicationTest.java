package fr.lapetina.pixelator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.pixelator.domain.model.PixelBuffer;
import fr.lapetina.pixelator.infrastructure.io.ImageEncoder;
import fr.lapetina.pixelator.infrastructure.io.ImageSources;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class PixelatorApplicationTest {

    @TempDir
    Path dir;

    private Path input;
    private Path output;

    @BeforeEach
    void setUp() throws IOException {
        input = dir.resolve("input.png");
        output = dir.resolve("output.png");
        Files.write(input, ImageEncoder.toPng(TestImages.solid(10, 10, 255, 0, 0, 255)));
    }

    @Test
    @DisplayName("should write the pixelated PNG and a JSON report")
    void shouldWriteOutputAndReport() throws IOException {
        Path report = dir.resolve("report.json");

        int exit = new PixelatorApplication().run(
                input.toString(), output.toString(), "2", "2",
                "--executors", "2", "--config", "test-config.yaml", "--report", report.toString());

        assertThat(exit).isEqualTo(PixelatorApplication.EXIT_OK);
        PixelBuffer written = ImageSources.fromPath(output);
        // test-config.yaml turns grayscale on: floor(0.299 * 255) = 76
        assertThat(written.rgba(9, 9)).isEqualTo(TestImages.pack(76, 76, 76, 255));

        JsonNode json = new ObjectMapper().readTree(report.toFile());
        assertThat(json.get("columns").asInt()).isEqualTo(2);
        assertThat(json.get("column_widths").toString()).isEqualTo("[5,5]");
        assertThat(json.get("executors").asInt()).isEqualTo(2);
        assertThat(json.get("grayscale").asBoolean()).isTrue();
        assertThat(json.get("created_at").isTextual()).isTrue();
    }

    @Test
    @DisplayName("should return the usage exit code for bad arguments")
    void shouldRejectBadArguments() {
        PixelatorApplication app = new PixelatorApplication();

        assertThat(app.run(input.toString(), output.toString(), "2")).isEqualTo(PixelatorApplication.EXIT_USAGE);
        assertThat(app.run(input.toString(), output.toString(), "2", "2", "--executors", "zero"))
                .isEqualTo(PixelatorApplication.EXIT_USAGE);
        assertThat(app.run(input.toString(), output.toString(), "2", "2", "--bogus"))
                .isEqualTo(PixelatorApplication.EXIT_USAGE);
    }

    @Test
    @DisplayName("should return the failure exit code for invalid cell counts")
    void shouldFailOnInvalidCellCounts() {
        PixelatorApplication app = new PixelatorApplication();

        assertThat(app.run(input.toString(), output.toString(), "2.5", "2", "--config", "test-config.yaml"))
                .isEqualTo(PixelatorApplication.EXIT_FAILURE);
        assertThat(app.run(input.toString(), output.toString(), "11", "2", "--config", "test-config.yaml"))
                .isEqualTo(PixelatorApplication.EXIT_FAILURE);
        assertThat(output).doesNotExist();
    }

    @Test
    @DisplayName("should return the failure exit code for a missing input")
    void shouldFailOnMissingInput() {
        int exit = new PixelatorApplication().run(
                dir.resolve("missing.png").toString(), output.toString(), "2", "2", "--config", "test-config.yaml");

        assertThat(exit).isEqualTo(PixelatorApplication.EXIT_FAILURE);
    }
}
