package fr.lapetina.pixelator.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.pixelator.domain.model.GridLayout;
import fr.lapetina.pixelator.domain.model.PixelatedImage;

import java.time.Instant;
import java.util.List;

/**
 * JSON summary of one pixelation run.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PixelationReport {

    private String input;
    private String output;
    private int width;
    private int height;
    private int columns;
    private int rows;
    private String orientation;

    @JsonProperty("column_widths")
    private List<Integer> columnWidths;

    @JsonProperty("row_heights")
    private List<Integer> rowHeights;

    private int stripes;
    private int executors;
    private boolean grayscale;

    @JsonProperty("elapsed_ms")
    private long elapsedMs;

    @JsonProperty("created_at")
    private Instant createdAt;

    /**
     * Creates a report from a completed result.
     */
    public static PixelationReport from(PixelatedImage image, String input, String output) {
        GridLayout layout = image.layout();
        PixelationReport report = new PixelationReport();
        report.input = input;
        report.output = output;
        report.width = image.width();
        report.height = image.height();
        report.columns = layout.columns().size();
        report.rows = layout.rows().size();
        report.orientation = layout.orientation().name();
        report.columnWidths = layout.columns().asList();
        report.rowHeights = layout.rows().asList();
        report.stripes = layout.stripeCount();
        report.executors = image.executors();
        report.grayscale = image.grayscale();
        report.elapsedMs = image.elapsed().toMillis();
        report.createdAt = Instant.now();
        return report;
    }

    // Getters and setters
    public String getInput() { return input; }
    public void setInput(String input) { this.input = input; }

    public String getOutput() { return output; }
    public void setOutput(String output) { this.output = output; }

    public int getWidth() { return width; }
    public void setWidth(int width) { this.width = width; }

    public int getHeight() { return height; }
    public void setHeight(int height) { this.height = height; }

    public int getColumns() { return columns; }
    public void setColumns(int columns) { this.columns = columns; }

    public int getRows() { return rows; }
    public void setRows(int rows) { this.rows = rows; }

    public String getOrientation() { return orientation; }
    public void setOrientation(String orientation) { this.orientation = orientation; }

    public List<Integer> getColumnWidths() { return columnWidths; }
    public void setColumnWidths(List<Integer> columnWidths) { this.columnWidths = columnWidths; }

    public List<Integer> getRowHeights() { return rowHeights; }
    public void setRowHeights(List<Integer> rowHeights) { this.rowHeights = rowHeights; }

    public int getStripes() { return stripes; }
    public void setStripes(int stripes) { this.stripes = stripes; }

    public int getExecutors() { return executors; }
    public void setExecutors(int executors) { this.executors = executors; }

    public boolean isGrayscale() { return grayscale; }
    public void setGrayscale(boolean grayscale) { this.grayscale = grayscale; }

    public long getElapsedMs() { return elapsedMs; }
    public void setElapsedMs(long elapsedMs) { this.elapsedMs = elapsedMs; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
