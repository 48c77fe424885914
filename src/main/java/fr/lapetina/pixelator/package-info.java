/**
 * Pixelator - parallel grid pixelation of raster images.
 *
 * <p>An image is divided into a grid of cells, each cell is painted with the average color
 * of the source pixels it covers, and the work is spread over a pool of executors built on
 * the LMAX Disruptor, one pool per call.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.pixelator.Pixelator} - Instance bound to one source image</li>
 *   <li>{@link fr.lapetina.pixelator.PixelatorFactory} - Creates pixelators from YAML configuration</li>
 *   <li>{@link fr.lapetina.pixelator.PixelatorApplication} - Command-line entry point</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (Pixelator pixelator = Pixelator.fromImage(Path.of("photo.png"))) {
 *     PixelatedImage image = pixelator.pixelate(40, 30, PixelateOptions.grayscaleOnly()).get();
 *     Files.write(Path.of("photo-pixelated.png"), pixelator.toPng());
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Staggered partitions: cell sizes differ by at most one pixel and cover the image exactly</li>
 *   <li>Optional luma grayscale</li>
 *   <li>Bounded, per-call executor pools with fail-fast teardown</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.pixelator.Pixelator
 * @see fr.lapetina.pixelator.disruptor.StripeScheduler
 */
package fr.lapetina.pixelator;
