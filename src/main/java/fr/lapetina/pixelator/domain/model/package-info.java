/**
 * Domain model of the pixelation pipeline.
 *
 * <p>Value types ({@code PixelBuffer}, {@code AveragedColor}, {@code PartitionSequence},
 * {@code StripeTask}, {@code GridLayout}, {@code PixelatedImage}) are immutable and can be
 * shared freely between executors. {@link fr.lapetina.pixelator.domain.model.RasterCanvas}
 * is the only mutable raster and is never shared: each stripe paints its own canvas and
 * the destination canvas is written by the compositing stage alone.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.pixelator.domain.model.PixelSource} - Crop accessor over the source image</li>
 *   <li>{@link fr.lapetina.pixelator.domain.model.PixelBuffer} - Read-only RGBA region</li>
 *   <li>{@link fr.lapetina.pixelator.domain.model.GridLayout} - Frozen column/row plan of one call</li>
 *   <li>{@link fr.lapetina.pixelator.domain.model.ErrorType} - Failure kinds</li>
 * </ul>
 */
package fr.lapetina.pixelator.domain.model;
