/**
 * LMAX Disruptor-based scheduling of stripe work.
 *
 * <p>Every pixelation call gets its own Disruptor. All stripes are published up front, a
 * worker pool drains them, and a single downstream handler composites the results, so
 * the destination raster never needs a lock.
 *
 * <h2>Pipeline Stages</h2>
 * <pre>
 * StripeWorkHandler x N → CompositingHandler → MetricsHandler
 * </pre>
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.pixelator.disruptor.StripeScheduler} - Per-call orchestrator</li>
 *   <li>{@link fr.lapetina.pixelator.disruptor.PixelationCall} - State shared by the handlers of one call</li>
 *   <li>{@link fr.lapetina.pixelator.disruptor.exception.PixelationException} - The single failure type</li>
 * </ul>
 *
 * @see fr.lapetina.pixelator.disruptor.StripeScheduler
 * @see com.lmax.disruptor.dsl.Disruptor
 */
package fr.lapetina.pixelator.disruptor;
