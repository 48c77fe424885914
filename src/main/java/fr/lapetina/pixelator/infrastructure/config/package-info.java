/**
 * Configuration loading.
 *
 * <p>YAML is read once, from the file system or the classpath, and validated.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code concurrency} - Default executor limit</li>
 *   <li>{@code disruptor} - Wait strategy of the executors</li>
 *   <li>{@code timeouts} - Call and shutdown timeouts</li>
 *   <li>{@code output} - Default grayscale flag</li>
 *   <li>{@code metrics} - Metric prefix and JVM binders</li>
 * </ul>
 *
 * @see fr.lapetina.pixelator.infrastructure.config.PixelatorConfig
 * @see fr.lapetina.pixelator.infrastructure.config.ConfigLoader
 */
package fr.lapetina.pixelator.infrastructure.config;
