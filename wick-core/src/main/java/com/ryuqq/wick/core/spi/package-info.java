/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the expansion runtime that adapter modules implement
 * to distribute Wick expansions over worker threads.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.wick.core.spi.ExpansionRuntime} - expands operator products into normal-ordered terms</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>{@link com.ryuqq.wick.core.spi.SequentialExpansionRuntime} is the in-core default.
 * wick-adapter-runner provides a worker-pool implementation.</p>
 *
 * @since 1.0.0
 * @author Wick Team
 */
package com.ryuqq.wick.core.spi;
