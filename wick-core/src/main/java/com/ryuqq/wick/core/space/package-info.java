/**
 * Index-space configuration.
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.wick.core.space.SpaceRegistry} - explicit configuration context, epoch-tagged</li>
 *   <li>{@link com.ryuqq.wick.core.space.Space} - label, statistics, occupation class, index stems</li>
 *   <li>{@link com.ryuqq.wick.core.space.Index} - immutable (label, ordinal) slot</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Wick Team
 */
package com.ryuqq.wick.core.space;
