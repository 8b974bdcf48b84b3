/**
 * Text grammar.
 *
 * <ul>
 *   <li>{@link com.ryuqq.wick.core.text.ExpressionParser} - recursive-descent parser</li>
 *   <li>{@link com.ryuqq.wick.core.text.ExpressionPrinter} - round-tripping printer</li>
 *   <li>{@link com.ryuqq.wick.core.text.LatexPrinter} - LaTeX rendering with index stems</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Wick Team
 */
package com.ryuqq.wick.core.text;
