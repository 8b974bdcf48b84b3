/**
 * Contract-test infrastructure for expansion runtimes and the expression algebra.
 *
 * <p>{@link com.ryuqq.wick.testkit.contract.AbstractAlgebraContractTest} is the base class
 * that runtime implementations extend to run the algebraic-law checks against themselves.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.wick.testkit.contract;
