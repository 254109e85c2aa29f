/**
 * Adapter contract tests.
 *
 * <p>Extend {@link com.ryuqq.ipc.testkit.contract.AbstractPrimitivesContractTest} in an adapter's
 * test sources and return the adapter's pool from {@code createPool()}.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.ipc.testkit.contract;
