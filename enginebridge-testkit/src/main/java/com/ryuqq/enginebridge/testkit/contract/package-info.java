/**
 * Test infrastructure for bridge contract tests.
 *
 * <p>{@link com.ryuqq.enginebridge.testkit.contract.AbstractBridgeTest} wires an in-memory runtime,
 * a manually driven hospice and an event loop for every test, and verifies on teardown that
 * every core was released.</p>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
package com.ryuqq.enginebridge.testkit.contract;
