/**
 * In-memory native runtime adapter.
 *
 * <p>This package provides a reference implementation of the native runtime SPI
 * for tests and examples. No native library is involved: environments are plain
 * identity handles and each core owns a small thread pool.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.enginebridge.adapter.inmemory.runtime.InMemoryNativeRuntime}:
 *       single policy slot, environment registry</li>
 *   <li>{@link com.ryuqq.enginebridge.adapter.inmemory.runtime.InMemoryPolicyApi}:
 *       API handed to the registered policy</li>
 *   <li>{@link com.ryuqq.enginebridge.adapter.inmemory.runtime.InMemoryEnvironment}:
 *       scoped activation through the registered policy</li>
 *   <li>{@link com.ryuqq.enginebridge.adapter.inmemory.runtime.InMemoryCore}:
 *       worker pool with an explicit hold counter</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Only one policy can be registered at a time</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @see com.ryuqq.enginebridge.core.spi.NativeRuntime
 * @author Engine Bridge Team
 * @since 1.0.0
 */
package com.ryuqq.enginebridge.adapter.inmemory.runtime;
