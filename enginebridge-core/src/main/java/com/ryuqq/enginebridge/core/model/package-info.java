/**
 * Core model package: environment handles and lifecycle states.
 *
 * <ul>
 *   <li>{@link com.ryuqq.enginebridge.core.model.EnvironmentData} - opaque identity handle issued by the native runtime</li>
 *   <li>{@link com.ryuqq.enginebridge.core.model.EnvironmentState} - lifecycle of a managed environment</li>
 *   <li>{@link com.ryuqq.enginebridge.core.model.EnvironmentTransition} - transition validator</li>
 *   <li>{@link com.ryuqq.enginebridge.core.model.HospiceStage} - reclamation stages of a hospice entry</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Engine Bridge Team
 */
package com.ryuqq.enginebridge.core.model;
