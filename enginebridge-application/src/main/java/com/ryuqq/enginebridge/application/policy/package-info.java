/**
 * Environment policy와 수명 관리 API.
 *
 * <p><strong>주요 구성:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.enginebridge.application.policy.Policy}: 등록/해제, environment 생성</li>
 *   <li>{@link com.ryuqq.enginebridge.application.policy.ManagedPolicy}: runtime에 등록되는 policy 본체.
 *       store 하나를 감싸고 생존 여부를 확인</li>
 *   <li>{@link com.ryuqq.enginebridge.application.policy.ManagedEnvironment}: environment 하나와 core 하나의 수명</li>
 *   <li>{@link com.ryuqq.enginebridge.application.policy.EnvironmentPropagator}: loop 경계를 넘어 현재 environment 전달</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * try (Policy policy = new Policy(runtime, StoreStrategy.TASK_LOCAL.newStore())) {
 *     policy.register();
 *     try (ManagedEnvironment environment = policy.newEnvironment();
 *          EnvironmentScope scope = environment.use()) {
 *         ...
 *     }
 * }
 * </pre>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
package com.ryuqq.enginebridge.application.policy;
