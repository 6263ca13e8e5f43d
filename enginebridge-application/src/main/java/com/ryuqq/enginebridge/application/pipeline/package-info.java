/**
 * Request pipelining.
 *
 * <p>{@link com.ryuqq.enginebridge.application.pipeline.PrefetchBuffer}는 요청 future 시퀀스를
 * 제한된 동시성으로 미리 발행하고, 완료 순서와 상관없이 제출 순서대로 돌려줍니다.
 * {@link com.ryuqq.enginebridge.application.pipeline.ResourceFutures}는 닫아야 하는 결과를
 * 소비자가 다음 항목으로 넘어갈 때 닫습니다.</p>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
package com.ryuqq.enginebridge.application.pipeline;
