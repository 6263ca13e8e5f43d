package com.ryuqq.enginebridge.testkit.contract;

import com.ryuqq.enginebridge.adapter.loop.CallbackEventLoop;
import com.ryuqq.enginebridge.adapter.loop.LoopConfig;
import com.ryuqq.enginebridge.core.loop.EventLoop;

/**
 * Loop contract on a callback-style loop thread with a worker pool.
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
class CallbackLoopContractTest extends AbstractLoopContractTest {

    @Override
    protected EventLoop eventLoop() {
        return new CallbackEventLoop(new LoopConfig().withThreadName("contract-callback-loop"));
    }
}
