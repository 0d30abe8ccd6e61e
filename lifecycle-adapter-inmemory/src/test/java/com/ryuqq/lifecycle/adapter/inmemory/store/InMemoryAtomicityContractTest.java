package com.ryuqq.lifecycle.adapter.inmemory.store;

import com.ryuqq.lifecycle.adapter.inmemory.recorder.InMemoryStateChangeRecorder;
import com.ryuqq.lifecycle.core.spi.StateChangeRecorder;
import com.ryuqq.lifecycle.core.spi.StateStore;
import com.ryuqq.lifecycle.testkit.contract.AtomicityContractTest;

class InMemoryAtomicityContractTest extends AtomicityContractTest {

    @Override
    protected StateStore createStateStore() {
        return new InMemoryStateStore();
    }

    @Override
    protected StateChangeRecorder createStateChangeRecorder() {
        return new InMemoryStateChangeRecorder();
    }
}
