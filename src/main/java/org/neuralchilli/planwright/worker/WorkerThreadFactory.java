package org.neuralchilli.planwright.worker;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Names dispatch threads after the worker id.
 */
class WorkerThreadFactory implements ThreadFactory {

    private final AtomicInteger counter = new AtomicInteger(0);
    private final String workerId;

    WorkerThreadFactory(String workerId) {
        this.workerId = workerId;
    }

    @Override
    public Thread newThread(Runnable r) {
        Thread t = new Thread(r);
        t.setName(workerId + "-dispatch-" + counter.incrementAndGet());
        t.setDaemon(true);
        return t;
    }
}
