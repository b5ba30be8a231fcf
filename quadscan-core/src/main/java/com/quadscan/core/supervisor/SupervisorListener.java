package com.quadscan.core.supervisor;

import com.quadscan.core.worker.WorkerHandle;

/**
 * Supervisor 事件监听。回调在 Supervisor 线程上执行，不应阻塞。
 */
public interface SupervisorListener {

    void onStateChanged(SupervisorState from, SupervisorState to);

    default void onWorkerExited(WorkerHandle worker) {
    }
}
