package com.sgw.worker;

import com.sgw.protocol.WorkerSignal;

/**
 * Where a worker sends replies and ownership signals: straight into the coordinator
 * for embedded workers, onto the worker's Aeron signal stream in process mode.
 */
@FunctionalInterface
public interface WorkerOutbox {

    void signal(WorkerSignal signal);
}
