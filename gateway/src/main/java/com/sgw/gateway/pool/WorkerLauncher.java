package com.sgw.gateway.pool;

import com.sgw.protocol.WorkerSignal;

import java.io.IOException;
import java.util.function.Consumer;

/**
 * Starts worker incarnations. Signals from every worker it launched are delivered to
 * the sink passed at launch; they may arrive on any thread.
 */
public interface WorkerLauncher extends AutoCloseable {

    WorkerHandle launch(int index, long generation, Consumer<WorkerSignal> signals) throws IOException;

    @Override
    void close();
}
