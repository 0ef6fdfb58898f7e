package com.workq.process;

import java.util.List;
import java.util.Set;

/**
 * Live workers of the pool, owned by the {@link WorkerSupervisor}.
 */
public interface WorkerRegistry {

    List<WorkerHandle> list();

    void register(WorkerHandle handle);

    /**
     * @return {@code true} if the handle was registered
     */
    boolean remove(WorkerHandle handle);

    int size();

    Set<Long> pids();
}
