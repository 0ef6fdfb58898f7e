package com.workq.process;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public class LiveWorkerRegistry implements WorkerRegistry {

    private final Map<Long, WorkerHandle> workersByPid = new ConcurrentHashMap<>();

    @Override
    public List<WorkerHandle> list() {
        return List.copyOf(workersByPid.values());
    }

    @Override
    public void register(WorkerHandle handle) {
        WorkerHandle previous = workersByPid.putIfAbsent(handle.pid(), handle);
        if (previous != null && previous != handle) {
            throw new IllegalStateException("A worker with pid " + handle.pid() + " is already registered");
        }
    }

    @Override
    public boolean remove(WorkerHandle handle) {
        return workersByPid.remove(handle.pid(), handle);
    }

    @Override
    public int size() {
        return workersByPid.size();
    }

    @Override
    public Set<Long> pids() {
        return Set.copyOf(workersByPid.keySet());
    }
}
