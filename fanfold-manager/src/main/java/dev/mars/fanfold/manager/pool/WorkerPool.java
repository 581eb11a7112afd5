/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.fanfold.manager.pool;

import dev.mars.fanfold.core.EventBusAddresses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Fixed set of workers plus the outstanding chunk count of each.
 *
 * <p>The worker list never changes after construction. Selection is deterministic
 * for a given policy and load and never blocks. Instances are not thread-safe: the
 * owning manager calls them from its own context only.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 * @version 1.0
 */
public class WorkerPool {

    private static final Logger logger = LoggerFactory.getLogger(WorkerPool.class);

    private final List<WorkerRef> workers;
    private final DispatchPolicy policy;
    private final int[] outstanding;
    private int nextRoundRobin;

    /**
     * @param workers workers in index order; may be empty
     * @param policy  how {@link #selectWorker()} picks the next worker
     */
    public WorkerPool(List<WorkerRef> workers, DispatchPolicy policy) {
        Objects.requireNonNull(workers, "workers cannot be null");
        this.policy = Objects.requireNonNull(policy, "policy cannot be null");
        for (int i = 0; i < workers.size(); i++) {
            if (workers.get(i).index() != i) {
                throw new IllegalArgumentException(
                        "Worker at position " + i + " has index " + workers.get(i).index());
            }
        }
        this.workers = List.copyOf(workers);
        this.outstanding = new int[workers.size()];
    }

    /**
     * Pool of {@code size} workers named {@code worker-<n>} at the standard worker addresses.
     *
     * @param addresses address scheme the workers listen on
     * @param size      number of workers, zero for an empty pool
     * @param policy    dispatch policy
     * @return the new pool
     */
    public static WorkerPool create(EventBusAddresses addresses, int size, DispatchPolicy policy) {
        if (size < 0) {
            throw new IllegalArgumentException("size cannot be negative: " + size);
        }
        List<WorkerRef> refs = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            refs.add(new WorkerRef(i, "worker-" + i, addresses.worker(i)));
        }
        return new WorkerPool(refs, policy);
    }

    /**
     * Chooses the worker for the next chunk and counts it as outstanding.
     * Round robin cycles through the pool; least loaded picks the worker with the
     * fewest outstanding chunks, the lowest index winning ties.
     *
     * @return the selected worker
     * @throws IllegalStateException if the pool is empty
     */
    public WorkerRef selectWorker() {
        if (workers.isEmpty()) {
            throw new IllegalStateException("Worker pool is empty");
        }

        int index;
        switch (policy) {
            case LEAST_LOADED:
                index = leastLoadedIndex();
                break;
            case ROUND_ROBIN:
            default:
                index = nextRoundRobin;
                nextRoundRobin = (nextRoundRobin + 1) % workers.size();
                break;
        }

        outstanding[index]++;
        return workers.get(index);
    }

    /**
     * Returns one load slot of a worker, once its partial has been accepted or its job
     * has timed out. Releasing an idle or unknown worker is logged and ignored.
     *
     * @param workerIndex index of the worker in this pool
     */
    public void release(int workerIndex) {
        if (workerIndex < 0 || workerIndex >= outstanding.length) {
            logger.debug("Ignoring release for unknown worker index {}", workerIndex);
            return;
        }
        if (outstanding[workerIndex] == 0) {
            logger.debug("Worker {} has no outstanding chunks to release", workerIndex);
            return;
        }
        outstanding[workerIndex]--;
    }

    /**
     * @param workerIndex index of the worker in this pool
     * @return chunks dispatched to the worker and not yet released
     */
    public int getOutstanding(int workerIndex) {
        return outstanding[workerIndex];
    }

    public int size() {
        return workers.size();
    }

    public boolean isEmpty() {
        return workers.isEmpty();
    }

    public List<WorkerRef> getWorkers() {
        return workers;
    }

    public DispatchPolicy getPolicy() {
        return policy;
    }

    private int leastLoadedIndex() {
        int best = 0;
        for (int i = 1; i < outstanding.length; i++) {
            if (outstanding[i] < outstanding[best]) {
                best = i;
            }
        }
        return best;
    }

    @Override
    public String toString() {
        return "WorkerPool{size=" + workers.size() + ", policy=" + policy + '}';
    }
}
