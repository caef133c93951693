package com.company.simulation.cache;

import com.company.simulation.exception.DataReadFailureException;
import com.company.simulation.exception.RequestTimeoutException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded LRU cache that runs at most one load per key at a time.
 *
 * <p>Callers asking for a key that is already loading wait for that load instead of
 * starting another one. Each caller waits up to its own timeout; the load itself is
 * cancelled only once every caller waiting on it has given up. Failed loads are
 * reported to all their waiters and are not cached.
 *
 * <p>All bookkeeping happens under a single lock that is never held while a load runs.
 */
@Slf4j
public class SingleFlightCache<K extends ProjectScopedKey, V> {

    @Getter
    private final String name;
    @Getter
    private final int maximumSize;
    private final Executor executor;

    private final Object lock = new Object();
    private final LinkedHashMap<K, V> entries = new LinkedHashMap<>(16, 0.75f, true);
    private final Map<K, Load> inFlight = new HashMap<>();
    private String retainedProject;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong loads = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    public SingleFlightCache(String name, int maximumSize, Executor executor) {
        if (maximumSize < 1) {
            throw new IllegalArgumentException("maximumSize must be positive: " + maximumSize);
        }
        this.name = Objects.requireNonNull(name, "name");
        this.maximumSize = maximumSize;
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Returns the cached value for {@code key}, or joins/starts its load and waits for it.
     *
     * @throws RequestTimeoutException if the value is not available within {@code timeout}
     *                                 or the calling thread is interrupted while waiting
     */
    public V getOrCompute(K key, Callable<V> loader, Duration timeout) {
        Load load;
        boolean started = false;

        synchronized (lock) {
            V cached = entries.get(key);
            if (cached != null) {
                hits.incrementAndGet();
                log.debug("CACHE HIT [{}]: {}", name, key);
                return cached;
            }
            misses.incrementAndGet();

            load = inFlight.get(key);
            if (load == null) {
                load = new Load(key, loader);
                inFlight.put(key, load);
                started = true;
            } else {
                log.debug("CACHE JOIN [{}]: {} already loading", name, key);
            }
            load.waiters++;
        }

        if (started) {
            loads.incrementAndGet();
            log.debug("CACHE MISS [{}]: loading {}", name, key);
            try {
                executor.execute(load);
            } catch (RejectedExecutionException e) {
                load.reject(e);
            }
        }

        return await(load, timeout);
    }

    public V getIfPresent(K key) {
        synchronized (lock) {
            return entries.get(key);
        }
    }

    /**
     * Keeps only values of {@code projectId}. Cached values of other projects are dropped
     * and their running loads detached, so those results reach only the callers already
     * waiting for them. Until the next call, values of other projects are never stored.
     *
     * @return the number of cached values dropped
     */
    public int retainOnlyProject(String projectId) {
        Objects.requireNonNull(projectId, "projectId");
        synchronized (lock) {
            retainedProject = projectId;
            int before = entries.size();
            entries.keySet().removeIf(key -> !projectId.equals(key.getProjectId()));
            inFlight.keySet().removeIf(key -> !projectId.equals(key.getProjectId()));
            return before - entries.size();
        }
    }

    public void clear() {
        synchronized (lock) {
            entries.clear();
            inFlight.clear();
            retainedProject = null;
        }
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    public int inFlightCount() {
        synchronized (lock) {
            return inFlight.size();
        }
    }

    public long hitCount() {
        return hits.get();
    }

    public long missCount() {
        return misses.get();
    }

    public long loadCount() {
        return loads.get();
    }

    public long evictionCount() {
        return evictions.get();
    }

    private V await(Load load, Duration timeout) {
        try {
            return load.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            log.debug("CACHE TIMEOUT [{}]: gave up on {} after {}", name, load.key, timeout);
            throw new RequestTimeoutException(load.key, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RequestTimeoutException(load.key, e);
        } catch (CancellationException e) {
            throw new DataReadFailureException("Load of " + load.key + " was cancelled", e);
        } catch (ExecutionException e) {
            throw propagate(e.getCause(), load.key);
        } finally {
            leave(load);
        }
    }

    private void leave(Load load) {
        synchronized (lock) {
            load.waiters--;
            if (load.waiters == 0 && !load.isDone()) {
                if (inFlight.get(load.key) == load) {
                    inFlight.remove(load.key);
                }
                load.cancel(true);
                log.debug("CACHE ABANDON [{}]: no caller left waiting for {}", name, load.key);
            }
        }
    }

    private void store(K key, V value) {
        if (retainedProject != null && !retainedProject.equals(key.getProjectId())) {
            log.debug("CACHE SKIP [{}]: {} belongs to an inactive project", name, key);
            return;
        }
        entries.put(key, value);
        Iterator<K> eldest = entries.keySet().iterator();
        while (entries.size() > maximumSize && eldest.hasNext()) {
            K evicted = eldest.next();
            eldest.remove();
            evictions.incrementAndGet();
            log.debug("CACHE EVICT [{}]: {}", name, evicted);
        }
    }

    private static RuntimeException propagate(Throwable cause, Object key) {
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return new DataReadFailureException("Failed to load " + key, cause);
    }

    /**
     * One running load. Guarded by {@code lock} except for the task state itself.
     */
    private final class Load extends FutureTask<V> {

        private final K key;
        private int waiters;

        private Load(K key, Callable<V> loader) {
            super(() -> Objects.requireNonNull(loader.call(), "loader returned null for " + key));
            this.key = key;
        }

        private void reject(RejectedExecutionException e) {
            setException(new DataReadFailureException("No capacity to load " + key, e));
        }

        // The value is cached before any waiter is released.
        @Override
        protected void set(V value) {
            synchronized (lock) {
                if (inFlight.get(key) == this) {
                    inFlight.remove(key);
                    store(key, value);
                }
            }
            super.set(value);
        }

        @Override
        protected void done() {
            synchronized (lock) {
                if (inFlight.get(key) == this) {
                    inFlight.remove(key);
                }
            }
        }
    }
}
