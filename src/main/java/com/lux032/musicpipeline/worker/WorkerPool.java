package com.lux032.musicpipeline.worker;

import com.lux032.musicpipeline.model.QueueName;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * 每个队列一个常驻 worker 线程
 * 停止时不打断正在执行的动作，只等待宽限时间
 */
@Slf4j
public class WorkerPool {

    private final Map<QueueName, Worker> workers = new EnumMap<>(QueueName.class);
    private ExecutorService executorService;

    public synchronized void register(QueueName name, Worker worker) {
        if (executorService != null) {
            throw new IllegalStateException("worker pool already started");
        }
        workers.put(name, worker);
    }

    public synchronized void start() {
        if (executorService != null) {
            log.warn("Worker pool already running");
            return;
        }
        if (workers.isEmpty()) {
            log.warn("No workers registered");
            return;
        }
        executorService = Executors.newFixedThreadPool(workers.size(), runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("worker-" + thread.getId());
            return thread;
        });
        for (Map.Entry<QueueName, Worker> entry : workers.entrySet()) {
            Worker worker = entry.getValue();
            String threadName = "worker-" + entry.getKey().getKey();
            executorService.submit(() -> {
                Thread.currentThread().setName(threadName);
                worker.run();
            });
            log.info("✓ {} worker thread started", entry.getKey().getKey());
        }
    }

    /**
     * 等待 worker 退出，调用前应已设置停止标志
     * @return 是否全部在宽限时间内退出
     */
    public boolean awaitStop(Duration grace) {
        ExecutorService executor;
        synchronized (this) {
            executor = executorService;
        }
        if (executor == null) {
            return true;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Workers still running in-flight actions after {}s, leaving them to finish", grace.getSeconds());
                return false;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        log.info("All workers stopped");
        return true;
    }

    public synchronized boolean isEnabled(QueueName name) {
        return workers.containsKey(name);
    }

    public synchronized Map<QueueName, Worker> getWorkers() {
        return Collections.unmodifiableMap(new EnumMap<>(workers));
    }
}
