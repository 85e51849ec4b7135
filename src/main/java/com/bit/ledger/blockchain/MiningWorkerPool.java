package com.bit.ledger.blockchain;

import com.bit.ledger.exception.ErrorType;
import com.bit.ledger.exception.LedgerException;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 挖矿线程池：出块是CPU密集型操作，放到固定大小的线程池里执行，不占用请求线程
 * 调用方同步等待结果，拿到的一定是已挖出并已持久化的区块
 */
@Slf4j
public class MiningWorkerPool implements AutoCloseable {

    private final ThreadPoolExecutor executor;

    public MiningWorkerPool(int threads, int queueCapacity) {
        int size = threads > 0 ? threads : Runtime.getRuntime().availableProcessors();
        int capacity = queueCapacity > 0 ? queueCapacity : 1024;
        this.executor = new ThreadPoolExecutor(
                size,
                size,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(capacity),
                new ThreadFactory() {
                    private final AtomicInteger seq = new AtomicInteger(0);

                    @Override
                    public Thread newThread(Runnable r) {
                        Thread t = new Thread(r, "mining-worker-" + seq.getAndIncrement());
                        t.setDaemon(true);
                        return t;
                    }
                },
                new ThreadPoolExecutor.CallerRunsPolicy() // 队列满时调用方执行，避免任务丢失
        );
        log.info("Mining pool started: threads={}, queue={}", size, capacity);
    }

    /**
     * 提交任务并等待完成
     * 任务抛出的账本异常原样抛给调用方，其他异常包装为 MINING_FAILED
     */
    public <T> T execute(Callable<T> task) {
        Future<T> future = executor.submit(task);
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LedgerException(ErrorType.MINING_FAILED, "等待出块时线程被中断", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new LedgerException(ErrorType.MINING_FAILED, String.valueOf(cause), cause);
        }
    }

    public int getPoolSize() {
        return executor.getCorePoolSize();
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Mining pool did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Mining pool stopped");
    }
}
