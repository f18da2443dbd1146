package com.imperium.auditrag.support;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 在调用方指定的线程池上执行阻塞调用，并在超时后放弃等待。
 */
public final class TimedCall {

    private TimedCall() {
    }

    /**
     * @throws TimeoutException   超过 timeout 仍未完成（任务会被中断）
     * @throws ExecutionException 任务本身抛出异常，原始异常见 getCause()
     */
    public static <T> T call(ExecutorService executor, Callable<T> task, Duration timeout)
            throws TimeoutException, ExecutionException, InterruptedException {
        Future<T> future = executor.submit(task);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException | InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    /**
     * 超时时长的可读形式：整秒写作 "30s"，否则写作毫秒 "250ms"。
     */
    public static String describe(Duration timeout) {
        long millis = timeout.toMillis();
        if (millis >= 1_000 && millis % 1_000 == 0) {
            return millis / 1_000 + "s";
        }
        return millis + "ms";
    }
}
