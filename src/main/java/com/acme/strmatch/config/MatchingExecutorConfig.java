package com.acme.strmatch.config;

import com.acme.strmatch.common.exec.MdcExecutorService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools of the matcher.  Queries and scan shards run on separate
 * pools so a query blocked on its shards never starves the shards.
 */
@Configuration
public class MatchingExecutorConfig {

    /**
     * CPU-bound scan shards, one thread per configured scan worker.
     */
    @Bean(name = "scanExecutor", destroyMethod = "shutdown")
    public ExecutorService scanExecutor(MatchingProperties props) {
        ExecutorService delegate = Executors.newFixedThreadPool(
                props.resolvedScanThreads(), daemonThreads("strmatch-scan-"));
        return new MdcExecutorService(delegate);
    }

    /**
     * Query-level fan-out used by the batch driver.
     */
    @Bean(name = "queryExecutor", destroyMethod = "shutdown")
    public ExecutorService queryExecutor(MatchingProperties props) {
        ExecutorService delegate = Executors.newFixedThreadPool(
                Math.max(1, props.getQueryConcurrency()), daemonThreads("strmatch-query-"));
        return new MdcExecutorService(delegate);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger(0);
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
