package com.asiainfo.semantic.config;

import io.quarkus.runtime.ShutdownEvent;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 计算线程池配置
 * 下钻同层候选并行求值使用。求值是纯 CPU 计算，线程数默认等于 CPU 核数。
 */
@ApplicationScoped
public class ComputeExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger(ComputeExecutorConfig.class);

    @ConfigProperty(name = "semantic.executor.threads", defaultValue = "0")
    int threads;

    private ExecutorService computeExecutor;

    @PostConstruct
    void init() {
        int size = threads > 0 ? threads : Runtime.getRuntime().availableProcessors();
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "semantic-compute-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        this.computeExecutor = Executors.newFixedThreadPool(size, factory);
        log.info("计算线程池初始化完成, threads={}", size);
    }

    void onStop(@Observes ShutdownEvent event) {
        computeExecutor.shutdown();
        try {
            if (!computeExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                computeExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            computeExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("计算线程池已关闭");
    }

    /**
     * 获取计算执行器
     */
    public ExecutorService getComputeExecutor() {
        return computeExecutor;
    }
}
