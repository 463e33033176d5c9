package com.ryuqq.agentmesh.adapter.runner;

import com.ryuqq.agentmesh.core.spi.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 보관 기간이 지난 종료 Task를 주기적으로 정리하는 컴포넌트.
 *
 * <p>TaskRegistry는 조회 시점에도 만료 레코드를 지우지만, 아무도 조회하지 않는 레코드는
 * 이 컴포넌트의 주기적 스캔으로만 정리됩니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * start() → scheduleWithFixedDelay(scan, initialDelayMs, scanIntervalMs)
 *   scan():
 *     1. registry.evictExpired() → 정리된 수
 *     2. 결과 로깅 (예외 발생 시에도 다음 주기는 계속)
 * </pre>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public final class RetentionReaper implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RetentionReaper.class);

    private final TaskRegistry registry;
    private final RetentionConfig config;
    private ScheduledExecutorService scheduler;

    /**
     * 생성자.
     *
     * @param registry 정리 대상 TaskRegistry
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RetentionReaper(TaskRegistry registry, RetentionConfig config) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.registry = registry;
        this.config = config;
    }

    /**
     * 만료 Task 한 번 정리.
     *
     * @return 정리된 Task 수 (실패 시 0)
     */
    public int scan() {
        try {
            int evicted = registry.evictExpired();
            if (evicted > 0) {
                log.info("Retention scan evicted {} expired tasks ({} remaining)", evicted, registry.size());
            } else {
                log.debug("Retention scan found no expired tasks");
            }
            return evicted;
        } catch (RuntimeException e) {
            log.error("Retention scan failed", e);
            return 0;
        }
    }

    /**
     * 주기적 정리 시작.
     *
     * @throws IllegalStateException 이미 시작된 경우
     */
    public synchronized void start() {
        if (scheduler != null) {
            throw new IllegalStateException("RetentionReaper is already running");
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "agentmesh-retention-reaper");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::scan, config.initialDelayMs(), config.scanIntervalMs(),
            TimeUnit.MILLISECONDS);
        log.info("RetentionReaper started (interval {}ms)", config.scanIntervalMs());
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    /**
     * 주기적 정리 중지 (멱등).
     */
    @Override
    public synchronized void close() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdownNow();
        scheduler = null;
        log.info("RetentionReaper stopped");
    }
}
