package com.ryuqq.rowcache.adapter.runner;

import com.ryuqq.rowcache.core.spi.ExpiredEntryPurger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 만료 엔트리 정리 데몬.
 *
 * <p>만료 시각이 지난 스칼라 엔트리를 주기적으로 물리 삭제합니다.</p>
 *
 * <p><strong>동작:</strong></p>
 * <pre>
 * 1. start() → initialDelayMs 대기
 * 2. sweep(): purger.purgeExpired() → 삭제 건수 로깅
 * 3. intervalMs 대기 후 2 반복 (이전 sweep 종료 기준)
 * </pre>
 *
 * <p><strong>실패 처리:</strong></p>
 * <ul>
 *   <li>저장소 오류는 로깅만 하고 다음 주기에 재시도</li>
 *   <li>여러 프로세스가 동시에 실행해도 안전 (같은 조건의 DELETE)</li>
 * </ul>
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
public final class ExpiryReaper implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExpiryReaper.class);
    private final ExpiredEntryPurger purger;
    private final ExpiryReaperConfig config;
    private ScheduledExecutorService scheduler;

    /**
     * 생성자.
     *
     * @param purger 만료 엔트리 삭제 SPI
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ExpiryReaper(ExpiredEntryPurger purger, ExpiryReaperConfig config) {
        if (purger == null) {
            throw new IllegalArgumentException("purger cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.purger = purger;
        this.config = config;
    }

    /**
     * 주기 실행 시작.
     *
     * @throws IllegalStateException 이미 시작된 경우
     */
    public synchronized void start() {
        if (scheduler != null) {
            throw new IllegalStateException("ExpiryReaper already started");
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "rowcache-expiry-reaper");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(
            this::sweep, config.initialDelayMs(), config.intervalMs(), TimeUnit.MILLISECONDS);
        log.info("ExpiryReaper started (initialDelay={}ms, interval={}ms)",
            config.initialDelayMs(), config.intervalMs());
    }

    /**
     * 만료 엔트리 1회 정리.
     *
     * <p>예외를 던지지 않습니다. 실패는 로깅하고 다음 주기로 넘깁니다.</p>
     *
     * @return 삭제 건수 (실패 시 -1)
     */
    public long sweep() {
        log.info("Cleaning expired cache entries");
        try {
            long purged = purger.purgeExpired();
            log.info("Cleaned {} expired cache entries", purged);
            return purged;
        } catch (Exception e) {
            log.error("Failed to clean expired cache entries", e);
            return -1;
        }
    }

    /**
     * 실행 중인지 확인.
     *
     * @return start() 후 stop() 전이면 true
     */
    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    /**
     * 주기 실행 중지.
     *
     * <p>진행 중인 sweep은 인터럽트합니다. 여러 번 호출해도 안전합니다.</p>
     */
    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("ExpiryReaper did not terminate within 5 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        scheduler = null;
        log.info("ExpiryReaper stopped");
    }

    @Override
    public void close() {
        stop();
    }
}
