package com.ryuqq.rowcache.core.pubsub;

import com.ryuqq.rowcache.core.model.ChannelMessage;
import com.ryuqq.rowcache.core.spi.MessageCursorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 메시지 로그를 주기적으로 폴링하는 구독 구현.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. attach → 커서 행 생성 (lastDeliveredId = -1)
 * 2. pollIntervalMs마다 fetchAfter(cursor, batchSize)
 * 3. 각 메시지를 버퍼에 넘긴 뒤에만 커서 전진 및 저장
 * 4. close → 폴링 중단, 커서 행 삭제
 * </pre>
 *
 * <p>폴링 실패는 로그만 남기고 다음 주기에 재시도합니다. 버퍼가 가득 차면
 * 소비자가 꺼낼 때까지 폴러가 기다리며, 이때도 close는 즉시 반영됩니다.</p>
 *
 * <p>구독마다 데몬 스레드 하나를 사용합니다. 폴러가 멈추면 시퀀스가 끝나며,
 * 버퍼가 비는 즉시 {@link #take()}와 {@link #poll(long, TimeUnit)}이 null을 반환합니다.</p>
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
public final class PollingSubscription implements Subscription {

    private static final Logger log = LoggerFactory.getLogger(PollingSubscription.class);
    private static final long CLOSE_TIMEOUT_MS = 5000;

    private final MessageCursorStore store;
    private final String channel;
    private final String subscriberId;
    private final SubscriptionConfig config;
    private final BlockingQueue<String> buffer;
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final ExecutorService poller;
    private volatile boolean active = true;
    private long cursor;

    private PollingSubscription(MessageCursorStore store, String channel, String subscriberId,
                                SubscriptionConfig config, long cursor) {
        this.store = store;
        this.channel = channel;
        this.subscriberId = subscriberId;
        this.config = config;
        this.cursor = cursor;
        this.buffer = new ArrayBlockingQueue<>(config.bufferCapacity());
        this.poller = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "rowcache-sub-" + channel + "-" + subscriberId);
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * 구독을 등록하고 폴링을 시작.
     *
     * @param store 커서 저장소
     * @param channel 채널명
     * @param config 구독 설정
     * @return 활성 구독
     * @throws IllegalArgumentException 파라미터가 null이거나 채널이 빈 문자열인 경우
     */
    public static PollingSubscription start(MessageCursorStore store, String channel, SubscriptionConfig config) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (channel == null || channel.isBlank()) {
            throw new IllegalArgumentException("channel cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        String subscriberId = "sub_" + UUID.randomUUID();
        long cursor = store.attach(channel, subscriberId);
        PollingSubscription subscription = new PollingSubscription(store, channel, subscriberId, config, cursor);
        subscription.poller.execute(subscription::pollLoop);
        log.debug("Subscription {} attached to channel {}", subscriberId, channel);
        return subscription;
    }

    @Override
    public String channel() {
        return channel;
    }

    @Override
    public String subscriberId() {
        return subscriberId;
    }

    @Override
    public String poll(long timeout, TimeUnit unit) throws InterruptedException {
        return next(System.nanoTime() + unit.toNanos(timeout));
    }

    @Override
    public String take() throws InterruptedException {
        return next(Long.MAX_VALUE);
    }

    /**
     * 버퍼에서 다음 메시지를 꺼냄.
     *
     * <p>폴러가 끝난 뒤에는 남은 메시지를 모두 돌려준 다음 null을 반환합니다.
     * 폴러는 마지막 hand-off 이후에 active를 내리므로, 종료를 확인한 뒤 한 번 더
     * 버퍼를 비우면 메시지가 유실되지 않습니다.</p>
     */
    private String next(long deadlineNanos) throws InterruptedException {
        long sliceNanos = TimeUnit.MILLISECONDS.toNanos(config.pollIntervalMs());
        while (true) {
            long remaining = deadlineNanos == Long.MAX_VALUE
                ? sliceNanos
                : Math.min(sliceNanos, deadlineNanos - System.nanoTime());
            if (remaining <= 0) {
                return buffer.poll();
            }
            String message = buffer.poll(remaining, TimeUnit.NANOSECONDS);
            if (message != null) {
                return message;
            }
            if (!active) {
                return buffer.poll();
            }
        }
    }

    @Override
    public boolean isActive() {
        return active;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        stopSignal.countDown();
        poller.shutdown();
        try {
            if (!poller.awaitTermination(CLOSE_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                log.warn("Subscription {} poller did not stop within {}ms", subscriberId, CLOSE_TIMEOUT_MS);
                poller.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            poller.shutdownNow();
        }
    }

    private void pollLoop() {
        try {
            while (!stopSignal.await(config.pollIntervalMs(), TimeUnit.MILLISECONDS)) {
                pollOnce();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            active = false;
            detach();
        }
    }

    private void pollOnce() throws InterruptedException {
        List<ChannelMessage> messages;
        try {
            messages = store.fetchAfter(channel, cursor, config.batchSize());
        } catch (RuntimeException e) {
            log.warn("Subscription {} failed to poll channel {}, retrying next tick", subscriberId, channel, e);
            return;
        }

        for (ChannelMessage message : messages) {
            if (!handOff(message.payload())) {
                return;
            }
            cursor = message.id();
            try {
                store.advance(channel, subscriberId, message.id());
            } catch (RuntimeException e) {
                log.warn("Subscription {} failed to persist cursor {} on channel {}",
                    subscriberId, message.id(), channel, e);
            }
        }
    }

    // false when closed while waiting for buffer space
    private boolean handOff(String payload) throws InterruptedException {
        while (stopSignal.getCount() > 0) {
            if (buffer.offer(payload, config.pollIntervalMs(), TimeUnit.MILLISECONDS)) {
                return true;
            }
        }
        return false;
    }

    private void detach() {
        try {
            store.detach(channel, subscriberId);
            log.debug("Subscription {} detached from channel {}", subscriberId, channel);
        } catch (RuntimeException e) {
            log.warn("Subscription {} failed to delete cursor on channel {}", subscriberId, channel, e);
        }
    }
}
