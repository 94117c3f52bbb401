package com.ryuqq.rowcache.core.pubsub;

import java.util.concurrent.TimeUnit;

/**
 * 채널 구독 핸들.
 *
 * <p>수신 전용 메시지 시퀀스와 구독 해제({@link #close()})를 제공합니다.
 * 한 채널 안에서 메시지는 ID 오름차순으로 전달됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try (Subscription subscription = client.subscribe("orders")) {
 *     String message = subscription.poll(1, TimeUnit.SECONDS);
 *     ...
 * }
 * </pre>
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
public interface Subscription extends AutoCloseable {

    /**
     * 구독 채널명.
     *
     * @return 채널명
     */
    String channel();

    /**
     * 구독자 ID (커서 행의 키).
     *
     * @return 구독자 ID
     */
    String subscriberId();

    /**
     * 다음 메시지를 최대 timeout 동안 기다려 꺼냄.
     *
     * @param timeout 대기 시간
     * @param unit 시간 단위
     * @return 메시지, 시간 내 도착하지 않았거나 구독이 끝나고 버퍼가 비었으면 null
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    String poll(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * 다음 메시지가 올 때까지 기다려 꺼냄.
     *
     * <p>구독이 해제되면 버퍼에 남은 메시지를 먼저 돌려주고, 그 뒤에는 null을 반환해
     * 시퀀스의 끝을 알립니다.</p>
     *
     * @return 메시지, 구독이 끝나고 버퍼가 비었으면 null
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    String take() throws InterruptedException;

    /**
     * 폴링이 계속 진행 중인지 확인.
     *
     * @return close 전이면 true
     */
    boolean isActive();

    /**
     * 폴링을 멈추고 커서 행을 삭제.
     *
     * <p>여러 번 호출해도 안전합니다. 이미 버퍼에 담긴 메시지는 계속 꺼낼 수 있습니다.</p>
     */
    @Override
    void close();
}
