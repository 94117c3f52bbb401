package com.ryuqq.rowcache.core.model;

import java.time.Instant;

/**
 * 채널 메시지 로그의 한 행.
 *
 * @param id 단조 증가 메시지 ID (채널 내 전달 순서 기준)
 * @param channel 채널명
 * @param payload 메시지 본문
 * @param createdAt 게시 시각
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
public record ChannelMessage(long id, String channel, String payload, Instant createdAt) {

    public ChannelMessage {
        if (channel == null || channel.isBlank()) {
            throw new IllegalArgumentException("channel cannot be null or blank");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
    }
}
