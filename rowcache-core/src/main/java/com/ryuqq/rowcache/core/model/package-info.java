/**
 * 캐시 도메인 값 타입.
 *
 * <ul>
 *   <li>{@link com.ryuqq.rowcache.core.model.Expiry} - TTL ↔ 만료 시각 규약</li>
 *   <li>{@link com.ryuqq.rowcache.core.model.ScanPage} - Map 커서 스캔 결과</li>
 *   <li>{@link com.ryuqq.rowcache.core.model.ChannelMessage} - 채널 메시지 로그 행</li>
 *   <li>{@link com.ryuqq.rowcache.core.model.MatchPattern} - 글롭 → LIKE 변환</li>
 * </ul>
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
package com.ryuqq.rowcache.core.model;
