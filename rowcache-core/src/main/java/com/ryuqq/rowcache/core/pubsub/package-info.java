/**
 * 메시지 로그 기반 폴링 구독.
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
package com.ryuqq.rowcache.core.pubsub;
