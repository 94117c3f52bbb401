/**
 * 백엔드 선택과 프로세스 단위 클라이언트 등록.
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
package com.ryuqq.rowcache.core.registry;
