package com.ryuqq.rowcache.core.error;

import java.sql.SQLException;
import java.util.Set;

/**
 * 하부 저장소 실패를 감싸는 예외.
 *
 * <p>연결 실패, 예상하지 못한 제약 조건 위반, 잘못된 쿼리 등 저장소에서 발생한
 * 모든 오류는 이 예외로 감싸져 호출자에게 그대로 전달됩니다.</p>
 *
 * <p><strong>일시적 실패 판별 ({@link #isTransient()}):</strong></p>
 * <ul>
 *   <li>SQLState 클래스 40: 직렬화 실패, 데드락 (트랜잭션 롤백)</li>
 *   <li>HYT00: 락 대기 타임아웃</li>
 *   <li>90131: H2 동시 갱신 충돌</li>
 *   <li>MySQL 오류 코드 1205: 락 대기 타임아웃</li>
 * </ul>
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
public class CacheStoreException extends CacheException {

    private static final Set<String> TRANSIENT_STATES = Set.of("HYT00", "90131");
    private static final int MYSQL_LOCK_WAIT_TIMEOUT = 1205;

    private final String sqlState;
    private final int errorCode;

    public CacheStoreException(String message, Throwable cause) {
        super(message, cause);
        this.sqlState = null;
        this.errorCode = 0;
    }

    public CacheStoreException(String message, SQLException cause) {
        super(message + ": " + cause.getMessage(), cause);
        this.sqlState = cause.getSQLState();
        this.errorCode = cause.getErrorCode();
    }

    /**
     * SQLState 조회.
     *
     * @return SQLState (SQLException이 원인이 아니면 null)
     */
    public String getSqlState() {
        return sqlState;
    }

    /**
     * 벤더 오류 코드 조회.
     *
     * @return 오류 코드 (SQLException이 원인이 아니면 0)
     */
    public int getErrorCode() {
        return errorCode;
    }

    /**
     * 같은 작업을 새 트랜잭션으로 재시도하면 성공할 수 있는 실패인지 확인.
     *
     * @return 일시적 실패 여부
     */
    public boolean isTransient() {
        if (errorCode == MYSQL_LOCK_WAIT_TIMEOUT) {
            return true;
        }
        if (sqlState == null) {
            return false;
        }
        return sqlState.startsWith("40") || TRANSIENT_STATES.contains(sqlState);
    }
}
