package com.ryuqq.rowcache.core.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Map 커서 스캔의 한 페이지.
 *
 * <p>entries는 [field, value, field, value, ...] 형태로 평탄화되어 있습니다.
 * nextCursor가 0이면 스캔이 끝난 것이지만, 호출자는 멈추기 전에 항상
 * 이번 페이지의 entries를 먼저 처리해야 합니다.</p>
 *
 * @param entries 평탄화된 field/value 시퀀스
 * @param nextCursor 다음 호출에 넘길 커서 (0이면 종료)
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
public record ScanPage(List<String> entries, long nextCursor) {

    public ScanPage {
        if (entries == null) {
            throw new IllegalArgumentException("entries cannot be null");
        }
        if (entries.size() % 2 != 0) {
            throw new IllegalArgumentException("entries must contain field/value pairs, but size was: " + entries.size());
        }
        if (nextCursor < 0) {
            throw new IllegalArgumentException("nextCursor cannot be negative, but was: " + nextCursor);
        }
        entries = List.copyOf(entries);
    }

    /**
     * 마지막 페이지인지 확인.
     *
     * @return nextCursor가 0이면 true
     */
    public boolean isLast() {
        return nextCursor == 0;
    }

    /**
     * 이번 페이지의 field 수.
     *
     * @return field 수
     */
    public int fieldCount() {
        return entries.size() / 2;
    }

    /**
     * 평탄화된 entries를 순서를 유지한 Map으로 변환.
     *
     * @return field → value
     */
    public Map<String, String> asMap() {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < entries.size(); i += 2) {
            map.put(entries.get(i), entries.get(i + 1));
        }
        return map;
    }
}
