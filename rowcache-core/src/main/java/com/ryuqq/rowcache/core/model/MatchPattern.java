package com.ryuqq.rowcache.core.model;

import java.util.regex.Pattern;

/**
 * 글롭 스타일 매치 패턴.
 *
 * <p>{@code *}는 임의 길이 문자열, {@code ?}는 임의의 한 글자와 일치합니다.
 * SQL 백엔드는 {@link #toSqlLike()}의 결과를 LIKE 연산자에 그대로 넘기고,
 * 인메모리 백엔드는 같은 LIKE 패턴을 {@link #matches(String)}로 평가합니다.</p>
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
public final class MatchPattern {

    private final String glob;
    private final Pattern regex;

    private MatchPattern(String glob) {
        this.glob = glob;
        this.regex = likeToRegex(toSqlLike(glob));
    }

    /**
     * 패턴 생성.
     *
     * @param glob 글롭 패턴
     * @return MatchPattern 인스턴스
     * @throws IllegalArgumentException glob이 null이거나 빈 문자열인 경우
     */
    public static MatchPattern of(String glob) {
        if (glob == null || glob.isEmpty()) {
            throw new IllegalArgumentException("glob cannot be null or empty");
        }
        return new MatchPattern(glob);
    }

    /**
     * 매치 조건이 주어졌는지 확인 (null/빈 문자열은 필터 없음).
     *
     * @param glob 글롭 패턴
     * @return 필터가 필요하면 true
     */
    public static boolean isPresent(String glob) {
        return glob != null && !glob.isEmpty();
    }

    /**
     * SQL LIKE 패턴으로 변환.
     *
     * @return LIKE 패턴
     */
    public String toSqlLike() {
        return toSqlLike(glob);
    }

    /**
     * LIKE 의미로 값이 패턴과 일치하는지 확인.
     *
     * @param value 검사할 값
     * @return 일치 여부
     */
    public boolean matches(String value) {
        return value != null && regex.matcher(value).matches();
    }

    private static String toSqlLike(String glob) {
        return glob.replace('*', '%').replace('?', '_');
    }

    private static Pattern likeToRegex(String like) {
        StringBuilder sb = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : like.toCharArray()) {
            if (c == '%' || c == '_') {
                if (literal.length() > 0) {
                    sb.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                sb.append(c == '%' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            sb.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(sb.toString(), Pattern.DOTALL);
    }

    @Override
    public String toString() {
        return "MatchPattern{" + glob + '}';
    }
}
