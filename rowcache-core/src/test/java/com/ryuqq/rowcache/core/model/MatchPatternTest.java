package com.ryuqq.rowcache.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * MatchPattern 테스트.
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
class MatchPatternTest {

    @Test
    void toSqlLike_TranslatesWildcards() {
        assertThat(MatchPattern.of("user:*").toSqlLike()).isEqualTo("user:%");
        assertThat(MatchPattern.of("a?c*").toSqlLike()).isEqualTo("a_c%");
    }

    @Test
    void matches_Star_MatchesAnySuffix() {
        MatchPattern pattern = MatchPattern.of("field_*");

        assertThat(pattern.matches("field_1")).isTrue();
        assertThat(pattern.matches("field_")).isTrue();
        assertThat(pattern.matches("other_1")).isFalse();
    }

    @Test
    void matches_QuestionMark_MatchesSingleChar() {
        MatchPattern pattern = MatchPattern.of("f?");

        assertThat(pattern.matches("f1")).isTrue();
        assertThat(pattern.matches("f12")).isFalse();
    }

    @Test
    void matches_RegexMetaCharacters_AreLiteral() {
        MatchPattern pattern = MatchPattern.of("a.b(*");

        assertThat(pattern.matches("a.b(xyz")).isTrue();
        assertThat(pattern.matches("aXb(xyz")).isFalse();
    }

    @Test
    void isPresent_NullOrEmpty_ReturnsFalse() {
        assertThat(MatchPattern.isPresent(null)).isFalse();
        assertThat(MatchPattern.isPresent("")).isFalse();
        assertThat(MatchPattern.isPresent("*")).isTrue();
    }

    @Test
    void of_Empty_ThrowsException() {
        assertThatThrownBy(() -> MatchPattern.of(""))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
