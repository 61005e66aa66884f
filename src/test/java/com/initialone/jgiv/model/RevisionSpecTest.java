package com.initialone.jgiv.model;

import com.initialone.jgiv.errors.RevisionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RevisionSpecTest {

    @ParameterizedTest
    @ValueSource(strings = {"", "  ", "working-tree", "--current", "current"})
    void workingTreeAliases(String text) {
        RevisionSpec spec = RevisionSpec.parse(text, List.of());

        assertThat(spec.kind).isEqualTo(RevisionSpec.Kind.WORKING_TREE);
        assertThat(spec.text).isEqualTo(Commit.WORKING_TREE_ID);
        assertThat(spec.isSynthetic()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"staged", "--cached", "cached"})
    void stagedAliases(String text) {
        assertThat(RevisionSpec.parse(text, null).kind).isEqualTo(RevisionSpec.Kind.STAGED);
    }

    @Test
    void nullMeansWorkingTree() {
        assertThat(RevisionSpec.parse(null, null).kind).isEqualTo(RevisionSpec.Kind.WORKING_TREE);
    }

    @Test
    void twoDotRange() {
        RevisionSpec spec = RevisionSpec.parse("HEAD~3..HEAD", List.of("src"));

        assertThat(spec.kind).isEqualTo(RevisionSpec.Kind.RANGE);
        assertThat(spec.from).isEqualTo("HEAD~3");
        assertThat(spec.to).isEqualTo("HEAD");
        assertThat(spec.symmetric).isFalse();
        assertThat(spec.pathFilters).containsExactly("src");
        assertThat(spec.rangeExpression()).isEqualTo("HEAD~3..HEAD");
    }

    @Test
    void threeDotRangeWithOpenEnd() {
        RevisionSpec spec = RevisionSpec.parse("v1.0.0...", List.of());

        assertThat(spec.symmetric).isTrue();
        assertThat(spec.rangeExpression()).isEqualTo("v1.0.0...HEAD");
    }

    @Test
    void openStartDefaultsToHead() {
        assertThat(RevisionSpec.parse("..main", List.of()).from).isEqualTo("HEAD");
    }

    @Test
    void singleRevision() {
        RevisionSpec spec = RevisionSpec.parse("abc1234", List.of());

        assertThat(spec.kind).isEqualTo(RevisionSpec.Kind.SINGLE);
        assertThat(spec.to).isEqualTo("abc1234");
        assertThat(spec.isSynthetic()).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"..", "...", "a..b..c", "HEAD ~1", "--all"})
    void malformedSpecsAreRevisionErrors(String text) {
        assertThatThrownBy(() -> RevisionSpec.parse(text, List.of()))
                .isInstanceOf(RevisionException.class)
                .hasMessageContaining(text.trim());
    }
}
