package com.initialone.jgiv.core;

import com.initialone.jgiv.errors.RevisionException;
import com.initialone.jgiv.git.CommitDiff;
import com.initialone.jgiv.git.CommitMetadata;
import com.initialone.jgiv.git.Repository;
import com.initialone.jgiv.model.Commit;
import com.initialone.jgiv.model.RevisionSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.OffsetDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RevisionResolverTest {

    @Mock
    Repository repo;

    private RevisionResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new RevisionResolver(repo);
    }

    private static CommitMetadata meta(String id) {
        return new CommitMetadata(id, id.substring(0, 3), "Ada", OffsetDateTime.parse("2024-05-01T10:00:00Z"), "msg " + id);
    }

    @Test
    void rangeKeepsRepositoryOrderAndAttachesMetadata() {
        when(repo.resolveCommits(any(RevisionSpec.class), anyList()))
                .thenReturn(List.of(new CommitDiff("aaa111", "diff a"), new CommitDiff("bbb222", "diff b")));
        when(repo.getMetadata("aaa111")).thenReturn(meta("aaa111"));
        when(repo.getMetadata("bbb222")).thenReturn(meta("bbb222"));

        List<Commit> commits = resolver.resolve("HEAD~2..HEAD", List.of());

        assertThat(commits).extracting(c -> c.id).containsExactly("aaa111", "bbb222");
        assertThat(commits.get(0).diff).isEqualTo("diff a");
        assertThat(commits.get(1).shortId).isEqualTo("bbb");
        assertThat(commits.get(1).date()).isEqualTo("2024-05-01");
        assertThat(commits).noneMatch(c -> c.synthetic);
    }

    @Test
    void emptyRangeGivesEmptyList() {
        when(repo.resolveCommits(any(RevisionSpec.class), anyList())).thenReturn(List.of());

        assertThat(resolver.resolve("v1.0.0..v1.0.0", List.of())).isEmpty();
    }

    @Test
    void workingTreeBecomesOneSyntheticCommit() {
        when(repo.uncommittedDiff(false, List.of("src"))).thenReturn("--- a\n+++ b\n");

        List<Commit> commits = resolver.resolve("", List.of("src"));

        assertThat(commits).hasSize(1);
        assertThat(commits.get(0).synthetic).isTrue();
        assertThat(commits.get(0).id).isEqualTo(Commit.WORKING_TREE_ID);
        verify(repo, never()).resolveCommits(any(), anyList());
    }

    @Test
    void cleanStagedAreaResolvesToNothing() {
        when(repo.uncommittedDiff(true, List.of())).thenReturn("  \n");

        assertThat(resolver.resolve("staged", List.of())).isEmpty();
    }

    @Test
    void repositoryFailurePropagates() {
        when(repo.resolveCommits(any(RevisionSpec.class), anyList()))
                .thenThrow(new RevisionException("nope..HEAD", "unknown revision 'nope' in 'nope..HEAD'"));

        assertThatThrownBy(() -> resolver.resolve("nope..HEAD", List.of()))
                .isInstanceOf(RevisionException.class)
                .hasMessageContaining("nope");
    }

    @Test
    void malformedSpecFailsBeforeTouchingGit() {
        assertThatThrownBy(() -> resolver.resolve("a..b..c", List.of())).isInstanceOf(RevisionException.class);
        verify(repo, never()).uncommittedDiff(anyBoolean(), anyList());
    }
}
