package com.initialone.jgiv.git;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CommitMetadataTest {

    @Test
    void parsesNulSeparatedShowOutput() {
        CommitMetadata md = CommitMetadata.parse(
                "0123456789abcdef\u00000123456\u0000Ada Lovelace\u00002024-05-01T10:00:00+02:00\u0000Fix parser\n\nBody line\n");

        assertThat(md.id).isEqualTo("0123456789abcdef");
        assertThat(md.shortId).isEqualTo("0123456");
        assertThat(md.author).isEqualTo("Ada Lovelace");
        assertThat(md.date.getOffset().getTotalSeconds()).isEqualTo(7200);
        assertThat(md.message).isEqualTo("Fix parser\n\nBody line");
    }

    @Test
    void messageMayContainAnything() {
        CommitMetadata md = CommitMetadata.parse("a\u0000b\u0000c\u0000not-a-date\u0000subject with \u0000 nul");

        assertThat(md.date).isNull();
        assertThat(md.message).isEqualTo("subject with \u0000 nul");
    }

    @Test
    void malformedOutputIsNull() {
        assertThat(CommitMetadata.parse("just text")).isNull();
        assertThat(CommitMetadata.parse(null)).isNull();
    }
}
