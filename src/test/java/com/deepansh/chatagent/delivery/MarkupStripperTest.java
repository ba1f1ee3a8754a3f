package com.deepansh.chatagent.delivery;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MarkupStripperTest {

    @Test
    void strip_removesLinksKeepingLabel() {
        assertThat(MarkupStripper.strip("See [the docs](https://example.com/docs) for more"))
                .isEqualTo("See the docs for more");
    }

    @Test
    void strip_removesEmphasisAndCode() {
        assertThat(MarkupStripper.strip("**Bold** and *italic* with `code`"))
                .isEqualTo("Bold and italic with code");
    }

    @Test
    void strip_removesHeadingsAndFences() {
        assertThat(MarkupStripper.strip("## Title\n```java\nint x = 1;\n```"))
                .isEqualTo("Title\nint x = 1;");
    }

    @Test
    void strip_leavesSnakeCaseAlone() {
        assertThat(MarkupStripper.strip("call send_messages now")).isEqualTo("call send_messages now");
    }

    @Test
    void strip_keepsDollarSigns() {
        assertThat(MarkupStripper.strip("**$87.50** tip")).isEqualTo("$87.50 tip");
    }
}
