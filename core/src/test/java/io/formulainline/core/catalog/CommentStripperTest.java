package io.formulainline.core.catalog;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class CommentStripperTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "1 + 2 // note                 | '1 + 2 '",
        "1 /* a */ + /* b */ 2         | '1  +  2'",
        "'\"a//b\"'                    | '\"a//b\"'",
        "'''it''''s // here'''         | '''it''''s // here'''",
        "'\"q\\\"//\" // gone'         | '\"q\\\"//\" '",
        "1 /* never closed             | '1 '",
    })
    void stripsCommentsOutsideStrings(String input, String expected) {
        assertThat(CommentStripper.strip(input)).isEqualTo(expected);
    }

    @Test
    void lineCommentKeepsNewline() {
        assertThat(CommentStripper.strip("a // one\nb")).isEqualTo("a \nb");
    }

    @Test
    void doubledQuoteDoesNotEndString() {
        assertThat(CommentStripper.strip("\"say \"\"//hi\"\"\" /* x */")).isEqualTo("\"say \"\"//hi\"\"\" ");
    }
}
