package com.yongkangl.labeling.io;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PreorderSequenceParserTest {

    @Test
    void parsesSeparatedLists() {
        assertThat(new PreorderSequenceParser("0,1,1,2").parse()).containsExactly(0, 1, 1, 2);
        assertThat(new PreorderSequenceParser(" 0 1  2 ").parse()).containsExactly(0, 1, 2);
        assertThat(new PreorderSequenceParser("0, 1, 2, 1").parse()).containsExactly(0, 1, 2, 1);
    }

    @Test
    void parsesJsonArrays() {
        assertThat(new PreorderSequenceParser("[0, 1, 1, 2]").parse()).containsExactly(0, 1, 1, 2);
        assertThat(new PreorderSequenceParser("[0]").parse()).containsExactly(0);
    }

    @Test
    void rejectsWrongContainerTypes() {
        assertThatThrownBy(() -> new PreorderSequenceParser("{\"tree\": [0, 1]}").parse())
                .isInstanceOf(InvalidTreeDescriptionException.class)
                .hasMessageContaining("array");
        assertThatThrownBy(() -> new PreorderSequenceParser("\"0,1\"").parse())
                .isInstanceOf(InvalidTreeDescriptionException.class);
        assertThatThrownBy(() -> new PreorderSequenceParser("42").parse())
                .isInstanceOf(InvalidTreeDescriptionException.class);
    }

    @Test
    void rejectsNonIntegerDepths() {
        assertThatThrownBy(() -> new PreorderSequenceParser("[0, 1.5]").parse())
                .isInstanceOf(InvalidTreeDescriptionException.class);
        assertThatThrownBy(() -> new PreorderSequenceParser("[0, \"1\"]").parse())
                .isInstanceOf(InvalidTreeDescriptionException.class);
        assertThatThrownBy(() -> new PreorderSequenceParser("0,a,1").parse())
                .isInstanceOf(InvalidTreeDescriptionException.class)
                .hasCauseInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> new PreorderSequenceParser("[0, 1").parse())
                .isInstanceOf(InvalidTreeDescriptionException.class);
    }

    @Test
    void rejectsEmptyAndInvalidTraversals() {
        assertThatThrownBy(() -> new PreorderSequenceParser("").parse())
                .isInstanceOf(InvalidTreeDescriptionException.class);
        assertThatThrownBy(() -> new PreorderSequenceParser(null).parse())
                .isInstanceOf(InvalidTreeDescriptionException.class);
        assertThatThrownBy(() -> new PreorderSequenceParser("[]").parse())
                .isInstanceOf(InvalidTreeDescriptionException.class);
        assertThatThrownBy(() -> new PreorderSequenceParser("[1, 2, 3]").parse())
                .isInstanceOf(InvalidTreeDescriptionException.class);
        assertThatThrownBy(() -> new PreorderSequenceParser("42,43").parse())
                .isInstanceOf(InvalidTreeDescriptionException.class);
    }

    @Test
    void parsesAlphabetSizes() {
        assertThat(PreorderSequenceParser.parseAlphabetSize("3")).isEqualTo(3);
        assertThat(PreorderSequenceParser.parseAlphabetSize(" 5 ")).isEqualTo(5);
        assertThatThrownBy(() -> PreorderSequenceParser.parseAlphabetSize(""))
                .isInstanceOf(InvalidAlphabetSizeException.class);
        assertThatThrownBy(() -> PreorderSequenceParser.parseAlphabetSize("2.5"))
                .isInstanceOf(InvalidAlphabetSizeException.class);
        assertThatThrownBy(() -> PreorderSequenceParser.parseAlphabetSize(null))
                .isInstanceOf(InvalidAlphabetSizeException.class);
        assertThatThrownBy(() -> PreorderSequenceParser.parseAlphabetSize("0"))
                .isInstanceOf(InvalidAlphabetSizeException.class);
    }
}
