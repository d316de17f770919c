package com.machining.kg.index;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TextTokenizerTest {

    @Test
    void testMixedQuestion() {
        assertEquals(List.of("feature", "类型", "型都"), TextTokenizer.tokenize("feature类型都有哪些"));
    }

    @Test
    void testHanBigramsAndUnits() {
        assertEquals(List.of("直径", "10mm", "的刀", "刀具"), TextTokenizer.tokenize("直径10mm的刀具"));
    }

    @Test
    void testToolIdsAndDecimalsStayWhole() {
        List<String> tokens = TextTokenizer.tokenize("T-101 R角 0.5mm, 4刃");

        assertTrue(tokens.contains("t-101"));
        assertTrue(tokens.contains("0.5mm"));
        assertTrue(tokens.contains("4"));
        assertTrue(tokens.contains("角"));
        assertTrue(tokens.contains("刃"));
    }

    @Test
    void testFullWidthInputIsNormalised() {
        assertEquals(TextTokenizer.tokenize("T-101"), TextTokenizer.tokenize("Ｔ－１０１"));
    }

    @Test
    void testStopWordsAndEmptyInput() {
        assertTrue(TextTokenizer.tokenize("what is the").isEmpty());
        assertTrue(TextTokenizer.tokenize("").isEmpty());
        assertTrue(TextTokenizer.tokenize(null).isEmpty());
    }
}
