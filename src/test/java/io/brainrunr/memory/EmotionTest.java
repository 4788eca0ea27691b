package io.brainrunr.memory;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EmotionTest {

    @Test
    void shouldParseCaseInsensitively() {
        assertEquals(Emotion.NOSTALGIC, Emotion.fromString("Nostalgic"));
        assertEquals(Emotion.HAPPY, Emotion.fromString(" happy "));
    }

    @Test
    void shouldDefaultBlankToNeutral() {
        assertEquals(Emotion.NEUTRAL, Emotion.fromString(null));
        assertEquals(Emotion.NEUTRAL, Emotion.fromString(""));
    }

    @Test
    void shouldRejectUnknownEmotion() {
        assertThrows(ValidationException.class, () -> Emotion.fromString("furious"));
    }

    @Test
    void shouldRenderLowercaseTag() {
        assertEquals("surprised", Emotion.SURPRISED.tag());
    }

    @Test
    void shouldBoostStrongEmotionsMostInRecall() {
        assertEquals(0.4, Emotion.EXCITED.recallBoost());
        assertEquals(0.0, Emotion.NEUTRAL.recallBoost());
        assertTrue(Emotion.SURPRISED.recallBoost() > Emotion.HAPPY.recallBoost());
        assertTrue(Emotion.HAPPY.recallBoost() > Emotion.CURIOUS.recallBoost());
    }
}
