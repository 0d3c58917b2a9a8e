package ai.scholar.outline.structure;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SentenceSplitterTest {

    @Test
    void splitsAtFirstBoundaryFollowedByWhitespace() {
        assertThat(SentenceSplitter.split("Introduction. This paper presents a new method."))
                .contains(new SentenceSplitter.Split("Introduction", "This paper presents a new method."));
        assertThat(SentenceSplitter.split("Why now? Because.")).contains(new SentenceSplitter.Split("Why now", "Because."));
    }

    @Test
    void ignoresDecimalPointsAndTrailingPunctuation() {
        assertThat(SentenceSplitter.split("Accuracy rose to 0.93 overall")).isEmpty();
        assertThat(SentenceSplitter.split("Done.")).isEmpty();
        assertThat(SentenceSplitter.split(". Leading boundary")).isEmpty();
    }

    @Test
    void respectsMaximumLeadLength() {
        assertThat(SentenceSplitter.split("Short. Rest", 5)).contains(new SentenceSplitter.Split("Short", "Rest"));
        assertThat(SentenceSplitter.split("Longer lead. Rest", 5)).isEmpty();
    }

    @Test
    void firstSentenceKeepsPunctuation() {
        assertThat(SentenceSplitter.firstSentence("One. Two. Three.")).isEqualTo("One.");
        assertThat(SentenceSplitter.firstSentence("No boundary here")).isEqualTo("No boundary here");
        assertThat(SentenceSplitter.firstSentence(null)).isEmpty();
    }
}
