package com.example.riskscan_backend.service.fusion;

import com.example.riskscan_backend.util.Modality;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FusionResponseParserTest {

    private final FusionResponseParser parser = new FusionResponseParser(new ObjectMapper());
    private final List<String> windows = List.of("W1", "W2", "W3");

    @Test
    void acceptsValidReplyAndOrdersCitationsByTime() {
        var out = parser.parse("""
                {"score": 72, "classification": "high", "narrative": "Raised voices and fear.", "citedWindows": ["W3", "W1", "W3"]}
                """, windows, List.of());

        assertThat(out.valid()).isTrue();
        assertThat(out.draft().score()).isEqualTo(72);
        assertThat(out.draft().proposedClassification()).isEqualTo("HIGH");
        assertThat(out.draft().citedWindows()).containsExactly("W1", "W3");
    }

    @Test
    void stripsMarkdownFences() {
        var out = parser.parse("```json\n{\"score\": 10, \"classification\": \"LOW\", \"narrative\": \"Calm.\", \"citedWindows\": [\"W2\"]}\n```",
                windows, List.of());
        assertThat(out.valid()).isTrue();
        assertThat(out.draft().score()).isEqualTo(10);
    }

    @Test
    void integralFloatScoreIsAccepted() {
        var out = parser.parse("{\"score\": 40.0, \"classification\": \"MEDIUM\", \"narrative\": \"x\", \"citedWindows\": [\"W1\"]}",
                windows, List.of());
        assertThat(out.valid()).isTrue();
        assertThat(out.draft().score()).isEqualTo(40);
    }

    @Test
    void neverDefaultsMissingFields() {
        var out = parser.parse("{\"narrative\": \"something\"}", windows, List.of());

        assertThat(out.valid()).isFalse();
        assertThat(out.violations()).anyMatch(v -> v.contains("score"))
                .anyMatch(v -> v.contains("classification"))
                .anyMatch(v -> v.contains("citedWindows"));
    }

    @Test
    void rejectsOutOfRangeFractionalAndNonNumericScores() {
        for (String score : List.of("101", "-1", "55.5", "\"55\"")) {
            var out = parser.parse("{\"score\": " + score + ", \"classification\": \"MEDIUM\", \"narrative\": \"n\", \"citedWindows\": [\"W1\"]}",
                    windows, List.of());
            assertThat(out.valid()).as("score %s", score).isFalse();
        }
    }

    @Test
    void rejectsScoresBeyondLongRangeInsteadOfWrapping() {
        // 2^64 + 50: the low 64 bits alone would read as 50
        for (String score : List.of("18446744073709551666", "-18446744073709551566", "1e30")) {
            var out = parser.parse("{\"score\": " + score + ", \"classification\": \"MEDIUM\", \"narrative\": \"n\", \"citedWindows\": [\"W1\"]}",
                    windows, List.of());
            assertThat(out.valid()).as("score %s", score).isFalse();
            assertThat(out.violations()).anyMatch(v -> v.contains("between 0 and 100"));
        }
    }

    @Test
    void rejectsUnknownWindowsAndEmptyCitations() {
        assertThat(parser.parse("{\"score\": 5, \"classification\": \"LOW\", \"narrative\": \"n\", \"citedWindows\": [\"W9\"]}",
                windows, List.of()).valid()).isFalse();
        assertThat(parser.parse("{\"score\": 5, \"classification\": \"LOW\", \"narrative\": \"n\", \"citedWindows\": []}",
                windows, List.of()).valid()).isFalse();
        assertThat(parser.parse("{\"score\": 5, \"classification\": \"LOW\", \"narrative\": \"n\", \"citedWindows\": []}",
                List.of(), List.of()).valid()).isTrue();
    }

    @Test
    void narrativeMustNameMissingModality() {
        String reply = "{\"score\": 50, \"classification\": \"MEDIUM\", \"narrative\": \"Speech sounds tense.\", \"citedWindows\": [\"W1\"]}";
        var out = parser.parse(reply, windows, List.of(Modality.VISUAL));
        assertThat(out.valid()).isFalse();
        assertThat(out.violations()).singleElement().asString().contains("visual");

        String disclosed = "{\"score\": 50, \"classification\": \"MEDIUM\", \"narrative\": \"Speech sounds tense; facial analysis was unavailable.\", \"citedWindows\": [\"W1\"]}";
        assertThat(parser.parse(disclosed, windows, List.of(Modality.VISUAL)).valid()).isTrue();
    }

    @Test
    void nonJsonIsAViolation() {
        assertThat(parser.parse("I think the risk is medium.", windows, List.of()).valid()).isFalse();
        assertThat(parser.parse(null, windows, List.of()).valid()).isFalse();
        assertThat(parser.parse("[1,2]", windows, List.of()).violations()).containsExactly("reply must be a JSON object");
    }
}
