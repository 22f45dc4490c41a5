package com.example.riskscan_backend.service.orchestration;

import com.example.riskscan_backend.service.orchestration.ModalityDependencyGraph.NodeStatus;
import com.example.riskscan_backend.service.orchestration.ModalityDependencyGraph.Outcome;
import com.example.riskscan_backend.service.orchestration.ModalityDependencyGraph.Verdict;
import com.example.riskscan_backend.util.Modality;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ModalityDependencyGraphTest {

    private final ModalityDependencyGraph graph = ModalityDependencyGraph.standard();

    private static Map<Modality, NodeStatus> status(NodeStatus visual, NodeStatus speech, NodeStatus sentiment) {
        Map<Modality, NodeStatus> m = new EnumMap<>(Modality.class);
        m.put(Modality.VISUAL, visual);
        m.put(Modality.SPEECH, speech);
        m.put(Modality.SENTIMENT, sentiment);
        return m;
    }

    @Test
    void sentimentWaitsForSpeech() {
        assertThat(graph.isReady(Modality.SENTIMENT, status(NodeStatus.OPEN, NodeStatus.OPEN, NodeStatus.OPEN))).isFalse();
        assertThat(graph.isReady(Modality.SENTIMENT, status(NodeStatus.OPEN, NodeStatus.SUCCEEDED, NodeStatus.OPEN))).isTrue();
        assertThat(graph.isReady(Modality.VISUAL, status(NodeStatus.OPEN, NodeStatus.OPEN, NodeStatus.OPEN))).isTrue();
    }

    @Test
    void speechFailureFailsTheRequest() {
        Verdict v = graph.evaluate(status(NodeStatus.SUCCEEDED, NodeStatus.FAILED, NodeStatus.OPEN));
        assertThat(v.outcome()).isEqualTo(Outcome.FAIL);
        assertThat(v.failedHard()).isEqualTo(Modality.SPEECH);
        assertThat(graph.isUnreachable(Modality.SENTIMENT, status(NodeStatus.OPEN, NodeStatus.FAILED, NodeStatus.OPEN))).isTrue();
    }

    @Test
    void softFailureProceedsWithMissingModality() {
        Verdict v = graph.evaluate(status(NodeStatus.FAILED, NodeStatus.SUCCEEDED, NodeStatus.SUCCEEDED));
        assertThat(v.outcome()).isEqualTo(Outcome.PROCEED);
        assertThat(v.missing()).containsExactly(Modality.VISUAL);
    }

    @Test
    void waitsWhileAnythingIsOpen() {
        assertThat(graph.evaluate(status(NodeStatus.FAILED, NodeStatus.SUCCEEDED, NodeStatus.OPEN)).outcome())
                .isEqualTo(Outcome.WAITING);
        assertThat(graph.evaluate(Map.of()).outcome()).isEqualTo(Outcome.WAITING);
    }

    @Test
    void allSucceededProceedsWithNothingMissing() {
        Verdict v = graph.evaluate(status(NodeStatus.SUCCEEDED, NodeStatus.SUCCEEDED, NodeStatus.SUCCEEDED));
        assertThat(v.outcome()).isEqualTo(Outcome.PROCEED);
        assertThat(v.missing()).isEmpty();
    }

    @Test
    void unknownDependencyIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ModalityDependencyGraph(List.of(
                new ModalityDependencyGraph.Node(Modality.SENTIMENT, ModalityDependencyGraph.Policy.SOFT, Set.of(Modality.SPEECH)))));
    }
}
