package com.example.riskscan_backend.service.orchestration;

import com.example.riskscan_backend.util.Modality;

import java.util.*;

/**
 * Which modalities must succeed, and in which order they may run.
 * <p>
 * A node is ready once all its dependencies succeeded and unreachable once any dependency failed
 * or is itself unreachable. A failed or unreachable hard node fails the request; soft nodes only
 * end up in the missing list.
 */
public class ModalityDependencyGraph {

    public enum Policy { HARD, SOFT }

    public enum NodeStatus { OPEN, SUCCEEDED, FAILED }

    public enum Outcome { WAITING, PROCEED, FAIL }

    public record Node(Modality modality, Policy policy, Set<Modality> requires) {}

    /**
     * @param missing    soft modalities that failed or became unreachable, for PROCEED.
     * @param failedHard the hard modality that sank the request, for FAIL.
     */
    public record Verdict(Outcome outcome, List<Modality> missing, Modality failedHard) {
        static Verdict waiting() {
            return new Verdict(Outcome.WAITING, List.of(), null);
        }
    }

    private final Map<Modality, Node> nodes = new EnumMap<>(Modality.class);

    public ModalityDependencyGraph(Collection<Node> nodes) {
        for (Node n : nodes) {
            this.nodes.put(n.modality(), n);
        }
        for (Node n : nodes) {
            for (Modality dep : n.requires()) {
                if (!this.nodes.containsKey(dep)) {
                    throw new IllegalArgumentException(n.modality() + " requires unknown " + dep);
                }
            }
        }
    }

    /** Visual and sentiment are soft, speech is hard, sentiment runs on the transcript. */
    public static ModalityDependencyGraph standard() {
        return new ModalityDependencyGraph(List.of(
                new Node(Modality.VISUAL, Policy.SOFT, Set.of()),
                new Node(Modality.SPEECH, Policy.HARD, Set.of()),
                new Node(Modality.SENTIMENT, Policy.SOFT, Set.of(Modality.SPEECH))));
    }

    public Set<Modality> modalities() {
        return Collections.unmodifiableSet(nodes.keySet());
    }

    public Node node(Modality modality) {
        return nodes.get(modality);
    }

    public boolean isReady(Modality modality, Map<Modality, NodeStatus> status) {
        for (Modality dep : nodes.get(modality).requires()) {
            if (statusOf(dep, status) != NodeStatus.SUCCEEDED) {
                return false;
            }
        }
        return true;
    }

    public boolean isUnreachable(Modality modality, Map<Modality, NodeStatus> status) {
        for (Modality dep : nodes.get(modality).requires()) {
            if (statusOf(dep, status) == NodeStatus.FAILED || isUnreachable(dep, status)) {
                return true;
            }
        }
        return false;
    }

    public Verdict evaluate(Map<Modality, NodeStatus> status) {
        List<Modality> missing = new ArrayList<>();
        boolean open = false;
        for (Node n : nodes.values()) {
            boolean lost = statusOf(n.modality(), status) == NodeStatus.FAILED || isUnreachable(n.modality(), status);
            if (lost) {
                if (n.policy() == Policy.HARD) {
                    return new Verdict(Outcome.FAIL, List.of(), n.modality());
                }
                missing.add(n.modality());
            } else if (statusOf(n.modality(), status) == NodeStatus.OPEN) {
                open = true;
            }
        }
        if (open) {
            return Verdict.waiting();
        }
        return new Verdict(Outcome.PROCEED, List.copyOf(missing), null);
    }

    private static NodeStatus statusOf(Modality m, Map<Modality, NodeStatus> status) {
        return status.getOrDefault(m, NodeStatus.OPEN);
    }
}
