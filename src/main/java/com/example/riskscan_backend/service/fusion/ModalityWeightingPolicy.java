package com.example.riskscan_backend.service.fusion;

import com.example.riskscan_backend.util.Modality;

import java.util.Map;
import java.util.Set;

/**
 * How much each available modality should count in the fused assessment.
 */
public interface ModalityWeightingPolicy {

    /** Weights over {@code available}, summing to 1. Empty when nothing is available. */
    Map<Modality, Double> weights(Set<Modality> available);

    /** Share of the full evidence picture that {@code available} represents, in {@code [0, 1]}. */
    double coverage(Set<Modality> available);
}
