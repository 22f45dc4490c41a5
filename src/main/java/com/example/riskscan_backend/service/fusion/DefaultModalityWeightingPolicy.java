package com.example.riskscan_backend.service.fusion;

import com.example.riskscan_backend.config.FusionProperties;
import com.example.riskscan_backend.util.Modality;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Configured base weights, renormalized over the modalities that actually produced results.
 */
@Component
public class DefaultModalityWeightingPolicy implements ModalityWeightingPolicy {
    private final Map<Modality, Double> base;

    public DefaultModalityWeightingPolicy(FusionProperties props) {
        this.base = new EnumMap<>(Modality.class);
        for (Modality m : Modality.values()) {
            this.base.put(m, Math.max(0.0, props.getWeights().getOrDefault(m, 0.0)));
        }
    }

    @Override
    public Map<Modality, Double> weights(Set<Modality> available) {
        Map<Modality, Double> out = new EnumMap<>(Modality.class);
        double sum = available.stream().mapToDouble(base::get).sum();
        if (sum <= 0) {
            return out;
        }
        for (Modality m : available) {
            out.put(m, Math.round(base.get(m) / sum * 1000d) / 1000d);
        }
        return out;
    }

    @Override
    public double coverage(Set<Modality> available) {
        double total = base.values().stream().mapToDouble(Double::doubleValue).sum();
        if (total <= 0) {
            return 0.0;
        }
        double have = available.stream().mapToDouble(base::get).sum();
        return Math.round(have / total * 1000d) / 1000d;
    }
}
