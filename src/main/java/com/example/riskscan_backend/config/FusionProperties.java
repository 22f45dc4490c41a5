package com.example.riskscan_backend.config;

import com.example.riskscan_backend.util.Modality;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.EnumMap;
import java.util.Map;

@ConfigurationProperties(prefix = "fusion")
public class FusionProperties {

    /** Corrective re-prompts after the first reasoning call. */
    private int maxRepairAttempts = 2;
    private int maxPromptEntries = 200;
    private Map<Modality, Double> weights = defaultWeights();

    public int getMaxRepairAttempts() {
        return maxRepairAttempts;
    }

    public void setMaxRepairAttempts(int maxRepairAttempts) {
        this.maxRepairAttempts = maxRepairAttempts;
    }

    public int getMaxPromptEntries() {
        return maxPromptEntries;
    }

    public void setMaxPromptEntries(int maxPromptEntries) {
        this.maxPromptEntries = maxPromptEntries;
    }

    public Map<Modality, Double> getWeights() {
        return weights;
    }

    public void setWeights(Map<Modality, Double> weights) {
        this.weights = weights;
    }

    private static Map<Modality, Double> defaultWeights() {
        Map<Modality, Double> w = new EnumMap<>(Modality.class);
        w.put(Modality.VISUAL, 0.30);
        w.put(Modality.SPEECH, 0.30);
        w.put(Modality.SENTIMENT, 0.40);
        return w;
    }
}
