package com.example.riskscan_backend.service.modality;

import com.example.riskscan_backend.engine.Interfaces.ModalityAdapter;
import com.example.riskscan_backend.util.Modality;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class ModalityAdapterRegistry {
    private final Map<Modality, ModalityAdapter> adapters = new EnumMap<>(Modality.class);

    public ModalityAdapterRegistry(List<ModalityAdapter> adapters) {
        for (ModalityAdapter a : adapters) {
            if (this.adapters.put(a.modality(), a) != null) {
                throw new IllegalStateException("Duplicate adapter for " + a.modality());
            }
        }
    }

    public ModalityAdapter get(Modality modality) {
        ModalityAdapter a = adapters.get(modality);
        if (a == null) {
            throw new IllegalStateException("No adapter for " + modality);
        }
        return a;
    }
}
