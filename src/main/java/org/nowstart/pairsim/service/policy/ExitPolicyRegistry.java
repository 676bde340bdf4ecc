package org.nowstart.pairsim.service.policy;

import jakarta.annotation.PostConstruct;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.nowstart.pairsim.data.type.SimulationMode;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ExitPolicyRegistry {

    private final List<ExitPolicy> policies;
    private Map<SimulationMode, ExitPolicy> policiesByMode = Map.of();

    @PostConstruct
    void init() {
        Map<SimulationMode, ExitPolicy> byMode = new EnumMap<>(SimulationMode.class);
        for (ExitPolicy policy : policies) {
            ExitPolicy previous = byMode.put(policy.mode(), policy);
            if (previous != null) {
                throw new IllegalStateException("Duplicate exit policy registered for mode=" + policy.mode());
            }
        }
        policiesByMode = Map.copyOf(byMode);
    }

    public ExitPolicy getRequired(SimulationMode mode) {
        ExitPolicy policy = policiesByMode.get(mode);
        if (policy == null) {
            throw new IllegalStateException("No exit policy registered for mode=" + mode);
        }
        return policy;
    }
}
