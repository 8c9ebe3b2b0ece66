package foldrun.coordinator.engine;

import foldrun.coordinator.model.JobInput;
import foldrun.coordinator.model.Protocol;

import java.util.List;

/**
 * Engine invocation arguments.
 */
public record EngineRequest(
        String sequence,
        List<String> directions,
        Protocol protocol,
        int repeats,
        String seed,
        boolean biasToDirections) {

    public EngineRequest {
        directions = directions != null ? List.copyOf(directions) : List.of();
    }

    public static EngineRequest from(JobInput input) {
        return new EngineRequest(
                input.sequence(),
                input.directions(),
                input.params().protocol(),
                input.params().repeats(),
                input.params().seed(),
                input.params().biasToDirections());
    }
}
