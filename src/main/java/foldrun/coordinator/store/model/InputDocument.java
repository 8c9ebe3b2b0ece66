package foldrun.coordinator.store.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * On-disk form of a job input ({@code inputs/<jobId>/input.json}).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record InputDocument(
        String jobId,
        String sequence,
        List<String> directions,
        Map<String, Object> params,
        Instant submittedAt) {
}
