package cockpit.jobs.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Snapshots keyed by run id; runs without live progress are listed in {@code missing}.
 */
public record BatchProgressResponse(
        @JsonProperty("progress") Map<String, ProgressResponse> progress,
        @JsonProperty("missing") List<String> missing) {
}
