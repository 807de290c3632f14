package cockpit.jobs.api.v1.dto;

import cockpit.jobs.model.Page;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.function.Function;

/**
 * Paginated list response.
 */
public record PageResponse<T>(
        @JsonProperty("items") List<T> items,
        @JsonProperty("total") long total,
        @JsonProperty("page") int page,
        @JsonProperty("pageSize") int pageSize,
        @JsonProperty("totalPages") int totalPages) {

    public static <S, T> PageResponse<T> from(Page<S> page, Function<S, T> mapper) {
        return new PageResponse<>(
                page.items().stream().map(mapper).toList(),
                page.total(),
                page.page(),
                page.pageSize(),
                page.totalPages());
    }
}
