package com.nnipa.iam.dto.response;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Page;

import java.util.List;
import java.util.function.Function;

/**
 * One page of results with self-describing pagination metadata. Page numbers start at 1.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Paged result")
public class PagedResponse<T> {

    private List<T> items;
    private int pageNumber;
    private int pageSize;
    private long totalCount;
    private int totalPages;
    private boolean hasNextPage;
    private boolean hasPreviousPage;

    public static <E, T> PagedResponse<T> of(Page<E> page, Function<E, T> mapper) {
        return PagedResponse.<T>builder()
                .items(page.getContent().stream().map(mapper).toList())
                .pageNumber(page.getNumber() + 1)
                .pageSize(page.getSize())
                .totalCount(page.getTotalElements())
                .totalPages(page.getTotalPages())
                .hasNextPage(page.hasNext())
                .hasPreviousPage(page.hasPrevious())
                .build();
    }
}
