package com.ClaimFlow.expense_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Page;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * One page of results with 1-based page numbers, as every list endpoint returns them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaginatedResponse<T> {
    private List<T> data;
    private PaginationInfo pagination;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PaginationInfo {
        private int page;
        private int limit;
        private long total;
        private int pages;
        private boolean hasNext;
        private boolean hasPrev;
    }

    public static <T> PaginatedResponse<T> of(List<T> data, int page, int limit, long total) {
        int pages = (int) Math.ceil((double) total / limit);
        return PaginatedResponse.<T>builder()
                .data(data)
                .pagination(PaginationInfo.builder()
                        .page(page)
                        .limit(limit)
                        .total(total)
                        .pages(pages)
                        .hasNext(page < pages)
                        .hasPrev(page > 1)
                        .build())
                .build();
    }

    /**
     * Maps a Spring Data page; its 0-based number is reported 1-based.
     */
    public static <S, T> PaginatedResponse<T> from(Page<S> source, Function<? super S, T> mapper) {
        List<T> data = source.getContent().stream()
                .map(mapper)
                .collect(Collectors.toList());
        return of(data, source.getNumber() + 1, source.getSize(), source.getTotalElements());
    }
}
