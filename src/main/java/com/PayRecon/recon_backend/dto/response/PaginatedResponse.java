package com.PayRecon.recon_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Page;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * One page of a history or list endpoint. Pages are 1-based on the wire.
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

    public static <E, T> PaginatedResponse<T> from(Page<E> source, Function<E, T> mapper) {
        List<T> data = source.getContent()
                .stream()
                .map(mapper)
                .collect(Collectors.toList());
        return PaginatedResponse.<T>builder()
                .data(data)
                .pagination(PaginationInfo.builder()
                        .page(source.getNumber() + 1)
                        .limit(source.getSize())
                        .total(source.getTotalElements())
                        .pages(source.getTotalPages())
                        .hasNext(source.hasNext())
                        .hasPrev(source.hasPrevious())
                        .build())
                .build();
    }
}
