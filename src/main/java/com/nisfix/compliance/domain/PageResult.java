package com.nisfix.compliance.domain;

import java.util.List;
import java.util.function.Function;

public record PageResult<T>(List<T> items, long totalCount, int page, int limit, int totalPages) {

    public static <T> PageResult<T> of(List<T> items, long totalCount, PageQuery query) {
        int totalPages = (int) ((totalCount + query.limit() - 1) / query.limit());
        return new PageResult<>(items, totalCount, query.page(), query.limit(), totalPages);
    }

    public <R> PageResult<R> map(Function<T, R> mapper) {
        return new PageResult<>(items.stream().map(mapper).toList(), totalCount, page, limit, totalPages);
    }
}
