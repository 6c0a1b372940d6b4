package com.opsdash.pagination;

import java.util.List;
import java.util.function.Function;

public record PageResult<T>(List<T> data, PageMetadata metadata) {

    public PageResult {
        data = List.copyOf(data);
    }

    public static <T> PageResult<T> empty(int limit) {
        return new PageResult<>(List.of(), PageMetadata.empty(limit, null));
    }

    public <U> PageResult<U> map(Function<T, U> mapper) {
        return new PageResult<>(data.stream().map(mapper).toList(), metadata);
    }

    public boolean isEmpty() {
        return data.isEmpty();
    }
}
