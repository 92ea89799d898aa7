package com.library.lending.dto.response;

import java.util.List;

public record ListResponse<T>(
    int count,
    List<T> items
) {
    public static <T> ListResponse<T> of(List<T> items) {
        return new ListResponse<>(items.size(), items);
    }
}
