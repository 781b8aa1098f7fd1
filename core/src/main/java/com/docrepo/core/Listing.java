package com.docrepo.core;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * One listing result: the number of records matching the filter, ignoring
 * pagination, and the records of the requested window.
 */
public record Listing<T>(long totalCount, List<T> items) {

    public <R> Listing<R> map(Function<? super T, ? extends R> mapper) {
        return new Listing<>(totalCount, items.stream().map(mapper).collect(Collectors.toList()));
    }
}
