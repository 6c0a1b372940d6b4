package com.opsdash.adapter.in.web;

import com.opsdash.pagination.PageMetadata;
import com.opsdash.pagination.PageResult;
import com.opsdash.pagination.params.Direction;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.util.List;
import java.util.function.Function;

/**
 * A page as returned to clients. {@code links} repeat the current request with the
 * cursor and direction swapped in; a link is null when there is no page that way.
 */
public record PageResponse<T>(
    List<T> data,
    PageMetadata pagination,
    Links links
) {
    public static <S, T> PageResponse<T> from(PageResult<S> page, Function<S, T> mapper) {
        List<T> data = page.data().stream().map(mapper).toList();
        PageMetadata metadata = page.metadata();
        Links links = new Links(
            ServletUriComponentsBuilder.fromCurrentRequest().toUriString(),
            metadata.hasNextPage() ? link(metadata.nextCursor(), Direction.NEXT) : null,
            metadata.hasPrevPage() ? link(metadata.prevCursor(), Direction.PREV) : null
        );
        return new PageResponse<>(data, metadata, links);
    }

    private static String link(String cursor, Direction direction) {
        if (cursor == null) {
            return null;
        }
        return ServletUriComponentsBuilder.fromCurrentRequest()
            .replaceQueryParam("cursor", cursor)
            .replaceQueryParam("direction", direction.wireName())
            .toUriString();
    }

    public record Links(
        String self,
        String next,
        String prev
    ) {}
}
