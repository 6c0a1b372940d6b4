package com.opsdash.pagination.params;

import com.opsdash.domain.model.Result;
import com.opsdash.pagination.cursor.CursorCodec;
import com.opsdash.pagination.cursor.CursorError;

/**
 * Normalises raw pagination input. Limit and direction problems are silently repaired;
 * a bad cursor is the one problem reported back to the caller.
 */
public class ParamsValidator {

    private final CursorCodec codec;
    private final PaginationLimits limits;

    public ParamsValidator(CursorCodec codec, PaginationLimits limits) {
        this.codec = codec;
        this.limits = limits;
    }

    public Result<PaginationParams, CursorError> parse(RawPageParams raw) {
        RawPageParams params = raw == null ? RawPageParams.none() : raw;
        int limit = parseLimit(params.limit());
        Direction direction = Direction.parse(params.direction());

        String token = params.cursor();
        if (token == null || token.isBlank()) {
            return Result.success(new PaginationParams(limit, direction, null, null));
        }
        return codec.decode(token.trim())
            .map(payload -> new PaginationParams(limit, direction, token.trim(), payload));
    }

    int parseLimit(String raw) {
        if (raw == null || raw.isBlank()) {
            return limits.defaultLimit();
        }
        try {
            return limits.clamp(Long.parseLong(raw.trim()));
        } catch (NumberFormatException e) {
            return limits.defaultLimit();
        }
    }
}
