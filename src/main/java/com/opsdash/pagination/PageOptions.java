package com.opsdash.pagination;

import com.opsdash.pagination.params.Direction;
import com.opsdash.pagination.params.RawPageParams;
import com.opsdash.pagination.predicate.Predicate;

/**
 * Per-call options of a {@link Paginator}: the business filter, the client's raw
 * pagination parameters and whether an exact total is wanted.
 */
public record PageOptions(Predicate filter, RawPageParams page, boolean includeTotal) {

    public PageOptions {
        filter = filter == null ? Predicate.all() : filter;
        page = page == null ? RawPageParams.none() : page;
    }

    public static PageOptions of(Predicate filter, RawPageParams page) {
        return new PageOptions(filter, page, false);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Predicate filter;
        private String cursor;
        private String limit;
        private String direction;
        private boolean includeTotal;

        private Builder() {}

        public Builder filter(Predicate filter) {
            this.filter = filter;
            return this;
        }

        public Builder cursor(String cursor) {
            this.cursor = cursor;
            return this;
        }

        public Builder limit(Integer limit) {
            this.limit = limit == null ? null : limit.toString();
            return this;
        }

        public Builder limit(String limit) {
            this.limit = limit;
            return this;
        }

        public Builder direction(Direction direction) {
            this.direction = direction.wireName();
            return this;
        }

        public Builder direction(String direction) {
            this.direction = direction;
            return this;
        }

        public Builder page(RawPageParams page) {
            this.cursor = page.cursor();
            this.limit = page.limit();
            this.direction = page.direction();
            return this;
        }

        public Builder includeTotal(boolean includeTotal) {
            this.includeTotal = includeTotal;
            return this;
        }

        public PageOptions build() {
            return new PageOptions(filter, new RawPageParams(cursor, limit, direction), includeTotal);
        }
    }
}
