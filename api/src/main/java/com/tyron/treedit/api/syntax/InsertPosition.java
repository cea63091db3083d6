package com.tyron.treedit.api.syntax;

import java.util.Objects;
import java.util.function.Function;

/**
 * Where to place new children relative to the existing children of a node.
 *
 * @param <T> type of the anchor element
 */
public sealed interface InsertPosition<T>
        permits InsertPosition.First, InsertPosition.Last, InsertPosition.Before, InsertPosition.After {

    static <T> InsertPosition<T> first() {
        return new First<>();
    }

    static <T> InsertPosition<T> last() {
        return new Last<>();
    }

    static <T> InsertPosition<T> before(T anchor) {
        return new Before<>(anchor);
    }

    static <T> InsertPosition<T> after(T anchor) {
        return new After<>(anchor);
    }

    /**
     * Maps the anchor, keeping the position variant.
     */
    <R> InsertPosition<R> map(Function<? super T, ? extends R> mapper);

    record First<T>() implements InsertPosition<T> {
        @Override
        public <R> InsertPosition<R> map(Function<? super T, ? extends R> mapper) {
            return new First<>();
        }
    }

    record Last<T>() implements InsertPosition<T> {
        @Override
        public <R> InsertPosition<R> map(Function<? super T, ? extends R> mapper) {
            return new Last<>();
        }
    }

    record Before<T>(T anchor) implements InsertPosition<T> {
        public Before {
            Objects.requireNonNull(anchor, "anchor");
        }

        @Override
        public <R> InsertPosition<R> map(Function<? super T, ? extends R> mapper) {
            return new Before<>(mapper.apply(anchor));
        }
    }

    record After<T>(T anchor) implements InsertPosition<T> {
        public After {
            Objects.requireNonNull(anchor, "anchor");
        }

        @Override
        public <R> InsertPosition<R> map(Function<? super T, ? extends R> mapper) {
            return new After<>(mapper.apply(anchor));
        }
    }
}
