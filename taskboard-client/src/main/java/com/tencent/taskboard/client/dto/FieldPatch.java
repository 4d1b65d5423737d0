package com.tencent.taskboard.client.dto;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * FieldPatch - 局部更新字段
 * <p>
 * 区分三种情况：未提供（保持不变）、显式置空、赋新值。
 * </p>
 *
 * @param <T> 字段类型
 * @author taskboard
 */
public final class FieldPatch<T> {

    private static final FieldPatch<?> ABSENT = new FieldPatch<>(false, null);
    private static final FieldPatch<?> CLEARED = new FieldPatch<>(true, null);

    private final boolean present;
    private final T value;

    private FieldPatch(boolean present, T value) {
        this.present = present;
        this.value = value;
    }

    @SuppressWarnings("unchecked")
    public static <T> FieldPatch<T> absent() {
        return (FieldPatch<T>) ABSENT;
    }

    @SuppressWarnings("unchecked")
    public static <T> FieldPatch<T> cleared() {
        return (FieldPatch<T>) CLEARED;
    }

    public static <T> FieldPatch<T> of(T value) {
        return new FieldPatch<>(true, Objects.requireNonNull(value, "value"));
    }

    public boolean isPresent() {
        return present;
    }

    public boolean isCleared() {
        return present && value == null;
    }

    /**
     * 仅在赋新值时非空
     */
    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    public <R> FieldPatch<R> map(Function<? super T, ? extends R> mapper) {
        if (!present) {
            return absent();
        }
        return value == null ? cleared() : of(mapper.apply(value));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FieldPatch)) {
            return false;
        }
        FieldPatch<?> other = (FieldPatch<?>) o;
        return present == other.present && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(present, value);
    }

    @Override
    public String toString() {
        if (!present) {
            return "FieldPatch.absent";
        }
        return value == null ? "FieldPatch.cleared" : "FieldPatch[" + value + "]";
    }
}
