package com.gpsr.registry.store;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Describes a table of the transactional store: its name, how a row's primary key is
 * obtained, and the unique constraints the store enforces on commit.
 *
 * <p>A unique constraint extractor may return {@code null} for rows it does not
 * cover, which makes it a partial unique index (for example "unique while ACTIVE").</p>
 *
 * @param <T> the row type
 */
public final class Table<T> {

    private final String name;
    private final String resource;
    private final Function<T, String> idExtractor;
    private final List<UniqueConstraint<T>> uniqueConstraints;

    private Table(Builder<T> builder) {
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.resource = builder.resource != null ? builder.resource : builder.name;
        this.idExtractor = Objects.requireNonNull(builder.idExtractor, "idExtractor is required");
        this.uniqueConstraints = List.copyOf(builder.uniqueConstraints);
    }

    public String name() {
        return name;
    }

    /**
     * Human readable resource name used in not-found errors.
     */
    public String resource() {
        return resource;
    }

    public String idOf(T row) {
        return idExtractor.apply(row);
    }

    public List<UniqueConstraint<T>> uniqueConstraints() {
        return uniqueConstraints;
    }

    /**
     * Builds a composite unique key. Returns {@code null} when any part is null,
     * so rows with a missing part are not indexed.
     */
    public static Object key(Object... parts) {
        for (Object part : parts) {
            if (part == null) {
                return null;
            }
        }
        return Arrays.asList(parts);
    }

    @Override
    public String toString() {
        return "Table{" + name + '}';
    }

    public static <T> Builder<T> builder(String name, Function<T, String> idExtractor) {
        return new Builder<T>().name(name).idExtractor(idExtractor);
    }

    /**
     * A named unique constraint over a key derived from the row.
     */
    public record UniqueConstraint<T>(String name, Function<T, Object> keyExtractor) {
        public UniqueConstraint {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(keyExtractor, "keyExtractor is required");
        }

        public Object keyOf(T row) {
            return keyExtractor.apply(row);
        }
    }

    public static class Builder<T> {
        private String name;
        private String resource;
        private Function<T, String> idExtractor;
        private final List<UniqueConstraint<T>> uniqueConstraints = new ArrayList<>();

        public Builder<T> name(String name) {
            this.name = name;
            return this;
        }

        public Builder<T> resource(String resource) {
            this.resource = resource;
            return this;
        }

        public Builder<T> idExtractor(Function<T, String> idExtractor) {
            this.idExtractor = idExtractor;
            return this;
        }

        public Builder<T> unique(String constraintName, Function<T, Object> keyExtractor) {
            this.uniqueConstraints.add(new UniqueConstraint<>(constraintName, keyExtractor));
            return this;
        }

        public Table<T> build() {
            return new Table<>(this);
        }
    }
}
