package io.cronkeeper.core.job;

import io.cronkeeper.core.error.ValidationException;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

public sealed interface SourceSelector permits SourceSelector.All, SourceSelector.ByIds {
    String ALL_TOKEN = "all";

    String encode();

    static SourceSelector all() {
        return All.INSTANCE;
    }

    static SourceSelector byIds(Collection<Long> ids) {
        return new ByIds(ids == null ? Set.of() : new LinkedHashSet<>(ids));
    }

    static SourceSelector none() {
        return new ByIds(Set.of());
    }

    static SourceSelector decode(String raw) {
        if (raw == null || raw.isBlank()) {
            return none();
        }
        if (ALL_TOKEN.equalsIgnoreCase(raw.trim())) {
            return all();
        }
        Set<Long> ids = new LinkedHashSet<>();
        for (String part : raw.split(",")) {
            String token = part.trim();
            if (token.isEmpty()) {
                continue;
            }
            try {
                ids.add(Long.parseLong(token));
            } catch (NumberFormatException e) {
                throw new ValidationException("invalid source id: " + token, e);
            }
        }
        return new ByIds(ids);
    }

    record All() implements SourceSelector {
        static final All INSTANCE = new All();

        @Override
        public String encode() {
            return ALL_TOKEN;
        }
    }

    record ByIds(Set<Long> ids) implements SourceSelector {
        public ByIds {
            ids = ids == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(ids));
        }

        @Override
        public String encode() {
            return ids.stream().map(String::valueOf).collect(Collectors.joining(","));
        }
    }
}
