package dev.twig.model;

import dev.twig.util.CommitFormatter;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A named change touching a list of files. Commits never change once built; branches share them by reference and
 * {@code join} re-creates them rather than moving them.
 *
 * <p>Equality is by value. Branches locate history entries by reference, so two equal commits built from the same
 * data in the same instant are still distinct entries of a branch.
 *
 * @param name identifying name, not required to be unique
 * @param description free text
 * @param createdAt creation time, captured once
 * @param files touched paths in insertion order, duplicates allowed
 */
public record Commit(String name, String description, Instant createdAt, List<String> files) {

    public Commit {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(createdAt, "createdAt");
        files = List.copyOf(files);
    }

    public static Commit create(String name, String description, List<String> files) {
        return create(name, description, files, Clock.systemDefaultZone());
    }

    public static Commit create(String name, String description, List<String> files, Clock clock) {
        return new Commit(name, description, clock.instant(), files);
    }

    /**
     * Renders with the JVM-wide {@link dev.twig.util.TwigSettings#load() settings}. A branch built with its own
     * settings renders its listing through {@link CommitFormatter#formatBranch} with those instead.
     */
    @Override
    public String toString() {
        return CommitFormatter.defaultFormatter().format(this);
    }
}
