package com.streamsql.hub;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Classified members of a SELECT projection.
 *
 * @param members the members in projection order
 * @param hubInput true if the projection reads a derived per-second rows stream
 */
public record ProjectionMetadata(List<ProjectionMember> members, boolean hubInput) {

    public ProjectionMetadata {
        members = List.copyOf(Objects.requireNonNull(members, "members must not be null"));
    }

    public Optional<ProjectionMember> member(String alias) {
        return members.stream().filter(m -> m.alias().equalsIgnoreCase(alias)).findFirst();
    }
}
