package io.cronkeeper.core.transfer;

import java.util.Optional;

/**
 * Maps the local numeric id of a backup source (an app, website or database) to a name that
 * survives moving to another instance, and back.
 */
public interface SourceResolver {
    Optional<SourceRef> describe(long id);

    Optional<Long> resolve(SourceRef ref);
}
