package io.github.loregraph.semantic;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Sources included when building draft batches.
 *
 * @param includeVaultDrafts whether relations already in note front matter are included
 * @param adapters           proposal sources to pull rows from
 */
public record DraftBatchOptions(boolean includeVaultDrafts, @NotNull List<ProposalSourceAdapter> adapters) {

    public DraftBatchOptions {
        adapters = List.copyOf(adapters);
    }

    @NotNull
    public static DraftBatchOptions vaultOnly() {
        return new DraftBatchOptions(true, List.of());
    }
}
