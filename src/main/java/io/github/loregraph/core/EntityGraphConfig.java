package io.github.loregraph.core;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import java.util.List;
import java.util.Optional;

/**
 * Configuration for the entity graph index.
 *
 * All properties are read from application.properties with the prefix
 * "entity-graph".
 */
@ConfigMapping(prefix = "entity-graph")
public interface EntityGraphConfig {

    /**
     * Alias extraction configuration group.
     */
    Alias alias();

    /**
     * Semantic front-matter relation configuration group.
     */
    Semantic semantic();

    /**
     * Retrieval augmentation configuration group.
     */
    Retrieval retrieval();

    /**
     * File-system vault configuration group.
     */
    Vault vault();

    interface Alias {

        /**
         * Front-matter fields whose values are treated as entity aliases.
         */
        @WithDefault("aliases")
        List<String> fields();
    }

    interface Semantic {

        @WithDefault("false")
        boolean enabled();

        /**
         * Front-matter fields holding relation records. The first one is where
         * batch edits are persisted.
         */
        @WithDefault("relations")
        List<String> fields();

        /**
         * Confidence percent assumed for relations that declare none.
         */
        @WithName("min-confidence")
        @WithDefault("70")
        @Min(0)
        @Max(100)
        int minConfidence();

        /**
         * Rows per draft batch.
         */
        @WithName("batch-size")
        @WithDefault("25")
        @Min(1)
        int batchSize();
    }

    interface Retrieval {

        @WithDefault("true")
        boolean enabled();

        @WithName("max-hops")
        @WithDefault("2")
        @Min(1)
        int maxHops();

        @WithName("max-expanded-docs")
        @WithDefault("12")
        @Min(1)
        int maxExpandedDocs();
    }

    interface Vault {

        /**
         * Root directory of the markdown vault.
         */
        @WithDefault("vault")
        String root();

        /**
         * Glob patterns a note path must match to be indexed. Empty means everything.
         */
        Optional<List<String>> include();

        /**
         * Glob patterns that exclude a note path from indexing.
         */
        Optional<List<String>> exclude();

        /**
         * Approximate character size of note chunks.
         */
        @WithName("chunk-size")
        @WithDefault("1200")
        @Min(100)
        int chunkSize();
    }
}
