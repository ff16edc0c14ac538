package io.github.loregraph.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SemanticPredicateTest {

    @Test
    @DisplayName("parse should accept canonical ids, camelCase keys and spaced phrases")
    void testParseCanonicalForms() {
        assertEquals(Optional.of(SemanticPredicate.ALLIED_WITH), SemanticPredicate.parse("allied_with"));
        assertEquals(Optional.of(SemanticPredicate.ALLIED_WITH), SemanticPredicate.parse("alliedWith"));
        assertEquals(Optional.of(SemanticPredicate.LOCATED_IN), SemanticPredicate.parse("  Located In "));
        assertEquals(Optional.of(SemanticPredicate.PARTICIPATED_IN), SemanticPredicate.parse("participated-in"));
    }

    @Test
    @DisplayName("parse should map synonyms onto canonical predicates")
    void testParseAliases() {
        assertEquals(Optional.of(SemanticPredicate.ALLIED_WITH), SemanticPredicate.parse("ally"));
        assertEquals(Optional.of(SemanticPredicate.RIVAL_OF), SemanticPredicate.parse("Enemy of"));
        assertEquals(Optional.of(SemanticPredicate.RIVAL_OF), SemanticPredicate.parse("enemy_of"));
        assertEquals(Optional.of(SemanticPredicate.MEMBER_OF), SemanticPredicate.parse("serves"));
        assertEquals(Optional.of(SemanticPredicate.LOCATED_IN), SemanticPredicate.parse("storedin"));
    }

    @Test
    @DisplayName("parse should reject unknown, blank and null values")
    void testParseRejects() {
        assertTrue(SemanticPredicate.parse("friend_of").isEmpty());
        assertTrue(SemanticPredicate.parse("   ").isEmpty());
        assertTrue(SemanticPredicate.parse("__").isEmpty());
        assertTrue(SemanticPredicate.parse(null).isEmpty());
    }

    @Test
    @DisplayName("fromId should only accept exact canonical ids")
    void testFromId() {
        assertEquals(Optional.of(SemanticPredicate.VASSAL_OF), SemanticPredicate.fromId("vassal_of"));
        assertTrue(SemanticPredicate.fromId("vassalOf").isEmpty());
        assertTrue(SemanticPredicate.fromId("ally").isEmpty());
        assertTrue(SemanticPredicate.fromId(null).isEmpty());
    }

    @Test
    @DisplayName("every predicate should have a convenience key that parses back to it")
    void testFrontmatterKeysRoundTrip() {
        for (SemanticPredicate predicate : SemanticPredicate.values()) {
            assertEquals(Optional.of(predicate), SemanticPredicate.parse(predicate.frontmatterKey()),
                predicate.frontmatterKey());
        }
        assertEquals(25, SemanticPredicate.values().length);
    }
}
