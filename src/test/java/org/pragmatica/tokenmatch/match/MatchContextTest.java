package org.pragmatica.tokenmatch.match;

import org.junit.jupiter.api.Test;
import org.pragmatica.tokenmatch.error.RecursionLimitException;
import org.pragmatica.tokenmatch.grammar.Grammar;
import org.pragmatica.tokenmatch.grammar.Keyword;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.tokenmatch.grammar.Grammars.grammar;
import static org.pragmatica.tokenmatch.grammar.Grammars.keyword;
import static org.pragmatica.tokenmatch.grammar.Grammars.rule;

/**
 * Tests for MatchContext scoping, depth tracking and rule resolution.
 */
class MatchContextTest {

    // === Depth Tests ===

    @Test
    void root_startsAtDepthZero() {
        var ctx = MatchContext.root();

        assertEquals(0, ctx.depth());
        assertThat(ctx.crumbs()).isEmpty();
    }

    @Test
    void deeper_incrementsDepthAndLeavesParentUntouched() {
        var ctx = MatchContext.root();

        try (var child = ctx.deeper()) {
            try (var grandChild = child.deeper()) {
                assertEquals(2, grandChild.depth());
            }
            assertEquals(1, child.depth());
        }
        assertEquals(0, ctx.depth());
    }

    @Test
    void deeper_beyondMaxDepth_throws() {
        var ctx = MatchContext.root(Grammar.empty(), MatcherConfig.DEFAULT.withMaxDepth(2));

        var child = ctx.deeper();
        var grandChild = child.deeper();

        var error = assertThrows(RecursionLimitException.class, grandChild::deeper);
        assertEquals(2, error.maxDepth());
    }

    // === Release Tests ===

    @Test
    void close_releasesChildOnly() {
        var ctx = MatchContext.root();
        var child = ctx.deeper();

        child.close();

        assertTrue(child.isReleased());
        assertFalse(ctx.isReleased());
    }

    @Test
    void deeper_onReleasedContext_throws() {
        var child = MatchContext.root().deeper();
        child.close();

        assertThrows(IllegalStateException.class, child::deeper);
    }

    @Test
    void tryWithResources_releasesOnException() {
        var ctx = MatchContext.root();
        var holder = new MatchContext[1];

        assertThrows(IllegalArgumentException.class, () -> {
            try (var child = ctx.deeper()) {
                holder[0] = child;
                throw new IllegalArgumentException("boom");
            }
        });
        assertTrue(holder[0].isReleased());
    }

    // === Trail Tests ===

    @Test
    void deeperWithCrumb_extendsTrail() {
        var ctx = MatchContext.root();

        try (var select = ctx.deeper("select");
             var column = select.deeper("column");
             var anonymous = column.deeper()) {
            assertThat(anonymous.crumbs()).containsExactly("select", "column");
            assertTrue(anonymous.onTrail("select"));
            assertFalse(anonymous.onTrail("insert"));
        }
        assertFalse(ctx.onTrail("select"));
    }

    // === Resolution Tests ===

    @Test
    void resolve_findsDefinedRule() {
        var ctx = MatchContext.root(grammar(rule("kw", keyword("a"))), MatcherConfig.DEFAULT);

        assertThat(ctx.resolve("kw")).containsInstanceOf(Keyword.class);
        assertThat(ctx.resolve("missing")).isEmpty();
    }
}
