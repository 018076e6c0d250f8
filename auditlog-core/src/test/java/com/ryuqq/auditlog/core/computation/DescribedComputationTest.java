package com.ryuqq.auditlog.core.computation;

import com.ryuqq.auditlog.core.outcome.Outcome;
import com.ryuqq.auditlog.core.tree.Described;
import com.ryuqq.auditlog.core.tree.LogTree;
import com.ryuqq.auditlog.core.tree.TreeCombiner;
import com.ryuqq.auditlog.core.tree.Undescribed;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DescribedComputation 생성자와 순차 실행 테스트.
 *
 * @author AuditLog Team
 * @since 1.0.0
 */
class DescribedComputationTest {

    @Test
    void leaf_CreatesDescribedLeafWithSuccess() {
        // When
        DescribedComputation<String, Integer> computation = DescribedComputation.leaf(3, "Got a 3");

        // Then
        assertEquals(LogTree.leaf("Got a 3"), computation.tree());
        assertEquals(Outcome.success(3), computation.outcome());
        assertTrue(computation.isSuccess());
    }

    @Test
    void failureLeaf_CreatesFailedDescribedLeaf() {
        // When
        DescribedComputation<String, Integer> computation = DescribedComputation.failureLeaf("bar unavailable", "Get bar");

        // Then
        assertEquals(LogTree.failedLeaf("Get bar"), computation.tree());
        assertEquals(Outcome.failure("bar unavailable"), computation.outcome());
        assertFalse(computation.isSuccess());
    }

    @Test
    void pure_HasNoAuditEntry() {
        // When
        DescribedComputation<String, Integer> computation = DescribedComputation.pure(42);

        // Then
        assertTrue(computation.isUnrecorded());
        assertEquals(new Undescribed(List.of()), computation.tree());
        assertFalse(computation.tree().isEmpty(), "Empty must never be handed out");
        assertEquals(Outcome.success(42), computation.outcome());
    }

    @Test
    void of_EmptyGroup_StoredAsUnrecorded() {
        // When
        DescribedComputation<String, Integer> rebuilt = DescribedComputation.of(LogTree.group(), Outcome.success(1));

        // Then
        assertTrue(rebuilt.isUnrecorded());
        assertEquals(DescribedComputation.pure(1), rebuilt);
    }

    @Test
    void of_NullArguments_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> DescribedComputation.of(null, Outcome.success(1)));
        assertThrows(IllegalArgumentException.class, () -> DescribedComputation.of(LogTree.leaf("a"), null));
    }

    @Test
    void bind_Success_CombinesTreesAndTakesNextOutcome() {
        // Given
        DescribedComputation<String, Integer> foo = DescribedComputation.leaf(3, "Got a 3");

        // When
        DescribedComputation<String, Integer> result = foo.bind(a -> DescribedComputation.leaf(a + 2, "Got a 5"));

        // Then
        assertEquals(LogTree.group(LogTree.leaf("Got a 3"), LogTree.leaf("Got a 5")), result.tree());
        assertEquals(Outcome.success(5), result.outcome());
    }

    @Test
    void bind_Failure_DoesNotInvokeNextAndKeepsTree() {
        // Given
        DescribedComputation<String, Integer> failed = DescribedComputation.failureLeaf("bar unavailable", "Get bar");
        AtomicInteger invocations = new AtomicInteger();

        // When
        DescribedComputation<String, String> result = failed.bind(value -> {
            invocations.incrementAndGet();
            return DescribedComputation.leaf("never", "never");
        });

        // Then
        assertEquals(0, invocations.get());
        assertEquals(failed.tree(), result.tree());
        assertEquals(Outcome.failure("bar unavailable"), result.outcome());
    }

    @Test
    void bind_ChainAfterFailure_InvokesNothingFurther() {
        // Given
        DescribedComputation<String, Integer> a = DescribedComputation.failureLeaf("e", "a");
        AtomicInteger invocations = new AtomicInteger();
        Function<Integer, DescribedComputation<String, Integer>> f = value -> {
            invocations.incrementAndGet();
            return DescribedComputation.leaf(value, "f");
        };
        Function<Integer, DescribedComputation<String, Integer>> g = value -> {
            invocations.incrementAndGet();
            return DescribedComputation.leaf(value, "g");
        };

        // When
        DescribedComputation<String, Integer> result = a.bind(f).bind(g);

        // Then
        assertEquals(0, invocations.get());
        assertEquals(a.tree(), result.tree());
        assertEquals(a, result);
    }

    @Test
    void bind_PureLeftIdentity_EqualsFunctionResult() {
        // Given
        Function<Integer, DescribedComputation<String, Integer>> f = v -> DescribedComputation.leaf(v * 2, "doubled " + v);

        // When & Then
        assertEquals(f.apply(21), DescribedComputation.<String, Integer>pure(21).bind(f));
    }

    @Test
    void bind_PureRightIdentity_ReturnsEquivalentComputation() {
        // Given
        List<DescribedComputation<String, Integer>> samples = List.of(
            DescribedComputation.leaf(1, "one"),
            DescribedComputation.failureLeaf("nope", "two"),
            DescribedComputation.pure(3),
            DescribedComputation.<String, Integer>leaf(4, "four").bind(v -> DescribedComputation.leaf(v + 1, "five"))
        );

        // When & Then
        for (DescribedComputation<String, Integer> a : samples) {
            DescribedComputation<String, Integer> same = a.bind(DescribedComputation::pure);
            assertEquals(a, same);
        }
    }

    @Test
    void bind_NextReturnsNull_ThrowsException() {
        // Given
        DescribedComputation<String, Integer> foo = DescribedComputation.leaf(3, "Got a 3");

        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> foo.bind(v -> null)
        );
        assertTrue(exception.getMessage().contains("next returned null"));
    }

    @Test
    void bind_NextThrows_PropagatesException() {
        // Given
        DescribedComputation<String, Integer> foo = DescribedComputation.leaf(3, "Got a 3");

        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> foo.bind(v -> {
                throw new IllegalStateException("boom");
            })
        );
        assertEquals("boom", exception.getMessage());
    }

    @Test
    void map_TransformsValueWithoutAddingNodes() {
        // Given
        DescribedComputation<String, Integer> foo = DescribedComputation.leaf(3, "Got a 3");

        // When
        DescribedComputation<String, String> mapped = foo.map(v -> "value=" + v);

        // Then
        assertEquals(foo.tree(), mapped.tree());
        assertEquals(Outcome.success("value=3"), mapped.outcome());
    }

    @Test
    void bind_ThreeDescribedSteps_StayFlatSiblings() {
        // When
        DescribedComputation<String, Integer> result = DescribedComputation.<String, Integer>leaf(1, "one")
            .bind(v -> DescribedComputation.leaf(v + 1, "two"))
            .bind(v -> DescribedComputation.leaf(v + 1, "three"));

        // Then
        Undescribed root = assertInstanceOf(Undescribed.class, result.tree());
        assertEquals(3, root.children().size());
        for (LogTree child : root.children()) {
            assertTrue(((Described) child).children().isEmpty());
        }
    }

    @Test
    void equals_SameTreeAndOutcome_ReturnsTrue() {
        // When & Then
        assertEquals(DescribedComputation.leaf(1, "a"), DescribedComputation.leaf(1, "a"));
        assertNotEquals(DescribedComputation.leaf(1, "a"), DescribedComputation.leaf(2, "a"));
        assertEquals(DescribedComputation.leaf(1, "a").hashCode(), DescribedComputation.leaf(1, "a").hashCode());
    }

    @Test
    void recover_PureFallback_KeepsFailedTreeUnchanged() {
        // Given: a failed lookup and a fallback that records nothing
        DescribedComputation<String, Integer> failed = DescribedComputation.failureLeaf("timeout", "Fetch price");
        DescribedComputation<String, Integer> defaultPrice = DescribedComputation.pure(0);

        // When
        DescribedComputation<String, Integer> recovered = failed.recover(reason -> defaultPrice);

        // Then: the failed leaf stays the root; no empty group is added
        assertEquals(LogTree.failedLeaf("Fetch price"), recovered.tree());
        assertEquals(Outcome.success(0), recovered.outcome());

        // Combining the public trees by hand keeps the empty group as a wrapper
        assertEquals(new Undescribed(List.of(LogTree.failedLeaf("Fetch price"))),
                TreeCombiner.combine(failed.tree(), defaultPrice.tree()));
    }

    @Test
    void recover_RecordedFallback_AppendsFallbackTree() {
        // Given
        DescribedComputation<String, Integer> failed = DescribedComputation.failureLeaf("timeout", "Fetch price");

        // When
        DescribedComputation<String, Integer> recovered =
                failed.recover(reason -> DescribedComputation.leaf(99, "Price from cache after " + reason));

        // Then
        assertEquals(LogTree.group(LogTree.failedLeaf("Fetch price"), LogTree.leaf("Price from cache after timeout")),
                recovered.tree());
        assertEquals(Outcome.success(99), recovered.outcome());
    }

    @Test
    void recover_Success_DoesNotInvokeFallback() {
        // Given
        DescribedComputation<String, Integer> loaded = DescribedComputation.leaf(5, "Fetch price");
        AtomicInteger invocations = new AtomicInteger();

        // When
        DescribedComputation<String, Integer> result = loaded.recover(reason -> {
            invocations.incrementAndGet();
            return DescribedComputation.pure(0);
        });

        // Then
        assertSame(loaded, result);
        assertEquals(0, invocations.get());
    }

    @Test
    void recover_FallbackReturnsNull_ThrowsException() {
        DescribedComputation<String, Integer> failed = DescribedComputation.failureLeaf("timeout", "Fetch price");

        assertThrows(IllegalArgumentException.class, () -> failed.recover(reason -> null));
    }
}
