package com.ryuqq.auditlog.core.computation;

import com.ryuqq.auditlog.core.outcome.Outcome;
import com.ryuqq.auditlog.core.tree.Described;
import com.ryuqq.auditlog.core.tree.LogTree;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Sequences 테스트.
 *
 * @author AuditLog Team
 * @since 1.0.0
 */
class SequencesTest {

    @Test
    void traverse_AllSucceed_CollectsValuesUnderOneDescribedNode() {
        // When
        DescribedComputation<String, List<Integer>> result = Sequences.traverse(
            "Measure legs", List.of("AAPL", "MSFT"),
            symbol -> DescribedComputation.leaf(symbol.length(), "Measured " + symbol));

        // Then
        assertThat(result.outcome()).isEqualTo(Outcome.success(List.of(4, 4)));
        assertThat(result.tree()).isEqualTo(new Described("Measure legs", true, List.of(
            LogTree.leaf("Measured AAPL"), LogTree.leaf("Measured MSFT"))));
    }

    @Test
    void traverse_StopsAtFirstFailure() {
        // Given
        List<String> visited = new ArrayList<>();

        // When
        DescribedComputation<String, List<Integer>> result = Sequences.traverse(
            "Price legs", List.of("a", "bad", "c"),
            item -> {
                visited.add(item);
                return item.equals("bad")
                    ? DescribedComputation.<String, Integer>failureLeaf("no quote for " + item, "Priced " + item)
                    : DescribedComputation.<String, Integer>leaf(1, "Priced " + item);
            });

        // Then
        assertThat(visited).containsExactly("a", "bad");
        assertThat(result.outcome()).isEqualTo(Outcome.failure("no quote for bad"));
        assertThat(result.tree().descriptions()).containsExactly("Price legs", "Priced a", "Priced bad");
        assertThat(result.tree().isSuccess()).isFalse();
    }

    @Test
    void traverse_EmptyItems_ProducesDescribedLeaf() {
        // When
        DescribedComputation<String, List<Integer>> result = Sequences.traverse(
            "Nothing to do", List.<String>of(), item -> DescribedComputation.leaf(1, item));

        // Then
        assertThat(result.tree()).isEqualTo(LogTree.leaf("Nothing to do"));
        assertThat(result.outcome()).isEqualTo(Outcome.success(List.of()));
    }

    @Test
    void traverse_UnrecordedSteps_AddNoChildren() {
        // When
        DescribedComputation<String, List<Integer>> result = Sequences.traverse(
            "Parse", List.of("1", "2"), item -> DescribedComputation.pure(Integer.parseInt(item)));

        // Then
        assertThat(result.tree().children()).isEmpty();
        assertThat(result.outcome()).isEqualTo(Outcome.success(List.of(1, 2)));
    }

    @Test
    void traverse_NullValues_AreKept() {
        // When
        DescribedComputation<String, List<Void>> result = Sequences.traverse(
            "Side effects", List.of("x", "y"), item -> DescribedComputation.<String, Void>leaf(null, "ran " + item));

        // Then
        assertThat(result.outcome().toOptional()).hasValueSatisfying(values -> assertThat(values).hasSize(2));
    }

    @Test
    void sequence_KeepsEveryTreeAndReportsFirstFailure() {
        // Given
        List<DescribedComputation<String, Integer>> evaluated = List.of(
            DescribedComputation.leaf(1, "one"),
            DescribedComputation.failureLeaf("second failed", "two"),
            DescribedComputation.failureLeaf("third failed", "three"),
            DescribedComputation.leaf(4, "four")
        );

        // When
        DescribedComputation<String, List<Integer>> result = Sequences.sequence("All legs", evaluated);

        // Then
        assertThat(result.outcome()).isEqualTo(Outcome.failure("second failed"));
        assertThat(result.tree().descriptions()).containsExactly("All legs", "one", "two", "three", "four");
        assertThat(result.tree().isSuccess()).isFalse();
    }

    @Test
    void sequence_AllSucceed_ReturnsValuesInOrder() {
        // When
        DescribedComputation<String, List<Integer>> result = Sequences.sequence("All legs", List.of(
            DescribedComputation.leaf(1, "one"), DescribedComputation.leaf(2, "two")));

        // Then
        assertThat(result.outcome()).isEqualTo(Outcome.success(List.of(1, 2)));
        assertThat(result.tree().isSuccess()).isTrue();
    }

    @Test
    void sequence_NullElement_ThrowsException() {
        // When & Then
        assertThatThrownBy(() -> Sequences.sequence("x", Arrays.asList(DescribedComputation.<String, Integer>leaf(1, "a"), null)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cannot contain null");
    }

    @Test
    void traverse_StepReturnsNull_ThrowsException() {
        // When & Then
        assertThatThrownBy(() -> Sequences.<String, String, Integer>traverse("x", List.of("a"), item -> null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("step returned null");
    }
}
