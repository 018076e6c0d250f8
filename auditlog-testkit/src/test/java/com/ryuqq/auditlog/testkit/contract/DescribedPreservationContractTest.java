package com.ryuqq.auditlog.testkit.contract;

import com.ryuqq.auditlog.core.computation.DescribedComputation;
import com.ryuqq.auditlog.core.label.Labels;
import com.ryuqq.auditlog.core.tree.Described;
import com.ryuqq.auditlog.core.tree.LogTree;
import com.ryuqq.auditlog.core.tree.TreeCombiner;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: Described Nodes Are Never Merged.
 *
 * <p>This test validates that combining and labeling keep every Described node intact,
 * with its description, success flag and children, in evaluation order.</p>
 *
 * @author AuditLog Team
 * @since 1.0.0
 */
class DescribedPreservationContractTest extends AbstractLogTreeLawTest {

    @Test
    void testCombine_PreservesDescribedNodes() {
        for (int i = 0; i < SAMPLE_COUNT; i++) {
            // Given
            LogTree a = randomTree();
            LogTree b = randomTree();

            // When
            LogTree combined = TreeCombiner.combine(a, b);

            // Then
            assertDescribedPreserved(combined, List.of(a, b));
        }
    }

    @Test
    void testCombine_PreservesDescriptionOrder() {
        for (int i = 0; i < SAMPLE_COUNT; i++) {
            // Given
            LogTree a = randomTree();
            LogTree b = randomTree();
            List<String> expected = new ArrayList<>(a.descriptions());
            expected.addAll(b.descriptions());

            // When & Then
            assertEquals(expected, a.append(b).descriptions());
        }
    }

    @Test
    void testBind_PreservesStepTrees() {
        for (int i = 0; i < SAMPLE_COUNT; i++) {
            // Given
            DescribedComputation<String, Integer> first = randomComputation();
            DescribedComputation<String, Integer> second = randomComputation();

            // When
            DescribedComputation<String, Integer> bound = first.bind(ignored -> second);

            // Then: a failed first computation keeps its own tree only
            List<LogTree> parts = first.isSuccess()
                    ? List.of(first.tree(), second.tree())
                    : List.of(first.tree());
            assertDescribedPreserved(bound.tree(), parts);
        }
    }

    @Test
    void testLabelBlock_WrapsTreeAsSingleChild() {
        for (int i = 0; i < SAMPLE_COUNT; i++) {
            // Given
            DescribedComputation<String, Integer> computation = randomComputation();

            // When
            DescribedComputation<String, Integer> labeled = Labels.labelBlock(computation, "block");

            // Then
            Described root = assertInstanceOf(Described.class, labeled.tree());
            assertEquals("block", root.description());
            assertEquals(computation.isSuccess(), root.success());
            assertEquals(computation.outcome(), labeled.outcome());
            if (computation.isUnrecorded()) {
                assertTrue(root.children().isEmpty());
            } else {
                assertEquals(List.of(computation.tree()), root.children());
            }
        }
    }
}
