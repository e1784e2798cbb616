/*
 * This file is part of JDAG.
 *
 * JDAG is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JDAG is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JDAG. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jdag;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Tests the operations on randomly generated formulas against their direct evaluation and checks
 * the canonicity of the constructed graphs.
 */
@SuppressWarnings({"checkstyle:javadoc", "NewClassNamingConvention"})
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class DecisionGraphTheoriesTest {
    private static final Logger logger = Logger.getLogger(DecisionGraphTheoriesTest.class.getName());

    private static final int variableCount = 6;
    private static final int formulaDepth = 6;
    private static final int unaryCount = 200;
    private static final int binaryCount = 200;
    private static final int ternaryCount = 100;

    private final NodeStore store = DagFactory.buildStore();
    private final DecisionGraph graph = DagFactory.graphOver(store);
    private final List<Formula> formulas;
    private final List<Node> nodes;

    DecisionGraphTheoriesTest() {
        Random random = new Random(0L);
        List<Formula> formulas = new ArrayList<>(unaryCount);
        List<Node> nodes = new ArrayList<>(unaryCount);
        for (int i = 0; i < unaryCount; i++) {
            Formula formula = Formula.random(random, variableCount, formulaDepth);
            formulas.add(formula);
            nodes.add(formula.toNode(graph));
        }
        this.formulas = ImmutableList.copyOf(formulas);
        this.nodes = ImmutableList.copyOf(nodes);
        logger.log(Level.INFO, "Built {0} formulas into {1} nodes", new Object[] {unaryCount, store.size()});
    }

    private static Iterable<boolean[]> valuations() {
        return () -> new SimplePowerSetIterator(variableCount);
    }

    private static boolean[] flip(boolean[] valuation, int variable) {
        boolean[] flipped = valuation.clone();
        flipped[variable] = !flipped[variable];
        return flipped;
    }

    Stream<Arguments> unary() {
        return Stream.iterate(0, i -> i + 1).limit(unaryCount).map(Arguments::of);
    }

    Stream<Arguments> binary() {
        Random random = new Random(1L);
        return Stream.generate(() -> Arguments.of(random.nextInt(unaryCount), random.nextInt(unaryCount)))
                .limit(binaryCount);
    }

    Stream<Arguments> ternary() {
        Random random = new Random(2L);
        return Stream.generate(() -> Arguments.of(
                        random.nextInt(unaryCount), random.nextInt(unaryCount), random.nextInt(unaryCount)))
                .limit(ternaryCount);
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("unary")
    public void testEvaluation(int index) {
        Formula formula = formulas.get(index);
        Node node = nodes.get(index);
        for (boolean[] valuation : valuations()) {
            assertThat(formula.toString(), graph.evaluate(node, valuation), is(formula.evaluate(valuation)));
        }
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("unary")
    public void testInvert(int index) {
        Node node = nodes.get(index);
        Node inverted = graph.invert(node);
        assertThat(graph.invert(inverted), sameInstance(node));
        for (boolean[] valuation : valuations()) {
            assertThat(graph.evaluate(inverted, valuation), is(!graph.evaluate(node, valuation)));
        }
        assertThat(graph.conjoin(node, inverted), sameInstance(Node.ZERO));
        assertThat(graph.disjoin(node, inverted), sameInstance(Node.ONE));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("unary")
    public void testSupport(int index) {
        Formula formula = formulas.get(index);
        Node node = nodes.get(index);
        BitSet support = graph.support(node);

        BitSet occurring = formula.occurringVariables();
        BitSet outside = (BitSet) support.clone();
        outside.andNot(occurring);
        assertThat(outside.isEmpty(), is(true));

        // In a reduced graph, exactly the variables the function depends on occur
        for (int variable = 0; variable < variableCount; variable++) {
            boolean dependent = false;
            for (boolean[] valuation : valuations()) {
                if (formula.evaluate(valuation) != formula.evaluate(flip(valuation, variable))) {
                    dependent = true;
                    break;
                }
            }
            assertThat(support.get(variable), is(dependent));
        }
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("unary")
    public void testCountSatisfyingAssignments(int index) {
        Node node = nodes.get(index);
        long expected = 0L;
        for (boolean[] valuation : valuations()) {
            if (graph.evaluate(node, valuation)) {
                expected += 1L;
            }
        }
        assertThat(graph.countSatisfyingAssignments(node, variableCount), is(BigInteger.valueOf(expected)));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("binary")
    public void testConjoin(int left, int right) {
        Node node1 = nodes.get(left);
        Node node2 = nodes.get(right);
        Node and = graph.conjoin(node1, node2);

        for (boolean[] valuation : valuations()) {
            assertThat(graph.evaluate(and, valuation),
                    is(graph.evaluate(node1, valuation) && graph.evaluate(node2, valuation)));
        }
        assertThat(graph.conjoin(node2, node1), sameInstance(and));
        assertThat(graph.invert(graph.disjoin(graph.invert(node1), graph.invert(node2))), sameInstance(and));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("binary")
    public void testDisjoin(int left, int right) {
        Node node1 = nodes.get(left);
        Node node2 = nodes.get(right);
        Node or = graph.disjoin(node1, node2);

        for (boolean[] valuation : valuations()) {
            assertThat(graph.evaluate(or, valuation),
                    is(graph.evaluate(node1, valuation) || graph.evaluate(node2, valuation)));
        }
        assertThat(graph.disjoin(node2, node1), sameInstance(or));
        assertThat(graph.invert(graph.conjoin(graph.invert(node1), graph.invert(node2))), sameInstance(or));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("binary")
    public void testCanonicity(int left, int right) {
        Node node1 = nodes.get(left);
        Node node2 = nodes.get(right);
        boolean equivalent = true;
        for (boolean[] valuation : valuations()) {
            if (formulas.get(left).evaluate(valuation) != formulas.get(right).evaluate(valuation)) {
                equivalent = false;
                break;
            }
        }
        assertThat(node1 == node2, is(equivalent));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("ternary")
    public void testFold(int first, int second, int third) {
        Node x = nodes.get(first);
        Node y = nodes.get(second);
        Node z = nodes.get(third);

        assertThat(graph.conjoin(x, y, z), sameInstance(graph.conjoin(graph.conjoin(x, y), z)));
        assertThat(graph.disjoin(x, y, z), sameInstance(graph.disjoin(graph.disjoin(x, y), z)));
        assertThat(graph.conjoin(x, y, z), sameInstance(graph.conjoin(x, graph.conjoin(y, z))));
        assertThat(graph.disjoin(x, y, z), sameInstance(graph.disjoin(z, y, x)));
    }

    @Test
    public void testStoreInvariants() {
        for (Node node : store.nodes()) {
            assertThat(node.negative(), not(sameInstance(node.positive())));
            assertThat(node.depth(), lessThan(node.negative().depth()));
            assertThat(node.depth(), lessThan(node.positive().depth()));
            assertThat(store.contains(node), is(true));
            assertThat(store.emplace(node.depth(), node.negative(), node.positive()), sameInstance(node));
        }
    }

    private static final class SimplePowerSetIterator implements Iterator<boolean[]> {
        private final int length;
        private final boolean[] next;
        private boolean hasNext = true;

        SimplePowerSetIterator(int length) {
            this.length = length;
            this.next = new boolean[length];
        }

        @Override
        public boolean hasNext() {
            return hasNext;
        }

        @Override
        public boolean[] next() {
            if (!hasNext) {
                throw new NoSuchElementException();
            }
            for (int i = 0; i < length; i++) {
                if (next[i]) {
                    next[i] = false;
                } else {
                    next[i] = true;
                    return next;
                }
            }
            hasNext = false;
            return next;
        }
    }
}
