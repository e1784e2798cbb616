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

import java.math.BigInteger;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collection;

/**
 * The operations on reduced, ordered decision graphs. Every node created by these operations is
 * emplaced through {@link #sink()}, hence two functions built against the same store are
 * equivalent iff their nodes are the same reference.
 *
 * <p>Operands may have been built against other stores. They are only read, never modified.</p>
 */
public interface DecisionGraph {
    /**
     * Returns the sink receiving all nodes created by this graph.
     */
    NodeSink sink();

    /**
     * Returns the node representing {@code variable == sign}.
     *
     * @param variable The index of the variable.
     * @param sign The value for which the literal is true.
     * @return The canonical literal node.
     * @throws IllegalArgumentException if {@code variable} is negative.
     */
    Node literal(int variable, boolean sign);

    /**
     * Determines whether the given {@code node} represents a (positive) variable.
     */
    default boolean isLiteral(Node node) {
        return !node.isTerminal() && node.negative() == Node.ZERO && node.positive() == Node.ONE;
    }

    /**
     * Determines whether the given {@code node} represents a negated variable.
     */
    default boolean isNegatedLiteral(Node node) {
        return !node.isTerminal() && node.negative() == Node.ONE && node.positive() == Node.ZERO;
    }

    /**
     * Constructs the node representing {@code NOT node}.
     */
    Node invert(Node node);

    /**
     * Combines the given operands with the commutative operator described by its {@code identity}
     * and {@code annihilator}. The operands are folded from left to right, all steps share one
     * cache.
     *
     * @param identity The terminal which leaves the other operand unchanged.
     * @param annihilator The terminal which forces the result.
     * @param operands The non-empty operands.
     * @return The combination of all operands.
     * @throws IllegalArgumentException if the identity and annihilator are not the two distinct
     *     terminals or no operand is given.
     */
    Node join(Node identity, Node annihilator, Collection<Node> operands);

    default Node join(Node identity, Node annihilator, Node... operands) {
        return join(identity, annihilator, Arrays.asList(operands));
    }

    /**
     * Constructs the node representing the conjunction of all {@code operands}.
     */
    default Node conjoin(Node... operands) {
        return join(Node.ONE, Node.ZERO, operands);
    }

    default Node conjoin(Collection<Node> operands) {
        return join(Node.ONE, Node.ZERO, operands);
    }

    /**
     * Constructs the node representing the disjunction of all {@code operands}.
     */
    default Node disjoin(Node... operands) {
        return join(Node.ZERO, Node.ONE, operands);
    }

    default Node disjoin(Collection<Node> operands) {
        return join(Node.ZERO, Node.ONE, operands);
    }

    /**
     * Checks whether the given {@code node} evaluates to {@code true} under the given variable
     * {@code assignment}.
     */
    boolean evaluate(Node node, BitSet assignment);

    /**
     * Checks whether the given {@code node} evaluates to {@code true} under the given variable
     * {@code assignment}. The array has to cover every variable of the graph.
     */
    boolean evaluate(Node node, boolean[] assignment);

    /**
     * Computes the <b>support</b> of the function represented by the given {@code node}, i.e. all
     * variables tested by some node reachable from it.
     */
    BitSet support(Node node);

    /**
     * Counts the distinct non-terminal nodes reachable from the given {@code node}.
     */
    int nodeCount(Node node);

    /**
     * Counts the assignments of the variables {@code 0, ..., numberOfVariables - 1} under which
     * the given {@code node} evaluates to {@code true}.
     *
     * @throws IllegalArgumentException if the node tests a variable outside of this range.
     */
    BigInteger countSatisfyingAssignments(Node node, int numberOfVariables);
}
