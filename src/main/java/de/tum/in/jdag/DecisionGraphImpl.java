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

import static de.tum.in.jdag.Util.checkArgument;
import static de.tum.in.jdag.Util.checkDepth;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The recursive implementation of the decision graph operations. Recursion depth is bounded by
 * the number of variables.
 */
final class DecisionGraphImpl implements DecisionGraph {
    private final NodeSink sink;

    DecisionGraphImpl(NodeSink sink) {
        this.sink = Objects.requireNonNull(sink);
    }

    @Override
    public NodeSink sink() {
        return sink;
    }

    @Override
    public Node literal(int variable, boolean sign) {
        checkDepth(variable);
        return sink.emplace(variable, sign ? Node.ZERO : Node.ONE, sign ? Node.ONE : Node.ZERO);
    }

    @Override
    public Node invert(Node node) {
        Objects.requireNonNull(node);
        return invertRecursive(new IdentityHashMap<>(), node);
    }

    private Node invertRecursive(Map<Node, Node> cache, Node node) {
        if (node == Node.ZERO) {
            return Node.ONE;
        }
        if (node == Node.ONE) {
            return Node.ZERO;
        }

        Node cached = cache.get(node);
        if (cached != null) {
            return cached;
        }
        Node negative = invertRecursive(cache, node.negative());
        Node positive = invertRecursive(cache, node.positive());
        Node result = sink.emplace(node.depth(), negative, positive);
        cache.put(node, result);
        return result;
    }

    @Override
    public Node join(Node identity, Node annihilator, Collection<Node> operands) {
        checkArgument(identity.isTerminal() && annihilator.isTerminal() && identity != annihilator,
                "Identity %s and annihilator %s must be distinct terminals", identity, annihilator);
        checkArgument(!operands.isEmpty(), "No operands given");

        // One cache for the whole fold
        Map<NodePair, Node> cache = new HashMap<>();
        Iterator<Node> iterator = operands.iterator();
        Node result = Objects.requireNonNull(iterator.next());
        while (iterator.hasNext()) {
            result = joinRecursive(cache, identity, annihilator, result, Objects.requireNonNull(iterator.next()));
        }
        return result;
    }

    private Node joinRecursive(Map<NodePair, Node> cache, Node identity, Node annihilator, Node node1, Node node2) {
        if (node1 == identity) {
            return node2;
        }
        if (node2 == identity) {
            return node1;
        }
        if (node1 == annihilator || node2 == annihilator) {
            return annihilator;
        }

        NodePair key = new NodePair(node1, node2);
        Node cached = cache.get(key);
        if (cached != null) {
            return cached;
        }

        int node1depth = node1.depth();
        int node2depth = node2.depth();

        // Only the operands testing the topmost variable are split, the other one is kept on both branches
        Node node1negative;
        Node node1positive;
        if (node1depth > node2depth) {
            node1negative = node1;
            node1positive = node1;
        } else {
            node1negative = node1.negative();
            node1positive = node1.positive();
        }
        Node node2negative;
        Node node2positive;
        if (node2depth > node1depth) {
            node2negative = node2;
            node2positive = node2;
        } else {
            node2negative = node2.negative();
            node2positive = node2.positive();
        }

        Node negative = joinRecursive(cache, identity, annihilator, node1negative, node2negative);
        Node positive = joinRecursive(cache, identity, annihilator, node1positive, node2positive);
        Node result = sink.emplace(Math.min(node1depth, node2depth), negative, positive);
        cache.put(key, result);
        return result;
    }

    @Override
    public boolean evaluate(Node node, BitSet assignment) {
        Node current = node;
        while (!current.isTerminal()) {
            current = assignment.get(current.depth()) ? current.positive() : current.negative();
        }
        return current == Node.ONE;
    }

    @Override
    public boolean evaluate(Node node, boolean[] assignment) {
        Node current = node;
        while (!current.isTerminal()) {
            current = assignment[current.depth()] ? current.positive() : current.negative();
        }
        return current == Node.ONE;
    }

    @Override
    public BitSet support(Node node) {
        BitSet support = new BitSet();
        forEachNodeOnce(node, current -> support.set(current.depth()));
        return support;
    }

    @Override
    public int nodeCount(Node node) {
        int[] count = {0};
        forEachNodeOnce(node, current -> count[0]++);
        return count[0];
    }

    private static void forEachNodeOnce(Node node, NodeVisitor visitor) {
        Set<Node> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(node);
        while (!stack.isEmpty()) {
            Node current = stack.pop();
            if (current.isTerminal() || !seen.add(current)) {
                continue;
            }
            visitor.visit(current);
            stack.push(current.positive());
            stack.push(current.negative());
        }
    }

    @Override
    public BigInteger countSatisfyingAssignments(Node node, int numberOfVariables) {
        checkArgument(numberOfVariables >= 0, "Negative number of variables %d", numberOfVariables);
        BigInteger count = countRecursive(new IdentityHashMap<>(), node, numberOfVariables);
        return count.shiftLeft(level(node, numberOfVariables));
    }

    /* Counts the assignments of the variables from the depth of the node up to numberOfVariables. */
    private static BigInteger countRecursive(Map<Node, BigInteger> cache, Node node, int numberOfVariables) {
        if (node == Node.ZERO) {
            return BigInteger.ZERO;
        }
        if (node == Node.ONE) {
            return BigInteger.ONE;
        }
        BigInteger cached = cache.get(node);
        if (cached != null) {
            return cached;
        }

        int depth = node.depth();
        checkArgument(depth < numberOfVariables, "Node %s tests variable %d out of range", node, depth);
        Node negative = node.negative();
        Node positive = node.positive();
        int negativeLevel = level(negative, numberOfVariables);
        int positiveLevel = level(positive, numberOfVariables);
        checkArgument(depth < negativeLevel && depth < positiveLevel, "Node %s is not ordered", node);

        BigInteger negativeCount =
                countRecursive(cache, negative, numberOfVariables).shiftLeft(negativeLevel - depth - 1);
        BigInteger positiveCount =
                countRecursive(cache, positive, numberOfVariables).shiftLeft(positiveLevel - depth - 1);
        BigInteger result = negativeCount.add(positiveCount);
        cache.put(node, result);
        return result;
    }

    private static int level(Node node, int numberOfVariables) {
        return node.isTerminal() ? numberOfVariables : node.depth();
    }

    @FunctionalInterface
    private interface NodeVisitor {
        void visit(Node node);
    }

    @Override
    public String toString() {
        return "DecisionGraph[" + sink + "]";
    }
}
