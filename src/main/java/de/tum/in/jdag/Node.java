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

import static de.tum.in.jdag.Util.checkState;

import javax.annotation.Nullable;

/**
 * A node of a decision graph. The node tests the variable given by its {@link #depth()} and
 * continues with {@link #negative()} if the variable is false and with {@link #positive()}
 * otherwise.
 *
 * <p>Nodes are only created through a {@link NodeSink}, which guarantees that the children of a
 * node are canonical references. Hence, equality only compares the depth and the identity of the
 * children. The two terminals {@link #ZERO} and {@link #ONE} exist independent of any sink and
 * are always compared by identity.</p>
 */
public final class Node {
    /**
     * The depth carried by the terminals. It is larger than any variable, so a terminal is never
     * split while aligning two operands.
     */
    public static final int TERMINAL_DEPTH = Integer.MAX_VALUE;

    /** The constant {@code false} function. */
    public static final Node ZERO = new Node("0");

    /** The constant {@code true} function. */
    public static final Node ONE = new Node("1");

    private final int depth;
    @Nullable
    private final Node negative;
    @Nullable
    private final Node positive;
    private final int hash;
    @Nullable
    private final String terminalName;

    private Node(String terminalName) {
        this.depth = TERMINAL_DEPTH;
        this.negative = null;
        this.positive = null;
        this.hash = System.identityHashCode(this);
        this.terminalName = terminalName;
    }

    Node(int depth, Node negative, Node positive) {
        assert 0 <= depth && depth < TERMINAL_DEPTH;
        assert negative != positive : "Unreduced node at depth " + depth;
        this.depth = depth;
        this.negative = negative;
        this.positive = positive;
        this.hash = HashUtil.hash(depth, negative.hash, positive.hash);
        this.terminalName = null;
    }

    /**
     * Returns the variable tested by this node or {@link #TERMINAL_DEPTH} for a terminal.
     */
    public int depth() {
        return depth;
    }

    /**
     * Returns the sub-graph selected when the tested variable is false.
     *
     * @throws IllegalStateException if this node is a terminal.
     */
    public Node negative() {
        checkState(negative != null, "Terminal %s has no children", this);
        return negative;
    }

    /**
     * Returns the sub-graph selected when the tested variable is true.
     *
     * @throws IllegalStateException if this node is a terminal.
     */
    public Node positive() {
        checkState(positive != null, "Terminal %s has no children", this);
        return positive;
    }

    public boolean isTerminal() {
        return this == ZERO || this == ONE;
    }

    boolean matches(int depth, Node negative, Node positive) {
        return this.depth == depth && this.negative == negative && this.positive == positive;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Node) || isTerminal()) {
            return false;
        }
        Node other = (Node) o;
        return hash == other.hash && matches(other.depth, other.negative, other.positive);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        if (terminalName != null) {
            return terminalName;
        }
        return String.format("%d[%s, %s]", depth, reference(negative), reference(positive));
    }

    private static String reference(Node node) {
        return node.isTerminal() ? node.toString() : "#" + Integer.toHexString(node.hash);
    }
}
