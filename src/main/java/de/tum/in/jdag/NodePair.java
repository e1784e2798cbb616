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

/**
 * An unordered pair of node references, used as key of the join cache. Both equality and hash are
 * based on reference identity and independent of the order of the two nodes.
 */
final class NodePair {
    private final Node first;
    private final Node second;

    NodePair(Node first, Node second) {
        this.first = first;
        this.second = second;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NodePair)) {
            return false;
        }
        NodePair other = (NodePair) o;
        return (first == other.first && second == other.second)
                || (first == other.second && second == other.first);
    }

    @Override
    public int hashCode() {
        return HashUtil.symmetricHash(System.identityHashCode(first), System.identityHashCode(second));
    }

    @Override
    public String toString() {
        return "{" + first + ", " + second + "}";
    }
}
