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
 * The single point through which decision nodes are created. Implementations intern nodes, i.e.
 * structurally equal nodes are represented by exactly one instance, and apply the reduction rule.
 */
public interface NodeSink {
    /**
     * Returns the canonical node testing the variable {@code depth} with the given children. If
     * both children are the same reference, no node is created and that child is returned.
     *
     * @param depth The variable tested by the node.
     * @param negative The node selected if the variable is false.
     * @param positive The node selected if the variable is true.
     * @return The canonical node or the shared child.
     */
    Node emplace(int depth, Node negative, Node positive);
}
