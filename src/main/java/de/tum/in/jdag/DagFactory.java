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

public final class DagFactory {
    private DagFactory() {}

    public static NodeStore buildStore() {
        return buildStore(ImmutableDagConfiguration.builder().build());
    }

    public static NodeStore buildStore(DagConfiguration configuration) {
        NodeStore store = new NodeStore(configuration.initialSize(), configuration.growthFactor());
        if (configuration.logStatisticsOnShutdown()) {
            NodeStore.logStatisticsOnShutdown(store);
        }
        return store;
    }

    /**
     * Returns the sink through which nodes should be emplaced into the given {@code store}, which
     * is the store itself or a checked view of it.
     */
    public static NodeSink sinkOf(NodeStore store, DagConfiguration configuration) {
        return configuration.threadSafetyCheck() ? new CheckedNodeSink(store) : store;
    }

    public static DecisionGraph buildGraph() {
        return buildGraph(ImmutableDagConfiguration.builder().build());
    }

    /**
     * Creates a graph over a fresh store built from the given {@code configuration}.
     */
    public static DecisionGraph buildGraph(DagConfiguration configuration) {
        return graphOver(sinkOf(buildStore(configuration), configuration));
    }

    /**
     * Creates a graph emplacing all nodes into the given {@code sink}.
     */
    public static DecisionGraph graphOver(NodeSink sink) {
        return new DecisionGraphImpl(sink);
    }

    /**
     * Creates a graph emplacing all nodes into whichever sink is bound to the {@link
     * GlobalNodeSink} at the time of the call.
     */
    public static DecisionGraph globalGraph() {
        return new DecisionGraphImpl(GlobalNodeSink.instance());
    }
}
