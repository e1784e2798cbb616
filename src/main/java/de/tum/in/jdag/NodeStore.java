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

import static de.tum.in.jdag.Util.checkDepth;

import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A canonical node store, holding the nodes of one diagram-building session. Nodes are kept in a
 * slot array and found through hash chains: {@code hashToChainStart} maps a bucket to the first
 * slot of its chain and {@code hashChain} maps a slot to the next slot of the same chain.
 *
 * <p>Interning is local to a store. A node equal to one held by another store is a distinct
 * instance here. Stores are not thread-safe.</p>
 */
public final class NodeStore implements NodeSink {
    private static final Logger logger = Logger.getLogger(NodeStore.class.getName());

    @SuppressWarnings("StaticCollection")
    private static final Collection<WeakReference<NodeStore>> storeShutdownHook = new ConcurrentLinkedDeque<>();

    // Use 0 as "not a node" so that freshly allocated chain arrays are empty
    private static final int NOT_A_NODE = 0;
    private static final int FIRST_NODE = 1;

    private static final int MINIMUM_TABLE_SIZE = MathUtil.nextPrime(32);
    private static final int MAXIMAL_TABLE_SIZE = Integer.MAX_VALUE / 2 - 8;

    private final double growthFactor;

    /* Slot i holds the i-th created node, slot 0 is unused. */
    private Node[] nodes;
    private int[] hashToChainStart;
    private int[] hashChain;
    /* Index of the next free slot. */
    private int nextFreeNode;

    // Statistics
    private long emplaceCount = 0;
    private long reductionCount = 0;
    private long hashChainLookups = 0;
    private long hashChainLookupLength = 0;
    private long hashChainLookupHit = 0;
    private long growCount = 0;

    public NodeStore() {
        this(DagConfiguration.DEFAULT_INITIAL_SIZE, DagConfiguration.DEFAULT_GROWTH_FACTOR);
    }

    NodeStore(int initialSize, double growthFactor) {
        assert growthFactor > 1.0d;
        this.growthFactor = growthFactor;
        int tableSize = Math.max(MathUtil.nextPrime(initialSize), MINIMUM_TABLE_SIZE);

        nodes = new Node[tableSize];
        hashToChainStart = new int[tableSize];
        hashChain = new int[tableSize];
        nextFreeNode = FIRST_NODE;
    }

    static void logStatisticsOnShutdown(NodeStore store) {
        logger.log(Level.FINER, "Adding {0} to shutdown hook", store);
        ShutdownHookLazyHolder.init();
        // Stores are only held weakly, discarded sessions are not reported
        storeShutdownHook.removeIf(reference -> reference.get() == null);
        storeShutdownHook.add(new WeakReference<>(store));
    }

    static Collection<WeakReference<NodeStore>> storesLoggedOnShutdown() {
        return Collections.unmodifiableCollection(storeShutdownHook);
    }

    @Override
    public Node emplace(int depth, Node negative, Node positive) {
        Objects.requireNonNull(negative);
        Objects.requireNonNull(positive);
        checkDepth(depth);
        emplaceCount += 1;

        if (negative == positive) {
            reductionCount += 1;
            return negative;
        }

        int hashCode = HashUtil.hash(depth, negative.hashCode(), positive.hashCode());
        Node[] nodes = this.nodes;
        int[] hashChain = this.hashChain;

        int chainLookups = 1;
        this.hashChainLookups += 1;
        int currentLookupNode = hashToChainStart[hashToTable(hashCode)];
        while (currentLookupNode != NOT_A_NODE) {
            Node candidate = nodes[currentLookupNode];
            if (candidate.hashCode() == hashCode && candidate.matches(depth, negative, positive)) {
                this.hashChainLookupLength += chainLookups;
                this.hashChainLookupHit += 1;
                return candidate;
            }
            currentLookupNode = hashChain[currentLookupNode];
            chainLookups += 1;
        }
        this.hashChainLookupLength += chainLookups;

        if (nextFreeNode == this.nodes.length) {
            ensureCapacity();
        }

        Node node = new Node(depth, negative, positive);
        assert node.hashCode() == hashCode;
        int freeNode = nextFreeNode++;
        this.nodes[freeNode] = node;
        connectHashList(freeNode, hashCode);
        return node;
    }

    /**
     * Determines whether the given {@code node} is the canonical instance held by this store.
     * Terminals and equal nodes interned by other stores are not contained.
     */
    public boolean contains(Node node) {
        if (node.isTerminal()) {
            return false;
        }
        int currentLookupNode = hashToChainStart[hashToTable(node.hashCode())];
        while (currentLookupNode != NOT_A_NODE) {
            if (nodes[currentLookupNode] == node) {
                return true;
            }
            currentLookupNode = hashChain[currentLookupNode];
        }
        return false;
    }

    /**
     * Returns the number of nodes held by this store.
     */
    public int size() {
        return nextFreeNode - FIRST_NODE;
    }

    public int tableSize() {
        return nodes.length;
    }

    /**
     * Returns a snapshot of the held nodes in order of creation. As children are always created
     * before their parents, every node of the list appears after its children held by this store.
     */
    public List<Node> nodes() {
        return new ArrayList<>(Arrays.asList(nodes).subList(FIRST_NODE, nextFreeNode));
    }

    private void ensureCapacity() {
        Util.checkState(nodes.length < MAXIMAL_TABLE_SIZE, "Node store %s is full", this);

        growCount += 1;
        int oldSize = nodes.length;
        @SuppressWarnings("NumericCastThatLosesPrecision")
        int newSize = Math.min(MAXIMAL_TABLE_SIZE, MathUtil.nextPrime((int) Math.ceil(oldSize * growthFactor)));
        assert oldSize < newSize : "Got new size " + newSize + " with old size " + oldSize;

        logger.log(Level.FINE, "Growing the table of {0} from {1} to {2}", new Object[] {this, oldSize, newSize});

        nodes = Arrays.copyOf(this.nodes, newSize); // NOPMD
        // The bucket of every node changes, re-build both chain arrays
        hashToChainStart = new int[newSize];
        hashChain = new int[newSize];
        for (int node = FIRST_NODE; node < nextFreeNode; node++) {
            connectHashList(node, nodes[node].hashCode());
        }
    }

    private void connectHashList(int node, int hashCode) {
        int position = hashToTable(hashCode);
        hashChain[node] = hashToChainStart[position];
        hashToChainStart[position] = node;
    }

    private int hashToTable(int hashCode) {
        int mod = hashCode % hashToChainStart.length;
        return mod < 0 ? mod + hashToChainStart.length : mod;
    }

    /**
     * Returns a string containing some statistics about this store. The content and formatting of
     * this string may change and is only intended as human-readable output.
     */
    public String statistics() {
        int longestChain = 0;
        int usedBuckets = 0;
        for (int chainStart : hashToChainStart) {
            int length = 0;
            for (int current = chainStart; current != NOT_A_NODE; current = hashChain[current]) {
                length += 1;
            }
            if (length > 0) {
                usedBuckets += 1;
            }
            longestChain = Math.max(longestChain, length);
        }
        float averageLookupLength = (float) hashChainLookupLength / (float) Math.max(hashChainLookups, 1L);
        return String.format(
                "Node store: size=%d, table size=%d, grow count=%d%n"
                        + "    emplace: calls=%d, reduced=%d, lookups=%d, hits=%d, average chain=%3.3f%n"
                        + "    chains: used buckets=%d, longest=%d",
                size(),
                tableSize(),
                growCount,
                emplaceCount,
                reductionCount,
                hashChainLookups,
                hashChainLookupHit,
                averageLookupLength,
                usedBuckets,
                longestChain);
    }

    @Override
    public String toString() {
        return String.format("NodeStore@%s(%d)", Integer.toHexString(System.identityHashCode(this)), size());
    }

    private static final class ShutdownHookLazyHolder {
        private static final Runnable shutdownHook = new ShutdownHookPrinter();

        static {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdownHook));
        }

        static void init() {
            // bogus method to force static initialization
        }
    }

    private static final class ShutdownHookPrinter implements Runnable {
        @Override
        public void run() {
            if (!logger.isLoggable(Level.INFO)) {
                return;
            }
            for (WeakReference<NodeStore> reference : storeShutdownHook) {
                NodeStore store = reference.get();
                if (store != null) {
                    logger.info(store.statistics());
                }
            }
        }
    }
}
