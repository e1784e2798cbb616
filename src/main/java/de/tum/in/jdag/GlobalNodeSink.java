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

import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * The process-wide binding of the sink into which nodes are emplaced. Rebinding is a flat swap:
 * {@link #bind(NodeSink)} returns the previously bound sink and callers are responsible for
 * restoring it, for example through {@link #open(NodeSink)}.
 *
 * <p>The binding is a plain static field without any synchronization. All construction against
 * this sink must happen on one thread.</p>
 */
public final class GlobalNodeSink implements NodeSink {
    private static final Logger logger = Logger.getLogger(GlobalNodeSink.class.getName());
    private static final GlobalNodeSink INSTANCE = new GlobalNodeSink();

    @Nullable
    private static NodeSink boundSink = null;

    private GlobalNodeSink() {}

    public static GlobalNodeSink instance() {
        return INSTANCE;
    }

    /**
     * Binds the given {@code sink} (or nothing) as target of all subsequent emplace calls.
     *
     * @return The sink which was bound before.
     */
    @Nullable
    public static NodeSink bind(@Nullable NodeSink sink) {
        NodeSink previous = boundSink;
        boundSink = sink;
        logger.log(Level.FINER, "Bound {0}, unbound {1}", new Object[] {sink, previous});
        return previous;
    }

    @Nullable
    public static NodeSink current() {
        return boundSink;
    }

    /**
     * Binds the given {@code sink} until the returned guard is closed, which restores the sink
     * bound before this call.
     */
    public static Binding open(NodeSink sink) {
        return new Binding(sink, bind(sink));
    }

    /**
     * Emplaces into the currently bound sink.
     *
     * @throws IllegalStateException if no sink is bound.
     */
    @Override
    public Node emplace(int depth, Node negative, Node positive) {
        NodeSink sink = boundSink;
        checkState(sink != null, "No node sink bound");
        return sink.emplace(depth, negative, positive);
    }

    @Override
    public String toString() {
        return "GlobalNodeSink[" + boundSink + "]";
    }

    /**
     * Restores the previously bound sink when closed. Closing more than once has no further effect.
     */
    public static final class Binding implements AutoCloseable {
        private final NodeSink sink;
        @Nullable
        private final NodeSink previous;
        private boolean closed = false;

        private Binding(NodeSink sink, @Nullable NodeSink previous) {
            this.sink = sink;
            this.previous = previous;
        }

        public NodeSink sink() {
            return sink;
        }

        @Nullable
        public NodeSink previous() {
            return previous;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            bind(previous);
        }
    }
}
