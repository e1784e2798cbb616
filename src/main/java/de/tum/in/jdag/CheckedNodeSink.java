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

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A sink which detects concurrent or re-entrant use of its delegate and fails fast instead of
 * corrupting the delegate's table.
 */
public final class CheckedNodeSink implements NodeSink {
    private final NodeSink delegate;
    private final AtomicBoolean access;

    public CheckedNodeSink(NodeSink delegate) {
        this.delegate = delegate;
        access = new AtomicBoolean(false);
    }

    public NodeSink delegate() {
        return delegate;
    }

    @Override
    public Node emplace(int depth, Node negative, Node positive) {
        onEnter("emplace");
        try {
            return delegate.emplace(depth, negative, positive);
        } finally {
            onExit();
        }
    }

    private void onEnter(String name) {
        if (!access.compareAndSet(false, true)) {
            throw new IllegalStateException("Concurrent access to " + name);
        }
    }

    private void onExit() {
        if (!access.getAndSet(false)) {
            throw new IllegalStateException("Concurrently accessed");
        }
    }

    @Override
    public String toString() {
        return "Checked" + delegate;
    }
}
