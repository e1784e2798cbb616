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

import org.immutables.value.Value;

@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public class DagConfiguration {
    public static final int DEFAULT_INITIAL_SIZE = 1024;
    public static final double DEFAULT_GROWTH_FACTOR = 1.5d;

    /**
     * The initial number of buckets of a node store. The actual size is the next prime, but at
     * least some fixed minimum.
     */
    @Value.Default
    public int initialSize() {
        return DEFAULT_INITIAL_SIZE;
    }

    @Value.Default
    public double growthFactor() {
        return DEFAULT_GROWTH_FACTOR;
    }

    /**
     * Whether created sinks fail on concurrent or re-entrant access.
     */
    @Value.Default
    public boolean threadSafetyCheck() {
        return false;
    }

    /**
     * Whether the statistics of created stores are logged when the JVM shuts down. Stores are
     * only referenced weakly for this, so a store collected before shutdown is not reported.
     */
    @Value.Default
    public boolean logStatisticsOnShutdown() {
        return false;
    }

    @Value.Check
    protected void check() {
        checkArgument(initialSize() > 0, "Initial size must be positive, got %d", initialSize());
        checkArgument(growthFactor() > 1.0d, "Growth factor must be larger than 1, got %s", growthFactor());
    }
}
