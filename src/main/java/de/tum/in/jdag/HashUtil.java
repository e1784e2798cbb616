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

final class HashUtil {
    // Cheap hash functions, called on every emplace and cache lookup

    static final int PRIME = 0x1000193;

    private HashUtil() {}

    static int hash(int depth, int negativeHash, int positiveHash) {
        return (PRIME * depth) + 31 * negativeHash + positiveHash;
    }

    /**
     * A hash of two values which does not depend on their order.
     */
    static int symmetricHash(int firstHash, int secondHash) {
        return firstHash + secondHash;
    }
}
