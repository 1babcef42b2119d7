/*
 * This file is part of BddSynth.
 * Copyright (c) 2026 The BddSynth authors.
 *
 * BddSynth is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * BddSynth is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with BddSynth. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.bddsynth;

import org.immutables.value.Value;

@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public class BddConfiguration {
    public static final int DEFAULT_CACHE_TERNARY_DIVIDER = 4;
    public static final int DEFAULT_INITIAL_SIZE = 1024;
    public static final double DEFAULT_NODE_TABLE_GROWTH_FACTOR = 1.5d;

    @Value.Default
    public int cacheTernaryDivider() {
        return DEFAULT_CACHE_TERNARY_DIVIDER;
    }

    @Value.Default
    public int initialSize() {
        return DEFAULT_INITIAL_SIZE;
    }

    @Value.Default
    public double growthFactor() {
        return DEFAULT_NODE_TABLE_GROWTH_FACTOR;
    }

    /**
     * Whether operations use explicit stacks instead of the call stack.
     */
    @Value.Default
    public boolean iterative() {
        return false;
    }

    /**
     * Whether the if-then-else cache is used at all. Disabling it only costs time.
     */
    @Value.Default
    public boolean useIfThenElseCache() {
        return true;
    }

    @Value.Default
    public DontCarePolicy dontCarePolicy() {
        return DontCarePolicy.ASSIGN_FALSE;
    }

    @Value.Default
    public boolean logStatisticsOnShutdown() {
        return false;
    }

    @Value.Check
    protected void check() {
        Util.checkState(cacheTernaryDivider() > 0, "Cache divider must be positive, got %d", cacheTernaryDivider());
        Util.checkState(initialSize() > 0, "Initial size must be positive, got %d", initialSize());
        Util.checkState(growthFactor() > 1.0, "Growth factor must be larger than 1, got %f", growthFactor());
    }
}
