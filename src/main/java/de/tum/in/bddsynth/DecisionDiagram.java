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

import java.util.BitSet;

/**
 * Read-only view on the structure of a decision diagram. Nodes are identified by plain {@code int}
 * values which are only meaningful for the diagram instance that created them.
 */
public interface DecisionDiagram {
    /**
     * Determines whether the given {@code node} represents a constant.
     *
     * @param node The node to be checked.
     * @return If the {@code node} represents a constant.
     */
    boolean isLeaf(int node);

    /**
     * Determines whether the given {@code node} is known to this diagram, i.e. is a leaf or was
     * created by it.
     */
    boolean isNodeValidOrLeaf(int node);

    /**
     * Gets the variable of the given {@code node} or {@code -1} for a leaf.
     */
    int variableOf(int node);

    int low(int node);

    int high(int node);

    /**
     * Returns the number of variables in this decision diagram.
     *
     * @return The number of variables.
     */
    int numberOfVariables();

    /**
     * Number of nodes stored in this diagram, including both leaves.
     */
    int nodeCount();

    /**
     * Number of internal (non-leaf) nodes stored in this diagram.
     */
    default int internalNodeCount() {
        return nodeCount() - 2;
    }

    /**
     * Number of internal nodes reachable from the given {@code node}.
     */
    int reachableNodeCount(int node);

    /**
     * Computes the <b>support</b> of the function represented by the given {@code node}. The support
     * of a function are all variables which have an influence on its value.
     *
     * @param node The node whose support should be computed.
     * @return A bit set with bit {@code i} is set iff the {@code i}-th variable is in the support.
     */
    BitSet support(int node);

    /**
     * Lists the internal nodes reachable from {@code node}, one {@code id: xV ? high : low} line per
     * node, starting with {@code node} itself. Leaves are printed as {@code 0} and {@code 1}.
     */
    String structureOf(int node);

    /**
     * Returns a string containing some statistics about the diagram. The content and formatting of
     * this string may change drastically and are only intended as human-readable output.
     */
    String statistics();
}
