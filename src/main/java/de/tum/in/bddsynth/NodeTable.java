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

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Deque;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Arena of diagram nodes together with the unique table. Nodes are stored in parallel arrays and
 * identified by their index; the two leaves occupy the indices {@code 0} and {@code 1}. Nodes are
 * never removed, so the table only grows.
 */
public abstract class NodeTable implements DecisionDiagram {
    private static final Logger logger = Logger.getLogger(NodeTable.class.getName());

    protected static final int FIRST_NODE = 2;
    protected static final int LEAF_VARIABLE = -1;
    // Leaves are never part of a hash chain, hence 0 can mark the end of a chain
    protected static final int NOT_A_NODE = 0;

    private static final int MINIMUM_NODE_TABLE_SIZE = Primes.nextPrime(1_000);
    private static final int MAXIMAL_NODE_COUNT = Integer.MAX_VALUE / 2 - 8;

    private final double growthFactor;

    /* Number of used slots, i.e. the index of the next created node. */
    private int nodeCount;

    /* Variable of each node, LEAF_VARIABLE for the two leaves. */
    private int[] variables;

    /* Hash map for existing nodes. When a node with a certain hash is created, it is prepended to
     * the chain starting at hashToChainStart[hash mod size]; hashChain[node] points to the next node
     * of the same chain. */
    private int[] hashToChainStart;
    private int[] hashChain;

    // Statistics
    private long createdNodes = 0;
    private long hashChainLookups = 0;
    private long hashChainLookupLength = 0;
    private long hashChainLookupHit = 0;
    private long growCount = 0;

    protected NodeTable(int initialSize, double growthFactor) {
        this.growthFactor = growthFactor;
        int tableSize = Math.max(Primes.nextPrime(initialSize), MINIMUM_NODE_TABLE_SIZE);

        variables = new int[tableSize];
        hashToChainStart = new int[tableSize];
        hashChain = new int[tableSize];

        variables[Bdd.FALSE_NODE] = LEAF_VARIABLE;
        variables[Bdd.TRUE_NODE] = LEAF_VARIABLE;
        // Just to ensure a fail-fast
        Arrays.fill(hashChain, 0, FIRST_NODE, Integer.MIN_VALUE);
        nodeCount = FIRST_NODE;
    }

    @Override
    public boolean isLeaf(int node) {
        return node == Bdd.FALSE_NODE || node == Bdd.TRUE_NODE;
    }

    public boolean isNodeValid(int node) {
        return FIRST_NODE <= node && node < nodeCount;
    }

    /**
     * Determines if the given {@code node} is either a leaf or valid. For most operations it is
     * required that this is the case.
     *
     * @param node The node to be checked.
     * @return If {@code} is valid or leaf node.
     * @see #isLeaf(int)
     */
    @Override
    public boolean isNodeValidOrLeaf(int node) {
        return 0 <= node && node < nodeCount;
    }

    @Override
    public int variableOf(int node) {
        assert isNodeValidOrLeaf(node);
        return variables[node];
    }

    @Override
    public int nodeCount() {
        return nodeCount;
    }

    public int tableSize() {
        return variables.length;
    }

    // Unique table

    /**
     * Checks whether the node stored at {@code lookup} has the children of the current lookup.
     */
    protected abstract boolean checkLookupChildrenMatch(int lookup);

    /**
     * Computes the hash of an existing node, which has to coincide with the hash used to create it.
     */
    protected abstract int hashCode(int node, int variable);

    /**
     * Called after the table has been resized, before any node is moved into its new chain.
     */
    protected abstract void onTableResize(int newSize);

    /**
     * Searches the unique table for a node with the given {@code variable} whose children match the
     * current lookup and creates a fresh slot if there is none. The caller is responsible for writing
     * the children of a fresh slot.
     */
    protected int findOrCreateNode(int variable, int hashCode) {
        int[] variables = this.variables;
        int[] hashChain = this.hashChain;

        int currentLookupNode = hashToChainStart[hashToTable(hashCode)];

        // Search for the node in the hash chain
        int chainLookups = 1;
        this.hashChainLookups += 1;
        while (currentLookupNode != NOT_A_NODE) {
            if (variables[currentLookupNode] == variable && checkLookupChildrenMatch(currentLookupNode)) {
                this.hashChainLookupLength += chainLookups;
                this.hashChainLookupHit += 1;
                return currentLookupNode;
            }
            int next = hashChain[currentLookupNode];
            assert next != currentLookupNode;
            currentLookupNode = next;
            chainLookups += 1;
        }
        this.hashChainLookupLength += chainLookups;

        if (nodeCount == tableSize()) {
            ensureCapacity();
        }

        int freeNode = nodeCount;
        nodeCount += 1;
        createdNodes += 1;
        this.variables[freeNode] = variable;
        connectHashList(freeNode, hashCode);
        return freeNode;
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

    private void ensureCapacity() {
        Util.checkState(nodeCount < MAXIMAL_NODE_COUNT, "Node table exhausted with %d nodes", nodeCount);

        growCount += 1;
        int oldSize = tableSize();
        @SuppressWarnings("NumericCastThatLosesPrecision")
        int newSize = Math.min(MAXIMAL_NODE_COUNT, Primes.nextPrime((int) Math.ceil(oldSize * growthFactor)));
        assert oldSize < newSize : "Got new size " + newSize + " with old size " + oldSize;

        logger.log(Level.FINE, "Growing the table of {0} from {1} to {2}", new Object[] {this, oldSize, newSize});

        onTableResize(newSize);

        variables = Arrays.copyOf(this.variables, newSize); // NOPMD
        hashChain = Arrays.copyOf(this.hashChain, newSize); // NOPMD
        // We need to re-build hashToChainStart completely
        hashToChainStart = new int[newSize];

        int[] variables = this.variables;
        for (int node = FIRST_NODE; node < nodeCount; node++) {
            connectHashList(node, hashCode(node, variables[node]));
        }

        assert check();
        logger.log(Level.FINE, "Finished growing the table");
    }

    // Traversal

    @Override
    public int reachableNodeCount(int node) {
        assert isNodeValidOrLeaf(node);
        BitSet visited = new BitSet(nodeCount);
        forEachReachable(node, visited);
        return visited.cardinality();
    }

    @Override
    public BitSet support(int node) {
        assert isNodeValidOrLeaf(node);
        BitSet visited = new BitSet(nodeCount);
        forEachReachable(node, visited);
        BitSet support = new BitSet(numberOfVariables());
        for (int i = visited.nextSetBit(0); i >= 0; i = visited.nextSetBit(i + 1)) {
            support.set(variables[i]);
        }
        return support;
    }

    @Override
    public String structureOf(int node) {
        assert isNodeValidOrLeaf(node);
        if (isLeaf(node)) {
            return node == Bdd.TRUE_NODE ? "1" : "0";
        }
        BitSet visited = new BitSet(nodeCount);
        forEachReachable(node, visited);
        StringBuilder builder = new StringBuilder(24 * visited.cardinality());
        // Parents are younger than their children, so the root comes first
        for (int i = visited.length() - 1; i >= 0; i = visited.previousSetBit(i - 1)) {
            if (builder.length() > 0) {
                builder.append('\n');
            }
            builder.append(i).append(": x").append(variables[i])
                    .append(" ? ").append(high(i)).append(" : ").append(low(i));
        }
        return builder.toString();
    }

    /* Marks all internal nodes reachable from node in visited. */
    private void forEachReachable(int node, BitSet visited) {
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(node);
        while (!stack.isEmpty()) {
            int current = stack.pop();
            if (isLeaf(current) || visited.get(current)) {
                continue;
            }
            visited.set(current);
            stack.push(high(current));
            stack.push(low(current));
        }
    }

    // Integrity

    /**
     * Checks the structural invariants of all nodes: children precede their parents, every node is
     * reduced, ordered, reachable through its hash chain and unique.
     */
    boolean check() {
        logger.log(Level.FINER, "Running integrity check");
        for (int node = FIRST_NODE; node < nodeCount; node++) {
            int variable = variables[node];
            int low = low(node);
            int high = high(node);
            checkState(variable >= 0, "Node %d has invalid variable %d", node, variable);
            checkState(low != high, "Node %d is not reduced", node);
            checkState(low < node && high < node, "Node %d refers to younger children %d, %d", node, low, high);
            checkState(isLeaf(low) || variable < variables[low], "Node %d is not ordered on low", node);
            checkState(isLeaf(high) || variable < variables[high], "Node %d is not ordered on high", node);

            int chainPosition = hashToChainStart[hashToTable(hashCode(node, variable))];
            boolean found = false;
            while (chainPosition != NOT_A_NODE) {
                if (chainPosition == node) {
                    found = true;
                } else if (variables[chainPosition] == variable
                        && low(chainPosition) == low
                        && high(chainPosition) == high) {
                    throw new IllegalStateException(String.format("Duplicate nodes %d and %d", node, chainPosition));
                }
                chainPosition = hashChain[chainPosition];
            }
            checkState(found, "Node %d is not contained in its hash chain", node);
        }
        return true;
    }

    private static void checkState(boolean state, String formatString, Object... format) {
        Util.checkState(state, formatString, format);
    }

    public String getStatistics() {
        int distinctChains = 0;
        int maximalLength = 0;
        for (int chainStart : hashToChainStart) {
            if (chainStart == NOT_A_NODE) {
                continue;
            }
            distinctChains += 1;
            int length = 0;
            for (int current = chainStart; current != NOT_A_NODE; current = hashChain[current]) {
                length += 1;
            }
            maximalLength = Math.max(maximalLength, length);
        }

        return String.format(
                "Node table statistics:%n"
                        + "Table Size: %1$d, %2$d nodes (%3$d internal), %4$d created%n"
                        + "Hash table: %5$d chains %6$.2f load, %7$.2f avg, %8$d max; "
                        + "%9$d lookups, %10$.2f avg. len, %11$d hits%n"
                        + "%12$d grows",
                tableSize(),
                nodeCount,
                nodeCount - FIRST_NODE,
                createdNodes,
                distinctChains,
                distinctChains * 1.0 / tableSize(),
                (nodeCount - FIRST_NODE) * 1.0 / Math.max(distinctChains, 1),
                maximalLength,
                hashChainLookups,
                hashChainLookupLength * 1.0 / Math.max(hashChainLookups, 1),
                hashChainLookupHit,
                growCount);
    }
}
