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
 * A reduced ordered binary decision diagram. The leaves are {@link #FALSE_NODE} and
 * {@link #TRUE_NODE}, all other nodes are created through {@link #makeNode(int, int, int)} and are
 * canonical: two nodes represent the same function iff they are the same {@code int}.
 *
 * <p>Variable numbers increase while descending the diagram. Cheap preconditions of the public
 * operations are always checked, everything else only through {@code assert} statements.</p>
 */
public interface Bdd extends DecisionDiagram {
    int FALSE_NODE = 0;
    int TRUE_NODE = 1;

    /**
     * Returns the node representing {@code true}.
     */
    default int trueNode() {
        return TRUE_NODE;
    }

    /**
     * Returns the node representing {@code false}.
     */
    default int falseNode() {
        return FALSE_NODE;
    }

    /**
     * Returns the canonical node testing {@code variable} with the given successors. If both
     * successors are equal, no node is created and {@code low} is returned. Calling this method twice
     * with the same arguments yields the same node.
     *
     * @param variable
     *     The tested variable, which must be smaller than the variables of all non-leaf successors.
     * @param low
     *     The function if {@code variable} is false.
     * @param high
     *     The function if {@code variable} is true.
     *
     * @return The node representing {@code variable ? high : low}.
     *
     * @throws InvalidVariableOrderException
     *     if {@code variable} is out of range or does not precede the variables of its successors.
     * @throws InvalidDiagramReferenceException
     *     if one of the successors is not a node of this diagram.
     */
    int makeNode(int variable, int low, int high);

    /**
     * Constructs the node representing {@code IF ifNode THEN thenNode ELSE elseNode}.
     */
    int ifThenElse(int ifNode, int thenNode, int elseNode);

    /**
     * Returns the node which represents the variable with given {@code variableNumber}. The variable
     * must already have been created.
     */
    int variableNode(int variableNumber);

    /**
     * Creates a new variable and returns the node representing it. Variables are allocated
     * sequentially starting from 0.
     */
    int createVariable();

    /**
     * Creates {@code count} many variables and returns their respective nodes. The first created
     * variable is at first position of the array.
     *
     * @throws IllegalArgumentException if count is negative.
     */
    default int[] createVariables(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Count must not be negative");
        }
        int[] array = new int[count];
        for (int i = 0; i < count; i++) {
            array[i] = createVariable();
        }
        return array;
    }

    default int not(int node) {
        return ifThenElse(node, FALSE_NODE, TRUE_NODE);
    }

    default int and(int node1, int node2) {
        return ifThenElse(node1, node2, FALSE_NODE);
    }

    default int or(int node1, int node2) {
        return ifThenElse(node1, TRUE_NODE, node2);
    }

    default int xor(int node1, int node2) {
        return ifThenElse(node1, not(node2), node2);
    }

    default int equivalence(int node1, int node2) {
        return ifThenElse(node1, node2, not(node2));
    }

    /**
     * Checks whether the given {@code node} evaluates to {@code true} under the given variable
     * assignment.
     */
    boolean evaluate(int node, boolean[] assignment);

    default boolean evaluate(int node, BitSet assignment) {
        boolean[] array = new boolean[numberOfVariables()];
        for (int i = assignment.nextSetBit(0); i >= 0 && i < array.length; i = assignment.nextSetBit(i + 1)) {
            array[i] = true;
        }
        return evaluate(node, array);
    }

    /**
     * Determines whether {@code node1} represents the negation of {@code node2}. Unlike comparing
     * against {@link #not(int)}, this never creates nodes.
     */
    boolean isComplement(int node1, int node2);

    /**
     * Builds the diagram of the function described by the given truth table, creating missing
     * variables on demand. Minterm {@code i} assigns variable {@code 0} to the most significant of
     * the {@code numberOfVariables} bits of {@code i}. Don't-care minterms are resolved according to
     * the configured {@link DontCarePolicy}.
     *
     * @return The root of the resulting diagram.
     */
    int buildFromTruthTable(TruthTable table);

    /**
     * Convenience variant of {@link #buildFromTruthTable(TruthTable)} for explicit minterm sets.
     *
     * @see MintermTruthTable
     */
    default int buildFromOnSet(BitSet onSet, BitSet dontCareSet, int variableCount) {
        return buildFromTruthTable(new MintermTruthTable(variableCount, onSet, dontCareSet));
    }
}
