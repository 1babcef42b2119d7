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

import static de.tum.in.bddsynth.Util.min;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/* Implementation notes:
 * - The recursive and iterative variants of if-then-else are the same algorithm, the latter keeps
 *   its frames in the branch and cache stacks. Both produce identical nodes.
 * - Due to the implementation of all operations, variable numbers increase while descending the
 *   tree of a particular node. Hence, the recursion depth is bounded by the number of variables.
 */
@SuppressWarnings({
    "PMD.AvoidReassigningParameters",
    "PMD.AssignmentInOperand",
    "ReassignedVariable",
    "AssignmentToMethodParameter",
    "ValueOfIncrementOrDecrementUsed",
    "NestedAssignment"
})
final class BddImpl extends NodeTable implements Bdd {
    private static final Logger logger = Logger.getLogger(BddImpl.class.getName());

    private static final int[] EMPTY_INT_ARRAY = new int[0];
    private static final int NO_RESULT = -1;

    private static final byte VALUE_OFF = 0;
    private static final byte VALUE_ON = 1;
    private static final byte VALUE_DONT_CARE = 2;

    private final BddCache cache;
    private final boolean iterative;
    private final DontCarePolicy dontCarePolicy;
    private int numberOfVariables;
    private int[] variableNodes;

    /* Low and high successors of each node */
    private int[] tree;

    // Iterative stack
    private int[] cacheStackHash = EMPTY_INT_ARRAY;
    private int[] cacheStackFirstArg = EMPTY_INT_ARRAY;
    private int[] cacheStackSecondArg = EMPTY_INT_ARRAY;
    private int[] cacheStackThirdArg = EMPTY_INT_ARRAY;
    private int[] branchStackParentVar = EMPTY_INT_ARRAY;
    private int[] branchStackFirstArg = EMPTY_INT_ARRAY;
    private int[] branchStackSecondArg = EMPTY_INT_ARRAY;
    private int[] branchStackThirdArg = EMPTY_INT_ARRAY;
    private int[] branchStackLowResult = EMPTY_INT_ARRAY;

    private int hashLookupLow = NOT_A_NODE;
    private int hashLookupHigh = NOT_A_NODE;

    BddImpl(BddConfiguration configuration) {
        super(configuration.initialSize(), configuration.growthFactor());
        this.iterative = configuration.iterative();
        this.dontCarePolicy = configuration.dontCarePolicy();

        tree = new int[2 * tableSize()];
        cache = new BddCache(this, configuration);
        variableNodes = new int[32];
        numberOfVariables = 0;
        if (iterative) {
            growStacks();
        }
    }

    // Nodes

    @Override
    protected boolean checkLookupChildrenMatch(int lookup) {
        int[] tree = this.tree;
        return tree[lookup * 2] == hashLookupLow && tree[lookup * 2 + 1] == hashLookupHigh;
    }

    @Override
    protected int hashCode(int node, int variable) {
        return HashUtil.hashNode(variable, tree[2 * node], tree[2 * node + 1]);
    }

    @Override
    protected void onTableResize(int newSize) {
        tree = Arrays.copyOf(tree, 2 * newSize);
        cache.invalidate(newSize);
    }

    @Override
    public int makeNode(int variable, int low, int high) {
        if (!isNodeValidOrLeaf(low)) {
            throw new InvalidDiagramReferenceException(low);
        }
        if (!isNodeValidOrLeaf(high)) {
            throw new InvalidDiagramReferenceException(high);
        }
        if (variable < 0 || variable >= numberOfVariables) {
            throw new InvalidVariableOrderException(
                    String.format("Variable %d out of range [0, %d)", variable, numberOfVariables));
        }
        if (!isLeaf(low) && variable >= variableOf(low)) {
            throw new InvalidVariableOrderException(
                    String.format("Variable %d does not precede low successor variable %d", variable, variableOf(low)));
        }
        if (!isLeaf(high) && variable >= variableOf(high)) {
            throw new InvalidVariableOrderException(String.format(
                    "Variable %d does not precede high successor variable %d", variable, variableOf(high)));
        }
        return makeNodeUnchecked(variable, low, high);
    }

    private int makeNodeUnchecked(int variable, int low, int high) {
        assert 0 <= variable && variable < numberOfVariables;
        assert (isLeaf(low) || variable < variableOf(low));
        assert (isLeaf(high) || variable < variableOf(high));

        if (low == high) {
            return low;
        }

        hashLookupLow = low;
        hashLookupHigh = high;
        int freeNode = findOrCreateNode(variable, HashUtil.hashNode(variable, low, high));

        this.tree[2 * freeNode] = low;
        this.tree[2 * freeNode + 1] = high;
        assert HashUtil.hashNode(variable, low, high) == hashCode(freeNode, variable);
        return freeNode;
    }

    @Override
    public int low(int node) {
        assert isNodeValid(node);
        return tree[2 * node];
    }

    @Override
    public int high(int node) {
        assert isNodeValid(node);
        return tree[2 * node + 1];
    }

    // Variables

    @Override
    public int numberOfVariables() {
        return numberOfVariables;
    }

    @Override
    public int variableNode(int variableNumber) {
        Util.checkArgument(0 <= variableNumber && variableNumber < numberOfVariables,
                "Variable %d out of range [0, %d)", variableNumber, numberOfVariables);
        return variableNodes[variableNumber];
    }

    @Override
    public int createVariable() {
        int variable = numberOfVariables;
        numberOfVariables++;
        int variableNode = makeNodeUnchecked(variable, FALSE_NODE, TRUE_NODE);

        if (variable == variableNodes.length) {
            variableNodes = Arrays.copyOf(variableNodes, variableNodes.length * 2);
        }
        variableNodes[variable] = variableNode;

        if (iterative) {
            growStacks();
        }
        return variableNode;
    }

    private void growStacks() {
        int size = numberOfVariables + 1;
        if (branchStackParentVar.length >= size) {
            return;
        }
        cacheStackHash = Arrays.copyOf(cacheStackHash, size);
        cacheStackFirstArg = Arrays.copyOf(cacheStackFirstArg, size);
        cacheStackSecondArg = Arrays.copyOf(cacheStackSecondArg, size);
        cacheStackThirdArg = Arrays.copyOf(cacheStackThirdArg, size);
        branchStackParentVar = Arrays.copyOf(branchStackParentVar, size);
        branchStackFirstArg = Arrays.copyOf(branchStackFirstArg, size);
        branchStackSecondArg = Arrays.copyOf(branchStackSecondArg, size);
        branchStackThirdArg = Arrays.copyOf(branchStackThirdArg, size);
        branchStackLowResult = Arrays.copyOf(branchStackLowResult, size);
    }

    // Reading

    @Override
    public boolean evaluate(int node, boolean[] assignment) {
        assert isNodeValidOrLeaf(node);
        int current = node;
        while (current >= FIRST_NODE) {
            current = assignment[variableOf(current)] ? high(current) : low(current);
        }
        assert isLeaf(current);
        return current == TRUE_NODE;
    }

    @Override
    public boolean isComplement(int node1, int node2) {
        if (!isNodeValidOrLeaf(node1)) {
            throw new InvalidDiagramReferenceException(node1);
        }
        if (!isNodeValidOrLeaf(node2)) {
            throw new InvalidDiagramReferenceException(node2);
        }
        return isComplementRecursive(node1, node2, new HashSet<>());
    }

    private boolean isComplementRecursive(int node1, int node2, Set<Long> complementPairs) {
        if (isLeaf(node1) || isLeaf(node2)) {
            // Internal nodes are never constant
            return isLeaf(node1) && isLeaf(node2) && node1 != node2;
        }
        if (variableOf(node1) != variableOf(node2)) {
            return false;
        }
        long pair = ((long) node1 << 32) | node2;
        if (complementPairs.contains(pair)) {
            return true;
        }
        boolean complement = isComplementRecursive(low(node1), low(node2), complementPairs)
                && isComplementRecursive(high(node1), high(node2), complementPairs);
        if (complement) {
            complementPairs.add(pair);
        }
        return complement;
    }

    // If-then-else

    @Override
    public int ifThenElse(int ifNode, int thenNode, int elseNode) {
        for (int node : new int[] {ifNode, thenNode, elseNode}) {
            if (!isNodeValidOrLeaf(node)) {
                throw new InvalidDiagramReferenceException(node);
            }
        }
        return iterative
                ? ifThenElseIterative(ifNode, thenNode, elseNode)
                : ifThenElseRecursive(ifNode, thenNode, elseNode);
    }

    private static int ifThenElseTerminal(int ifNode, int thenNode, int elseNode) {
        if (ifNode == TRUE_NODE) {
            return thenNode;
        }
        if (ifNode == FALSE_NODE) {
            return elseNode;
        }
        if (thenNode == elseNode) {
            return thenNode;
        }
        if (thenNode == TRUE_NODE && elseNode == FALSE_NODE) {
            return ifNode;
        }
        return NO_RESULT;
    }

    private int ifThenElseIterative(int ifNode, int thenNode, int elseNode) {
        int[] cacheStackHash = this.cacheStackHash;
        int[] cacheIfArgStack = this.cacheStackFirstArg;
        int[] cacheThenArgStack = this.cacheStackSecondArg;
        int[] cacheElseArgStack = this.cacheStackThirdArg;
        int[] branchStackParentVar = this.branchStackParentVar;
        int[] branchTaskIfStack = this.branchStackFirstArg;
        int[] branchTaskThenStack = this.branchStackSecondArg;
        int[] branchTaskElseStack = this.branchStackThirdArg;
        int[] branchLowResultStack = this.branchStackLowResult;

        int stackIndex = 0;
        int currentIf = ifNode;
        int currentThen = thenNode;
        int currentElse = elseNode;

        while (true) {
            assert stackIndex >= 0;

            int result;
            do {
                result = ifThenElseTerminal(currentIf, currentThen, currentElse);
                if (result != NO_RESULT) {
                    break;
                }
                if (cache.lookupIfThenElse(currentIf, currentThen, currentElse)) {
                    result = cache.lookupResult();
                    break;
                }
                int ifVar = variableOf(currentIf);
                int thenVar = isLeaf(currentThen) ? Integer.MAX_VALUE : variableOf(currentThen);
                int elseVar = isLeaf(currentElse) ? Integer.MAX_VALUE : variableOf(currentElse);
                int minVar = min(ifVar, thenVar, elseVar);

                cacheStackHash[stackIndex] = cache.lookupHash();
                cacheIfArgStack[stackIndex] = currentIf;
                cacheThenArgStack[stackIndex] = currentThen;
                cacheElseArgStack[stackIndex] = currentElse;

                branchStackParentVar[stackIndex] = minVar;
                if (ifVar == minVar) {
                    branchTaskIfStack[stackIndex] = high(currentIf);
                    currentIf = low(currentIf);
                } else {
                    branchTaskIfStack[stackIndex] = currentIf;
                }
                if (thenVar == minVar) {
                    branchTaskThenStack[stackIndex] = high(currentThen);
                    currentThen = low(currentThen);
                } else {
                    branchTaskThenStack[stackIndex] = currentThen;
                }
                if (elseVar == minVar) {
                    branchTaskElseStack[stackIndex] = high(currentElse);
                    currentElse = low(currentElse);
                } else {
                    branchTaskElseStack[stackIndex] = currentElse;
                }
                stackIndex += 1;
            } while (true);

            if (stackIndex == 0) {
                return result;
            }

            // Negative parent variables mark frames whose low branch is finished
            int parentVar;
            while ((parentVar = branchStackParentVar[--stackIndex]) < 0) {
                int variable = -parentVar - 1;
                result = makeNodeUnchecked(variable, branchLowResultStack[stackIndex], result);

                int cacheIf = cacheIfArgStack[stackIndex];
                int cacheThen = cacheThenArgStack[stackIndex];
                int cacheElse = cacheElseArgStack[stackIndex];
                cache.putIfThenElse(cacheStackHash[stackIndex], cacheIf, cacheThen, cacheElse, result);

                if (stackIndex == 0) {
                    return result;
                }
            }
            assert stackIndex >= 0;
            branchStackParentVar[stackIndex] = -(parentVar + 1);
            branchLowResultStack[stackIndex] = result;

            currentIf = branchTaskIfStack[stackIndex];
            currentThen = branchTaskThenStack[stackIndex];
            currentElse = branchTaskElseStack[stackIndex];
            stackIndex += 1;
        }
    }

    private int ifThenElseRecursive(int ifNode, int thenNode, int elseNode) {
        int terminal = ifThenElseTerminal(ifNode, thenNode, elseNode);
        if (terminal != NO_RESULT) {
            return terminal;
        }

        if (cache.lookupIfThenElse(ifNode, thenNode, elseNode)) {
            return cache.lookupResult();
        }
        int hash = cache.lookupHash();
        int ifVar = variableOf(ifNode);
        int thenVar = isLeaf(thenNode) ? Integer.MAX_VALUE : variableOf(thenNode);
        int elseVar = isLeaf(elseNode) ? Integer.MAX_VALUE : variableOf(elseNode);

        int minVar = Math.min(ifVar, Math.min(thenVar, elseVar));
        int ifLowNode;
        int ifHighNode;

        if (ifVar == minVar) {
            ifLowNode = low(ifNode);
            ifHighNode = high(ifNode);
        } else {
            ifLowNode = ifNode;
            ifHighNode = ifNode;
        }

        int thenHighNode;
        int thenLowNode;
        if (thenVar == minVar) {
            thenLowNode = low(thenNode);
            thenHighNode = high(thenNode);
        } else {
            thenLowNode = thenNode;
            thenHighNode = thenNode;
        }

        int elseHighNode;
        int elseLowNode;
        if (elseVar == minVar) {
            elseLowNode = low(elseNode);
            elseHighNode = high(elseNode);
        } else {
            elseLowNode = elseNode;
            elseHighNode = elseNode;
        }

        int lowNode = ifThenElseRecursive(ifLowNode, thenLowNode, elseLowNode);
        int highNode = ifThenElseRecursive(ifHighNode, thenHighNode, elseHighNode);
        int result = makeNodeUnchecked(minVar, lowNode, highNode);
        cache.putIfThenElse(hash, ifNode, thenNode, elseNode, result);
        return result;
    }

    // Construction from truth tables

    @Override
    public int buildFromTruthTable(TruthTable table) {
        int variables = table.numberOfVariables();
        Util.checkArgument(0 <= variables && variables <= MintermTruthTable.MAXIMAL_VARIABLE_COUNT,
                "Unsupported number of variables %d", variables);
        if (numberOfVariables < variables) {
            createVariables(variables - numberOfVariables);
        }

        int size = 1 << variables;
        byte[] values = new byte[size];
        for (int minterm = 0; minterm < size; minterm++) {
            TruthValue value = table.valueOf(minterm);
            if (value == TruthValue.ON) {
                values[minterm] = VALUE_ON;
            } else if (value == TruthValue.DONT_CARE && dontCarePolicy == DontCarePolicy.MERGE) {
                values[minterm] = VALUE_DONT_CARE;
            } else {
                values[minterm] = VALUE_OFF;
            }
        }

        int root = buildRecursive(values, 0, size, 0);
        logger.log(Level.FINE, "Built diagram of {0} variables with {1} nodes",
                new Object[] {variables, reachableNodeCount(root)});
        return root;
    }

    /* Builds the function of values[offset, offset + length), whose first variable is variable. The
     * first half of the range is the cofactor where variable is false. */
    private int buildRecursive(byte[] values, int offset, int length, int variable) {
        boolean hasOn = false;
        boolean hasOff = false;
        for (int i = offset; i < offset + length; i++) {
            if (values[i] == VALUE_ON) {
                hasOn = true;
            } else if (values[i] == VALUE_OFF) {
                hasOff = true;
            }
        }
        if (!hasOn) {
            return FALSE_NODE;
        }
        if (!hasOff) {
            return TRUE_NODE;
        }

        int half = length / 2;
        if (dontCarePolicy == DontCarePolicy.MERGE && isCompatible(values, offset, offset + half, half)) {
            byte[] merged = new byte[half];
            for (int i = 0; i < half; i++) {
                byte lowValue = values[offset + i];
                merged[i] = lowValue == VALUE_DONT_CARE ? values[offset + half + i] : lowValue;
            }
            return buildRecursive(merged, 0, half, variable + 1);
        }

        int low = buildRecursive(values, offset, half, variable + 1);
        int high = buildRecursive(values, offset + half, half, variable + 1);
        return makeNodeUnchecked(variable, low, high);
    }

    private static boolean isCompatible(byte[] values, int lowOffset, int highOffset, int length) {
        for (int i = 0; i < length; i++) {
            byte lowValue = values[lowOffset + i];
            byte highValue = values[highOffset + i];
            if (lowValue != VALUE_DONT_CARE && highValue != VALUE_DONT_CARE && lowValue != highValue) {
                return false;
            }
        }
        return true;
    }

    // Statistics

    @Override
    public String statistics() {
        return getStatistics() + '\n' + cache.getStatistics();
    }

    @Override
    public String toString() {
        return String.format("Bdd(%d variables, %d nodes)", numberOfVariables, nodeCount());
    }
}
