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

/**
 * Thrown when an operation is given a node which is unknown to the diagram.
 */
public class InvalidDiagramReferenceException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final int node;

    public InvalidDiagramReferenceException(int node) {
        super(String.format("Node %d is not part of this diagram", node));
        this.node = node;
    }

    public int node() {
        return node;
    }
}
