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
 * Thrown when a node would violate the variable order of its diagram. This indicates a programming
 * error, as construction always proceeds bottom-up.
 */
public class InvalidVariableOrderException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public InvalidVariableOrderException(String message) {
        super(message);
    }
}
