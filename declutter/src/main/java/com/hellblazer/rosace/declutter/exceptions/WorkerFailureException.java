/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Rosace.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.rosace.declutter.exceptions;

/**
 * Thrown when a partition of the parallel assignment step, or the centroid recompute, fails or cannot be awaited.
 * The run is abandoned; partial assignments are never substituted.
 */
public final class WorkerFailureException extends DeclutterException {

    public WorkerFailureException(String message) {
        super(message);
    }

    public WorkerFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
