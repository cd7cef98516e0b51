/* 
 * Copyright (C) 2026 PIXELOPS contributors
 *
 * This File is part of PIXELOPS
 *
 * PIXELOPS is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * PIXELOPS is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with PIXELOPS.  If not, see <http://www.gnu.org/licenses/>.
 */
package pixelops.image;

/**
 * Thrown for an empty, non-square or even-sided kernel, and for a non-positive or even window size.
 */
public class InvalidKernelSizeException extends IllegalArgumentException {
    public InvalidKernelSizeException(String message) {
        super(message);
    }
}
