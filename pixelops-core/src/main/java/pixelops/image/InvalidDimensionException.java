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
 * Thrown when a buffer is built with a non-positive dimension, or with a sample array that does not match its dimensions.
 */
public class InvalidDimensionException extends IllegalArgumentException {
    public InvalidDimensionException(String message) {
        super(message);
    }
}
