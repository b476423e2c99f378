/*
 * AACalc - Asset Allocation Calculator
 * Copyright (C) 2009, 2011-2017 Gordon Irlam
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package com.gordoni.planner;

public enum CorrelationMode
{
        FULL("full"), // One market shock per year, scaled by each account's volatility.
        INDEPENDENT("independent"); // Each account draws its own shock.

        public final String key;

        private CorrelationMode(String key)
        {
                this.key = key;
        }

        public static CorrelationMode fromKey(String key)
        {
                for (CorrelationMode mode : values())
                        if (mode.key.equals(key))
                                return mode;
                throw new IllegalArgumentException("Unknown correlation mode: " + key);
        }
}
