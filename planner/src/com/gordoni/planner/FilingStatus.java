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

public enum FilingStatus
{
        SINGLE("single"),
        MARRIED_JOINT("married_joint"),
        MARRIED_SEPARATE("married_separate"),
        HEAD_OF_HOUSEHOLD("head_of_household");

        public final String key;

        private FilingStatus(String key)
        {
                this.key = key;
        }

        public static FilingStatus fromKey(String key)
        {
                for (FilingStatus status : values())
                        if (status.key.equals(key))
                                return status;
                throw new IllegalArgumentException("Unknown filing status: " + key);
        }
}
