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

/**
 * Source of the tax due on a Roth conversion.
 */
public enum ConversionFunding
{
        TAXABLE("taxable"), // Paid alongside the year's other tax, from taxable savings first.
        CONVERTED("converted"); // Withheld from the amount deposited into the Roth account.

        public final String key;

        private ConversionFunding(String key)
        {
                this.key = key;
        }

        public static ConversionFunding fromKey(String key)
        {
                for (ConversionFunding funding : values())
                        if (funding.key.equals(key))
                                return funding;
                throw new IllegalArgumentException("Unknown conversion funding: " + key);
        }
}
