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

public enum AccountType
{
        TAXABLE("taxable"),
        TAX_DEFERRED("tax_deferred"),
        ROTH("roth");

        public final String key;

        private AccountType(String key)
        {
                this.key = key;
        }

        public static AccountType fromKey(String key)
        {
                for (AccountType type : values())
                        if (type.key.equals(key))
                                return type;
                throw new IllegalArgumentException("Unknown account type: " + key);
        }
}
