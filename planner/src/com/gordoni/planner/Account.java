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

import java.util.Objects;

public class Account
{
        public final String name;
        public final AccountType type;
        public final double balance;
        public final double cost_basis; // Taxable accounts only. Basis is recovered tax free on withdrawal.
        public final double mean_return;
        public final double volatility;
        public final int owner; // Index of the person whose age drives RMDs.

        public Account(String name, AccountType type, double balance, double cost_basis, double mean_return, double volatility, int owner)
        {
                this.name = name;
                this.type = type;
                this.balance = balance;
                this.cost_basis = cost_basis;
                this.mean_return = mean_return;
                this.volatility = volatility;
                this.owner = owner;
        }

        public Account(String name, AccountType type, double balance, double mean_return, double volatility)
        {
                this(name, type, balance, type == AccountType.TAXABLE ? balance : 0, mean_return, volatility, 0);
        }

        @Override
        public boolean equals(Object o)
        {
                if (!(o instanceof Account))
                        return false;
                Account a = (Account) o;
                return Objects.equals(name, a.name) && type == a.type && Double.compare(balance, a.balance) == 0
                        && Double.compare(cost_basis, a.cost_basis) == 0 && Double.compare(mean_return, a.mean_return) == 0
                        && Double.compare(volatility, a.volatility) == 0 && owner == a.owner;
        }

        @Override
        public int hashCode()
        {
                return Objects.hash(name, type, balance, cost_basis, mean_return, volatility, owner);
        }

        public String toString()
        {
                return name + " (" + type.key + ")";
        }
}
