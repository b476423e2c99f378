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

/**
 * Fixed income outside the portfolio, such as a pension or annuity.
 */
public class IncomeStream
{
        public final String name;
        public final double amount; // Annual amount in start year dollars.
        public final int start_age;
        public final int end_age;
        public final boolean taxable; // Taxed as ordinary income.
        public final boolean inflation_indexed;

        public IncomeStream(String name, double amount, int start_age, int end_age, boolean taxable, boolean inflation_indexed)
        {
                this.name = name;
                this.amount = amount;
                this.start_age = start_age;
                this.end_age = end_age;
                this.taxable = taxable;
                this.inflation_indexed = inflation_indexed;
        }

        public boolean applies(int age)
        {
                return start_age <= age && age <= end_age;
        }

        @Override
        public boolean equals(Object o)
        {
                if (!(o instanceof IncomeStream))
                        return false;
                IncomeStream s = (IncomeStream) o;
                return Objects.equals(name, s.name) && Double.compare(amount, s.amount) == 0 && start_age == s.start_age && end_age == s.end_age
                        && taxable == s.taxable && inflation_indexed == s.inflation_indexed;
        }

        @Override
        public int hashCode()
        {
                return Objects.hash(name, amount, start_age, end_age, taxable, inflation_indexed);
        }
}
