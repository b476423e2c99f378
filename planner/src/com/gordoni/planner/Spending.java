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

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Spending met from the portfolio once retired. Amounts are in start year dollars and grow with inflation.
 */
public class Spending
{
        public final double annual;
        public final Map<Integer, Double> special_expenses; // One off expenses keyed by age.

        public Spending(double annual, Map<Integer, Double> special_expenses)
        {
                this.annual = annual;
                this.special_expenses = Collections.unmodifiableMap(new TreeMap<Integer, Double>(special_expenses));
        }

        public Spending(double annual)
        {
                this(annual, Collections.<Integer, Double>emptyMap());
        }

        /**
         * Spending at age before inflation.
         */
        public double at_age(int age)
        {
                Double special = special_expenses.get(age);
                return annual + (special == null ? 0 : special);
        }

        @Override
        public boolean equals(Object o)
        {
                if (!(o instanceof Spending))
                        return false;
                Spending s = (Spending) o;
                return Double.compare(annual, s.annual) == 0 && special_expenses.equals(s.special_expenses);
        }

        @Override
        public int hashCode()
        {
                return Objects.hash(annual, special_expenses);
        }
}
