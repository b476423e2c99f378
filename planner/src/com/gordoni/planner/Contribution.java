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
 * Annual deposit into an account, made at the end of each year from start_age through end_age while still
 * working.
 */
public class Contribution
{
        public final String account;
        public final double amount;
        public final int start_age;
        public final int end_age;

        public Contribution(String account, double amount, int start_age, int end_age)
        {
                this.account = account;
                this.amount = amount;
                this.start_age = start_age;
                this.end_age = end_age;
        }

        public boolean applies(int age)
        {
                return start_age <= age && age <= end_age;
        }

        @Override
        public boolean equals(Object o)
        {
                if (!(o instanceof Contribution))
                        return false;
                Contribution c = (Contribution) o;
                return Objects.equals(account, c.account) && Double.compare(amount, c.amount) == 0 && start_age == c.start_age && end_age == c.end_age;
        }

        @Override
        public int hashCode()
        {
                return Objects.hash(account, amount, start_age, end_age);
        }
}
