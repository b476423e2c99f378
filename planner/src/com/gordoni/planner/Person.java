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

public class Person
{
        public final String name;
        public final int birth_year;
        public final double pia; // Monthly Primary Insurance Amount in start year dollars.
        public final int claiming_age;
        public final Integer death_age; // Age in the year of death, or null if alive throughout the plan.

        public Person(String name, int birth_year, double pia, int claiming_age, Integer death_age)
        {
                this.name = name;
                this.birth_year = birth_year;
                this.pia = pia;
                this.claiming_age = claiming_age;
                this.death_age = death_age;
        }

        public Person(String name, int birth_year, double pia, int claiming_age)
        {
                this(name, birth_year, pia, claiming_age, null);
        }

        public int age(int year)
        {
                return year - birth_year;
        }

        public boolean alive(int year)
        {
                return death_age == null || age(year) <= death_age;
        }

        @Override
        public boolean equals(Object o)
        {
                if (!(o instanceof Person))
                        return false;
                Person p = (Person) o;
                return Objects.equals(name, p.name) && birth_year == p.birth_year && Double.compare(pia, p.pia) == 0
                        && claiming_age == p.claiming_age && Objects.equals(death_age, p.death_age);
        }

        @Override
        public int hashCode()
        {
                return Objects.hash(name, birth_year, pia, claiming_age, death_age);
        }

        public String toString()
        {
                return name + " (born " + birth_year + ")";
        }
}
