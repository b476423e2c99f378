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
 * Heuristic for how much to move from tax-deferred to Roth accounts each year.
 *
 * The simulator never converts more than the tax-deferred balance, whatever is proposed.
 */
public abstract class ConversionPolicy
{
        public final int start_age;
        public final int end_age;
        public final ConversionFunding funding;

        protected ConversionPolicy(int start_age, int end_age, ConversionFunding funding)
        {
                this.start_age = start_age;
                this.end_age = end_age;
                this.funding = funding;
        }

        public boolean active(int age)
        {
                return start_age <= age && age <= end_age;
        }

        /**
         * Amount to convert this year. Only called for ages within the policy's window.
         */
        protected abstract double convert(ConversionContext context);

        public double propose(ConversionContext context)
        {
                if (!active(context.age))
                        return 0;
                return Math.max(0, convert(context));
        }

        public abstract String type();

        /**
         * Largest amount converted in any one year.
         */
        public abstract double cap();

        /**
         * Copy of this policy with a different annual cap.
         */
        public abstract ConversionPolicy with_cap(double cap);

        public static ConversionPolicy policyFactory(String type, double cap, Double bracket_rate, int start_age, int end_age, ConversionFunding funding)
        {
                if (type.equals("cap"))
                        return new ConversionCap(cap, start_age, end_age, funding);
                else if (type.equals("bracket"))
                {
                        if (bracket_rate == null)
                                throw new IllegalArgumentException("bracket conversion policy requires bracket_rate");
                        return new ConversionBracketFill(bracket_rate, cap, start_age, end_age, funding);
                }
                else
                        throw new IllegalArgumentException("Unknown conversion policy: " + type);
        }

        @Override
        public boolean equals(Object o)
        {
                if (o == null || o.getClass() != getClass())
                        return false;
                ConversionPolicy p = (ConversionPolicy) o;
                return start_age == p.start_age && end_age == p.end_age && funding == p.funding && Double.compare(cap(), p.cap()) == 0;
        }

        @Override
        public int hashCode()
        {
                return Objects.hash(type(), start_age, end_age, funding, cap());
        }
}
