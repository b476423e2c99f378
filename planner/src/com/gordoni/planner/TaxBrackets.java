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

import java.util.Arrays;

/**
 * Progressive rate schedule. Rate rates[i] applies to the slice of income from lower_bounds[i] up to
 * lower_bounds[i + 1].
 */
public class TaxBrackets
{
        private final String name;
        private final double[] lower_bounds;
        private final double[] rates;

        public TaxBrackets(String name, double[] lower_bounds, double[] rates)
        {
                this.name = name;
                if (lower_bounds.length == 0 || lower_bounds.length != rates.length)
                        throw new TableDataException(name, "brackets", "expecting one rate per lower bound and at least one bracket");
                if (lower_bounds[0] != 0)
                        throw new TableDataException(name, "lower_bound[0]", "brackets must start at 0, not " + lower_bounds[0]);
                for (int i = 0; i < lower_bounds.length; i++)
                {
                        if (i > 0 && !(lower_bounds[i] > lower_bounds[i - 1]))
                                throw new TableDataException(name, "lower_bound[" + i + "]", "bounds must strictly increase: " + lower_bounds[i - 1] + " then " + lower_bounds[i]);
                        if (!(rates[i] >= 0 && rates[i] <= 1))
                                throw new TableDataException(name, "rate[" + i + "]", "rate must be between 0 and 1: " + rates[i]);
                }
                this.lower_bounds = lower_bounds.clone();
                this.rates = rates.clone();
        }

        /**
         * Flat schedule.
         */
        public static TaxBrackets flat(String name, double rate)
        {
                return new TaxBrackets(name, new double[]{0}, new double[]{rate});
        }

        public double tax(double income)
        {
                if (income < 0)
                        throw new TableDataException(name, "income", "negative income " + income);
                double tax = 0;
                for (int i = 0; i < lower_bounds.length && lower_bounds[i] < income; i++)
                {
                        double top = (i + 1 < lower_bounds.length) ? Math.min(income, lower_bounds[i + 1]) : income;
                        tax += (top - lower_bounds[i]) * rates[i];
                }
                return tax;
        }

        /**
         * Rate applied to the next dollar above income.
         */
        public double marginal_rate(double income)
        {
                int i = lower_bounds.length - 1;
                while (i > 0 && lower_bounds[i] > income)
                        i--;
                return rates[i];
        }

        /**
         * Lower bound of the bracket after the one containing income, or infinity in the top bracket.
         */
        public double next_bound(double income)
        {
                for (double bound : lower_bounds)
                        if (bound > income)
                                return bound;
                return Double.POSITIVE_INFINITY;
        }

        public int size()
        {
                return lower_bounds.length;
        }

        public double lower_bound(int i)
        {
                return lower_bounds[i];
        }

        public double rate(int i)
        {
                return rates[i];
        }

        public String getName()
        {
                return name;
        }

        @Override
        public boolean equals(Object o)
        {
                if (!(o instanceof TaxBrackets))
                        return false;
                TaxBrackets other = (TaxBrackets) o;
                return Arrays.equals(lower_bounds, other.lower_bounds) && Arrays.equals(rates, other.rates);
        }

        @Override
        public int hashCode()
        {
                return 31 * Arrays.hashCode(lower_bounds) + Arrays.hashCode(rates);
        }
}
