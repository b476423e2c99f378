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
 * Convert enough to fill ordinary income up to the top of the federal bracket taxed at bracket_rate,
 * never more than cap.
 */
public class ConversionBracketFill extends ConversionPolicy
{
        public final double bracket_rate;
        private final double cap;

        public ConversionBracketFill(double bracket_rate, double cap, int start_age, int end_age, ConversionFunding funding)
        {
                super(start_age, end_age, funding);
                this.bracket_rate = bracket_rate;
                this.cap = cap;
        }

        protected double convert(ConversionContext context)
        {
                double top = context.tax_engine.bracket_top(bracket_rate, context.filing_status, context.year);
                return Math.min(cap, top - context.ordinary_income);
        }

        public String type()
        {
                return "bracket";
        }

        public double cap()
        {
                return cap;
        }

        public ConversionPolicy with_cap(double cap)
        {
                return new ConversionBracketFill(bracket_rate, cap, start_age, end_age, funding);
        }

        @Override
        public boolean equals(Object o)
        {
                return super.equals(o) && Double.compare(bracket_rate, ((ConversionBracketFill) o).bracket_rate) == 0;
        }

        @Override
        public int hashCode()
        {
                return 31 * super.hashCode() + Double.valueOf(bracket_rate).hashCode();
        }
}
