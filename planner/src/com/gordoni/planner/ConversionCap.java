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
 * Convert a fixed amount each year of the window.
 */
public class ConversionCap extends ConversionPolicy
{
        private final double cap;

        public ConversionCap(double cap, int start_age, int end_age, ConversionFunding funding)
        {
                super(start_age, end_age, funding);
                this.cap = cap;
        }

        protected double convert(ConversionContext context)
        {
                return cap;
        }

        public String type()
        {
                return "cap";
        }

        public double cap()
        {
                return cap;
        }

        public ConversionPolicy with_cap(double cap)
        {
                return new ConversionCap(cap, start_age, end_age, funding);
        }
}
