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

public class TaxResult
{
        public final double federal_tax;
        public final double state_tax;
        public final double ordinary_tax; // Federal tax on ordinary income.
        public final double gains_tax; // Federal tax on capital gains.

        public TaxResult(double ordinary_tax, double gains_tax, double state_tax)
        {
                this.ordinary_tax = ordinary_tax;
                this.gains_tax = gains_tax;
                this.federal_tax = ordinary_tax + gains_tax;
                this.state_tax = state_tax;
        }

        public double total()
        {
                return federal_tax + state_tax;
        }

        public String toString()
        {
                return "{federal: " + federal_tax + ", state: " + state_tax + "}";
        }
}
