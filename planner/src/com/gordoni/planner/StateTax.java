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
 * State income tax for one state and tax year. A flat rate is a single bracket starting at 0.
 */
public class StateTax
{
        public final String state;
        public final int year;
        public final FilingStatus filing_status; // Null if the entry applies to every filing status.
        public final double standard_deduction;
        public final boolean include_gains; // Whether capital gains are part of the state tax base.
        public final TaxBrackets brackets;

        public StateTax(String state, int year, FilingStatus filing_status, double standard_deduction, boolean include_gains, TaxBrackets brackets)
        {
                if (!(standard_deduction >= 0))
                        throw new TableDataException(brackets.getName(), "standard_deduction", "negative standard deduction " + standard_deduction);
                this.state = state;
                this.year = year;
                this.filing_status = filing_status;
                this.standard_deduction = standard_deduction;
                this.include_gains = include_gains;
                this.brackets = brackets;
        }

        public double tax(double ordinary_income, double capital_gains)
        {
                double base = ordinary_income + (include_gains ? capital_gains : 0);
                return brackets.tax(Math.max(0, base - standard_deduction));
        }
}
