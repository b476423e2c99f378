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
 * Federal schedule for one tax year and filing status.
 */
public class TaxTable
{
        public final int year;
        public final FilingStatus filing_status;
        public final double standard_deduction;
        public final TaxBrackets ordinary;
        public final TaxBrackets capital_gains;

        public TaxTable(int year, FilingStatus filing_status, double standard_deduction, TaxBrackets ordinary, TaxBrackets capital_gains)
        {
                if (!(standard_deduction >= 0))
                        throw new TableDataException(ordinary.getName(), "standard_deduction", "negative standard deduction " + standard_deduction);
                this.year = year;
                this.filing_status = filing_status;
                this.standard_deduction = standard_deduction;
                this.ordinary = ordinary;
                this.capital_gains = capital_gains;
        }
}
