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
 * State of the current year offered to a conversion policy, after RMDs and before spending withdrawals.
 */
public class ConversionContext
{
        public final int year;
        public final int age;
        public final double tax_deferred_balance;
        public final double ordinary_income; // Ordinary income realized so far this year.
        public final FilingStatus filing_status;
        public final TaxEngine tax_engine;

        public ConversionContext(int year, int age, double tax_deferred_balance, double ordinary_income, FilingStatus filing_status, TaxEngine tax_engine)
        {
                this.year = year;
                this.age = age;
                this.tax_deferred_balance = tax_deferred_balance;
                this.ordinary_income = ordinary_income;
                this.filing_status = filing_status;
                this.tax_engine = tax_engine;
        }
}
