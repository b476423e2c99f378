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
 * Federal and state income tax for one year of a household's income.
 *
 * Ordinary income is taxed by marginal slices. Capital gains use their own brackets stacked on top of
 * ordinary income, so the gains brackets are evaluated against ordinary income plus gains. The standard
 * deduction offsets ordinary income first and any remainder offsets gains.
 */
public class TaxEngine
{
        private final TaxTables tables;

        public TaxEngine(TaxTables tables)
        {
                this.tables = tables;
        }

        public TaxResult tax(double ordinary_income, double capital_gains, FilingStatus filing_status, int year, String state)
        {
                if (!(ordinary_income >= 0))
                        throw new TableDataException(tables.getName(), "ordinary_income", "negative or undefined income " + ordinary_income);
                if (!(capital_gains >= 0))
                        throw new TableDataException(tables.getName(), "capital_gains", "negative or undefined gains " + capital_gains);

                TaxTable federal = tables.federal(year, filing_status);
                double taxable_ordinary = Math.max(0, ordinary_income - federal.standard_deduction);
                double unused_deduction = Math.max(0, federal.standard_deduction - ordinary_income);
                double taxable_gains = Math.max(0, capital_gains - unused_deduction);

                double ordinary_tax = federal.ordinary.tax(taxable_ordinary);
                double gains_tax = federal.capital_gains.tax(taxable_ordinary + taxable_gains) - federal.capital_gains.tax(taxable_ordinary);

                double state_tax = 0;
                StateTax state_table = tables.state(year, filing_status, state);
                if (state_table != null)
                        state_tax = state_table.tax(ordinary_income, capital_gains);

                return new TaxResult(ordinary_tax, gains_tax, state_tax);
        }

        public TaxResult tax(double ordinary_income, double capital_gains, FilingStatus filing_status, int year)
        {
                return tax(ordinary_income, capital_gains, filing_status, year, null);
        }

        /**
         * Federal rate on the next dollar of ordinary income.
         */
        public double marginal_rate(double ordinary_income, FilingStatus filing_status, int year)
        {
                TaxTable federal = tables.federal(year, filing_status);
                double taxable = ordinary_income - federal.standard_deduction;
                if (taxable < 0)
                        return 0;
                return federal.ordinary.marginal_rate(taxable);
        }

        /**
         * Gross ordinary income at which taxable ordinary income reaches the top of the bracket with the given rate.
         */
        public double bracket_top(double rate, FilingStatus filing_status, int year)
        {
                TaxTable federal = tables.federal(year, filing_status);
                TaxBrackets brackets = federal.ordinary;
                for (int i = 0; i < brackets.size(); i++)
                        if (brackets.rate(i) == rate)
                                return federal.standard_deduction + ((i + 1 < brackets.size()) ? brackets.lower_bound(i + 1) : Double.POSITIVE_INFINITY);
                throw new TableDataException(tables.getName(), year + "/" + filing_status.key, "no bracket with rate " + rate);
        }

        public TaxTables getTables()
        {
                return tables;
        }
}
