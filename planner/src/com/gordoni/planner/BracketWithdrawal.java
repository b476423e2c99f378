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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Draw tax-deferred accounts first, but only up to pre_tax_limit of tax-deferred income a year counting the
 * RMD, so withdrawals stay within a chosen bracket. The rest comes from the other accounts in withdrawal
 * order, with tax-deferred accounts last.
 *
 * The limit is in nominal dollars and is not inflation indexed.
 */
public class BracketWithdrawal extends WithdrawalStrategy
{
        public final double pre_tax_limit;

        public BracketWithdrawal(double pre_tax_limit)
        {
                this.pre_tax_limit = pre_tax_limit;
        }

        public double withdraw(Holdings holdings, double need, double rmd, List<AccountType> order, double[] record)
        {
                double room = Math.max(0, pre_tax_limit - rmd);
                need -= holdings.withdraw_type(Math.min(need, room), AccountType.TAX_DEFERRED, record);

                List<AccountType> rest = new ArrayList<AccountType>();
                for (AccountType type : order)
                        if (type != AccountType.TAX_DEFERRED)
                                rest.add(type);
                rest.add(AccountType.TAX_DEFERRED);

                return holdings.withdraw(need, rest, record);
        }

        public String type()
        {
                return "tax_bracket";
        }

        @Override
        public boolean equals(Object o)
        {
                return super.equals(o) && Double.compare(pre_tax_limit, ((BracketWithdrawal) o).pre_tax_limit) == 0;
        }

        @Override
        public int hashCode()
        {
                return Objects.hash(type(), pre_tax_limit);
        }
}
