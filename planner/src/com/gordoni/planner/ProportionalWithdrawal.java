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

import java.util.List;

/**
 * Split the need between taxable and tax-deferred accounts in proportion to their balances, so both run
 * down together. Anything they can't cover comes from the remaining accounts in withdrawal order.
 */
public class ProportionalWithdrawal extends WithdrawalStrategy
{
        public double withdraw(Holdings holdings, double need, double rmd, List<AccountType> order, double[] record)
        {
                double taxable = holdings.total(AccountType.TAXABLE);
                double deferred = holdings.total(AccountType.TAX_DEFERRED);
                if (taxable + deferred > 0)
                {
                        double taxable_share = need * taxable / (taxable + deferred);
                        double deferred_share = need - taxable_share;
                        need -= holdings.withdraw_type(taxable_share, AccountType.TAXABLE, record);
                        need -= holdings.withdraw_type(deferred_share, AccountType.TAX_DEFERRED, record);
                }
                return holdings.withdraw(need, order, record);
        }

        public String type()
        {
                return "proportional";
        }
}
