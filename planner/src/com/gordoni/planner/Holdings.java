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
 * Balances of one path, and the income realized from them during the current year.
 *
 * Cash is income that has been received but neither spent nor invested. It earns nothing, is drawn
 * before any account, and counts toward net worth.
 */
public class Holdings
{
        public final AccountType[] types;
        public final double[] balance;
        public final double[] basis; // Cost basis of taxable accounts, zero for the others.
        public double cash;
        public double ordinary; // Ordinary income realized this year.
        public double gains; // Net realized gains this year. May be negative.

        public Holdings(List<Account> accounts)
        {
                int num_accounts = accounts.size();
                types = new AccountType[num_accounts];
                balance = new double[num_accounts];
                basis = new double[num_accounts];
                for (int a = 0; a < num_accounts; a++)
                {
                        Account account = accounts.get(a);
                        types[a] = account.type;
                        balance[a] = account.balance;
                        basis[a] = (account.type == AccountType.TAXABLE) ? account.cost_basis : 0;
                }
        }

        public void deposit(int a, double amount, double[] record)
        {
                balance[a] += amount;
                if (types[a] == AccountType.TAXABLE)
                        basis[a] += amount;
                record[a] += amount;
        }

        /**
         * Withdraw up to amount from accounts of one type, first account first, realizing income. Returns the
         * amount withdrawn.
         */
        public double withdraw_type(double amount, AccountType type, double[] record)
        {
                double taken = 0;
                for (int a = 0; a < types.length && amount - taken > 0; a++)
                {
                        if (types[a] != type || balance[a] <= 0)
                                continue;
                        double take = Math.min(amount - taken, balance[a]);
                        if (type == AccountType.TAXABLE)
                        {
                                double basis_used = (take == balance[a]) ? basis[a] : basis[a] * take / balance[a];
                                gains += take - basis_used;
                                basis[a] -= basis_used;
                        }
                        else if (type == AccountType.TAX_DEFERRED)
                                ordinary += take;
                        balance[a] -= take;
                        record[a] += take;
                        taken += take;
                }
                return taken;
        }

        /**
         * Withdraw amount from accounts by type in the given order. Returns the amount that couldn't be found.
         */
        public double withdraw(double amount, List<AccountType> order, double[] record)
        {
                for (AccountType type : order)
                {
                        if (amount <= 0)
                                break;
                        amount -= withdraw_type(amount, type, record);
                }
                return amount;
        }

        /**
         * Take up to amount from cash. Returns the amount taken.
         */
        public double draw_cash(double amount)
        {
                double take = Math.max(0, Math.min(amount, cash));
                cash -= take;
                return take;
        }

        public double total(AccountType type)
        {
                double total = 0;
                for (int a = 0; a < types.length; a++)
                        if (types[a] == type)
                                total += balance[a];
                return total;
        }
}
