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
 * One simulated year of one path. Per account arrays are indexed like Scenario.accounts and satisfy
 *
 *     end = start + contribution + growth - rmd_taken - withdrawal + conversion - tax_paid
 *
 * where conversion is negative for accounts converted from and positive for the account converted to.
 * Uninvested cash satisfies
 *
 *     cash = cash_start + cash_deposit - cash_withdrawal - cash_tax_paid - cash_swept
 */
public class LedgerYear
{
        public final int year;
        public final int age;

        public final AccountType[] types;
        public final double[] start_balance;
        public final double[] contribution; // Scheduled contributions plus cash swept into the account.
        public final double[] returns; // Sampled rate of return.
        public final double[] growth;
        public final double[] rmd_required;
        public final double[] rmd_taken;
        public final double[] withdrawal; // Discretionary withdrawals to meet spending.
        public final double[] conversion;
        public final double[] tax_paid; // Withdrawals used to pay tax, and tax withheld from conversions.
        public final double[] end_balance;

        public final double social_security;
        public final double other_income;
        public final double spending;
        public final double conversion_amount;
        public final double conversion_tax;
        public final double ordinary_income;
        public final double capital_gains;
        public final double federal_tax;
        public final double state_tax;
        public final double cash_start;
        public final double cash_deposit; // Income in excess of spending.
        public final double cash_withdrawal; // Cash used for spending.
        public final double cash_tax_paid;
        public final double cash_swept; // Cash moved into the first taxable account.
        public final double cash; // Carried into the next year.
        public final double shortfall; // Spending and tax left unpaid once every account was exhausted.

        public LedgerYear(int year, int age, AccountType[] types, double[] start_balance, double[] contribution, double[] returns, double[] growth,
                double[] rmd_required, double[] rmd_taken, double[] withdrawal, double[] conversion, double[] tax_paid, double[] end_balance,
                double social_security, double other_income, double spending, double conversion_amount, double conversion_tax,
                double ordinary_income, double capital_gains, double federal_tax, double state_tax,
                double cash_start, double cash_deposit, double cash_withdrawal, double cash_tax_paid, double cash_swept, double cash, double shortfall)
        {
                this.year = year;
                this.age = age;
                this.types = types.clone();
                this.start_balance = start_balance.clone();
                this.contribution = contribution.clone();
                this.returns = returns.clone();
                this.growth = growth.clone();
                this.rmd_required = rmd_required.clone();
                this.rmd_taken = rmd_taken.clone();
                this.withdrawal = withdrawal.clone();
                this.conversion = conversion.clone();
                this.tax_paid = tax_paid.clone();
                this.end_balance = end_balance.clone();
                this.social_security = social_security;
                this.other_income = other_income;
                this.spending = spending;
                this.conversion_amount = conversion_amount;
                this.conversion_tax = conversion_tax;
                this.ordinary_income = ordinary_income;
                this.capital_gains = capital_gains;
                this.federal_tax = federal_tax;
                this.state_tax = state_tax;
                this.cash_start = cash_start;
                this.cash_deposit = cash_deposit;
                this.cash_withdrawal = cash_withdrawal;
                this.cash_tax_paid = cash_tax_paid;
                this.cash_swept = cash_swept;
                this.cash = cash;
                this.shortfall = shortfall;
        }

        private static double sum(double[] v)
        {
                double s = 0;
                for (double x : v)
                        s += x;
                return s;
        }

        public double rmd_required_total()
        {
                return sum(rmd_required);
        }

        public double rmd_taken_total()
        {
                return sum(rmd_taken);
        }

        public double withdrawal_total()
        {
                return sum(withdrawal);
        }

        public double total_tax()
        {
                return federal_tax + state_tax;
        }

        public double net_worth()
        {
                return sum(end_balance) + cash;
        }

        public double balance(AccountType type)
        {
                double s = 0;
                for (int a = 0; a < types.length; a++)
                        if (types[a] == type)
                                s += end_balance[a];
                return s;
        }

        /**
         * Cash available for spending and tax before tax: benefits, other income, RMDs and spending withdrawals.
         */
        public double income()
        {
                return social_security + other_income + rmd_taken_total() + withdrawal_total();
        }

        public boolean failed()
        {
                return shortfall > 0;
        }

        public String toString()
        {
                return String.format("%d age %d: net worth %.2f cash %.2f ss %.2f rmd %.2f withdrawal %.2f conversion %.2f ordinary %.2f gains %.2f tax %.2f+%.2f shortfall %.2f",
                        year, age, net_worth(), cash, social_security, rmd_taken_total(), withdrawal_total(), conversion_amount, ordinary_income, capital_gains,
                        federal_tax, state_tax, shortfall);
        }
}
