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

/**
 * Year by year projection of one scenario along one sequence of returns.
 *
 * Each year, in order: Social Security and other income; growth on the beginning of year balances;
 * contributions while working; RMDs from the prior year end balances; Roth conversion; spending, met from
 * cash and then by the scenario's withdrawal strategy; tax, paid from cash, then taxable accounts, then the
 * remaining accounts in withdrawal order, repeating while paying tax creates more tax. Cash left at the end
 * of the year is swept into the first taxable account, or carried to the next year when there is none.
 * A year whose spending or tax can't be met ends the path as a failure.
 *
 * Holds no per path state, so one instance may simulate many paths concurrently.
 */
public class LedgerSimulator
{
        private static final double EPSILON = 1e-6;

        private final Scenario scenario;
        private final Config config;
        private final TaxEngine tax_engine;
        private final RmdTable rmd_table;

        private final int num_accounts;
        private final AccountType[] types;
        private final double[] mean;
        private final double[] volatility;
        private final int[] contribution_account;
        private final int taxable_account; // First taxable account, or -1.
        private final int roth_account; // First Roth account, or -1.
        private final double[] benefit; // Annual Social Security of each person in start year dollars.
        private final List<AccountType> tax_order;

        public LedgerSimulator(Scenario scenario, Config config, TaxEngine tax_engine, RmdTable rmd_table)
        {
                this.scenario = scenario;
                this.config = config;
                this.tax_engine = tax_engine;
                this.rmd_table = rmd_table;

                if (scenario.state != null && !tax_engine.getTables().has_state(scenario.state))
                        throw new InvalidScenarioException(scenario.id, "state", "no tax table for state " + scenario.state);
                tax_engine.tax(0, 0, scenario.filing_status, scenario.start_year, scenario.state); // Fail before the run if the tables lack this household.

                num_accounts = scenario.accounts.size();
                types = new AccountType[num_accounts];
                mean = new double[num_accounts];
                volatility = new double[num_accounts];
                int first_taxable = -1;
                int first_roth = -1;
                for (int a = 0; a < num_accounts; a++)
                {
                        Account account = scenario.accounts.get(a);
                        types[a] = account.type;
                        mean[a] = account.mean_return;
                        volatility[a] = account.volatility;
                        if (account.type == AccountType.TAXABLE && first_taxable == -1)
                                first_taxable = a;
                        if (account.type == AccountType.ROTH && first_roth == -1)
                                first_roth = a;
                }
                taxable_account = first_taxable;
                roth_account = first_roth;

                contribution_account = new int[scenario.contributions.size()];
                for (int c = 0; c < contribution_account.length; c++)
                        contribution_account[c] = scenario.account_index(scenario.contributions.get(c).account);

                benefit = new double[scenario.people.size()];
                for (int i = 0; i < benefit.length; i++)
                {
                        Person p = scenario.people.get(i);
                        benefit[i] = SocialSecurity.annual_benefit_months(p.pia, p.claiming_age * 12, SocialSecurity.full_retirement_age_months(p.birth_year));
                }

                tax_order = new ArrayList<AccountType>();
                tax_order.add(AccountType.TAXABLE);
                for (AccountType type : scenario.withdrawal_order)
                        if (type != AccountType.TAXABLE)
                                tax_order.add(type);

                assert(config.tax_iterations >= 1);
        }

        /**
         * Household Social Security for a year in start year dollars.
         */
        private double social_security(int year)
        {
                List<Person> people = scenario.people;
                double total = 0;
                if (people.size() == 2 && people.get(0).alive(year) != people.get(1).alive(year))
                {
                        int survivor = people.get(0).alive(year) ? 0 : 1;
                        Person p = people.get(survivor);
                        if (p.age(year) >= p.claiming_age)
                                total = SocialSecurity.survivor_benefit(benefit[survivor], benefit[1 - survivor]);
                }
                else
                {
                        for (int i = 0; i < people.size(); i++)
                        {
                                Person p = people.get(i);
                                if (p.alive(year) && p.age(year) >= p.claiming_age)
                                        total += benefit[i];
                        }
                }
                return total;
        }

        /**
         * Person whose age sets an account's RMD. A surviving spouse is treated as having rolled the account over.
         */
        private Person rmd_owner(int a, int year)
        {
                int owner = scenario.accounts.get(a).owner;
                Person p = scenario.people.get(owner);
                if (!p.alive(year) && scenario.people.size() == 2 && scenario.people.get(1 - owner).alive(year))
                        p = scenario.people.get(1 - owner);
                return p;
        }

        private TaxResult tax(double ordinary, double gains, int year)
        {
                return tax_engine.tax(Math.max(0, ordinary), Math.max(0, gains), scenario.filing_status, year, scenario.state);
        }

        public PathOutcome simulate(int path, ReturnSampler sampler)
        {
                Holdings holdings = new Holdings(scenario.accounts);
                WithdrawalStrategy strategy = scenario.withdrawal_strategy;
                List<LedgerYear> ledger = new ArrayList<LedgerYear>();
                Person primary = scenario.people.get(0);
                ConversionPolicy policy = scenario.conversion;
                double lifetime_tax = 0;
                Integer failure_year = null;

                for (int year = scenario.start_year; year <= scenario.end_year(); year++)
                {
                        int age = primary.age(year);
                        double index = Math.pow(1 + scenario.inflation, year - scenario.start_year);
                        double[] start = holdings.balance.clone();
                        double cash_start = holdings.cash;
                        double[] contribution = new double[num_accounts];
                        double[] growth = new double[num_accounts];
                        double[] rmd_required = new double[num_accounts];
                        double[] rmd_taken = new double[num_accounts];
                        double[] withdrawal = new double[num_accounts];
                        double[] conversion = new double[num_accounts];
                        double[] tax_paid = new double[num_accounts];
                        holdings.ordinary = 0;
                        holdings.gains = 0;

                        // Income.
                        double social_security = social_security(year) * index;
                        double other_income = 0;
                        for (IncomeStream stream : scenario.other_income)
                                if (stream.applies(age))
                                {
                                        double amount = stream.amount * (stream.inflation_indexed ? index : 1);
                                        other_income += amount;
                                        if (stream.taxable)
                                                holdings.ordinary += amount;
                                }

                        // Growth.
                        double[] returns = sampler.sample_year(mean, volatility, scenario.correlation);
                        for (int a = 0; a < num_accounts; a++)
                        {
                                growth[a] = holdings.balance[a] * returns[a];
                                holdings.balance[a] = Math.max(0, holdings.balance[a] + growth[a]);
                        }

                        if (age < scenario.retirement_age)
                                for (int c = 0; c < contribution_account.length; c++)
                                {
                                        Contribution contrib = scenario.contributions.get(c);
                                        if (contrib.applies(age))
                                                holdings.deposit(contribution_account[c], contrib.amount, contribution);
                                }

                        // RMDs.
                        double rmd_cash = 0;
                        for (int a = 0; a < num_accounts; a++)
                        {
                                if (types[a] != AccountType.TAX_DEFERRED)
                                        continue;
                                Person owner = rmd_owner(a, year);
                                rmd_required[a] = rmd_table.required_minimum(owner.age(year), start[a], owner.birth_year);
                                double take = Math.min(rmd_required[a], holdings.balance[a]);
                                holdings.balance[a] -= take;
                                rmd_taken[a] = take;
                                holdings.ordinary += take;
                                rmd_cash += take;
                        }

                        // Roth conversion.
                        double conversion_amount = 0;
                        if (policy != null && roth_account != -1)
                        {
                                double available = holdings.total(AccountType.TAX_DEFERRED);
                                ConversionContext context = new ConversionContext(year, age, available, holdings.ordinary, scenario.filing_status, tax_engine);
                                double amount = Math.min(policy.propose(context), available);
                                for (int a = 0; a < num_accounts && amount - conversion_amount > 0; a++)
                                {
                                        if (types[a] != AccountType.TAX_DEFERRED)
                                                continue;
                                        double take = Math.min(amount - conversion_amount, holdings.balance[a]);
                                        holdings.balance[a] -= take;
                                        conversion[a] -= take;
                                        conversion_amount += take;
                                }
                                holdings.balance[roth_account] += conversion_amount;
                                conversion[roth_account] += conversion_amount;
                                holdings.ordinary += conversion_amount;
                        }

                        // Spending.
                        double spending = (age >= scenario.retirement_age) ? scenario.spending.at_age(age) * index : 0;
                        double need = spending - (social_security + other_income + rmd_cash);
                        double cash_deposit = 0;
                        double cash_withdrawal = 0;
                        double shortfall = 0;
                        if (need > 0)
                        {
                                cash_withdrawal = holdings.draw_cash(need);
                                shortfall = strategy.withdraw(holdings, need - cash_withdrawal, rmd_cash, scenario.withdrawal_order, withdrawal);
                        }
                        else
                        {
                                cash_deposit = -need;
                                holdings.cash += cash_deposit;
                        }

                        // Tax.
                        double paid = 0;
                        double cash_tax_paid = 0;
                        double withheld = 0;
                        TaxResult tax = null;
                        for (int i = 0; i < config.tax_iterations; i++)
                        {
                                tax = tax(holdings.ordinary, holdings.gains, year);
                                double due = tax.total() - paid;
                                if (due <= config.tax_tolerance)
                                        break;
                                if (conversion_amount > 0 && policy.funding == ConversionFunding.CONVERTED)
                                {
                                        double conversion_tax = tax.total() - tax(holdings.ordinary - conversion_amount, holdings.gains, year).total();
                                        double withhold = Math.min(Math.min(conversion_tax - withheld, due), Math.min(conversion_amount - withheld, holdings.balance[roth_account]));
                                        if (withhold > 0)
                                        {
                                                holdings.balance[roth_account] -= withhold;
                                                tax_paid[roth_account] += withhold;
                                                withheld += withhold;
                                                paid += withhold;
                                                due -= withhold;
                                        }
                                }
                                double from_cash = holdings.draw_cash(due);
                                cash_tax_paid += from_cash;
                                paid += from_cash;
                                due -= from_cash;
                                double unpaid = holdings.withdraw(due, tax_order, tax_paid);
                                paid += due - unpaid;
                                if (unpaid > EPSILON)
                                {
                                        shortfall += unpaid;
                                        break;
                                }
                        }
                        assert(tax != null);
                        lifetime_tax += paid;

                        double cash_swept = 0;
                        if (holdings.cash > 0 && taxable_account != -1)
                        {
                                cash_swept = holdings.cash;
                                holdings.deposit(taxable_account, cash_swept, contribution);
                                holdings.cash = 0;
                        }

                        double conversion_tax = 0;
                        if (conversion_amount > 0)
                                conversion_tax = tax.total() - tax(holdings.ordinary - conversion_amount, holdings.gains, year).total();

                        if (shortfall <= EPSILON)
                                shortfall = 0;

                        LedgerYear ledger_year = new LedgerYear(year, age, types, start, contribution, returns, growth, rmd_required, rmd_taken,
                                withdrawal, conversion, tax_paid, holdings.balance, social_security, other_income, spending, conversion_amount, conversion_tax,
                                holdings.ordinary, holdings.gains, tax.federal_tax, tax.state_tax,
                                cash_start, cash_deposit, cash_withdrawal, cash_tax_paid, cash_swept, holdings.cash, shortfall);
                        ledger.add(ledger_year);
                        if (config.trace)
                                System.out.println("path " + path + " " + ledger_year);

                        if (shortfall > 0)
                        {
                                failure_year = year;
                                break;
                        }
                }

                double terminal_net_worth = ledger.isEmpty() ? 0 : ledger.get(ledger.size() - 1).net_worth();

                return new PathOutcome(path, failure_year == null, failure_year, terminal_net_worth, lifetime_tax, ledger);
        }

        public Scenario getScenario()
        {
                return scenario;
        }
}
