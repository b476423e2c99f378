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
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Everything that is projected: the household, its accounts and cash flows, and the assumptions applied
 * to them. Immutable; validated on construction. Ages are those of the first person.
 */
public class Scenario
{
        public static final List<AccountType> DEFAULT_WITHDRAWAL_ORDER = Collections.unmodifiableList(Arrays.asList(AccountType.TAXABLE, AccountType.TAX_DEFERRED, AccountType.ROTH));

        public static final int MAX_AGE = 120;

        public final String id;
        public final int start_year; // First simulated calendar year.
        public final List<Person> people;
        public final int retirement_age; // Contributions stop and portfolio funded spending starts at this age.
        public final int end_age; // Last simulated year is the year the first person reaches this age.
        public final List<Account> accounts;
        public final List<Contribution> contributions;
        public final Spending spending;
        public final List<IncomeStream> other_income;
        public final FilingStatus filing_status;
        public final String state; // State tax table, or null for none.
        public final double inflation; // Growth rate of spending, indexed income, and Social Security.
        public final CorrelationMode correlation;
        public final List<AccountType> withdrawal_order;
        public final WithdrawalStrategy withdrawal_strategy;
        public final ConversionPolicy conversion; // Null for no Roth conversions.

        public Scenario(String id, int start_year, List<Person> people, int retirement_age, int end_age, List<Account> accounts,
                List<Contribution> contributions, Spending spending, List<IncomeStream> other_income, FilingStatus filing_status, String state,
                double inflation, CorrelationMode correlation, List<AccountType> withdrawal_order, ConversionPolicy conversion)
        {
                this(id, start_year, people, retirement_age, end_age, accounts, contributions, spending, other_income, filing_status, state,
                        inflation, correlation, withdrawal_order, new OrderedWithdrawal(), conversion);
        }

        public Scenario(String id, int start_year, List<Person> people, int retirement_age, int end_age, List<Account> accounts,
                List<Contribution> contributions, Spending spending, List<IncomeStream> other_income, FilingStatus filing_status, String state,
                double inflation, CorrelationMode correlation, List<AccountType> withdrawal_order, WithdrawalStrategy withdrawal_strategy,
                ConversionPolicy conversion)
        {
                this.id = id;
                this.start_year = start_year;
                this.people = Collections.unmodifiableList(new ArrayList<Person>(people));
                this.retirement_age = retirement_age;
                this.end_age = end_age;
                this.accounts = Collections.unmodifiableList(new ArrayList<Account>(accounts));
                this.contributions = Collections.unmodifiableList(new ArrayList<Contribution>(contributions));
                this.spending = spending;
                this.other_income = Collections.unmodifiableList(new ArrayList<IncomeStream>(other_income));
                this.filing_status = filing_status;
                this.state = state;
                this.inflation = inflation;
                this.correlation = correlation;
                this.withdrawal_order = Collections.unmodifiableList(new ArrayList<AccountType>(withdrawal_order));
                this.withdrawal_strategy = withdrawal_strategy;
                this.conversion = conversion;

                validate();
        }

        private void fail(String field, String message)
        {
                throw new InvalidScenarioException(id, field, message);
        }

        private static boolean finite(double x)
        {
                return !Double.isNaN(x) && !Double.isInfinite(x);
        }

        private void validate()
        {
                if (id == null || id.trim().equals(""))
                        fail("id", "missing scenario id");

                if (people.size() < 1 || people.size() > 2)
                        fail("people", "expecting one or two people, not " + people.size());
                for (int i = 0; i < people.size(); i++)
                {
                        Person p = people.get(i);
                        String field = "people[" + i + "]";
                        if (p == null)
                                fail(field, "missing");
                        if (p.birth_year < 1900 || p.birth_year > 2100)
                                fail(field + ".birth_year", "implausible birth year " + p.birth_year);
                        if (p.birth_year > start_year)
                                fail(field + ".birth_year", "born after the start year");
                        if (!(p.pia >= 0) || !finite(p.pia))
                                fail(field + ".pia", "must be at least 0: " + p.pia);
                        if (p.claiming_age < SocialSecurity.EARLIEST_CLAIM_AGE || p.claiming_age > SocialSecurity.LATEST_CLAIM_AGE)
                                fail(field + ".claiming_age", "must be between " + SocialSecurity.EARLIEST_CLAIM_AGE + " and " + SocialSecurity.LATEST_CLAIM_AGE + ": " + p.claiming_age);
                        if (p.death_age != null && (p.death_age < p.age(start_year) || p.death_age > MAX_AGE))
                                fail(field + ".death_age", "must be between the start year age and " + MAX_AGE + ": " + p.death_age);
                        if (p.birth_year < RmdTable.EARLIEST_BIRTH_YEAR && p.age(start_year) < RmdTable.start_age(p.birth_year) && owns_tax_deferred(i))
                                fail(field + ".birth_year", "RMDs starting at 70 1/2 are not supported for tax-deferred savings held before age "
                                        + RmdTable.start_age(p.birth_year));
                }

                if (end_age <= start_age() || end_age > MAX_AGE)
                        fail("end_age", "must be after the start age " + start_age() + " and at most " + MAX_AGE + ": " + end_age);
                if (retirement_age < 0 || retirement_age > end_age)
                        fail("retirement_age", "must be between 0 and the end age: " + retirement_age);

                Set<String> names = new HashSet<String>();
                for (int i = 0; i < accounts.size(); i++)
                {
                        Account a = accounts.get(i);
                        String field = "accounts[" + i + "]";
                        if (a == null)
                                fail(field, "missing");
                        if (a.name == null || a.name.trim().equals(""))
                                fail(field + ".name", "missing account name");
                        if (!names.add(a.name))
                                fail(field + ".name", "duplicate account name " + a.name);
                        if (a.type == null)
                                fail(field + ".type", "missing account type");
                        if (!(a.balance >= 0) || !finite(a.balance))
                                fail(field + ".balance", "must be at least 0: " + a.balance);
                        if (a.type == AccountType.TAXABLE && !(a.cost_basis >= 0 && a.cost_basis <= a.balance))
                                fail(field + ".cost_basis", "must be between 0 and the balance: " + a.cost_basis);
                        if (!(a.mean_return > -1) || !finite(a.mean_return))
                                fail(field + ".mean_return", "must exceed -1: " + a.mean_return);
                        if (!(a.volatility >= 0) || !finite(a.volatility))
                                fail(field + ".volatility", "must be at least 0: " + a.volatility);
                        if (a.owner < 0 || a.owner >= people.size())
                                fail(field + ".owner", "no such person " + a.owner);
                }

                for (int i = 0; i < contributions.size(); i++)
                {
                        Contribution c = contributions.get(i);
                        String field = "contributions[" + i + "]";
                        if (account_index(c.account) == -1)
                                fail(field + ".account", "no such account " + c.account);
                        if (!(c.amount >= 0) || !finite(c.amount))
                                fail(field + ".amount", "must be at least 0: " + c.amount);
                        if (c.start_age > c.end_age)
                                fail(field + ".start_age", "after end age");
                }

                if (spending == null)
                        fail("spending", "missing spending");
                if (!(spending.annual >= 0) || !finite(spending.annual))
                        fail("spending.annual", "must be at least 0: " + spending.annual);
                for (Integer age : spending.special_expenses.keySet())
                {
                        Double amount = spending.special_expenses.get(age);
                        if (amount == null || !(amount >= 0) || !finite(amount))
                                fail("spending.special_expenses[" + age + "]", "must be at least 0: " + amount);
                }

                for (int i = 0; i < other_income.size(); i++)
                {
                        IncomeStream s = other_income.get(i);
                        String field = "other_income[" + i + "]";
                        if (!(s.amount >= 0) || !finite(s.amount))
                                fail(field + ".amount", "must be at least 0: " + s.amount);
                        if (s.start_age > s.end_age)
                                fail(field + ".start_age", "after end age");
                }

                if (filing_status == null)
                        fail("filing_status", "missing filing status");
                if (state != null && state.trim().equals(""))
                        fail("state", "empty state code");
                if (!(inflation > -1) || !finite(inflation))
                        fail("inflation", "must exceed -1: " + inflation);
                if (correlation == null)
                        fail("correlation", "missing correlation mode");

                if (withdrawal_order.size() != AccountType.values().length || !new HashSet<AccountType>(withdrawal_order).equals(EnumSet.allOf(AccountType.class)))
                        fail("withdrawal_order", "must list each account type exactly once: " + withdrawal_order);
                if (withdrawal_strategy == null)
                        fail("withdrawal_strategy", "missing withdrawal strategy");
                if (withdrawal_strategy instanceof BracketWithdrawal)
                {
                        double limit = ((BracketWithdrawal) withdrawal_strategy).pre_tax_limit;
                        if (!(limit >= 0) || !finite(limit))
                                fail("withdrawal_strategy.pre_tax_limit", "must be at least 0: " + limit);
                }

                if (conversion != null)
                {
                        if (conversion.funding == null)
                                fail("conversion.funding", "missing funding source");
                        if (!(conversion.cap() >= 0))
                                fail("conversion.annual_cap", "must be at least 0: " + conversion.cap());
                        if (conversion.start_age > conversion.end_age)
                                fail("conversion.start_age", "after end age");
                        if (conversion instanceof ConversionBracketFill)
                        {
                                double rate = ((ConversionBracketFill) conversion).bracket_rate;
                                if (!(rate > 0 && rate <= 1))
                                        fail("conversion.bracket_rate", "must be between 0 and 1: " + rate);
                        }
                }
        }

        private boolean owns_tax_deferred(int person)
        {
                for (Account a : accounts)
                        if (a != null && a.type == AccountType.TAX_DEFERRED && a.owner == person)
                                return true;
                return false;
        }

        public int start_age()
        {
                return people.get(0).age(start_year);
        }

        public int end_year()
        {
                return people.get(0).birth_year + end_age;
        }

        public int num_years()
        {
                return end_year() - start_year + 1;
        }

        public int account_index(String name)
        {
                for (int i = 0; i < accounts.size(); i++)
                        if (accounts.get(i).name.equals(name))
                                return i;
                return -1;
        }

        /**
         * Independent copy with a different annual conversion cap. A scenario without a conversion policy
         * gains a fixed cap policy spanning the whole plan with tax paid from taxable savings.
         */
        public Scenario with_conversion_cap(double cap)
        {
                ConversionPolicy policy;
                if (conversion == null)
                        policy = new ConversionCap(cap, start_age(), end_age, ConversionFunding.TAXABLE);
                else
                        policy = conversion.with_cap(cap);
                return new Scenario(id, start_year, people, retirement_age, end_age, accounts, contributions, spending, other_income,
                        filing_status, state, inflation, correlation, withdrawal_order, withdrawal_strategy, policy);
        }

        public Scenario with_spending(Spending spending)
        {
                return new Scenario(id, start_year, people, retirement_age, end_age, accounts, contributions, spending, other_income,
                        filing_status, state, inflation, correlation, withdrawal_order, withdrawal_strategy, conversion);
        }

        public Scenario with_withdrawals(List<AccountType> withdrawal_order, WithdrawalStrategy withdrawal_strategy)
        {
                return new Scenario(id, start_year, people, retirement_age, end_age, accounts, contributions, spending, other_income,
                        filing_status, state, inflation, correlation, withdrawal_order, withdrawal_strategy, conversion);
        }

        @Override
        public boolean equals(Object o)
        {
                if (!(o instanceof Scenario))
                        return false;
                Scenario s = (Scenario) o;
                return id.equals(s.id) && start_year == s.start_year && people.equals(s.people) && retirement_age == s.retirement_age
                        && end_age == s.end_age && accounts.equals(s.accounts) && contributions.equals(s.contributions)
                        && spending.equals(s.spending) && other_income.equals(s.other_income) && filing_status == s.filing_status
                        && Objects.equals(state, s.state) && Double.compare(inflation, s.inflation) == 0 && correlation == s.correlation
                        && withdrawal_order.equals(s.withdrawal_order) && withdrawal_strategy.equals(s.withdrawal_strategy) && Objects.equals(conversion, s.conversion);
        }

        @Override
        public int hashCode()
        {
                return Objects.hash(id, start_year, people, retirement_age, end_age, accounts, contributions, spending, other_income,
                        filing_status, state, inflation, correlation, withdrawal_order, withdrawal_strategy, conversion);
        }

        public String toString()
        {
                return "scenario " + id;
        }
}
