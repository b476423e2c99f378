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
import java.util.List;

/**
 * Tables and scenarios shared by the tests.
 */
class Fixtures
{
        static final TaxTables TAX_TABLES = TaxTables.load("tax-tables.json");
        static final RmdTable RMD_TABLE = RmdTable.load("irs-pub590b-uniform_lifetime-2022.csv");

        static TaxTables zero_tax_tables()
        {
                List<TaxTable> federal = new ArrayList<TaxTable>();
                for (FilingStatus status : FilingStatus.values())
                        federal.add(new TaxTable(2024, status, 0, TaxBrackets.flat("zero", 0), TaxBrackets.flat("zero", 0)));
                return new TaxTables("zero", federal, Collections.<StateTax>emptyList());
        }

        static Config config()
        {
                Config config = new Config();
                config.workers = 2;
                config.tasks = 20;
                return config;
        }

        static LedgerSimulator simulator(Scenario scenario, TaxTables tables)
        {
                return new LedgerSimulator(scenario, config(), new TaxEngine(tables), RMD_TABLE);
        }

        static PathOutcome simulate(Scenario scenario, TaxTables tables)
        {
                return simulator(scenario, tables).simulate(0, new ReturnSampler(0, 0));
        }

        static Scenario scenario(String id, List<Person> people, int start_year, int retirement_age, int end_age, List<Account> accounts,
                List<Contribution> contributions, Spending spending, List<IncomeStream> other_income, FilingStatus filing_status, String state,
                ConversionPolicy conversion)
        {
                return new Scenario(id, start_year, people, retirement_age, end_age, accounts, contributions, spending, other_income,
                        filing_status, state, 0, CorrelationMode.FULL, Scenario.DEFAULT_WITHDRAWAL_ORDER, conversion);
        }

        static Scenario single(String id, int birth_year, int start_year, int end_age, List<Account> accounts, double spending, ConversionPolicy conversion)
        {
                List<Person> people = Arrays.asList(new Person("Pat", birth_year, 0, 67));
                return scenario(id, people, start_year, 0, end_age, accounts, Collections.<Contribution>emptyList(), new Spending(spending),
                        Collections.<IncomeStream>emptyList(), FilingStatus.SINGLE, null, conversion);
        }

        /**
         * $1,000,000 tax-deferred, $40,000 a year spending, no returns or Social Security, age 65 to 95.
         */
        static Scenario depletion_baseline()
        {
                return single("baseline", 1960, 2025, 95, Arrays.asList(new Account("ira", AccountType.TAX_DEFERRED, 1000000, 0, 0)), 40000, null);
        }

        /**
         * Household with every account type and random returns.
         */
        static Scenario diversified(double spending, ConversionPolicy conversion)
        {
                List<Account> accounts = Arrays.asList(
                        new Account("brokerage", AccountType.TAXABLE, 200000, 120000, 0.05, 0.12, 0),
                        new Account("ira", AccountType.TAX_DEFERRED, 600000, 0, 0.05, 0.12, 0),
                        new Account("roth", AccountType.ROTH, 50000, 0, 0.05, 0.12, 0));
                List<Person> people = Arrays.asList(new Person("Pat", 1959, 2200, 67));
                return scenario("diversified", people, 2024, 65, 95, accounts, Collections.<Contribution>emptyList(), new Spending(spending),
                        Collections.<IncomeStream>emptyList(), FilingStatus.SINGLE, null, conversion);
        }
}
