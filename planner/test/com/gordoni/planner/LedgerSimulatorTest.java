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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LedgerSimulatorTest
{
        private static final TaxTables ZERO_TAX = Fixtures.zero_tax_tables();

        @Test
        @DisplayName("$1M at $40k a year with no returns or tax lasts exactly 25 years")
        void baseline_depletesInYear26()
        {
                PathOutcome outcome = Fixtures.simulate(Fixtures.depletion_baseline(), ZERO_TAX);
                assertFalse(outcome.success);
                assertEquals(Integer.valueOf(2050), outcome.failure_year);
                assertEquals(26, outcome.ledger.size());
                LedgerYear last_funded = outcome.ledger.get(24);
                assertEquals(2049, last_funded.year);
                assertEquals(0, last_funded.shortfall, 0);
                assertEquals(0, last_funded.net_worth(), 1e-6);
                assertTrue(outcome.ledger.get(25).failed());
        }

        @Test
        void baseline_taxesShortenTheHorizon()
        {
                PathOutcome outcome = Fixtures.simulate(Fixtures.depletion_baseline(), Fixtures.TAX_TABLES);
                assertFalse(outcome.success);
                assertTrue(outcome.failure_year < 2050, "failed in " + outcome.failure_year);
                assertTrue(outcome.lifetime_tax > 0);
        }

        @Test
        @DisplayName("RMDs are at least prior year end balance over the divisor")
        void rmd_takenEveryYear()
        {
                Scenario scenario = Fixtures.single("rmd", 1950, 2024, 90,
                        Arrays.asList(new Account("ira", AccountType.TAX_DEFERRED, 500000, 0.05, 0)), 10000, null);
                PathOutcome outcome = Fixtures.simulate(scenario, ZERO_TAX);
                assertTrue(outcome.success);
                assertEquals(500000 / 25.5, outcome.ledger.get(0).rmd_required[0], 1e-9);
                for (LedgerYear ly : outcome.ledger)
                {
                        double expected = ly.start_balance[0] / Fixtures.RMD_TABLE.divisor(ly.age);
                        assertEquals(expected, ly.rmd_required[0], 1e-6, "age " + ly.age);
                        assertEquals(ly.rmd_required[0], ly.rmd_taken[0], 1e-6, "age " + ly.age);
                        assertTrue(ly.withdrawal[0] + ly.rmd_taken[0] >= expected - 1e-6);
                }
        }

        @Test
        void conversion_neverExceedsCapOrBalance()
        {
                double cap = 30000;
                Scenario scenario = Fixtures.diversified(50000, new ConversionCap(cap, 65, 80, ConversionFunding.TAXABLE));
                LedgerSimulator simulator = Fixtures.simulator(scenario, Fixtures.TAX_TABLES);
                for (int path = 0; path < 50; path++)
                {
                        PathOutcome outcome = simulator.simulate(path, new ReturnSampler(0, path));
                        for (LedgerYear ly : outcome.ledger)
                        {
                                double available = Math.max(0, ly.start_balance[1] + ly.growth[1]) - ly.rmd_taken[1];
                                assertTrue(ly.conversion_amount <= cap + 1e-9);
                                assertTrue(ly.conversion_amount <= available + 1e-6);
                                assertEquals(-ly.conversion_amount, ly.conversion[1], 1e-9);
                                assertEquals(ly.conversion_amount, ly.conversion[2], 1e-9);
                                if (ly.age > 80)
                                        assertEquals(0, ly.conversion_amount, 0);
                        }
                }
        }

        private static Scenario conversion_only(ConversionFunding funding, boolean with_taxable)
        {
                List<Account> accounts = with_taxable
                        ? Arrays.asList(new Account("ira", AccountType.TAX_DEFERRED, 500000, 0, 0), new Account("roth", AccountType.ROTH, 0, 0, 0),
                                new Account("brokerage", AccountType.TAXABLE, 100000, 0, 0))
                        : Arrays.asList(new Account("ira", AccountType.TAX_DEFERRED, 500000, 0, 0), new Account("roth", AccountType.ROTH, 0, 0, 0));
                return Fixtures.single("convert", 1964, 2024, 62, accounts, 0, new ConversionCap(50000, 60, 60, funding));
        }

        @Test
        @DisplayName("Tax on a conversion can be withheld from the converted amount")
        void conversion_taxWithheldFromRoth()
        {
                LedgerYear ly = Fixtures.simulate(conversion_only(ConversionFunding.CONVERTED, false), Fixtures.TAX_TABLES).ledger.get(0);
                // $50,000 of ordinary income, $35,400 taxable.
                assertEquals(50000, ly.conversion_amount, 0);
                assertEquals(4016, ly.conversion_tax, 1e-9);
                assertEquals(4016, ly.tax_paid[1], 1e-6);
                assertEquals(45984, ly.end_balance[1], 1e-6);
                assertEquals(450000, ly.end_balance[0], 1e-9);
        }

        @Test
        void conversion_taxPaidFromTaxable()
        {
                LedgerYear ly = Fixtures.simulate(conversion_only(ConversionFunding.TAXABLE, true), Fixtures.TAX_TABLES).ledger.get(0);
                assertEquals(50000, ly.end_balance[1], 1e-9);
                assertEquals(95984, ly.end_balance[2], 1e-6);
                assertEquals(4016, ly.tax_paid[2], 1e-6);
                assertEquals(0, ly.capital_gains, 1e-9);
        }

        @Test
        void conversion_outsideWindowIsZero()
        {
                PathOutcome outcome = Fixtures.simulate(conversion_only(ConversionFunding.TAXABLE, true), Fixtures.TAX_TABLES);
                assertEquals(0, outcome.ledger.get(1).conversion_amount, 0);
                assertEquals(0, outcome.ledger.get(2).conversion_amount, 0);
        }

        @Test
        void socialSecurity_startsAtClaimingAge()
        {
                PathOutcome outcome = Fixtures.simulate(Fixtures.diversified(40000, null), ZERO_TAX);
                double expected = SocialSecurity.annual_benefit_months(2200, 67 * 12, SocialSecurity.full_retirement_age_months(1959));
                assertEquals(0, outcome.ledger.get(0).social_security, 0);
                assertEquals(0, outcome.ledger.get(1).social_security, 0);
                assertEquals(2026, outcome.ledger.get(2).year);
                assertEquals(expected, outcome.ledger.get(2).social_security, 1e-9);
        }

        @Test
        @DisplayName("A surviving spouse keeps the larger of the two benefits")
        void socialSecurity_survivorBenefit()
        {
                List<Person> people = Arrays.asList(new Person("Alex", 1955, 2500, 67, 80), new Person("Sam", 1957, 1000, 67));
                Scenario scenario = Fixtures.scenario("couple", people, 2024, 0, 95,
                        Arrays.asList(new Account("brokerage", AccountType.TAXABLE, 2000000, 0, 0)), Collections.<Contribution>emptyList(),
                        new Spending(0), Collections.<IncomeStream>emptyList(), FilingStatus.MARRIED_JOINT, null, null);
                double a = SocialSecurity.annual_benefit_months(2500, 67 * 12, SocialSecurity.full_retirement_age_months(1955));
                double b = SocialSecurity.annual_benefit_months(1000, 67 * 12, SocialSecurity.full_retirement_age_months(1957));
                PathOutcome outcome = Fixtures.simulate(scenario, ZERO_TAX);
                assertTrue(outcome.success);
                assertEquals(a + b, outcome.ledger.get(0).social_security, 1e-9);
                assertEquals(a + b, outcome.ledger.get(2035 - 2024).social_security, 1e-9);
                assertEquals(Math.max(a, b), outcome.ledger.get(2036 - 2024).social_security, 1e-9);
        }

        @Test
        void taxableWithdrawal_realizesGainsProRata()
        {
                Scenario scenario = Fixtures.single("gains", 1960, 2025, 90,
                        Arrays.asList(new Account("brokerage", AccountType.TAXABLE, 100000, 50000, 0, 0, 0)), 20000, null);
                LedgerYear ly = Fixtures.simulate(scenario, ZERO_TAX).ledger.get(0);
                assertEquals(20000, ly.withdrawal[0], 1e-9);
                assertEquals(10000, ly.capital_gains, 1e-9);
                assertEquals(0, ly.ordinary_income, 0);
        }

        private static Scenario pension(List<Account> accounts, Spending spending)
        {
                List<IncomeStream> income = Arrays.asList(new IncomeStream("pension", 50000, 0, 120, true, false));
                return Fixtures.scenario("pension", Arrays.asList(new Person("Pat", 1960, 0, 67)), 2025, 0, 90, accounts,
                        Collections.<Contribution>emptyList(), spending, income, FilingStatus.SINGLE, null, null);
        }

        @Test
        @DisplayName("Income above spending is swept into the taxable account")
        void cash_sweptIntoTaxable()
        {
                Scenario scenario = pension(Arrays.asList(new Account("brokerage", AccountType.TAXABLE, 10000, 0, 0)), new Spending(30000));
                LedgerYear ly = Fixtures.simulate(scenario, ZERO_TAX).ledger.get(0);
                assertEquals(50000, ly.other_income, 0);
                assertEquals(20000, ly.cash_deposit, 1e-9);
                assertEquals(20000, ly.cash_swept, 1e-9);
                assertEquals(20000, ly.contribution[0], 1e-9);
                assertEquals(30000, ly.end_balance[0], 1e-9);
                assertEquals(0, ly.cash, 0);
                assertEquals(30000, ly.net_worth(), 1e-9);
        }

        @Test
        @DisplayName("Without a taxable account unspent income is kept as cash and spent later")
        void cash_carriedWithoutTaxableAccount()
        {
                Map<Integer, Double> special = new TreeMap<Integer, Double>();
                special.put(67, 60000.0);
                Scenario scenario = pension(Arrays.asList(new Account("ira", AccountType.TAX_DEFERRED, 10000, 0, 0)), new Spending(30000, special));
                PathOutcome outcome = Fixtures.simulate(scenario, ZERO_TAX);
                assertTrue(outcome.success);

                LedgerYear first = outcome.ledger.get(0);
                assertEquals(20000, first.cash, 1e-9);
                assertEquals(10000, first.end_balance[0], 1e-9);
                assertEquals(30000, first.net_worth(), 1e-9);

                LedgerYear second = outcome.ledger.get(1);
                assertEquals(20000, second.cash_start, 1e-9);
                assertEquals(40000, second.cash, 1e-9);

                // $90,000 of spending at 67 against $50,000 of pension: the other $40,000 is the saved cash.
                LedgerYear third = outcome.ledger.get(2);
                assertEquals(67, third.age);
                assertEquals(40000, third.cash_withdrawal, 1e-9);
                assertEquals(0, third.withdrawal[0], 0);
                assertEquals(0, third.cash, 1e-9);
                assertEquals(10000, third.end_balance[0], 1e-9);
        }

        @Test
        void cash_paysTaxBeforeAccounts()
        {
                Scenario scenario = pension(Arrays.asList(new Account("ira", AccountType.TAX_DEFERRED, 10000, 0, 0)), new Spending(30000));
                LedgerYear ly = Fixtures.simulate(scenario, Fixtures.TAX_TABLES).ledger.get(0);
                // $50,000 of ordinary income, $35,400 taxable.
                assertEquals(4016, ly.total_tax(), 1e-6);
                assertEquals(4016, ly.cash_tax_paid, 1e-6);
                assertEquals(0, ly.tax_paid[0], 0);
                assertEquals(15984, ly.cash, 1e-6);
        }

        @Test
        @DisplayName("RMDs nobody spends stay in the household's net worth")
        void cash_unspentRmdsKeepNetWorth()
        {
                List<Account> accounts = Arrays.asList(new Account("ira", AccountType.TAX_DEFERRED, 1000000, 0, 0), new Account("roth", AccountType.ROTH, 0, 0, 0));
                PathOutcome outcome = Fixtures.simulate(Fixtures.single("rmd-only", 1950, 2025, 95, accounts, 0, null), ZERO_TAX);
                assertTrue(outcome.success);
                assertEquals(1000000, outcome.terminal_net_worth, 1e-6);
                LedgerYear last = outcome.ledger.get(outcome.ledger.size() - 1);
                assertTrue(last.cash > 700000, "cash " + last.cash);
                for (LedgerYear ly : outcome.ledger)
                {
                        assertEquals(1000000, ly.net_worth(), 1e-6, "year " + ly.year);
                        assertEquals(ly.cash_start + ly.cash_deposit - ly.cash_withdrawal - ly.cash_tax_paid - ly.cash_swept, ly.cash, 1e-6);
                }
        }

        @Test
        @DisplayName("A non default withdrawal order funds spending from the first listed account type")
        void withdrawalOrder_rothFirst()
        {
                List<Account> accounts = Arrays.asList(
                        new Account("brokerage", AccountType.TAXABLE, 100000, 100000, 0, 0, 0),
                        new Account("ira", AccountType.TAX_DEFERRED, 100000, 0, 0),
                        new Account("roth", AccountType.ROTH, 100000, 0, 0));
                Scenario scenario = Fixtures.single("roth-first", 1960, 2025, 90, accounts, 30000, null)
                        .with_withdrawals(Arrays.asList(AccountType.ROTH, AccountType.TAXABLE, AccountType.TAX_DEFERRED), new OrderedWithdrawal());
                PathOutcome outcome = Fixtures.simulate(scenario, ZERO_TAX);

                LedgerYear first = outcome.ledger.get(0);
                assertEquals(0, first.withdrawal[0], 0);
                assertEquals(0, first.withdrawal[1], 0);
                assertEquals(30000, first.withdrawal[2], 1e-9);
                assertEquals(0, first.ordinary_income, 0);

                // Roth runs out during the fourth year; taxable takes over, then tax-deferred.
                LedgerYear fourth = outcome.ledger.get(3);
                assertEquals(10000, fourth.withdrawal[2], 1e-9);
                assertEquals(20000, fourth.withdrawal[0], 1e-9);
                assertEquals(0, fourth.withdrawal[1], 0);
                LedgerYear seventh = outcome.ledger.get(6);
                assertEquals(20000, seventh.withdrawal[0], 1e-9);
                assertEquals(10000, seventh.withdrawal[1], 1e-9);
                assertEquals(10000, seventh.ordinary_income, 1e-9);
                assertEquals(30000, outcome.ledger.get(7).withdrawal[1], 1e-9);
        }

        @Test
        @DisplayName("Spending the last dollar in the final year is still a success")
        void finalYear_exactDepletionSucceeds()
        {
                Scenario scenario = Fixtures.single("exact", 1960, 2025, 89,
                        Arrays.asList(new Account("brokerage", AccountType.TAXABLE, 1000000, 1000000, 0, 0, 0)), 40000, null);
                assertEquals(25, scenario.num_years());
                PathOutcome outcome = Fixtures.simulate(scenario, ZERO_TAX);
                assertTrue(outcome.success);
                assertNull(outcome.failure_year);
                assertEquals(25, outcome.ledger.size());
                assertEquals(0, outcome.terminal_net_worth, 1e-6);
                assertEquals(0, outcome.ledger.get(24).shortfall, 0);
        }

        @Test
        void contributions_stopAtRetirement()
        {
                Scenario scenario = Fixtures.scenario("saver", Arrays.asList(new Person("Pat", 1980, 0, 67)), 2024, 50, 55,
                        Arrays.asList(new Account("401k", AccountType.TAX_DEFERRED, 0, 0, 0)),
                        Arrays.asList(new Contribution("401k", 10000, 40, 60)), new Spending(5000),
                        Collections.<IncomeStream>emptyList(), FilingStatus.SINGLE, null, null);
                PathOutcome outcome = Fixtures.simulate(scenario, ZERO_TAX);
                assertTrue(outcome.success);
                for (LedgerYear ly : outcome.ledger)
                {
                        if (ly.age < 50)
                        {
                                assertEquals(10000, ly.contribution[0], 0, "age " + ly.age);
                                assertEquals(0, ly.spending, 0);
                        }
                        else
                        {
                                assertEquals(0, ly.contribution[0], 0, "age " + ly.age);
                                assertEquals(5000, ly.spending, 0);
                        }
                }
                assertEquals(60000 - 6 * 5000, outcome.terminal_net_worth, 1e-9);
        }

        @Test
        void noAccounts_succeedsOnlyWithoutSpending()
        {
                PathOutcome nothing = Fixtures.simulate(Fixtures.single("empty", 1960, 2025, 90, Collections.<Account>emptyList(), 0, null), ZERO_TAX);
                assertTrue(nothing.success);
                assertNull(nothing.failure_year);
                assertEquals(0, nothing.terminal_net_worth, 0);

                PathOutcome broke = Fixtures.simulate(Fixtures.single("empty", 1960, 2025, 90, Collections.<Account>emptyList(), 1000, null), ZERO_TAX);
                assertFalse(broke.success);
                assertEquals(Integer.valueOf(2025), broke.failure_year);
                assertEquals(1000, broke.ledger.get(0).shortfall, 1e-9);
        }

        @Test
        void unknownState_rejectedBeforeSimulation()
        {
                Scenario scenario = Fixtures.scenario("nowhere", Arrays.asList(new Person("Pat", 1960, 0, 67)), 2025, 0, 90,
                        Arrays.asList(new Account("ira", AccountType.TAX_DEFERRED, 1000, 0, 0)), Collections.<Contribution>emptyList(),
                        new Spending(0), Collections.<IncomeStream>emptyList(), FilingStatus.SINGLE, "ZZ", null);
                InvalidScenarioException e = assertThrows(InvalidScenarioException.class, () -> Fixtures.simulator(scenario, Fixtures.TAX_TABLES));
                assertEquals("state", e.getField());
                assertEquals("nowhere", e.getScenarioId());
        }

        @Test
        @DisplayName("Every account balance reconciles every year")
        void ledger_balancesReconcile()
        {
                Scenario scenario = Fixtures.diversified(50000, new ConversionCap(20000, 65, 72, ConversionFunding.CONVERTED));
                LedgerSimulator simulator = Fixtures.simulator(scenario, Fixtures.TAX_TABLES);
                for (int path = 0; path < 20; path++)
                {
                        PathOutcome outcome = simulator.simulate(path, new ReturnSampler(7, path));
                        for (LedgerYear ly : outcome.ledger)
                                for (int a = 0; a < ly.types.length; a++)
                                {
                                        double expected = ly.start_balance[a] + ly.contribution[a] + ly.growth[a] - ly.rmd_taken[a] - ly.withdrawal[a]
                                                + ly.conversion[a] - ly.tax_paid[a];
                                        assertEquals(expected, ly.end_balance[a], 1e-6, "path " + path + " year " + ly.year + " account " + a);
                                        assertTrue(ly.end_balance[a] >= 0);
                                }
                        double total = 0;
                        for (LedgerYear ly : outcome.ledger)
                                total += ly.tax_paid[0] + ly.tax_paid[1] + ly.tax_paid[2];
                        assertTrue(outcome.lifetime_tax >= total - 1e-6);
                }
        }
}
