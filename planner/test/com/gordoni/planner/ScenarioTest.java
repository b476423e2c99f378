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
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

class ScenarioTest
{
        private static InvalidScenarioException invalid(List<Person> people, List<Account> accounts, List<AccountType> order)
        {
                return assertThrows(InvalidScenarioException.class,
                        () -> new Scenario("bad", 2024, people, 65, 95, accounts, Collections.<Contribution>emptyList(), new Spending(40000),
                                Collections.<IncomeStream>emptyList(), FilingStatus.SINGLE, null, 0.02, CorrelationMode.FULL, order, null));
        }

        private static final List<Person> PAT = Arrays.asList(new Person("Pat", 1959, 2000, 67));
        private static final List<Account> IRA = Arrays.asList(new Account("ira", AccountType.TAX_DEFERRED, 100000, 0.05, 0.1));

        @Test
        void claimingAgeOutOfRange_rejected()
        {
                InvalidScenarioException e = invalid(Arrays.asList(new Person("Pat", 1959, 2000, 61)), IRA, Scenario.DEFAULT_WITHDRAWAL_ORDER);
                assertEquals("people[0].claiming_age", e.getField());
                assertEquals("bad", e.getScenarioId());
        }

        @Test
        void negativeBalance_rejected()
        {
                InvalidScenarioException e = invalid(PAT, Arrays.asList(new Account("ira", AccountType.TAX_DEFERRED, -1, 0.05, 0.1)),
                        Scenario.DEFAULT_WITHDRAWAL_ORDER);
                assertEquals("accounts[0].balance", e.getField());
        }

        @Test
        void costBasisAboveBalance_rejected()
        {
                InvalidScenarioException e = invalid(PAT, Arrays.asList(new Account("brokerage", AccountType.TAXABLE, 100, 200, 0.05, 0.1, 0)),
                        Scenario.DEFAULT_WITHDRAWAL_ORDER);
                assertEquals("accounts[0].cost_basis", e.getField());
        }

        @Test
        void withdrawalOrder_mustListEachTypeOnce()
        {
                assertEquals("withdrawal_order",
                        invalid(PAT, IRA, Arrays.asList(AccountType.TAXABLE, AccountType.TAXABLE, AccountType.ROTH)).getField());
                assertEquals("withdrawal_order", invalid(PAT, IRA, Arrays.asList(AccountType.TAXABLE, AccountType.ROTH)).getField());
                assertEquals("withdrawal_order", invalid(PAT, IRA, Collections.<AccountType>emptyList()).getField());
        }

        @Test
        void tooManyPeople_rejected()
        {
                Person p = new Person("Pat", 1959, 2000, 67);
                assertEquals("people", invalid(Arrays.asList(p, p, p), IRA, Scenario.DEFAULT_WITHDRAWAL_ORDER).getField());
                assertEquals("people", invalid(Collections.<Person>emptyList(), IRA, Scenario.DEFAULT_WITHDRAWAL_ORDER).getField());
        }

        @Test
        void duplicateAccountNames_rejected()
        {
                assertEquals("accounts[1].name", invalid(PAT, Arrays.asList(IRA.get(0), IRA.get(0)), Scenario.DEFAULT_WITHDRAWAL_ORDER).getField());
        }

        @Test
        void contributionToUnknownAccount_rejected()
        {
                InvalidScenarioException e = assertThrows(InvalidScenarioException.class,
                        () -> new Scenario("bad", 2024, PAT, 65, 95, IRA, Arrays.asList(new Contribution("401k", 1000, 60, 64)), new Spending(40000),
                                Collections.<IncomeStream>emptyList(), FilingStatus.SINGLE, null, 0.02, CorrelationMode.FULL,
                                Scenario.DEFAULT_WITHDRAWAL_ORDER, null));
                assertEquals("contributions[0].account", e.getField());
        }

        private static Scenario born_1948(int start_year, List<Account> accounts)
        {
                return new Scenario("early", start_year, Arrays.asList(new Person("Lee", 1948, 1500, 70)), 65, 95, accounts,
                        Collections.<Contribution>emptyList(), new Spending(30000), Collections.<IncomeStream>emptyList(), FilingStatus.SINGLE, null,
                        0.02, CorrelationMode.FULL, Scenario.DEFAULT_WITHDRAWAL_ORDER, null);
        }

        @Test
        void rmdsBefore72_rejectedForEarlyBirthYears()
        {
                InvalidScenarioException e = assertThrows(InvalidScenarioException.class, () -> born_1948(2015, IRA));
                assertEquals("people[0].birth_year", e.getField());

                // Nothing to distribute, or already past 72.
                born_1948(2015, Arrays.asList(new Account("brokerage", AccountType.TAXABLE, 100000, 0.05, 0.1)));
                assertEquals(73, born_1948(2021, IRA).start_age());
        }

        @Test
        void bracketWithdrawalLimit_mustBeNonNegative()
        {
                Scenario s = Fixtures.diversified(40000, null);
                InvalidScenarioException e = assertThrows(InvalidScenarioException.class,
                        () -> s.with_withdrawals(Scenario.DEFAULT_WITHDRAWAL_ORDER, new BracketWithdrawal(-1)));
                assertEquals("withdrawal_strategy.pre_tax_limit", e.getField());
                assertEquals("withdrawal_strategy",
                        assertThrows(InvalidScenarioException.class, () -> s.with_withdrawals(Scenario.DEFAULT_WITHDRAWAL_ORDER, null)).getField());
        }

        @Test
        void withWithdrawals_copiesWithoutMutating()
        {
                Scenario original = Fixtures.diversified(40000, null);
                Scenario copy = original.with_withdrawals(Arrays.asList(AccountType.ROTH, AccountType.TAXABLE, AccountType.TAX_DEFERRED), new ProportionalWithdrawal());
                assertEquals(new OrderedWithdrawal(), original.withdrawal_strategy);
                assertEquals(Scenario.DEFAULT_WITHDRAWAL_ORDER, original.withdrawal_order);
                assertEquals(new ProportionalWithdrawal(), copy.withdrawal_strategy);
                assertEquals(AccountType.ROTH, copy.withdrawal_order.get(0));
                assertNotEquals(original, copy);
        }

        @Test
        void ages()
        {
                Scenario s = Fixtures.diversified(40000, null);
                assertEquals(65, s.start_age());
                assertEquals(2054, s.end_year());
                assertEquals(31, s.num_years());
                assertEquals(2, s.account_index("roth"));
                assertEquals(-1, s.account_index("savings"));
        }

        @Test
        void withConversionCap_copiesWithoutMutating()
        {
                Scenario original = Fixtures.diversified(40000, new ConversionCap(10000, 65, 70, ConversionFunding.CONVERTED));
                Scenario copy = original.with_conversion_cap(30000);
                assertEquals(10000, original.conversion.cap(), 0);
                assertEquals(30000, copy.conversion.cap(), 0);
                assertEquals(70, copy.conversion.end_age);
                assertEquals(ConversionFunding.CONVERTED, copy.conversion.funding);
                assertNotEquals(original, copy);
                assertEquals(original.accounts, copy.accounts);

                Scenario none = Fixtures.diversified(40000, null);
                Scenario capped = none.with_conversion_cap(5000);
                assertNull(none.conversion);
                assertEquals(new ConversionCap(5000, 65, 95, ConversionFunding.TAXABLE), capped.conversion);
        }
}
