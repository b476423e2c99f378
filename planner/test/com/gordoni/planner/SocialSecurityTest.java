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
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SocialSecurityTest
{
        @Test
        @DisplayName("Claiming at 62 with a full retirement age of 67 reduces the benefit by 30%")
        void claimAt62()
        {
                // 36 months at 5/9% plus 24 months at 5/12%.
                assertEquals(16800, SocialSecurity.annual_benefit(2000, 62, 67), 1e-9);
        }

        @Test
        @DisplayName("Claiming at 70 with a full retirement age of 67 adds 24% in delayed credits")
        void claimAt70()
        {
                assertEquals(29760, SocialSecurity.annual_benefit(2000, 70, 67), 1e-9);
        }

        @Test
        void claimAtFullRetirementAge()
        {
                assertEquals(24000, SocialSecurity.annual_benefit(2000, 67, 67), 1e-9);
        }

        @Test
        void earlyReduction_steeperWithin36Months()
        {
                assertEquals(0.8, SocialSecurity.benefit_factor(64 * 12, 67 * 12), 1e-12);
                assertEquals(0.75, SocialSecurity.benefit_factor(63 * 12, 67 * 12), 1e-12);
                assertEquals(1 - 5.0 / 900, SocialSecurity.benefit_factor(67 * 12 - 1, 67 * 12), 1e-12);
        }

        @Test
        void fullRetirementAge_byBirthYear()
        {
                assertEquals(65 * 12, SocialSecurity.full_retirement_age_months(1937));
                assertEquals(65 * 12 + 6, SocialSecurity.full_retirement_age_months(1940));
                assertEquals(66 * 12, SocialSecurity.full_retirement_age_months(1954));
                assertEquals(66 * 12 + 6, SocialSecurity.full_retirement_age_months(1957));
                assertEquals(67 * 12, SocialSecurity.full_retirement_age_months(1960));
        }

        @Test
        void claimingAgeOutsideRange_rejected()
        {
                assertThrows(IllegalArgumentException.class, () -> SocialSecurity.annual_benefit(2000, 61, 67));
                assertThrows(IllegalArgumentException.class, () -> SocialSecurity.annual_benefit(2000, 71, 67));
        }

        @Test
        void survivor_receivesGreaterBenefit()
        {
                assertEquals(30000, SocialSecurity.survivor_benefit(12000, 30000), 0);
                assertEquals(30000, SocialSecurity.survivor_benefit(30000, 12000), 0);
        }
}
