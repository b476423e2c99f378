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
 * Social Security retirement benefits from a Primary Insurance Amount.
 */
public class SocialSecurity
{
        public static final int EARLIEST_CLAIM_AGE = 62;
        public static final int LATEST_CLAIM_AGE = 70;

        private static final double EARLY_FIRST_36 = 5.0 / 9 / 100; // Reduction per month for the first 36 months early.
        private static final double EARLY_BEYOND_36 = 5.0 / 12 / 100; // Reduction per additional month early.
        private static final double DELAYED_CREDIT = 2.0 / 3 / 100; // Credit per month of delay past full retirement age.

        /**
         * Full retirement age in months for a birth year.
         */
        public static int full_retirement_age_months(int birth_year)
        {
                if (birth_year <= 1937)
                        return 65 * 12;
                else if (birth_year <= 1942)
                        return 65 * 12 + 2 * (birth_year - 1937);
                else if (birth_year <= 1954)
                        return 66 * 12;
                else if (birth_year <= 1959)
                        return 66 * 12 + 2 * (birth_year - 1954);
                else
                        return 67 * 12;
        }

        /**
         * Benefit as a fraction of PIA when claimed at claim_months of age.
         */
        public static double benefit_factor(int claim_months, int full_retirement_age_months)
        {
                if (claim_months < EARLIEST_CLAIM_AGE * 12 || claim_months > LATEST_CLAIM_AGE * 12)
                        throw new IllegalArgumentException("claiming age outside " + EARLIEST_CLAIM_AGE + " to " + LATEST_CLAIM_AGE + ": " + claim_months / 12.0);
                int months = claim_months - full_retirement_age_months;
                if (months < 0)
                {
                        int early = -months;
                        return 1 - EARLY_FIRST_36 * Math.min(early, 36) - EARLY_BEYOND_36 * Math.max(early - 36, 0);
                }
                else
                        return 1 + DELAYED_CREDIT * months;
        }

        /**
         * Annual benefit in the claiming year's dollars.
         */
        public static double annual_benefit(double pia, int claiming_age, int full_retirement_age)
        {
                return annual_benefit_months(pia, claiming_age * 12, full_retirement_age * 12);
        }

        public static double annual_benefit_months(double pia, int claim_months, int full_retirement_age_months)
        {
                return 12 * pia * benefit_factor(claim_months, full_retirement_age_months);
        }

        /**
         * Benefit paid to a surviving spouse: the greater of the two individually computed benefits.
         */
        public static double survivor_benefit(double own_benefit, double deceased_benefit)
        {
                return Math.max(own_benefit, deceased_benefit);
        }
}
