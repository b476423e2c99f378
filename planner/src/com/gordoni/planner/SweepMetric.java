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
 * Outcome measures compared across the cells of a conversion sweep.
 */
public enum SweepMetric
{
        SUCCESS_PROBABILITY("success_probability"),
        MEDIAN_TERMINAL_NET_WORTH("median_terminal_net_worth"),
        MEAN_LIFETIME_TAX("mean_lifetime_tax"),
        MEDIAN_LIFETIME_TAX("median_lifetime_tax"),
        MEDIAN_TERMINAL_ROTH("median_terminal_roth");

        public final String key;

        private SweepMetric(String key)
        {
                this.key = key;
        }
}
