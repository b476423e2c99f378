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

import java.util.Collections;
import java.util.List;

/**
 * Aggregate of every path of a Monte Carlo run. Derived entirely from the paths; recomputable from the
 * scenario, path count and seed.
 */
public class SimulationSummary
{
        public final String scenario_id;
        public final int num_paths;
        public final int seed;
        public final int successes;
        public final double success_probability;

        public final int[] years;
        public final int[] ages;
        public final double[] percentiles;
        public final PercentileBands net_worth;
        public final PercentileBands taxable;
        public final PercentileBands tax_deferred;
        public final PercentileBands roth;
        public final PercentileBands income;
        public final PercentileBands tax;

        public final double mean_terminal_net_worth;
        public final double median_terminal_net_worth;
        public final double[] terminal_net_worth_percentiles;
        public final double median_terminal_roth;
        public final double mean_lifetime_tax;
        public final double median_lifetime_tax;
        public final double[] lifetime_tax_percentiles;

        public final PathOutcome median_path; // Path whose terminal net worth is nearest the median.
        public final List<PathOutcome> display_paths; // The first few paths, retained with their ledgers.

        public SimulationSummary(String scenario_id, int num_paths, int seed, int successes, int[] years, int[] ages, double[] percentiles,
                PercentileBands net_worth, PercentileBands taxable, PercentileBands tax_deferred, PercentileBands roth, PercentileBands income,
                PercentileBands tax, double mean_terminal_net_worth, double median_terminal_net_worth, double[] terminal_net_worth_percentiles,
                double median_terminal_roth, double mean_lifetime_tax, double median_lifetime_tax, double[] lifetime_tax_percentiles,
                PathOutcome median_path, List<PathOutcome> display_paths)
        {
                this.scenario_id = scenario_id;
                this.num_paths = num_paths;
                this.seed = seed;
                this.successes = successes;
                this.success_probability = successes / (double) num_paths;
                this.years = years;
                this.ages = ages;
                this.percentiles = percentiles;
                this.net_worth = net_worth;
                this.taxable = taxable;
                this.tax_deferred = tax_deferred;
                this.roth = roth;
                this.income = income;
                this.tax = tax;
                this.mean_terminal_net_worth = mean_terminal_net_worth;
                this.median_terminal_net_worth = median_terminal_net_worth;
                this.terminal_net_worth_percentiles = terminal_net_worth_percentiles;
                this.median_terminal_roth = median_terminal_roth;
                this.mean_lifetime_tax = mean_lifetime_tax;
                this.median_lifetime_tax = median_lifetime_tax;
                this.lifetime_tax_percentiles = lifetime_tax_percentiles;
                this.median_path = median_path;
                this.display_paths = Collections.unmodifiableList(display_paths);
        }

        public double metric(SweepMetric metric)
        {
                switch (metric)
                {
                case SUCCESS_PROBABILITY:
                        return success_probability;
                case MEDIAN_TERMINAL_NET_WORTH:
                        return median_terminal_net_worth;
                case MEAN_LIFETIME_TAX:
                        return mean_lifetime_tax;
                case MEDIAN_LIFETIME_TAX:
                        return median_lifetime_tax;
                case MEDIAN_TERMINAL_ROTH:
                        return median_terminal_roth;
                default:
                        throw new IllegalArgumentException("Unknown metric " + metric);
                }
        }

        public String toString()
        {
                StringBuilder sb = new StringBuilder();
                sb.append("{");
                sb.append("scenario: " + scenario_id);
                sb.append(", paths: " + num_paths);
                sb.append(", success_probability: " + success_probability);
                sb.append(", median_terminal_net_worth: " + median_terminal_net_worth);
                sb.append(", mean_lifetime_tax: " + mean_lifetime_tax);
                sb.append("}");
                return sb.toString();
        }
}
