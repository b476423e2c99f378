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
 * Monte Carlo summaries of one scenario under each of a range of annual conversion caps.
 */
public class ConversionSweep
{
        public final double[] caps;
        public final SimulationSummary[] summaries; // Indexed like caps.

        public ConversionSweep(double[] caps, SimulationSummary[] summaries)
        {
                assert(caps.length == summaries.length);
                this.caps = caps.clone();
                this.summaries = summaries.clone();
        }

        public SimulationSummary get(double cap)
        {
                for (int i = 0; i < caps.length; i++)
                        if (caps[i] == cap)
                                return summaries[i];
                throw new IllegalArgumentException("No sweep cell for cap " + cap);
        }

        /**
         * Heat map values, [cap][metric].
         */
        public double[][] grid(SweepMetric... metrics)
        {
                double[][] grid = new double[caps.length][metrics.length];
                for (int i = 0; i < caps.length; i++)
                        for (int m = 0; m < metrics.length; m++)
                                grid[i][m] = summaries[i].metric(metrics[m]);
                return grid;
        }

        /**
         * Index of the cap with the best value of a metric. Ties go to the lower cap index.
         */
        public int best(SweepMetric metric, boolean maximize)
        {
                int best = 0;
                for (int i = 1; i < caps.length; i++)
                {
                        double v = summaries[i].metric(metric);
                        double b = summaries[best].metric(metric);
                        if (maximize ? v > b : v < b)
                                best = i;
                }
                return best;
        }
}
