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

import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/**
 * Per year percentiles of one quantity across all paths.
 */
public class PercentileBands
{
        public final String name;
        public final double[] percentiles;
        public final double[][] values; // [percentile][year]

        public PercentileBands(String name, double[] percentiles, double[][] values)
        {
                this.name = name;
                this.percentiles = percentiles.clone();
                this.values = values;
        }

        /**
         * Linear interpolation between closest ranks, the R-7 estimator.
         */
        public static Percentile estimator()
        {
                return new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        }

        /**
         * @param samples [year][path]
         */
        public static PercentileBands compute(String name, double[] percentiles, double[][] samples)
        {
                Percentile estimator = estimator();
                double[][] values = new double[percentiles.length][samples.length];
                for (int y = 0; y < samples.length; y++)
                {
                        estimator.setData(samples[y]);
                        for (int i = 0; i < percentiles.length; i++)
                                values[i][y] = estimator.evaluate(percentiles[i]);
                }
                return new PercentileBands(name, percentiles, values);
        }

        public double[] band(double percentile)
        {
                for (int i = 0; i < percentiles.length; i++)
                        if (percentiles[i] == percentile)
                                return values[i].clone();
                throw new IllegalArgumentException("No " + percentile + " percentile band for " + name);
        }

        public double get(double percentile, int year_index)
        {
                return band(percentile)[year_index];
        }
}
