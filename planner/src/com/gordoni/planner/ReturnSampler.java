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

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

/**
 * Normally distributed annual returns for one path.
 *
 * The generator is seeded from the run seed and the path index alone, so a path's returns do not depend on
 * which worker simulates it or in what order.
 */
public class ReturnSampler
{
        private final RandomGenerator random;

        public ReturnSampler(int seed, int path_index)
        {
                this.random = new Well19937c(new int[]{seed, path_index});
        }

        /**
         * One year's return per account class. A return below -100% is truncated to -100%.
         */
        public double[] sample_year(double[] mean, double[] volatility, CorrelationMode correlation)
        {
                assert(mean.length == volatility.length);
                double[] returns = new double[mean.length];
                double shock = random.nextGaussian();
                for (int a = 0; a < mean.length; a++)
                {
                        if (correlation == CorrelationMode.INDEPENDENT && a > 0)
                                shock = random.nextGaussian();
                        returns[a] = Math.max(-1, mean[a] + volatility[a] * shock);
                }
                return returns;
        }
}
