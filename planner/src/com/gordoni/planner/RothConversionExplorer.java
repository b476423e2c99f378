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
import java.util.List;
import java.util.concurrent.ExecutionException;

/**
 * Sweep the annual Roth conversion cap. Each cap gets its own copy of the scenario and its own run; the
 * tasks of every run are submitted to the pool together, so paths and caps are both parallel.
 */
public class RothConversionExplorer
{
        private final MonteCarloEngine engine;

        public RothConversionExplorer(MonteCarloEngine engine)
        {
                this.engine = engine;
        }

        public ConversionSweep sweep(Scenario scenario, double[] caps, int num_paths, int seed) throws ExecutionException
        {
                List<MonteCarloRun> runs = new ArrayList<MonteCarloRun>();
                for (double cap : caps)
                        runs.add(engine.prepare(scenario.with_conversion_cap(cap), num_paths, seed));

                engine.execute(runs);

                SimulationSummary[] summaries = new SimulationSummary[caps.length];
                for (int i = 0; i < caps.length; i++)
                {
                        summaries[i] = runs.get(i).summarize();
                        if (engine.getConfig().trace)
                                System.out.println("cap " + caps[i] + ": " + summaries[i]);
                }
                return new ConversionSweep(caps, summaries);
        }

        public ConversionSweep sweep(Scenario scenario, double[] caps) throws ExecutionException
        {
                Config config = engine.getConfig();
                return sweep(scenario, caps, config.paths, config.seed);
        }
}
