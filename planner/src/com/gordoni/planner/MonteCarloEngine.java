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
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Runs a scenario along many independently sampled return paths on a shared worker pool.
 *
 * The tax and RMD tables are read only and shared by every path. Path i of a run with a given seed always
 * sees the same returns, so results do not depend on the number of workers or tasks.
 */
public class MonteCarloEngine
{
        private final Config config;
        private final TaxEngine tax_engine;
        private final RmdTable rmd_table;
        private final ExecutorService executor;

        private final Set<MonteCarloRun> active = ConcurrentHashMap.newKeySet();

        public MonteCarloEngine(Config config, TaxEngine tax_engine, RmdTable rmd_table, ExecutorService executor)
        {
                this.config = config;
                this.tax_engine = tax_engine;
                this.rmd_table = rmd_table;
                this.executor = executor;

                for (double pct : config.percentiles)
                        if (!(pct > 0 && pct <= 100))
                                throw new IllegalArgumentException("Percentiles must be in (0, 100]: " + pct);
        }

        /**
         * Set up a run without starting it. Validates the scenario against the tables.
         */
        public MonteCarloRun prepare(Scenario scenario, int num_paths, int seed)
        {
                if (num_paths < config.min_paths)
                        throw new InvalidScenarioException(scenario.id, "num_paths", "at least " + config.min_paths + " paths are required, not " + num_paths);
                LedgerSimulator simulator = new LedgerSimulator(scenario, config, tax_engine, rmd_table);
                return new MonteCarloRun(simulator, config, num_paths, seed);
        }

        public SimulationSummary run(Scenario scenario, int num_paths, int seed) throws ExecutionException
        {
                MonteCarloRun run = prepare(scenario, num_paths, seed);
                List<MonteCarloRun> runs = new ArrayList<MonteCarloRun>();
                runs.add(run);
                execute(runs);
                return run.summarize();
        }

        public SimulationSummary run(Scenario scenario) throws ExecutionException
        {
                return run(scenario, config.paths, config.seed);
        }

        /**
         * Run every task of the given runs as one batch on the pool.
         */
        public void execute(List<MonteCarloRun> runs) throws ExecutionException
        {
                long start = System.currentTimeMillis();
                List<Callable<Integer>> tasks = new ArrayList<Callable<Integer>>();
                for (MonteCarloRun run : runs)
                {
                        active.add(run);
                        tasks.addAll(run.tasks());
                }
                try
                {
                        invoke_all(tasks);
                }
                finally
                {
                        active.removeAll(runs);
                }
                if (config.trace)
                        System.out.println("Simulation done: " + (System.currentTimeMillis() - start) / 1000.0 + " seconds");
        }

        private void invoke_all(List<Callable<Integer>> tasks) throws ExecutionException
        {
                try
                {
                        List<Future<Integer>> future_tasks = executor.invokeAll(tasks); // Will block until all tasks are finished
                        // If a task dies due to an assertion error, it can't be caught within the task, so we probe for it here.
                        for (Future<Integer> f : future_tasks)
                        {
                                try
                                {
                                        f.get();
                                }
                                catch (ExecutionException e)
                                {
                                        if (e.getCause() instanceof CancellationException)
                                                throw (CancellationException) e.getCause();
                                        if (e.getCause() instanceof RuntimeException)
                                                throw (RuntimeException) e.getCause();
                                        throw e;
                                }
                        }
                }
                catch (InterruptedException e)
                {
                        Thread.currentThread().interrupt();
                        CancellationException ce = new CancellationException("interrupted");
                        ce.initCause(e);
                        throw ce;
                }
        }

        /**
         * Cancel every run in progress. Each task stops after its current path and the runs report nothing.
         */
        public void cancel()
        {
                for (MonteCarloRun run : active)
                        run.cancel();
        }

        public Config getConfig()
        {
                return config;
        }
}
