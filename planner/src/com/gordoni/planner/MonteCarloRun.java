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
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/**
 * The paths of one Monte Carlo run, split into tasks, and the per path results they fill in.
 *
 * Each path writes only its own column of the result arrays, so tasks may complete in any order. Ledgers
 * are kept only for the first few display paths; the median path's ledger is recovered by simulating that
 * path again, which reproduces it exactly.
 */
public class MonteCarloRun
{
        private final LedgerSimulator simulator;
        private final Config config;
        private final int num_paths;
        private final int seed;
        private final int num_years;

        private final double[][] net_worth; // [year][path]
        private final double[][] taxable;
        private final double[][] tax_deferred;
        private final double[][] roth;
        private final double[][] income;
        private final double[][] tax;
        private final boolean[] success;
        private final double[] terminal_net_worth;
        private final double[] terminal_roth;
        private final double[] lifetime_tax;
        private final PathOutcome[] display;

        private volatile boolean cancelled = false;

        public MonteCarloRun(LedgerSimulator simulator, Config config, int num_paths, int seed)
        {
                this.simulator = simulator;
                this.config = config;
                this.num_paths = num_paths;
                this.seed = seed;
                this.num_years = simulator.getScenario().num_years();

                net_worth = new double[num_years][num_paths];
                taxable = new double[num_years][num_paths];
                tax_deferred = new double[num_years][num_paths];
                roth = new double[num_years][num_paths];
                income = new double[num_years][num_paths];
                tax = new double[num_years][num_paths];
                success = new boolean[num_paths];
                terminal_net_worth = new double[num_paths];
                terminal_roth = new double[num_paths];
                lifetime_tax = new double[num_paths];
                display = new PathOutcome[Math.min(config.max_display_paths, num_paths)];
        }

        /**
         * Request that the run stop after each task's current path.
         */
        public void cancel()
        {
                cancelled = true;
        }

        public boolean isCancelled()
        {
                return cancelled;
        }

        private PathOutcome simulate_path(int path)
        {
                return simulator.simulate(path, new ReturnSampler(seed, path));
        }

        private void fold(PathOutcome outcome)
        {
                int p = outcome.path;
                List<LedgerYear> ledger = outcome.ledger;
                for (int y = 0; y < ledger.size(); y++)
                {
                        LedgerYear ly = ledger.get(y);
                        net_worth[y][p] = ly.net_worth();
                        taxable[y][p] = ly.balance(AccountType.TAXABLE);
                        tax_deferred[y][p] = ly.balance(AccountType.TAX_DEFERRED);
                        roth[y][p] = ly.balance(AccountType.ROTH);
                        income[y][p] = ly.income();
                        tax[y][p] = ly.total_tax();
                }
                // Years after a failure keep their zero balances, income and tax.
                success[p] = outcome.success;
                terminal_net_worth[p] = outcome.terminal_net_worth;
                terminal_roth[p] = ledger.isEmpty() ? 0 : ledger.get(ledger.size() - 1).balance(AccountType.ROTH);
                lifetime_tax[p] = outcome.lifetime_tax;
                if (p < display.length)
                        display[p] = outcome;
        }

        public List<Callable<Integer>> tasks()
        {
                List<Callable<Integer>> tasks = new ArrayList<Callable<Integer>>();
                int num_tasks = Math.max(1, Math.min(config.tasks, num_paths));
                int paths_per_task = (num_paths + num_tasks - 1) / num_tasks;
                for (int first = 0; first < num_paths; first += paths_per_task)
                {
                        final int ffirst = first;
                        final int flast = Math.min(first + paths_per_task, num_paths);
                        tasks.add(new Callable<Integer>()
                        {
                                public Integer call()
                                {
                                        long start = System.currentTimeMillis();
                                        for (int path = ffirst; path < flast; path++)
                                        {
                                                fold(simulate_path(path));
                                                if (cancelled)
                                                        throw new CancellationException("run of " + simulator.getScenario() + " cancelled");
                                        }
                                        if (config.trace)
                                                System.out.println("paths " + ffirst + "-" + (flast - 1) + " done: " + (System.currentTimeMillis() - start) + " ms");
                                        return flast - ffirst;
                                }
                        });
                }
                return tasks;
        }

        private int median_path(double median)
        {
                int best = 0;
                for (int p = 1; p < num_paths; p++)
                        if (Math.abs(terminal_net_worth[p] - median) < Math.abs(terminal_net_worth[best] - median))
                                best = p;
                return best;
        }

        private double[] percentiles(double[] samples)
        {
                Percentile estimator = PercentileBands.estimator();
                estimator.setData(samples);
                double[] values = new double[config.percentiles.length];
                for (int i = 0; i < values.length; i++)
                        values[i] = estimator.evaluate(config.percentiles[i]);
                return values;
        }

        /**
         * Fold the completed paths into a summary. Every task must have completed.
         */
        public SimulationSummary summarize()
        {
                if (cancelled)
                        throw new CancellationException("run of " + simulator.getScenario() + " cancelled");

                Scenario scenario = simulator.getScenario();
                int successes = 0;
                for (boolean s : success)
                        if (s)
                                successes++;

                int[] years = new int[num_years];
                int[] ages = new int[num_years];
                for (int y = 0; y < num_years; y++)
                {
                        years[y] = scenario.start_year + y;
                        ages[y] = scenario.start_age() + y;
                }

                double[] pcts = config.percentiles;
                Percentile estimator = PercentileBands.estimator();
                double median_terminal = estimator.evaluate(terminal_net_worth, 50);
                double median_roth = estimator.evaluate(terminal_roth, 50);
                double median_tax = estimator.evaluate(lifetime_tax, 50);

                PathOutcome median_path = simulate_path(median_path(median_terminal));
                List<PathOutcome> display_paths = new ArrayList<PathOutcome>();
                for (PathOutcome outcome : display)
                        display_paths.add(outcome);

                return new SimulationSummary(scenario.id, num_paths, seed, successes, years, ages, pcts.clone(),
                        PercentileBands.compute("net_worth", pcts, net_worth),
                        PercentileBands.compute("taxable", pcts, taxable),
                        PercentileBands.compute("tax_deferred", pcts, tax_deferred),
                        PercentileBands.compute("roth", pcts, roth),
                        PercentileBands.compute("income", pcts, income),
                        PercentileBands.compute("tax", pcts, tax),
                        StatUtils.mean(terminal_net_worth), median_terminal, percentiles(terminal_net_worth), median_roth,
                        StatUtils.mean(lifetime_tax), median_tax, percentiles(lifetime_tax),
                        median_path, display_paths);
        }
}
