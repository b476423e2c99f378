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

import java.io.File;
import java.text.DecimalFormat;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

public class Planner
{
        private static DecimalFormat f1f = new DecimalFormat("0.0");
        private static DecimalFormat f0f = new DecimalFormat("#,##0");

        public static void usage()
        {
                System.err.println("expecting: -c scenario.json [-e E] [-s cap,cap,...]");
                System.exit(1);
        }

        private static double[] parse_caps(String s)
        {
                String[] sa = s.split(",");
                double[] caps = new double[sa.length];
                for (int i = 0; i < sa.length; i++)
                        caps[i] = Double.parseDouble(sa[i].trim());
                return caps;
        }

        private static void print_summary(SimulationSummary summary)
        {
                System.out.println("Probability of success: " + f1f.format(100 * summary.success_probability) + "%");
                System.out.println("Median terminal net worth: " + f0f.format(summary.median_terminal_net_worth));
                System.out.println("Mean lifetime tax: " + f0f.format(summary.mean_lifetime_tax));
                System.out.println();
                StringBuilder header = new StringBuilder("year age");
                for (double pct : summary.percentiles)
                        header.append(" net_worth_p" + f1f.format(pct));
                for (double pct : summary.percentiles)
                        header.append(" income_p" + f1f.format(pct));
                System.out.println(header);
                for (int y = 0; y < summary.years.length; y++)
                {
                        StringBuilder line = new StringBuilder(summary.years[y] + " " + summary.ages[y]);
                        for (int i = 0; i < summary.percentiles.length; i++)
                                line.append(" " + f0f.format(summary.net_worth.values[i][y]));
                        for (int i = 0; i < summary.percentiles.length; i++)
                                line.append(" " + f0f.format(summary.income.values[i][y]));
                        System.out.println(line);
                }
        }

        private static void print_sweep(ConversionSweep sweep)
        {
                SweepMetric[] metrics = SweepMetric.values();
                StringBuilder header = new StringBuilder("cap");
                for (SweepMetric metric : metrics)
                        header.append(" " + metric.key);
                System.out.println(header);
                double[][] grid = sweep.grid(metrics);
                for (int i = 0; i < sweep.caps.length; i++)
                {
                        StringBuilder line = new StringBuilder(f0f.format(sweep.caps[i]));
                        for (int m = 0; m < metrics.length; m++)
                                line.append(" " + (metrics[m] == SweepMetric.SUCCESS_PROBABILITY ? f1f.format(100 * grid[i][m]) + "%" : f0f.format(grid[i][m])));
                        System.out.println(line);
                }
        }

        public static void run(Config config, Scenario scenario, double[] caps, String cwd) throws Exception
        {
                TaxEngine tax_engine = new TaxEngine(TaxTables.load(config.tax_tables));
                RmdTable rmd_table = RmdTable.load(config.rmd_table);

                ExecutorService executor = Executors.newFixedThreadPool(config.workers);
                try
                {
                        MonteCarloEngine engine = new MonteCarloEngine(config, tax_engine, rmd_table, executor);
                        long start = System.currentTimeMillis();
                        if (caps == null)
                        {
                                SimulationSummary summary = engine.run(scenario);
                                print_summary(summary);
                                LedgerExport.write(new File(cwd + "/" + config.prefix + "-ledger.csv"), scenario, summary);
                        }
                        else
                        {
                                ConversionSweep sweep = new RothConversionExplorer(engine).sweep(scenario, caps);
                                print_sweep(sweep);
                        }
                        System.out.println();
                        System.out.println("Total done: " + f1f.format((System.currentTimeMillis() - start) / 1000.0) + " seconds");
                }
                catch (Exception | AssertionError e)
                {
                        executor.shutdownNow();
                        throw e;
                }
                executor.shutdown();
        }

        public static void main(String[] args) throws Exception
        {
                Config config = new Config();
                String scenario_filename = null;
                double[] caps = null;
                Map<String, Object> params = new HashMap<String, Object>();

                try
                {
                        config.load_resource(params, Config.DEFAULTS);
                        for (int idx = 0; idx < args.length; idx++)
                        {
                                String arg = args[idx];
                                if ("-c".equals(arg))
                                        scenario_filename = args[++idx];
                                else if ("-e".equals(arg))
                                        config.load_params(params, args[++idx]);
                                else if ("-s".equals(arg))
                                        caps = parse_caps(args[++idx]);
                                else
                                {
                                        System.err.println("Unrecognized argument");
                                        usage();
                                }
                        }
                        config.apply_params(params);
                }
                catch (ArrayIndexOutOfBoundsException e)
                {
                        System.err.println("Invalid parameters");
                        usage();
                }
                catch (IllegalArgumentException e)
                {
                        System.err.println(e.getMessage());
                        usage();
                }
                if (scenario_filename == null)
                        usage();

                try
                {
                        Scenario scenario = ScenarioIO.load(new File(scenario_filename));
                        System.out.println("Parameters:");
                        config.dump_params(System.out);
                        System.out.println();
                        run(config, scenario, caps, System.getProperty("user.dir"));
                }
                catch (InvalidScenarioException | TableDataException e)
                {
                        System.err.println(e.getMessage());
                        System.exit(1);
                }
        }
}
