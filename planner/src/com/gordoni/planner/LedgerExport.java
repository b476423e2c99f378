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
import java.io.IOException;
import java.io.PrintWriter;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.List;
import java.util.Locale;

/**
 * CSV dump of path ledgers, one row per path, year and account, plus a cash row per year.
 */
public class LedgerExport
{
        public static final String HEADER = "path,year,age,account,type,starting_balance,contribution,return,withdrawal,rmd,conversion,tax_paid,ending_balance";

        private static final DecimalFormat f2f = new DecimalFormat("0.00", DecimalFormatSymbols.getInstance(Locale.US));

        private static String fmt(double x)
        {
                synchronized (f2f)
                {
                        return f2f.format(x);
                }
        }

        public static void write_path(PrintWriter out, String label, Scenario scenario, List<LedgerYear> ledger)
        {
                for (LedgerYear ly : ledger)
                {
                        for (int a = 0; a < scenario.accounts.size(); a++)
                        {
                                Account account = scenario.accounts.get(a);
                                out.println(label + "," + ly.year + "," + ly.age + "," + account.name + "," + account.type.key + ","
                                        + fmt(ly.start_balance[a]) + "," + fmt(ly.contribution[a]) + "," + fmt(ly.growth[a]) + ","
                                        + fmt(ly.withdrawal[a]) + "," + fmt(ly.rmd_taken[a]) + "," + fmt(ly.conversion[a]) + ","
                                        + fmt(ly.tax_paid[a]) + "," + fmt(ly.end_balance[a]));
                        }
                        out.println(label + "," + ly.year + "," + ly.age + ",cash,cash,"
                                + fmt(ly.cash_start) + "," + fmt(ly.cash_deposit) + "," + fmt(0) + ","
                                + fmt(ly.cash_withdrawal + ly.cash_swept) + "," + fmt(0) + "," + fmt(0) + ","
                                + fmt(ly.cash_tax_paid) + "," + fmt(ly.cash));
                }
        }

        /**
         * Write the median path followed by the retained display paths.
         */
        public static void write(PrintWriter out, Scenario scenario, SimulationSummary summary)
        {
                out.println(HEADER);
                write_path(out, "median", scenario, summary.median_path.ledger);
                for (PathOutcome outcome : summary.display_paths)
                        write_path(out, Integer.toString(outcome.path), scenario, outcome.ledger);
        }

        public static void write(File file, Scenario scenario, SimulationSummary summary) throws IOException
        {
                PrintWriter out = new PrintWriter(file, "UTF-8");
                try
                {
                        write(out, scenario, summary);
                }
                finally
                {
                        out.close();
                }
        }
}
