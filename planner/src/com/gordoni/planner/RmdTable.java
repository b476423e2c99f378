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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Required minimum distributions from tax-deferred accounts using the IRS Uniform Lifetime table.
 */
public class RmdTable
{
        public static final int EARLIEST_BIRTH_YEAR = 1949; // Earlier births reached 70 1/2 under the pre SECURE Act rules.

        private final String name;
        private final int first_age;
        private final double[] divisors; // Indexed by age - first_age.

        public RmdTable(String name, int first_age, double[] divisors)
        {
                if (divisors.length == 0)
                        throw new TableDataException(name, "divisors", "empty table");
                for (int i = 0; i < divisors.length; i++)
                        if (!(divisors[i] > 0))
                                throw new TableDataException(name, "age " + (first_age + i), "divisor must be positive: " + divisors[i]);
                this.name = name;
                this.first_age = first_age;
                this.divisors = divisors.clone();
        }

        /**
         * Age in the distribution year at which RMDs begin, under the SECURE 2.0 schedule.
         *
         * Birth years before EARLIEST_BIRTH_YEAR are clamped to 72. Their real start was 70 1/2, which this table
         * can't express, so Scenario rejects such a person while they still own tax-deferred savings and are
         * below 72 in the start year. Once past 72 the clamp is harmless.
         */
        public static int start_age(int birth_year)
        {
                if (birth_year <= 1950)
                        return 72;
                else if (birth_year <= 1959)
                        return 73;
                else
                        return 75;
        }

        /**
         * Uniform Lifetime divisor for an attained age. Ages past the end of the table use the last entry.
         */
        public double divisor(int age)
        {
                if (age < first_age)
                        throw new TableDataException(name, "age " + age, "no divisor before age " + first_age);
                return divisors[Math.min(age - first_age, divisors.length - 1)];
        }

        public double required_minimum(int age, double prior_year_end_balance, int birth_year)
        {
                if (age < start_age(birth_year) || prior_year_end_balance <= 0)
                        return 0;
                return prior_year_end_balance / divisor(age);
        }

        public static RmdTable load(String resource)
        {
                InputStream stream = RmdTable.class.getClassLoader().getResourceAsStream(resource);
                if (stream == null)
                        throw new TableDataException(resource, "resource", "not found on classpath");
                try
                {
                        return load(resource, new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8)));
                }
                catch (IOException e)
                {
                        throw new TableDataException(resource, "resource", "unreadable: " + e.getMessage(), e);
                }
        }

        /**
         * Read age,divisor rows following a header line. Ages must be consecutive.
         */
        public static RmdTable load(String name, BufferedReader in) throws IOException
        {
                try
                {
                        String line = in.readLine(); // Header.
                        List<Double> divisor_list = new ArrayList<Double>();
                        int first_age = -1;
                        int prev_age = -1;
                        int line_no = 1;
                        while ((line = in.readLine()) != null)
                        {
                                line_no++;
                                if (line.trim().equals(""))
                                        continue;
                                String[] fields = line.split(",", -1);
                                if (fields.length != 2)
                                        throw new TableDataException(name, "line " + line_no, "expecting age,divisor");
                                int age;
                                double divisor;
                                try
                                {
                                        age = Integer.parseInt(fields[0].trim());
                                        divisor = Double.parseDouble(fields[1].trim());
                                }
                                catch (NumberFormatException e)
                                {
                                        throw new TableDataException(name, "line " + line_no, "not a number: " + line);
                                }
                                if (first_age == -1)
                                        first_age = age;
                                else if (age != prev_age + 1)
                                        throw new TableDataException(name, "line " + line_no, "ages must be consecutive: " + prev_age + " then " + age);
                                prev_age = age;
                                divisor_list.add(divisor);
                        }
                        double[] divisors = new double[divisor_list.size()];
                        for (int i = 0; i < divisors.length; i++)
                                divisors[i] = divisor_list.get(i);
                        return new RmdTable(name, first_age, divisors);
                }
                finally
                {
                        in.close();
                }
        }
}
