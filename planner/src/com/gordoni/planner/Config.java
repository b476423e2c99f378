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
import java.io.PrintStream;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;
import java.util.TreeMap;

/**
 * Run parameters for the projection engine.
 *
 * These control how a run executes, never what is projected: results are identical for any choice of
 * workers and tasks.
 */
public class Config
{
        public static final String DEFAULTS = "planner-config.txt";

        public String version = "java-1.0.0";

        public String prefix = "planner"; // Prefix to use for result files.

        public boolean trace = false; // Be chatty.

        public int workers = Runtime.getRuntime().availableProcessors(); // Number of worker threads to use.
        public int tasks = 100; // Break a simulation into this many concurrent tasks.

        public int paths = 1000; // Number of Monte Carlo paths to simulate.
        public int min_paths = 1000; // Fewer paths than this are rejected as statistically meaningless.
        public int seed = 0; // Base seed. Path seeds are derived from this and the path index.
        public double[] percentiles = new double[]{10, 50, 90}; // Percentile bands to report.
        public int max_display_paths = 10; // Number of path ledgers to retain in addition to the median path.

        public double tax_tolerance = 0.005; // Unpaid tax below which settlement of the year's tax stops.
        public int tax_iterations = 50; // Maximum rounds of paying tax on the withdrawals used to pay tax.

        public String tax_tables = "tax-tables.json"; // Classpath resource holding the tax tables.
        public String rmd_table = "irs-pub590b-uniform_lifetime-2022.csv"; // Classpath resource holding the RMD divisors.

        /**
         * Parse name = value lines into params. Text after a # is a comment.
         */
        public void load_params(Map<String, Object> params, String in)
        {
                String[] lines = in.split("\\r?\\n");
                for (String line : lines)
                {
                        int comment_pos = line.indexOf("#");
                        if (comment_pos != -1)
                                line = line.substring(0, comment_pos);
                        line = line.trim(); // Handle empty lines containing whitespace.
                        if (line.equals(""))
                                continue;
                        int eq_pos = line.indexOf("=");
                        if (eq_pos == -1)
                                throw new IllegalArgumentException("Expecting name = value: " + line);

                        String var = line.substring(0, eq_pos).trim();
                        String val = line.substring(eq_pos + 1).trim();
                        params.put(var, parse_value(parameter(var).getType(), val));
                }
        }

        /**
         * Read name = value lines from a classpath resource.
         */
        public void load_resource(Map<String, Object> params, String resource) throws IOException
        {
                InputStream stream = Config.class.getClassLoader().getResourceAsStream(resource);
                if (stream == null)
                        throw new IOException("Missing resource " + resource);
                BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8));
                StringBuilder stringBuilder = new StringBuilder();
                String line;
                try
                {
                        while ((line = reader.readLine()) != null)
                        {
                                stringBuilder.append(line);
                                stringBuilder.append("\n");
                        }
                }
                finally
                {
                        reader.close();
                }
                load_params(params, stringBuilder.toString());
        }

        /**
         * Run parameter called name. Only instance fields are parameters.
         */
        private Field parameter(String name)
        {
                Field f;
                try
                {
                        f = Config.class.getDeclaredField(name);
                }
                catch (NoSuchFieldException e)
                {
                        throw new IllegalArgumentException("Unknown parameter " + name, e);
                }
                if (Modifier.isStatic(f.getModifiers()))
                        throw new IllegalArgumentException("Unknown parameter " + name);
                return f;
        }

        /**
         * Set each parameter from a value produced by load_params.
         */
        public void apply_params(Map<String, Object> params)
        {
                for (Map.Entry<String, Object> e : params.entrySet())
                {
                        try
                        {
                                parameter(e.getKey()).set(this, e.getValue());
                        }
                        catch (IllegalAccessException ex)
                        {
                                throw new IllegalStateException("Parameter " + e.getKey() + " is not settable", ex);
                        }
                }
        }

        /**
         * Print every parameter as a name = value line that load_params reads back.
         */
        public void dump_params(PrintStream out)
        {
                Map<String, String> lines = new TreeMap<String, String>();
                for (Field f : Config.class.getDeclaredFields())
                {
                        if (Modifier.isStatic(f.getModifiers()))
                                continue;
                        try
                        {
                                lines.put(f.getName(), format_value(f.get(this)));
                        }
                        catch (IllegalAccessException e)
                        {
                                throw new IllegalStateException("Parameter " + f.getName() + " is not readable", e);
                        }
                }
                for (Map.Entry<String, String> e : lines.entrySet())
                        out.println("   " + e.getKey() + " = " + e.getValue());
        }

        private static String format_value(Object value)
        {
                if (value instanceof String)
                        return "'" + value + "'";
                else if (value instanceof double[])
                        return Arrays.toString((double[]) value);
                else
                        return String.valueOf(value);
        }

        /**
         * Parse the text of a value for a parameter of the given type: a quoted string, true or false, a number,
         * or a bracketed list of numbers.
         */
        private static Object parse_value(Class<?> type, String raw)
        {
                try
                {
                        if (type == String.class)
                        {
                                if (raw.length() < 2 || !(raw.startsWith("'") && raw.endsWith("'") || raw.startsWith("\"") && raw.endsWith("\"")))
                                        throw new IllegalArgumentException("expecting a quoted string");
                                return raw.substring(1, raw.length() - 1);
                        }
                        else if (type == boolean.class)
                        {
                                if (!raw.equals("true") && !raw.equals("false"))
                                        throw new IllegalArgumentException("expecting true or false");
                                return Boolean.valueOf(raw);
                        }
                        else if (type == int.class)
                                return Integer.valueOf(raw);
                        else if (type == double.class)
                                return Double.valueOf(raw);
                        else if (type == double[].class)
                        {
                                if (!raw.startsWith("[") || !raw.endsWith("]"))
                                        throw new IllegalArgumentException("expecting [a, b, ...]");
                                String body = raw.substring(1, raw.length() - 1).trim();
                                if (body.equals(""))
                                        return new double[0];
                                String[] items = body.split(",");
                                double[] list = new double[items.length];
                                for (int i = 0; i < items.length; i++)
                                        list[i] = Double.parseDouble(items[i].trim());
                                return list;
                        }
                        else
                                throw new IllegalStateException("No parser for parameters of type " + type.getName());
                }
                catch (NumberFormatException e)
                {
                        throw new IllegalArgumentException("Not a number: " + raw, e);
                }
                catch (IllegalArgumentException e)
                {
                        throw new IllegalArgumentException("Invalid value " + raw + ": " + e.getMessage(), e);
                }
        }
}
