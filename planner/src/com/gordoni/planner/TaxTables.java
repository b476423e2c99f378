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

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Federal and state tax schedules keyed by tax year and filing status. Read only once constructed.
 *
 * A request for a year without a table uses the latest earlier year, or the earliest year when the request
 * precedes every table. Amounts are not indexed for inflation.
 */
public class TaxTables
{
        private static final String DEFAULT_STATUS = "default";

        private final String name;
        private final TreeMap<Integer, Map<FilingStatus, TaxTable>> federal = new TreeMap<Integer, Map<FilingStatus, TaxTable>>();
        private final TreeMap<Integer, Map<String, StateTax>> states = new TreeMap<Integer, Map<String, StateTax>>();

        public TaxTables(String name, List<TaxTable> federal_tables, List<StateTax> state_tables)
        {
                this.name = name;
                for (TaxTable table : federal_tables)
                {
                        Map<FilingStatus, TaxTable> year = federal.get(table.year);
                        if (year == null)
                        {
                                year = new HashMap<FilingStatus, TaxTable>();
                                federal.put(table.year, year);
                        }
                        if (year.put(table.filing_status, table) != null)
                                throw new TableDataException(name, table.year + "/" + table.filing_status.key, "duplicate federal table");
                }
                for (StateTax table : state_tables)
                {
                        Map<String, StateTax> year = states.get(table.year);
                        if (year == null)
                        {
                                year = new HashMap<String, StateTax>();
                                states.put(table.year, year);
                        }
                        String key = state_key(table.state, table.filing_status);
                        if (year.put(key, table) != null)
                                throw new TableDataException(name, table.year + "/" + key, "duplicate state table");
                }
                if (federal.isEmpty())
                        throw new TableDataException(name, "federal", "no federal tables");
        }

        private static String state_key(String state, FilingStatus filing_status)
        {
                return state + "/" + (filing_status == null ? DEFAULT_STATUS : filing_status.key);
        }

        private static <T> T for_year(TreeMap<Integer, T> tables, int year)
        {
                if (tables.isEmpty())
                        return null;
                Integer key = tables.floorKey(year);
                if (key == null)
                        key = tables.firstKey();
                return tables.get(key);
        }

        public TaxTable federal(int year, FilingStatus filing_status)
        {
                TaxTable table = for_year(federal, year).get(filing_status);
                if (table == null)
                        throw new TableDataException(name, year + "/" + filing_status.key, "no federal table for filing status");
                return table;
        }

        /**
         * State table, or null when state is null.
         */
        public StateTax state(int year, FilingStatus filing_status, String state)
        {
                if (state == null)
                        return null;
                Map<String, StateTax> year_tables = for_year(states, year);
                StateTax table = null;
                if (year_tables != null)
                {
                        table = year_tables.get(state_key(state, filing_status));
                        if (table == null)
                                table = year_tables.get(state_key(state, null));
                }
                if (table == null)
                        throw new TableDataException(name, year + "/" + state, "no state table");
                return table;
        }

        public boolean has_state(String state)
        {
                for (Map<String, StateTax> year_tables : states.values())
                        for (StateTax table : year_tables.values())
                                if (table.state.equals(state))
                                        return true;
                return false;
        }

        public String getName()
        {
                return name;
        }

        public static TaxTables load(String resource)
        {
                InputStream in = TaxTables.class.getClassLoader().getResourceAsStream(resource);
                if (in == null)
                        throw new TableDataException(resource, "resource", "not found on classpath");
                try
                {
                        try
                        {
                                return parse(resource, in);
                        }
                        finally
                        {
                                in.close();
                        }
                }
                catch (IOException e)
                {
                        throw new TableDataException(resource, "resource", "unreadable: " + e.getMessage(), e);
                }
        }

        /**
         * Parse a document of the form
         * {"2024": {"federal": {"single": {"standard_deduction": d, "brackets": [[0, r], ...], "capital_gains": [[0, r], ...]}},
         *           "state": {"MI": {"default": {"rate": r, "standard_deduction": d, "include_gains": true}}}}}.
         */
        public static TaxTables parse(String name, InputStream in) throws IOException
        {
                JsonNode root = new ObjectMapper().readTree(in);
                if (root == null || !root.isObject())
                        throw new TableDataException(name, "root", "expecting an object keyed by tax year");

                List<TaxTable> federal_tables = new ArrayList<TaxTable>();
                List<StateTax> state_tables = new ArrayList<StateTax>();
                Iterator<Map.Entry<String, JsonNode>> years = root.fields();
                while (years.hasNext())
                {
                        Map.Entry<String, JsonNode> year_entry = years.next();
                        int year;
                        try
                        {
                                year = Integer.parseInt(year_entry.getKey());
                        }
                        catch (NumberFormatException e)
                        {
                                throw new TableDataException(name, year_entry.getKey(), "tax year is not a number");
                        }
                        JsonNode fed = year_entry.getValue().path("federal");
                        Iterator<Map.Entry<String, JsonNode>> statuses = fed.fields();
                        while (statuses.hasNext())
                        {
                                Map.Entry<String, JsonNode> status_entry = statuses.next();
                                String where = year + "/federal/" + status_entry.getKey();
                                FilingStatus status = filing_status(name, where, status_entry.getKey());
                                JsonNode node = status_entry.getValue();
                                federal_tables.add(new TaxTable(year, status,
                                        node.path("standard_deduction").asDouble(0),
                                        brackets(name, where + "/brackets", node.get("brackets")),
                                        brackets(name, where + "/capital_gains", node.get("capital_gains"))));
                        }
                        Iterator<Map.Entry<String, JsonNode>> state_codes = year_entry.getValue().path("state").fields();
                        while (state_codes.hasNext())
                        {
                                Map.Entry<String, JsonNode> state_entry = state_codes.next();
                                Iterator<Map.Entry<String, JsonNode>> state_statuses = state_entry.getValue().fields();
                                while (state_statuses.hasNext())
                                {
                                        Map.Entry<String, JsonNode> status_entry = state_statuses.next();
                                        String where = year + "/state/" + state_entry.getKey() + "/" + status_entry.getKey();
                                        FilingStatus status = DEFAULT_STATUS.equals(status_entry.getKey()) ? null : filing_status(name, where, status_entry.getKey());
                                        JsonNode node = status_entry.getValue();
                                        TaxBrackets schedule;
                                        if (node.has("rate"))
                                                schedule = TaxBrackets.flat(name + " " + where, node.get("rate").asDouble());
                                        else
                                                schedule = brackets(name, where + "/brackets", node.get("brackets"));
                                        state_tables.add(new StateTax(state_entry.getKey(), year, status,
                                                node.path("standard_deduction").asDouble(0), node.path("include_gains").asBoolean(false), schedule));
                                }
                        }
                }

                return new TaxTables(name, federal_tables, state_tables);
        }

        private static FilingStatus filing_status(String name, String where, String key)
        {
                try
                {
                        return FilingStatus.fromKey(key);
                }
                catch (IllegalArgumentException e)
                {
                        throw new TableDataException(name, where, e.getMessage());
                }
        }

        private static TaxBrackets brackets(String name, String where, JsonNode node)
        {
                if (node == null || !node.isArray())
                        throw new TableDataException(name, where, "expecting [[lower_bound, rate], ...]");
                double[] lower_bounds = new double[node.size()];
                double[] rates = new double[node.size()];
                for (int i = 0; i < node.size(); i++)
                {
                        JsonNode pair = node.get(i);
                        if (!pair.isArray() || pair.size() != 2 || !pair.get(0).isNumber() || !pair.get(1).isNumber())
                                throw new TableDataException(name, where + "[" + i + "]", "expecting [lower_bound, rate]");
                        lower_bounds[i] = pair.get(0).asDouble();
                        rates[i] = pair.get(1).asDouble();
                }
                return new TaxBrackets(name + " " + where, lower_bounds, rates);
        }
}
