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
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * JSON documents for scenarios. Every field round trips exactly.
 */
public class ScenarioIO
{
        private static final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

        public static ObjectNode to_tree(Scenario scenario)
        {
                ObjectNode root = mapper.createObjectNode();
                root.put("id", scenario.id);
                root.put("start_year", scenario.start_year);
                root.put("retirement_age", scenario.retirement_age);
                root.put("end_age", scenario.end_age);

                ArrayNode people = root.putArray("people");
                for (Person p : scenario.people)
                {
                        ObjectNode node = people.addObject();
                        node.put("name", p.name);
                        node.put("birth_year", p.birth_year);
                        node.put("pia", p.pia);
                        node.put("claiming_age", p.claiming_age);
                        if (p.death_age == null)
                                node.putNull("death_age");
                        else
                                node.put("death_age", p.death_age);
                }

                ArrayNode accounts = root.putArray("accounts");
                for (Account a : scenario.accounts)
                {
                        ObjectNode node = accounts.addObject();
                        node.put("name", a.name);
                        node.put("type", a.type.key);
                        node.put("balance", a.balance);
                        node.put("cost_basis", a.cost_basis);
                        node.put("mean_return", a.mean_return);
                        node.put("volatility", a.volatility);
                        node.put("owner", a.owner);
                }

                ArrayNode contributions = root.putArray("contributions");
                for (Contribution c : scenario.contributions)
                {
                        ObjectNode node = contributions.addObject();
                        node.put("account", c.account);
                        node.put("amount", c.amount);
                        node.put("start_age", c.start_age);
                        node.put("end_age", c.end_age);
                }

                ObjectNode spending = root.putObject("spending");
                spending.put("annual", scenario.spending.annual);
                ObjectNode special = spending.putObject("special_expenses");
                for (Map.Entry<Integer, Double> e : scenario.spending.special_expenses.entrySet())
                        special.put(e.getKey().toString(), e.getValue());

                ArrayNode other_income = root.putArray("other_income");
                for (IncomeStream s : scenario.other_income)
                {
                        ObjectNode node = other_income.addObject();
                        node.put("name", s.name);
                        node.put("amount", s.amount);
                        node.put("start_age", s.start_age);
                        node.put("end_age", s.end_age);
                        node.put("taxable", s.taxable);
                        node.put("inflation_indexed", s.inflation_indexed);
                }

                root.put("filing_status", scenario.filing_status.key);
                if (scenario.state == null)
                        root.putNull("state");
                else
                        root.put("state", scenario.state);
                root.put("inflation", scenario.inflation);
                root.put("correlation", scenario.correlation.key);
                ArrayNode order = root.putArray("withdrawal_order");
                for (AccountType type : scenario.withdrawal_order)
                        order.add(type.key);
                ObjectNode strategy = root.putObject("withdrawal_strategy");
                strategy.put("type", scenario.withdrawal_strategy.type());
                if (scenario.withdrawal_strategy instanceof BracketWithdrawal)
                        strategy.put("pre_tax_limit", ((BracketWithdrawal) scenario.withdrawal_strategy).pre_tax_limit);

                ConversionPolicy policy = scenario.conversion;
                if (policy == null)
                        root.putNull("roth_conversion");
                else
                {
                        ObjectNode node = root.putObject("roth_conversion");
                        node.put("type", policy.type());
                        if (Double.isInfinite(policy.cap()))
                                node.putNull("annual_cap"); // Unlimited.
                        else
                                node.put("annual_cap", policy.cap());
                        if (policy instanceof ConversionBracketFill)
                                node.put("bracket_rate", ((ConversionBracketFill) policy).bracket_rate);
                        node.put("start_age", policy.start_age);
                        node.put("end_age", policy.end_age);
                        node.put("funding", policy.funding.key);
                }

                return root;
        }

        public static String to_json(Scenario scenario)
        {
                try
                {
                        return mapper.writeValueAsString(to_tree(scenario));
                }
                catch (JsonProcessingException e)
                {
                        throw new IllegalStateException("Unable to write " + scenario, e);
                }
        }

        public static void save(Scenario scenario, File file) throws IOException
        {
                mapper.writeValue(file, to_tree(scenario));
        }

        public static Scenario from_json(String json) throws IOException
        {
                return from_tree(mapper.readTree(json));
        }

        public static Scenario load(File file) throws IOException
        {
                return from_tree(mapper.readTree(file));
        }

        private static JsonNode required(JsonNode node, String field, String id, String path)
        {
                JsonNode value = node.get(field);
                if (value == null || value.isNull())
                        throw new InvalidScenarioException(id, path + field, "missing");
                return value;
        }

        private static int get_int(JsonNode node, String field, String id, String path)
        {
                JsonNode value = required(node, field, id, path);
                if (!value.canConvertToInt() || !value.isIntegralNumber())
                        throw new InvalidScenarioException(id, path + field, "expecting an integer: " + value);
                return value.intValue();
        }

        private static double get_double(JsonNode node, String field, String id, String path)
        {
                JsonNode value = required(node, field, id, path);
                if (!value.isNumber())
                        throw new InvalidScenarioException(id, path + field, "expecting a number: " + value);
                return value.doubleValue();
        }

        private static String get_string(JsonNode node, String field, String id, String path)
        {
                JsonNode value = required(node, field, id, path);
                if (!value.isTextual())
                        throw new InvalidScenarioException(id, path + field, "expecting a string: " + value);
                return value.textValue();
        }

        private static boolean get_boolean(JsonNode node, String field, String id, String path)
        {
                JsonNode value = required(node, field, id, path);
                if (!value.isBoolean())
                        throw new InvalidScenarioException(id, path + field, "expecting true or false: " + value);
                return value.booleanValue();
        }

        private static Iterable<JsonNode> elements(JsonNode node, String field, String id)
        {
                JsonNode value = node.get(field);
                List<JsonNode> elements = new ArrayList<JsonNode>();
                if (value == null || value.isNull())
                        return elements;
                if (!value.isArray())
                        throw new InvalidScenarioException(id, field, "expecting a list");
                for (JsonNode element : value)
                        elements.add(element);
                return elements;
        }

        public static Scenario from_tree(JsonNode root)
        {
                if (root == null || !root.isObject())
                        throw new InvalidScenarioException(null, "document", "expecting a scenario object");
                JsonNode id_node = root.get("id");
                String id = (id_node == null || !id_node.isTextual()) ? null : id_node.textValue();
                if (id == null)
                        throw new InvalidScenarioException(null, "id", "missing scenario id");

                try
                {
                        List<Person> people = new ArrayList<Person>();
                        int i = 0;
                        for (JsonNode node : elements(root, "people", id))
                        {
                                String path = "people[" + i++ + "].";
                                JsonNode death = node.get("death_age");
                                Integer death_age = (death == null || death.isNull()) ? null : get_int(node, "death_age", id, path);
                                people.add(new Person(get_string(node, "name", id, path), get_int(node, "birth_year", id, path),
                                        get_double(node, "pia", id, path), get_int(node, "claiming_age", id, path), death_age));
                        }

                        List<Account> accounts = new ArrayList<Account>();
                        i = 0;
                        for (JsonNode node : elements(root, "accounts", id))
                        {
                                String path = "accounts[" + i++ + "].";
                                AccountType type = AccountType.fromKey(get_string(node, "type", id, path));
                                double balance = get_double(node, "balance", id, path);
                                double cost_basis = node.has("cost_basis") ? get_double(node, "cost_basis", id, path) : (type == AccountType.TAXABLE ? balance : 0);
                                int owner = node.has("owner") ? get_int(node, "owner", id, path) : 0;
                                accounts.add(new Account(get_string(node, "name", id, path), type, balance, cost_basis,
                                        get_double(node, "mean_return", id, path), get_double(node, "volatility", id, path), owner));
                        }

                        List<Contribution> contributions = new ArrayList<Contribution>();
                        i = 0;
                        for (JsonNode node : elements(root, "contributions", id))
                        {
                                String path = "contributions[" + i++ + "].";
                                contributions.add(new Contribution(get_string(node, "account", id, path), get_double(node, "amount", id, path),
                                        get_int(node, "start_age", id, path), get_int(node, "end_age", id, path)));
                        }

                        JsonNode spending_node = required(root, "spending", id, "");
                        Map<Integer, Double> special = new TreeMap<Integer, Double>();
                        JsonNode special_node = spending_node.get("special_expenses");
                        if (special_node != null && !special_node.isNull())
                        {
                                Iterator<Map.Entry<String, JsonNode>> it = special_node.fields();
                                while (it.hasNext())
                                {
                                        Map.Entry<String, JsonNode> e = it.next();
                                        int age;
                                        try
                                        {
                                                age = Integer.parseInt(e.getKey());
                                        }
                                        catch (NumberFormatException ex)
                                        {
                                                throw new InvalidScenarioException(id, "spending.special_expenses." + e.getKey(), "age is not a number");
                                        }
                                        special.put(age, get_double(special_node, e.getKey(), id, "spending.special_expenses."));
                                }
                        }
                        Spending spending = new Spending(get_double(spending_node, "annual", id, "spending."), special);

                        List<IncomeStream> other_income = new ArrayList<IncomeStream>();
                        i = 0;
                        for (JsonNode node : elements(root, "other_income", id))
                        {
                                String path = "other_income[" + i++ + "].";
                                other_income.add(new IncomeStream(get_string(node, "name", id, path), get_double(node, "amount", id, path),
                                        get_int(node, "start_age", id, path), get_int(node, "end_age", id, path),
                                        get_boolean(node, "taxable", id, path), get_boolean(node, "inflation_indexed", id, path)));
                        }

                        FilingStatus filing_status = FilingStatus.fromKey(get_string(root, "filing_status", id, ""));
                        JsonNode state_node = root.get("state");
                        String state = (state_node == null || state_node.isNull()) ? null : get_string(root, "state", id, "");
                        double inflation = root.has("inflation") ? get_double(root, "inflation", id, "") : 0;
                        CorrelationMode correlation = root.has("correlation") ? CorrelationMode.fromKey(get_string(root, "correlation", id, "")) : CorrelationMode.FULL;

                        List<AccountType> withdrawal_order = new ArrayList<AccountType>();
                        for (JsonNode node : elements(root, "withdrawal_order", id))
                        {
                                if (!node.isTextual())
                                        throw new InvalidScenarioException(id, "withdrawal_order", "expecting account type names");
                                withdrawal_order.add(AccountType.fromKey(node.textValue()));
                        }
                        if (!root.has("withdrawal_order"))
                                withdrawal_order.addAll(Scenario.DEFAULT_WITHDRAWAL_ORDER);

                        WithdrawalStrategy withdrawal_strategy = new OrderedWithdrawal();
                        JsonNode strategy = root.get("withdrawal_strategy");
                        if (strategy != null && !strategy.isNull())
                        {
                                String path = "withdrawal_strategy.";
                                Double pre_tax_limit = strategy.has("pre_tax_limit") ? get_double(strategy, "pre_tax_limit", id, path) : null;
                                withdrawal_strategy = WithdrawalStrategy.strategyFactory(get_string(strategy, "type", id, path), pre_tax_limit);
                        }

                        ConversionPolicy conversion = null;
                        JsonNode policy = root.get("roth_conversion");
                        if (policy != null && !policy.isNull())
                        {
                                String path = "roth_conversion.";
                                JsonNode cap_node = policy.get("annual_cap");
                                double cap = (cap_node == null || cap_node.isNull()) ? Double.POSITIVE_INFINITY : get_double(policy, "annual_cap", id, path);
                                Double bracket_rate = policy.has("bracket_rate") ? get_double(policy, "bracket_rate", id, path) : null;
                                conversion = ConversionPolicy.policyFactory(get_string(policy, "type", id, path), cap, bracket_rate,
                                        get_int(policy, "start_age", id, path), get_int(policy, "end_age", id, path),
                                        ConversionFunding.fromKey(get_string(policy, "funding", id, path)));
                        }

                        return new Scenario(id, get_int(root, "start_year", id, ""), people, get_int(root, "retirement_age", id, ""),
                                get_int(root, "end_age", id, ""), accounts, contributions, spending, other_income, filing_status, state,
                                inflation, correlation, withdrawal_order, withdrawal_strategy, conversion);
                }
                catch (InvalidScenarioException e)
                {
                        throw e;
                }
                catch (IllegalArgumentException e)
                {
                        // Unknown enumeration keys and policy types.
                        throw new InvalidScenarioException(id, "document", e.getMessage());
                }
        }
}
