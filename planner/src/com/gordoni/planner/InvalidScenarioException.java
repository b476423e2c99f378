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

/**
 * Scenario input is malformed or out of range. Raised before any simulation starts.
 */
public class InvalidScenarioException extends IllegalArgumentException
{
        private static final long serialVersionUID = 1L;

        private final String scenario_id;
        private final String field;

        public InvalidScenarioException(String scenario_id, String field, String message)
        {
                super("scenario " + scenario_id + ": " + field + ": " + message);
                this.scenario_id = scenario_id;
                this.field = field;
        }

        public String getScenarioId()
        {
                return scenario_id;
        }

        public String getField()
        {
                return field;
        }
}
