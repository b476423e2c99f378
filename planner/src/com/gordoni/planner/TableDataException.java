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
 * A tax or RMD table is malformed, missing, or was asked to tax a negative income. Fatal to the run.
 */
public class TableDataException extends RuntimeException
{
        private static final long serialVersionUID = 1L;

        private final String table;
        private final String entry;

        public TableDataException(String table, String entry, String message)
        {
                super(table + " [" + entry + "]: " + message);
                this.table = table;
                this.entry = entry;
        }

        public TableDataException(String table, String entry, String message, Throwable cause)
        {
                super(table + " [" + entry + "]: " + message, cause);
                this.table = table;
                this.entry = entry;
        }

        public String getTable()
        {
                return table;
        }

        public String getEntry()
        {
                return entry;
        }
}
