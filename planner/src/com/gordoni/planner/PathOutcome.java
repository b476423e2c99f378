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

import java.util.Collections;
import java.util.List;

public class PathOutcome
{
        public final int path;
        public final boolean success; // Spending and tax were met every year through the end of the plan.
        public final Integer failure_year; // Year funds ran out, or null.
        public final double terminal_net_worth;
        public final double lifetime_tax;
        public final List<LedgerYear> ledger;

        public PathOutcome(int path, boolean success, Integer failure_year, double terminal_net_worth, double lifetime_tax, List<LedgerYear> ledger)
        {
                assert(success == (failure_year == null));
                this.path = path;
                this.success = success;
                this.failure_year = failure_year;
                this.terminal_net_worth = terminal_net_worth;
                this.lifetime_tax = lifetime_tax;
                this.ledger = Collections.unmodifiableList(ledger);
        }

        public String toString()
        {
                return "{path: " + path + ", success: " + success + ", terminal_net_worth: " + terminal_net_worth + ", lifetime_tax: " + lifetime_tax + "}";
        }
}
