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

import java.util.List;
import java.util.Objects;

/**
 * How a year's spending need is split between accounts once cash is used up.
 *
 * Withdrawals here are gross. Tax on them is settled afterwards along with the rest of the year's tax.
 */
public abstract class WithdrawalStrategy
{
        /**
         * Withdraw need from holdings, recording per account amounts in record. rmd is the RMD taken this year.
         * Returns the part of need that couldn't be found.
         */
        public abstract double withdraw(Holdings holdings, double need, double rmd, List<AccountType> order, double[] record);

        public abstract String type();

        public static WithdrawalStrategy strategyFactory(String type, Double pre_tax_limit)
        {
                if (type.equals("standard"))
                        return new OrderedWithdrawal();
                else if (type.equals("proportional"))
                        return new ProportionalWithdrawal();
                else if (type.equals("tax_bracket"))
                {
                        if (pre_tax_limit == null)
                                throw new IllegalArgumentException("tax_bracket withdrawal strategy requires pre_tax_limit");
                        return new BracketWithdrawal(pre_tax_limit);
                }
                else
                        throw new IllegalArgumentException("Unknown withdrawal strategy: " + type);
        }

        @Override
        public boolean equals(Object o)
        {
                return o != null && o.getClass() == getClass();
        }

        @Override
        public int hashCode()
        {
                return Objects.hash(type());
        }

        public String toString()
        {
                return type();
        }
}
