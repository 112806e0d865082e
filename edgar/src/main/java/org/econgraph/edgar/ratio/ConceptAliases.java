/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.econgraph.edgar.ratio;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;

import java.util.List;

/**
 * Friendly concept names used in ratio formulas, mapped to the US-GAAP
 * concepts that report them, most common first.
 */
final class ConceptAliases {
  private static final ImmutableListMultimap<String, String> ALIASES =
      ImmutableListMultimap.<String, String>builder()
          .put("CurrentAssets", "AssetsCurrent")
          .put("CurrentLiabilities", "LiabilitiesCurrent")
          .put("TotalAssets", "Assets")
          .put("TotalLiabilities", "Liabilities")
          .putAll("StockholdersEquity", "StockholdersEquity",
              "StockholdersEquityIncludingPortionAttributableToNoncontrollingInterest")
          .putAll("NetIncome", "NetIncomeLoss", "ProfitLoss")
          .putAll("Revenue", "Revenues", "RevenueFromContractWithCustomerExcludingAssessedTax",
              "SalesRevenueNet")
          .put("OperatingIncome", "OperatingIncomeLoss")
          .putAll("InterestExpense", "InterestExpense", "InterestExpenseNonoperating")
          .putAll("LongTermDebt", "LongTermDebt", "LongTermDebtNoncurrent")
          .putAll("ShortTermDebt", "ShortTermBorrowings", "LongTermDebtCurrent")
          .put("CashAndEquivalents", "CashAndCashEquivalentsAtCarryingValue")
          .put("Inventory", "InventoryNet")
          .put("OperatingCashFlow", "NetCashProvidedByUsedInOperatingActivities")
          .put("CapitalExpenditures", "PaymentsToAcquirePropertyPlantAndEquipment")
          .build();

  private ConceptAliases() {
  }

  /** The name itself first, then its known aliases. */
  static List<String> candidates(String name) {
    return ImmutableList.<String>builder().add(name).addAll(ALIASES.get(name)).build();
  }
}
