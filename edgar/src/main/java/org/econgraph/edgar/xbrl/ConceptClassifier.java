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
package org.econgraph.edgar.xbrl;

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Map;

/**
 * Infers labels and statement placement for concepts from their names.
 *
 * <p>Rules match on name fragments, so they cover the common US-GAAP
 * concepts without loading taxonomy linkbases.
 */
public final class ConceptClassifier {

  public static final String BALANCE_SHEET = "balance_sheet";
  public static final String INCOME_STATEMENT = "income_statement";
  public static final String CASH_FLOW_STATEMENT = "cash_flow_statement";
  public static final String OTHER = "other";

  private static final Map<String, String> LABELS = ImmutableMap.<String, String>builder()
      .put("Assets", "Total Assets")
      .put("AssetsCurrent", "Current Assets")
      .put("Liabilities", "Total Liabilities")
      .put("LiabilitiesCurrent", "Current Liabilities")
      .put("LiabilitiesAndStockholdersEquity", "Total Liabilities and Stockholders' Equity")
      .put("StockholdersEquity", "Stockholders' Equity")
      .put("NetIncomeLoss", "Net Income")
      .put("Revenues", "Revenues")
      .put("RevenueFromContractWithCustomerExcludingAssessedTax", "Revenues")
      .put("CostOfRevenue", "Cost of Revenue")
      .put("GrossProfit", "Gross Profit")
      .put("OperatingIncomeLoss", "Operating Income")
      .put("InterestExpense", "Interest Expense")
      .put("CashAndCashEquivalentsAtCarryingValue", "Cash and Cash Equivalents")
      .put("InventoryNet", "Inventory")
      .put("LongTermDebt", "Long-Term Debt")
      .put("LongTermDebtNoncurrent", "Long-Term Debt")
      .put("NetCashProvidedByUsedInOperatingActivities", "Operating Cash Flow")
      .put("NetCashProvidedByUsedInInvestingActivities", "Investing Cash Flow")
      .put("NetCashProvidedByUsedInFinancingActivities", "Financing Cash Flow")
      .put("PaymentsToAcquirePropertyPlantAndEquipment", "Capital Expenditures")
      .put("EarningsPerShareBasic", "Earnings Per Share, Basic")
      .put("EarningsPerShareDiluted", "Earnings Per Share, Diluted")
      .build();

  private ConceptClassifier() {
  }

  /** Classifies a concept by its local name (prefix is ignored). */
  public static ConceptDefinition classify(String concept) {
    String name = localName(concept);
    return new ConceptDefinition(name, label(name), dataType(name), periodType(name),
        balanceType(name), statementType(name), section(name));
  }

  public static String localName(String concept) {
    int colon = concept.indexOf(':');
    return colon >= 0 ? concept.substring(colon + 1) : concept;
  }

  static String label(String name) {
    String label = LABELS.get(name);
    if (label != null) {
      return label;
    }
    // Split CamelCase into words
    return name.replaceAll("([a-z0-9])([A-Z])", "$1 $2");
  }

  static String statementType(String name) {
    if (name.contains("Activities") || name.startsWith("PaymentsTo")
        || name.startsWith("ProceedsFrom")) {
      return CASH_FLOW_STATEMENT;
    }
    if (name.contains("Assets") || name.contains("Liabilities")
        || name.contains("StockholdersEquity") || name.startsWith("CashAndCashEquivalents")
        || name.startsWith("Inventory") || name.contains("Debt")
        || name.contains("Receivable") || name.contains("Payable")) {
      return BALANCE_SHEET;
    }
    if (name.contains("IncomeLoss") || name.contains("Revenue") || name.contains("Expense")
        || name.contains("GrossProfit") || name.startsWith("CostOf")
        || name.startsWith("EarningsPerShare")) {
      return INCOME_STATEMENT;
    }
    return OTHER;
  }

  static String section(String name) {
    if (name.contains("Activities")) {
      if (name.contains("Operating")) {
        return "operating_activities";
      } else if (name.contains("Investing")) {
        return "investing_activities";
      } else if (name.contains("Financing")) {
        return "financing_activities";
      }
    }
    if (name.startsWith("LiabilitiesAndStockholdersEquity")) {
      return "liabilities_and_equity";
    }
    if (name.contains("Assets") || name.startsWith("CashAndCashEquivalents")
        || name.startsWith("Inventory") || name.contains("Receivable")) {
      return "assets";
    }
    if (name.contains("Liabilities") || name.contains("Debt") || name.contains("Payable")) {
      return "liabilities";
    }
    if (name.contains("StockholdersEquity")) {
      return "equity";
    }
    if (name.contains("Revenue")) {
      return "revenues";
    }
    if (name.contains("Expense") || name.startsWith("CostOf")) {
      return "expenses";
    }
    if (name.contains("NetIncomeLoss")) {
      return "net_income";
    }
    return OTHER;
  }

  static String dataType(String name) {
    if (name.startsWith("EarningsPerShare")) {
      return "perShareItemType";
    }
    if (name.contains("Shares") || name.contains("Units")) {
      return "sharesItemType";
    }
    if (name.contains("Date")) {
      return "dateItemType";
    }
    if (name.contains("TextBlock") || name.contains("Policy")) {
      return "textBlockItemType";
    }
    if (name.startsWith("Entity") || name.startsWith("Document")) {
      return "stringItemType";
    }
    return "monetaryItemType";
  }

  static PeriodType periodType(String name) {
    if (BALANCE_SHEET.equals(statementType(name)) && !name.contains("IncreaseDecrease")) {
      return PeriodType.INSTANT;
    }
    return PeriodType.DURATION;
  }

  static @Nullable String balanceType(String name) {
    if (!"monetaryItemType".equals(dataType(name))) {
      return null;
    }
    if (name.contains("Liabilities") || name.contains("Equity") || name.contains("Revenue")
        || name.contains("Debt") || name.contains("Payable") || name.contains("GrossProfit")
        || name.contains("IncomeLoss")) {
      return "credit";
    }
    if (name.contains("Assets") || name.contains("Expense") || name.startsWith("CostOf")
        || name.startsWith("CashAndCashEquivalents") || name.startsWith("PaymentsTo")
        || name.startsWith("Inventory") || name.contains("Receivable")) {
      return "debit";
    }
    return null;
  }
}
