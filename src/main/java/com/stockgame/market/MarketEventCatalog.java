package com.stockgame.market;

import static com.stockgame.domain.enums.MarketEventType.DEFLATION;
import static com.stockgame.domain.enums.MarketEventType.INFLATION;
import static com.stockgame.domain.enums.MarketEventType.NEGATIVE;
import static com.stockgame.domain.enums.MarketEventType.POSITIVE;

import java.util.List;

/**
 * Built-in event deck. Volatility rises by sector: automotive moves by at most 10,
 * finance by up to 30.
 */
public final class MarketEventCatalog {

    public static final List<String> SECTORS =
            List.of("Technology", "Finance", "Energy", "Healthcare", "Consumer", "Automotive");

    private static final List<EventTemplate> TEMPLATES = List.of(
            // Automotive
            EventTemplate.stock("auto-sales-uptick", POSITIVE, "Auto Sales Increase",
                    "Vehicle sales show modest improvement", 5, "Automotive"),
            EventTemplate.stock("auto-inventory-buildup", NEGATIVE, "Auto Inventory Buildup",
                    "Excess inventory concerns weigh on automotive stocks", -5, "Automotive"),
            EventTemplate.stock("auto-recall", NEGATIVE, "Automotive Recall",
                    "Major safety recall impacts automotive industry", -10, "Automotive"),
            EventTemplate.stock("ev-sales-boost", POSITIVE, "EV Sales Surge",
                    "Electric vehicle demand exceeds expectations", 10, "Automotive"),
            // Energy
            EventTemplate.stock("energy-prices-stable", POSITIVE, "Energy Prices Stabilize",
                    "Oil and gas prices find steady footing", 5, "Energy"),
            EventTemplate.stock("energy-demand-drop", NEGATIVE, "Energy Demand Softens",
                    "Lower than expected energy consumption reported", -5, "Energy"),
            EventTemplate.stock("renewable-competition", NEGATIVE, "Renewable Energy Competition",
                    "Fossil fuel demand concerns impact traditional energy", -10, "Energy"),
            EventTemplate.stock("opec-production-cut", POSITIVE, "OPEC Cuts Production",
                    "Oil prices surge on supply reduction announcement", 10, "Energy"),
            EventTemplate.stock("oil-discovery", POSITIVE, "New Oil Reserves Found",
                    "Major discovery increases energy sector optimism", 15, "Energy"),
            EventTemplate.stock("energy-crisis", NEGATIVE, "Energy Supply Crisis",
                    "Supply disruptions cause energy price volatility", -15, "Energy"),
            // Consumer
            EventTemplate.stock("consumer-spending-up", POSITIVE, "Consumer Spending Rises",
                    "Retail sales beat forecasts", 5, "Consumer"),
            EventTemplate.stock("consumer-caution", NEGATIVE, "Consumers Tighten Belts",
                    "Household spending slows on weak sentiment", -5, "Consumer"),
            EventTemplate.stock("food-price-spike", NEGATIVE, "Food Input Costs Spike",
                    "Commodity prices squeeze consumer margins", -10, "Consumer"),
            EventTemplate.stock("holiday-sales-record", POSITIVE, "Record Holiday Sales",
                    "Seasonal demand lifts consumer names", 15, "Consumer"),
            EventTemplate.stock("supply-chain-breakdown", NEGATIVE, "Supply Chain Breakdown",
                    "Shipping delays empty shelves across retail", -20, "Consumer"),
            // Healthcare
            EventTemplate.stock("drug-approval", POSITIVE, "Drug Approval Granted",
                    "Regulator approves a major new treatment", 10, "Healthcare"),
            EventTemplate.stock("trial-failure", NEGATIVE, "Clinical Trial Fails",
                    "Late-stage trial misses its primary endpoint", -15, "Healthcare"),
            EventTemplate.stock("pricing-reform", NEGATIVE, "Drug Pricing Reform",
                    "New rules cap prescription drug prices", -20, "Healthcare"),
            EventTemplate.stock("pandemic-preparedness", POSITIVE, "Health Spending Boost",
                    "Governments expand healthcare budgets", 20, "Healthcare"),
            EventTemplate.stock("aging-demand", POSITIVE, "Aging Population Demand",
                    "Demographic trends support steady healthcare growth", 5, "Healthcare"),
            // Technology
            EventTemplate.stock("chip-shortage", NEGATIVE, "Chip Shortage",
                    "Semiconductor supply constraints hit hardware makers", -15, "Technology", "Automotive"),
            EventTemplate.stock("ai-breakthrough", POSITIVE, "AI Breakthrough",
                    "A major AI advance sparks a technology rally", 25, "Technology"),
            EventTemplate.stock("data-breach", NEGATIVE, "Massive Data Breach",
                    "Security failure shakes confidence in tech platforms", -20, "Technology"),
            EventTemplate.stock("cloud-growth", POSITIVE, "Cloud Revenue Surges",
                    "Enterprise cloud adoption accelerates", 15, "Technology"),
            EventTemplate.stock("antitrust-probe", NEGATIVE, "Antitrust Investigation",
                    "Regulators open probe into big tech", -25, "Technology"),
            // Finance
            EventTemplate.stock("bank-merger", POSITIVE, "Major Bank Merger",
                    "Consolidation creates financial sector mega-institution", 15, "Finance"),
            EventTemplate.stock("credit-crunch", NEGATIVE, "Credit Crunch",
                    "Tightening lending standards impact financial sector", -15, "Finance"),
            EventTemplate.stock("interest-rate-cut", POSITIVE, "Major Interest Rate Cut",
                    "Central bank announces aggressive rate cuts", 20, "Finance"),
            EventTemplate.stock("interest-rate-hike", NEGATIVE, "Aggressive Rate Hikes",
                    "Central bank raises rates to combat inflation", -20, "Finance"),
            EventTemplate.stock("deregulation-boost", POSITIVE, "Financial Deregulation",
                    "Regulatory rollback boosts banking profitability", 25, "Finance"),
            EventTemplate.stock("financial-crisis-fears", NEGATIVE, "Financial Crisis Warning",
                    "Systemic risk indicators trigger market concerns", -25, "Finance"),
            EventTemplate.stock("central-bank-crisis", NEGATIVE, "Central Bank Emergency",
                    "Emergency monetary measures signal deep financial stress", -30, "Finance"),
            EventTemplate.stock("financial-renaissance", POSITIVE, "Financial System Overhaul",
                    "Comprehensive reforms unlock massive financial sector growth", 30, "Finance"),
            // Cash
            EventTemplate.cash("inflation-spike", INFLATION, "Inflation Spike",
                    "Rising prices erode the value of cash", -5),
            EventTemplate.cash("deflation", DEFLATION, "Deflationary Pressure",
                    "Falling prices increase purchasing power", 5));

    private MarketEventCatalog() {}

    public static List<EventTemplate> templates() {
        return TEMPLATES;
    }
}
