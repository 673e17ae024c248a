package com.fxledger.config;

import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the settlement pipeline.
 *
 * <p>Binds to the {@code fxledger.settlement.*} prefix in application.yml. The pipeline handles
 * exactly one trading currency (trades in any other currency are dropped at ingestion) and one
 * domestic currency that every monetary result is expressed in.
 *
 * <p>Lexicon entries are matched as lower-case substrings of the raw operation label, so composite
 * labels such as "swap opening. purchase." classify by containment.
 */
@Configuration
@ConfigurationProperties(prefix = "fxledger.settlement")
@Getter
@Setter
public class SettlementConfig {

    /** Currency the broker trades are denominated in. Also the placeholder for missing currency columns. */
    private String tradingCurrency = "USD";

    /** Currency all settled amounts are expressed in. */
    private String domesticCurrency = "RUB";

    /**
     * Value of the rate table's currency column to keep (e.g. "Доллар США" in the central-bank
     * export). Null keeps every row.
     */
    private String rateCurrencyName;

    /** Substrings marking a purchase. Russian stems cover "покупка" and "купля". */
    private List<String> buyLexicon = List.of("покуп", "купл", "buy", "purchase");

    /** Substrings marking a sale. */
    private List<String> sellLexicon = List.of("продаж", "sell", "sale");

    /** Substrings marking a prior-period row usable as a purchase lot. Includes position openings. */
    private List<String> lotLexicon = List.of("покуп", "купл", "buy", "purchase", "открыт");

    /** Operation label stamped on trades synthesized from prior-period lots. */
    private String borrowedOperationLabel = "Buy (prior period)";

    /** Ticker label of the synthetic grand-total row of the closed-position table. */
    private String totalRowLabel = "Total";
}
