package com.fxledger.ingest;

import java.util.List;
import lombok.Getter;

/**
 * Columns of a broker trade table. Each column is found by its canonical name or by the header
 * used in the Russian-language broker export.
 */
@Getter
public enum TradeColumn {
    TICKER(Kind.REQUIRED, "ticker", "Тикер"),
    OPERATION(Kind.REQUIRED, "operation", "Операция"),
    QUANTITY(Kind.NUMERIC, "quantity", "Количество"),
    PRICE(Kind.NUMERIC, "price", "Цена"),
    CURRENCY(Kind.CATEGORICAL, "currency", "Валюта"),
    AMOUNT(Kind.NUMERIC, "amount", "Сумма"),
    COMMISSION(Kind.NUMERIC, "commission", "Комиссия"),
    COMMISSION_CURRENCY(Kind.CATEGORICAL, "commissionCurrency", "Валюта комиссии"),
    TRADE_DATE(Kind.DATE, "tradeDate", "Дата сделки"),
    SETTLEMENT_DATE(Kind.DATE, "settlementDate", "Расчеты");

    /** How a column is treated when a table lacks it entirely. */
    public enum Kind {
        REQUIRED,
        NUMERIC,
        CATEGORICAL,
        DATE
    }

    private final Kind kind;
    private final List<String> headers;

    TradeColumn(Kind kind, String... headers) {
        this.kind = kind;
        this.headers = List.of(headers);
    }

    public String canonicalName() {
        return headers.get(0);
    }
}
