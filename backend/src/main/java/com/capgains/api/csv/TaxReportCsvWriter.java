package com.capgains.api.csv;

import com.capgains.costbasis.tax.SymbolFailure;
import com.capgains.costbasis.tax.SymbolTaxSummary;
import com.capgains.costbasis.tax.TaxEvent;
import com.capgains.costbasis.tax.TaxReport;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders a TaxReport as CSV. The summary has one row per replayed symbol, one per failed symbol and a TOTAL
 * row; the detail has one row per taxable event. Amounts are plain decimal strings in the report's base
 * currency.
 */
@Component
public class TaxReportCsvWriter {

    private static final CsvMapper CSV_MAPPER = CsvMapper.builder()
            .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
            .build();
    static final CsvSchema SUMMARY_SCHEMA = CSV_MAPPER.schemaFor(SummaryRow.class).withHeader();
    static final CsvSchema DETAIL_SCHEMA = CSV_MAPPER.schemaFor(DetailRow.class).withHeader();

    public String write(TaxReport report) {
        List<SummaryRow> rows = new ArrayList<>();
        int events = 0;
        BigDecimal proceeds = BigDecimal.ZERO;
        BigDecimal cost = BigDecimal.ZERO;
        for (SymbolTaxSummary s : report.symbols()) {
            events += s.events().size();
            proceeds = proceeds.add(s.totalProceeds());
            cost = cost.add(s.totalCost());
            rows.add(new SummaryRow(s.symbol(), String.valueOf(s.events().size()), plain(s.totalProceeds()),
                    plain(s.totalCost()), plain(s.gains()), plain(s.losses()), plain(s.netGainLoss()), "",
                    s.incompleteHistory() ? "INCOMPLETE_HISTORY" : "OK"));
        }
        for (SymbolFailure f : report.failures()) {
            rows.add(new SummaryRow(f.symbol(), "", "", "", "", "", "", "", "FAILED:" + f.errorCode()));
        }
        rows.add(new SummaryRow("TOTAL", String.valueOf(events), plain(proceeds), plain(cost),
                plain(report.totalGains()), plain(report.totalLosses()), plain(report.netGainLoss()),
                plain(report.taxDue()), report.complete() ? "COMPLETE" : "INCOMPLETE"));
        return render(SUMMARY_SCHEMA, rows);
    }

    public String writeDetail(TaxReport report) {
        List<DetailRow> rows = new ArrayList<>();
        for (SymbolTaxSummary s : report.symbols()) {
            for (TaxEvent e : s.events()) {
                rows.add(new DetailRow(e.symbol(), e.orderId(), String.valueOf(e.sequenceId()),
                        e.tradeDate().toString(), e.closedSide().name(), plain(e.quantityClosed()),
                        plain(e.proceeds()), plain(e.cost()), plain(e.gainLoss()), plain(e.rate())));
            }
        }
        return render(DETAIL_SCHEMA, rows);
    }

    private static String render(CsvSchema schema, List<?> rows) {
        if (rows.isEmpty()) {
            List<String> names = new ArrayList<>();
            schema.forEach(column -> names.add(column.getName()));
            String separator = String.valueOf(schema.getColumnSeparator());
            return String.join(separator, names) + new String(schema.getLineSeparator());
        }
        try {
            return CSV_MAPPER.writer(schema).writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not render tax report CSV", e);
        }
    }

    private static String plain(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }

    @JsonPropertyOrder({"symbol", "events", "proceeds", "cost", "gains", "losses", "net_gain_loss", "tax_due",
            "status"})
    record SummaryRow(
            String symbol,
            String events,
            String proceeds,
            String cost,
            String gains,
            String losses,
            @JsonProperty("net_gain_loss") String netGainLoss,
            @JsonProperty("tax_due") String taxDue,
            String status
    ) {
    }

    @JsonPropertyOrder({"symbol", "order_id", "sequence_id", "trade_date", "closed_side", "quantity_closed",
            "proceeds", "cost", "gain_loss", "rate"})
    record DetailRow(
            String symbol,
            @JsonProperty("order_id") String orderId,
            @JsonProperty("sequence_id") String sequenceId,
            @JsonProperty("trade_date") String tradeDate,
            @JsonProperty("closed_side") String closedSide,
            @JsonProperty("quantity_closed") String quantityClosed,
            String proceeds,
            String cost,
            @JsonProperty("gain_loss") String gainLoss,
            String rate
    ) {
    }
}
