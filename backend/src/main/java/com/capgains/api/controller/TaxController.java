package com.capgains.api.controller;

import com.capgains.api.csv.TaxReportCsvWriter;
import com.capgains.api.dto.ErrorBody;
import com.capgains.costbasis.tax.TaxCalculator;
import com.capgains.costbasis.tax.TaxReport;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /tax/{year} (JSON report, 207 when any symbol failed), GET /tax/{year}/summary.csv and
 * GET /tax/{year}/detail.csv (one row per taxable event).
 */
@RestController
@RequestMapping("/api/v1/tax")
@RequiredArgsConstructor
public class TaxController {

    static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

    private final TaxCalculator taxCalculator;
    private final TaxReportCsvWriter csvWriter;

    @GetMapping("/{year}")
    public ResponseEntity<?> getReport(@PathVariable int year) {
        if (!isValidYear(year)) {
            return invalidYear(year);
        }
        TaxReport report = taxCalculator.calculate(year);
        return ResponseEntity.status(report.complete() ? HttpStatus.OK : HttpStatus.MULTI_STATUS).body(report);
    }

    @GetMapping("/{year}/summary.csv")
    public ResponseEntity<?> getSummaryCsv(@PathVariable int year) {
        if (!isValidYear(year)) {
            return invalidYear(year);
        }
        TaxReport report = taxCalculator.calculate(year);
        return ResponseEntity.status(report.complete() ? HttpStatus.OK : HttpStatus.MULTI_STATUS)
                .contentType(TEXT_CSV)
                .body(csvWriter.write(report));
    }

    @GetMapping("/{year}/detail.csv")
    public ResponseEntity<?> getDetailCsv(@PathVariable int year) {
        if (!isValidYear(year)) {
            return invalidYear(year);
        }
        TaxReport report = taxCalculator.calculate(year);
        return ResponseEntity.status(report.complete() ? HttpStatus.OK : HttpStatus.MULTI_STATUS)
                .contentType(TEXT_CSV)
                .body(csvWriter.writeDetail(report));
    }

    private static boolean isValidYear(int year) {
        return year >= 1900 && year <= 9999;
    }

    private static ResponseEntity<ErrorBody> invalidYear(int year) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_YEAR", "Unsupported fiscal year " + year));
    }
}
