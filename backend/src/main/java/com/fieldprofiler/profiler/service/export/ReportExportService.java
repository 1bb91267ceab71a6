package com.fieldprofiler.profiler.service.export;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.List;

import org.springframework.stereotype.Service;

import com.fieldprofiler.profiler.model.ProfileResult;
import com.opencsv.CSVWriter;
import com.opencsv.ICSVWriter;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes the tabular projection of a run as CSV (quoted where needed) or as clipboard-style TSV,
 * where embedded newlines become {@code " | "}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReportExportService {

  static final String NEWLINE_REPLACEMENT = " | ";

  private final ReportTableBuilder tableBuilder;

  public String export(ProfileResult result, ExportFormat format) {
    List<String[]> table = tableBuilder.build(result);
    log.debug("Exporting {} statistic row(s) as {}", table.size() - 1, format);
    return format == ExportFormat.TSV ? toTsv(table) : toCsv(table);
  }

  String toCsv(List<String[]> table) {
    StringWriter out = new StringWriter();
    try (CSVWriter writer = new CSVWriter(out)) {
      for (String[] row : table) {
        writer.writeNext(row, false);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write CSV export", e);
    }
    return out.toString();
  }

  String toTsv(List<String[]> table) {
    StringWriter out = new StringWriter();
    try (CSVWriter writer =
        new CSVWriter(
            out,
            '\t',
            ICSVWriter.NO_QUOTE_CHARACTER,
            ICSVWriter.NO_ESCAPE_CHARACTER,
            ICSVWriter.DEFAULT_LINE_END)) {
      for (String[] row : table) {
        String[] cells = new String[row.length];
        for (int i = 0; i < row.length; i++) {
          cells[i] = row[i] == null ? "" : row[i].replace("\n", NEWLINE_REPLACEMENT);
        }
        writer.writeNext(cells, false);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write TSV export", e);
    }
    return out.toString();
  }
}
