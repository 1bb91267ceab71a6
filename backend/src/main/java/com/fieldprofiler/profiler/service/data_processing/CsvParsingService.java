package com.fieldprofiler.profiler.service.data_processing;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.fieldprofiler.profiler.config.ProfilerProperties;
import com.fieldprofiler.profiler.exception.AnalysisRejectedException;
import com.fieldprofiler.profiler.model.Dataset;
import com.fieldprofiler.profiler.model.DatasetRow;
import com.fieldprofiler.profiler.model.FieldDescriptor;
import com.fieldprofiler.profiler.model.FieldKind;
import com.fieldprofiler.profiler.model.RawValue;
import com.fieldprofiler.profiler.service.collection.NumberParser;
import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns an uploaded CSV file into a {@link Dataset}. Columns without an explicit kind are
 * inferred: numeric when every non-empty cell is a number, temporal when every non-empty cell is
 * an ISO date or datetime, text otherwise. Row ids are 1-based data row numbers.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CsvParsingService {

  private final ProfilerProperties properties;

  /**
   * @param kinds explicit kinds by column name; may be empty
   * @param selectedFields columns to profile in this order; all columns when empty
   */
  public Dataset parse(
      InputStream csvStream,
      String fileName,
      Map<String, FieldKind> kinds,
      List<String> selectedFields)
      throws IOException {
    List<String> headers;
    List<String[]> rows = new ArrayList<>();
    long maxRows = properties.getUpload().getMaxRows();

    try (CSVReader reader =
        new CSVReaderBuilder(new InputStreamReader(csvStream, StandardCharsets.UTF_8))
            .withCSVParser(
                new CSVParserBuilder().withSeparator(properties.getUpload().getSeparator()).build())
            .build()) {
      String[] headerRow = reader.readNext();
      if (headerRow == null || headerRow.length == 0) {
        throw new IllegalArgumentException("CSV file has no headers");
      }
      headers = Arrays.asList(headerRow);

      String[] row;
      while ((row = reader.readNext()) != null) {
        if (row.length != headerRow.length) {
          log.debug(
              "Skipping row with incorrect column count: {} vs {}", row.length, headerRow.length);
          continue;
        }
        if (rows.size() >= maxRows) {
          log.warn("CSV '{}' truncated at {} rows", fileName, maxRows);
          break;
        }
        rows.add(row);
      }
    } catch (CsvValidationException e) {
      throw new IllegalArgumentException("Invalid CSV content: " + e.getMessage(), e);
    }

    List<String> fieldNames =
        selectedFields == null || selectedFields.isEmpty() ? headers : selectedFields;
    Dataset.DatasetBuilder dataset =
        Dataset.builder().name(extractDatasetName(fileName)).totalRows(rows.size());
    Map<String, Integer> columnIndex = new LinkedHashMap<>();
    Map<String, FieldKind> resolvedKinds = new LinkedHashMap<>();
    for (String field : fieldNames) {
      int index = headers.indexOf(field);
      if (index < 0) {
        throw new AnalysisRejectedException("Field not found: " + field);
      }
      FieldKind kind = kinds == null ? null : kinds.get(field);
      if (kind == null) {
        kind = inferKind(rows, index);
      }
      columnIndex.put(field, index);
      resolvedKinds.put(field, kind);
      dataset.field(FieldDescriptor.of(field, kind));
    }

    List<DatasetRow> datasetRows = new ArrayList<>(rows.size());
    long rowId = 1;
    for (String[] row : rows) {
      Map<String, RawValue> values = new LinkedHashMap<>();
      for (Map.Entry<String, Integer> column : columnIndex.entrySet()) {
        String field = column.getKey();
        values.put(field, toRawValue(row[column.getValue()], resolvedKinds.get(field)));
      }
      datasetRows.add(new DatasetRow(rowId++, values));
    }

    log.info(
        "Parsed CSV '{}': {} row(s), {} field(s) {}",
        fileName,
        rows.size(),
        resolvedKinds.size(),
        resolvedKinds);
    return dataset.rows(datasetRows).build();
  }

  /** Kind suggested by the non-empty cells of one column. */
  static FieldKind inferKind(List<String[]> rows, int column) {
    boolean anyValue = false;
    boolean allNumeric = true;
    boolean allTemporal = true;
    for (String[] row : rows) {
      String cell = row[column];
      if (cell == null || cell.trim().isEmpty()) {
        continue;
      }
      anyValue = true;
      if (allNumeric && NumberParser.parse(cell) == null) {
        allNumeric = false;
      }
      if (allTemporal && TemporalValueParser.parse(cell) == null) {
        allTemporal = false;
      }
      if (!allNumeric && !allTemporal) {
        return FieldKind.TEXT;
      }
    }
    if (!anyValue) {
      return FieldKind.TEXT;
    }
    return allNumeric ? FieldKind.NUMERIC : FieldKind.TEMPORAL;
  }

  /** Empty cells are null except in text columns, where they stay empty strings. */
  static RawValue toRawValue(String cell, FieldKind kind) {
    boolean empty = cell == null || cell.trim().isEmpty();
    switch (kind) {
      case TEXT:
        return cell == null ? RawValue.nullValue() : RawValue.string(cell);
      case TEMPORAL:
        return empty ? RawValue.nullValue() : TemporalValueParser.parseOrInvalid(cell);
      case NUMERIC:
      case OTHER:
      default:
        return empty ? RawValue.nullValue() : RawValue.string(cell);
    }
  }

  private String extractDatasetName(String fileName) {
    if (fileName == null || fileName.isEmpty()) {
      return "unnamed_dataset";
    }
    int lastDotIndex = fileName.lastIndexOf('.');
    return lastDotIndex > 0 ? fileName.substring(0, lastDotIndex) : fileName;
  }
}
