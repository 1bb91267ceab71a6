package com.fieldprofiler.profiler.service.export;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.fieldprofiler.profiler.model.FieldReport;
import com.fieldprofiler.profiler.model.ProfileResult;
import com.fieldprofiler.profiler.model.StatisticKeys;

/**
 * Projects a run onto a table: one header row ({@code Statistic} followed by the field names),
 * then one row per statistic in canonical order.
 */
@Component
public class ReportTableBuilder {

  public static final String STATISTIC_HEADER = "Statistic";

  public List<String[]> build(ProfileResult result) {
    List<FieldReport> reports = new ArrayList<>(result.getReports().values());
    StatValueFormatter formatter =
        new StatValueFormatter(result.getOptions().getDecimalPlaces());

    Set<String> keys = new LinkedHashSet<>();
    for (FieldReport report : reports) {
      keys.addAll(report.getStatistics().keySet());
    }

    List<String[]> table = new ArrayList<>();
    String[] header = new String[reports.size() + 1];
    header[0] = STATISTIC_HEADER;
    for (int c = 0; c < reports.size(); c++) {
      header[c + 1] = reports.get(c).getFieldName();
    }
    table.add(header);

    for (String key : StatisticKeys.order(keys)) {
      String[] row = new String[reports.size() + 1];
      row[0] = key;
      for (int c = 0; c < reports.size(); c++) {
        row[c + 1] = formatter.format(key, reports.get(c).get(key));
      }
      table.add(row);
    }
    return table;
  }
}
