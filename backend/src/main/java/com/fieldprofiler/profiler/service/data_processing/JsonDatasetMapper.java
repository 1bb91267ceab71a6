package com.fieldprofiler.profiler.service.data_processing;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.fieldprofiler.profiler.dto.profile.FieldSpec;
import com.fieldprofiler.profiler.dto.profile.ProfileRequest;
import com.fieldprofiler.profiler.model.AnalysisScope;
import com.fieldprofiler.profiler.model.Dataset;
import com.fieldprofiler.profiler.model.DatasetRow;
import com.fieldprofiler.profiler.model.FieldDescriptor;
import com.fieldprofiler.profiler.model.FieldKind;
import com.fieldprofiler.profiler.model.RawValue;

/**
 * Builds a {@link Dataset} from a JSON profile request. With scope {@code SELECTED} only the rows
 * whose id is listed in {@code selected_row_ids} are kept, and they form the percentage base.
 */
@Component
public class JsonDatasetMapper {

  public static AnalysisScope scopeOf(ProfileRequest request) {
    String scope = request.getScope();
    if (scope == null || scope.isBlank()) {
      return AnalysisScope.ALL;
    }
    try {
      return AnalysisScope.valueOf(scope.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown scope: " + scope, e);
    }
  }

  public Dataset toDataset(ProfileRequest request) {
    List<FieldDescriptor> fields = new ArrayList<>();
    for (FieldSpec spec : request.getFields()) {
      fields.add(FieldDescriptor.of(spec.getName(), FieldKind.fromString(spec.getKind())));
    }

    List<Long> rowIds = request.getRowIds();
    List<Map<String, Object>> rows = request.getRows();
    if (rowIds != null && rowIds.size() != rows.size()) {
      throw new IllegalArgumentException(
          "row_ids has " + rowIds.size() + " entries but rows has " + rows.size());
    }

    Set<Long> selected = null;
    if (scopeOf(request) == AnalysisScope.SELECTED) {
      selected =
          request.getSelectedRowIds() == null
              ? Set.of()
              : new HashSet<>(request.getSelectedRowIds());
    }

    List<DatasetRow> datasetRows = new ArrayList<>();
    for (int i = 0; i < rows.size(); i++) {
      long rowId = rowIds != null ? rowIds.get(i) : i + 1;
      if (selected != null && !selected.contains(rowId)) {
        continue;
      }
      Map<String, Object> row = rows.get(i) == null ? Map.of() : rows.get(i);
      Map<String, RawValue> values = new LinkedHashMap<>();
      for (FieldDescriptor field : fields) {
        values.put(field.getName(), toRawValue(row.get(field.getName()), field.getKind()));
      }
      datasetRows.add(new DatasetRow(rowId, values));
    }

    return Dataset.builder()
        .name(request.getDatasetName())
        .fields(fields)
        .rows(datasetRows)
        .totalRows(datasetRows.size())
        .build();
  }

  /** JSON value to raw value; temporal fields parse ISO strings, unparseable ones count as null. */
  static RawValue toRawValue(Object value, FieldKind kind) {
    if (value == null) {
      return RawValue.nullValue();
    }
    if (kind == FieldKind.TEMPORAL) {
      if (value instanceof LocalDate || value instanceof LocalDateTime) {
        return RawValue.of(value);
      }
      return TemporalValueParser.parseOrInvalid(value.toString());
    }
    if (value instanceof Number) {
      return RawValue.number((Number) value);
    }
    if (value instanceof String) {
      return RawValue.string((String) value);
    }
    return RawValue.string(value.toString());
  }
}
