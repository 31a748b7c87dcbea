package com.di.schemanova.agent.cleaning;

import com.di.schemanova.config.InferenceProperties;
import com.di.schemanova.exception.ShapeException;
import com.di.schemanova.util.DateFormatUtils;
import com.di.schemanova.util.TypeConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Stage 1: turns a raw dataset into its canonical form.
 *
 * <p>Steps, in order:
 * <ol>
 *   <li>header repair (trim, name blank columns, de-duplicate names)</li>
 *   <li>cell normalization (line breaks, whitespace, null tokens) and row-width repair</li>
 *   <li>per-column typing: boolean, then numeric (only with zero failures), then date
 *       (at least the configured share must parse; the rest become missing), else text</li>
 *   <li>removal of exact duplicate rows, first occurrence kept</li>
 * </ol>
 * The input is never mutated. Running the normalizer on its own output changes nothing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CleaningNormalizer {

    private final InferenceProperties properties;

    /**
     * Cleans one dataset.
     *
     * @throws ShapeException when the dataset has no columns
     */
    public CleaningResult clean(RawDataset raw) {
        if (raw == null) {
            throw new ShapeException(null, "Dataset is missing");
        }
        String name = raw.getName();
        if (raw.getColumns() == null || raw.getColumns().isEmpty()) {
            throw new ShapeException(name, "Dataset '" + name + "' has no columns");
        }

        List<String> notes = new ArrayList<>();
        List<String> columns = normalizeHeader(raw.getColumns(), notes);
        List<List<Object>> rows = normalizeRows(raw.getRows(), columns.size(), notes);

        Map<String, ColumnCoercion> coercions = new LinkedHashMap<>();
        List<ColumnType> types = new ArrayList<>(columns.size());
        for (int c = 0; c < columns.size(); c++) {
            ColumnCoercion coercion = coerceColumn(columns.get(c), rows, c);
            coercions.put(columns.get(c), coercion);
            types.add(coercion.getType());
        }

        Set<List<Object>> unique = new LinkedHashSet<>(rows);
        int duplicates = rows.size() - unique.size();

        Dataset dataset = new Dataset(name, columns, types, new ArrayList<>(unique));
        log.info("[CLEANING] dataset={} rows={} columns={} duplicatesRemoved={} types={}",
                name, dataset.rowCount(), dataset.columnCount(), duplicates, types);
        return CleaningResult.builder()
                .dataset(dataset)
                .duplicateRowsRemoved(duplicates)
                .coercions(coercions)
                .notes(notes)
                .build();
    }

    private List<String> normalizeHeader(List<String> header, List<String> notes) {
        List<String> out = new ArrayList<>(header.size());
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < header.size(); i++) {
            String original = header.get(i);
            String trimmed = original == null ? "" : original.replace('\n', ' ').trim();
            String candidate = trimmed.isEmpty() ? "column_" + (i + 1) : trimmed;
            if (trimmed.isEmpty()) {
                notes.add("Blank column name at position " + (i + 1) + " renamed to '" + candidate + "'");
            }
            String unique = candidate;
            for (int k = 2; seen.contains(unique); k++) {
                unique = candidate + "_" + k;
            }
            if (!unique.equals(candidate)) {
                notes.add("Duplicate column name '" + candidate + "' renamed to '" + unique + "'");
            }
            seen.add(unique);
            out.add(unique);
        }
        return out;
    }

    private List<List<Object>> normalizeRows(List<List<Object>> rawRows, int width, List<String> notes) {
        List<List<Object>> rows = new ArrayList<>(rawRows.size());
        int padded = 0;
        int truncated = 0;
        for (List<Object> raw : rawRows) {
            List<Object> row = new ArrayList<>(width);
            for (int i = 0; i < width; i++) {
                row.add(i < raw.size() ? normalizeCell(raw.get(i)) : null);
            }
            if (raw.size() < width) padded++;
            else if (raw.size() > width) truncated++;
            rows.add(row);
        }
        if (padded > 0) {
            notes.add(padded + " short row(s) padded with missing values");
        }
        if (truncated > 0) {
            notes.add(truncated + " long row(s) truncated to " + width + " column(s)");
        }
        return rows;
    }

    private Object normalizeCell(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean || DateFormatUtils.isTemporal(value)) {
            return value;
        }
        if (value instanceof Number) {
            // NaN and infinities are missing
            return TypeConverter.toNumeric(value);
        }
        String text = value.toString()
                .replace("\r\n", " ")
                .replace('\n', ' ')
                .replace('\r', ' ')
                .trim();
        if (text.isEmpty() || isNullToken(text)) {
            return null;
        }
        return text;
    }

    private boolean isNullToken(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (String token : properties.getCleaning().getNullTokens()) {
            if (lower.equals(token.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private ColumnCoercion coerceColumn(String column, List<List<Object>> rows, int c) {
        int nonMissing = 0;
        int booleanOk = 0;
        int numericOk = 0;
        int textCells = 0;
        for (List<Object> row : rows) {
            Object v = row.get(c);
            if (v == null) continue;
            nonMissing++;
            if (v instanceof String) textCells++;
            if (TypeConverter.toBoolean(v) != null) booleanOk++;
            if (TypeConverter.toNumeric(v) != null) numericOk++;
        }

        ColumnCoercion.ColumnCoercionBuilder result = ColumnCoercion.builder().column(column);
        if (nonMissing == 0) {
            return result.type(ColumnType.TEXT).build();
        }
        if (booleanOk == nonMissing) {
            for (List<Object> row : rows) {
                row.set(c, TypeConverter.toBoolean(row.get(c)));
            }
            return result.type(ColumnType.BOOLEAN).convertedCells(textCells).build();
        }
        if (numericOk == nonMissing) {
            for (List<Object> row : rows) {
                row.set(c, TypeConverter.toNumeric(row.get(c)));
            }
            return result.type(ColumnType.NUMERIC).convertedCells(textCells).build();
        }

        List<Object> parsed = new ArrayList<>(rows.size());
        int dateOk = 0;
        for (List<Object> row : rows) {
            Object v = row.get(c);
            Object date = null;
            if (DateFormatUtils.isTemporal(v)) {
                date = v;
            } else if (v instanceof String) {
                Optional<Temporal> t = DateFormatUtils.tryParse((String) v);
                date = t.orElse(null);
            }
            if (date != null) dateOk++;
            parsed.add(date);
        }
        if ((double) dateOk / nonMissing >= properties.getCleaning().getDateParseThreshold()) {
            for (int r = 0; r < rows.size(); r++) {
                rows.get(r).set(c, parsed.get(r));
            }
            int converted = 0;
            for (Object p : parsed) {
                if (p != null) converted++;
            }
            int failures = nonMissing - dateOk;
            if (failures > 0) {
                log.warn("[CLEANING] column={} date-tagged; {} unparseable value(s) set to missing", column, failures);
            }
            return result.type(ColumnType.DATE)
                    .dateParseFailures(failures)
                    .convertedCells(Math.min(converted, textCells))
                    .build();
        }

        for (List<Object> row : rows) {
            row.set(c, TypeConverter.toText(row.get(c)));
        }
        boolean ambiguous = numericOk > 0;
        if (ambiguous) {
            log.debug("[CLEANING] column={} numeric coercion ambiguous ({} of {} parsed); kept as text",
                    column, numericOk, nonMissing);
        }
        return result.type(ColumnType.TEXT).numericAmbiguous(ambiguous).build();
    }
}
