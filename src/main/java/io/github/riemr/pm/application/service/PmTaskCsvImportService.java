package io.github.riemr.pm.application.service;

import io.github.riemr.pm.application.exception.TaskCsvFormatException;
import io.github.riemr.pm.domain.model.PmTask;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.file.FlatFileItemReader;
import org.springframework.batch.item.file.FlatFileParseException;
import org.springframework.batch.item.file.builder.FlatFileItemReaderBuilder;
import org.springframework.batch.item.file.mapping.DefaultLineMapper;
import org.springframework.batch.item.file.mapping.PassThroughFieldSetMapper;
import org.springframework.batch.item.file.transform.DelimitedLineTokenizer;
import org.springframework.batch.item.file.transform.FieldSet;
import org.springframework.core.io.InputStreamResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * PM 作業一覧 CSV の取り込みと列の正規化。
 * - "Option ID" は "System" の別名として扱う
 * - 所要時間・周期は数値化し、空や非数値は 0
 * - System / Category は trim + 大文字化（System が空なら NOT SPECIFIED）
 */
@Service
@Slf4j
public class PmTaskCsvImportService {

    static final String COL_DESCRIPTION = "Task Description";
    static final String COL_DURATION = "Duration (mins)";
    static final String COL_INTERVAL = "Interval (months)";
    static final String COL_SYSTEM = "System";
    static final String COL_SYSTEM_ALIAS = "Option ID";
    static final String COL_CATEGORY = "Category of PM check";
    static final String COL_PAGE = "Page Number";
    static final String NOT_SPECIFIED = "NOT SPECIFIED";

    public List<PmTask> readTasks(InputStream in) throws IOException {
        FlatFileItemReader<FieldSet> reader = openReader(in);
        try {
            FieldSet headerRow = next(reader);
            if (headerRow == null) {
                throw new TaskCsvFormatException("CSV has no header row");
            }
            Map<String, Integer> header = indexHeader(headerRow.getValues());
            for (String required : List.of(COL_DESCRIPTION, COL_DURATION, COL_INTERVAL)) {
                if (!header.containsKey(required)) {
                    throw new TaskCsvFormatException("Missing required column: " + required);
                }
            }
            Integer systemCol = header.containsKey(COL_SYSTEM) ? header.get(COL_SYSTEM) : header.get(COL_SYSTEM_ALIAS);

            List<PmTask> tasks = new ArrayList<>();
            int skipped = 0;
            FieldSet fs;
            while ((fs = next(reader)) != null) {
                String[] row = fs.getValues();
                if (isBlankRow(row)) {
                    skipped++;
                    continue;
                }
                tasks.add(PmTask.builder()
                        .description(cell(row, header.get(COL_DESCRIPTION)))
                        .durationMinutes(toInt(cell(row, header.get(COL_DURATION))))
                        .intervalMonths(toInt(cell(row, header.get(COL_INTERVAL))))
                        .system(normalizeSystem(systemCol == null ? null : cell(row, systemCol)))
                        .category(blankToNull(normalizeUpper(cell(row, header.get(COL_CATEGORY)))))
                        .referencePage(blankToNull(cell(row, header.get(COL_PAGE))))
                        .build());
            }
            log.info("Imported PM tasks: {} (skipped blank rows: {})", tasks.size(), skipped);
            return tasks;
        } finally {
            reader.close();
        }
    }

    /**
     * ヘッダ行も含めて1レコードずつ返す。列名はヘッダから自前で引くため tokenizer には names を設定しない。
     * ダブルクォート内の改行は DefaultRecordSeparatorPolicy で1レコードにまとめられる。
     */
    private static FlatFileItemReader<FieldSet> openReader(InputStream in) {
        DelimitedLineTokenizer tokenizer = new DelimitedLineTokenizer();
        tokenizer.setDelimiter(",");
        tokenizer.setStrict(false);

        DefaultLineMapper<FieldSet> lineMapper = new DefaultLineMapper<>();
        lineMapper.setLineTokenizer(tokenizer);
        lineMapper.setFieldSetMapper(new PassThroughFieldSetMapper());

        FlatFileItemReader<FieldSet> reader = new FlatFileItemReaderBuilder<FieldSet>()
                .name("pmTaskCsvReader")
                .resource(new InputStreamResource(in))
                .encoding(StandardCharsets.UTF_8.name())
                .lineMapper(lineMapper)
                .saveState(false)
                .build();
        // "#" 始まりの作業名を読み飛ばさない
        reader.setComments(new String[0]);
        reader.open(new ExecutionContext());
        return reader;
    }

    private static FieldSet next(FlatFileItemReader<FieldSet> reader) throws IOException {
        try {
            return reader.read();
        } catch (FlatFileParseException e) {
            throw new TaskCsvFormatException("Malformed CSV at line " + e.getLineNumber() + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IOException("Failed to read task CSV", e);
        }
    }

    private Map<String, Integer> indexHeader(String[] headerRow) {
        Map<String, Integer> idx = new HashMap<>();
        for (int i = 0; i < headerRow.length; i++) {
            String name = headerRow[i].strip();
            // BOM 付き UTF-8 対策
            if (i == 0 && name.startsWith("\uFEFF")) {
                name = name.substring(1);
            }
            idx.putIfAbsent(name, i);
        }
        return idx;
    }

    private static String cell(String[] row, Integer col) {
        if (col == null || col >= row.length) return null;
        return row[col];
    }

    private static boolean isBlankRow(String[] row) {
        return Arrays.stream(row).allMatch(s -> s == null || s.isBlank());
    }

    /**
     * 小数は切り捨て。空・非数値は 0、int に収まらない値は取り込みエラー。
     */
    static int toInt(String raw) {
        if (raw == null || raw.isBlank()) return 0;
        BigDecimal value;
        try {
            value = new BigDecimal(raw.strip());
        } catch (NumberFormatException e) {
            return 0;
        }
        // 整数部が11桁以上なら setScale 前に弾く（"1e999999999" 等）
        if (value.precision() - value.scale() > 10) {
            throw new TaskCsvFormatException("Numeric value out of range: " + raw.strip());
        }
        try {
            return value.setScale(0, RoundingMode.DOWN).intValueExact();
        } catch (ArithmeticException e) {
            throw new TaskCsvFormatException("Numeric value out of range: " + raw.strip(), e);
        }
    }

    static String normalizeSystem(String raw) {
        String s = normalizeUpper(raw);
        return s == null || s.isEmpty() ? NOT_SPECIFIED : s;
    }

    private static String normalizeUpper(String raw) {
        return raw == null ? null : raw.strip().toUpperCase(Locale.ROOT);
    }

    private static String blankToNull(String raw) {
        return raw == null || raw.isBlank() ? null : raw.strip();
    }
}
