/*
 * Copyright 2024 Inscope Metrics
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.arpnetworking.precipcompare.export;

import com.arpnetworking.hydrocore.model.DataSufficiency;
import com.arpnetworking.hydrocore.model.MetricResult;
import com.arpnetworking.hydrocore.model.MetricSummary;
import com.arpnetworking.hydrocore.model.Season;
import com.arpnetworking.hydrocore.model.SkippedRow;
import com.arpnetworking.precipcompare.orchestration.AnalysisResults;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Writes run results as CSV tables: {@code metrics.csv}, {@code skipped.csv},
 * {@code summary.csv} and {@code sufficiency.csv}.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public final class CsvResultWriter {

    /**
     * Public constructor.
     *
     * @param directory the directory to write to; created if absent
     */
    public CsvResultWriter(final File directory) {
        _directory = directory;
    }

    /**
     * Write every table.
     *
     * @param results the run results
     * @return the files written
     * @throws IOException if a table cannot be written
     */
    public ImmutableList<File> write(final AnalysisResults results) throws IOException {
        Files.createDirectories(_directory.toPath());
        final ImmutableList<File> files = ImmutableList.of(
                write(METRICS_FILE, METRIC_COLUMNS, results.getMetrics(), CsvResultWriter::toRow),
                write(SKIPPED_FILE, SKIPPED_COLUMNS, results.getSkipped(), CsvResultWriter::toRow),
                write(SUMMARY_FILE, SUMMARY_COLUMNS, results.getSummaries(), CsvResultWriter::toRow),
                write(SUFFICIENCY_FILE, SUFFICIENCY_COLUMNS, results.getSufficiency(), CsvResultWriter::toRow));
        LOGGER.info()
                .setMessage("Wrote result tables")
                .addData("directory", _directory)
                .addData("files", files)
                .log();
        return files;
    }

    private <T> File write(
            final String name,
            final ImmutableList<String> columns,
            final Collection<T> rows,
            final Function<T, Map<String, Object>> toRow)
            throws IOException {
        final CsvSchema.Builder schema = CsvSchema.builder().setUseHeader(true);
        columns.forEach(schema::addColumn);
        final File file = new File(_directory, name);
        try (SequenceWriter writer = CSV_MAPPER.writer(schema.build()).writeValues(file)) {
            for (final T row : rows) {
                writer.write(toRow.apply(row));
            }
        }
        return file;
    }

    private static Map<String, Object> toRow(final MetricResult result) {
        final Map<String, Object> row = Maps.newLinkedHashMap();
        row.put("station_id", result.getStationId());
        row.put("dataset", result.getDatasetName());
        row.put("scale", result.getScale());
        row.put("season", season(result.getSeason()));
        row.put("subset", result.getSubset());
        row.put("metric", result.getMetric().getKey());
        row.put("value", result.getValue());
        row.put("sample_size", result.getSampleSize());
        return row;
    }

    private static Map<String, Object> toRow(final SkippedRow skipped) {
        final Map<String, Object> row = Maps.newLinkedHashMap();
        row.put("station_id", skipped.getStationId());
        row.put("dataset", skipped.getDatasetName());
        row.put("scale", skipped.getScale());
        row.put("reason", skipped.getReason());
        row.put("detail", skipped.getDetail());
        return row;
    }

    private static Map<String, Object> toRow(final MetricSummary summary) {
        final Map<String, Object> row = Maps.newLinkedHashMap();
        row.put("dataset", summary.getDatasetName());
        row.put("scale", summary.getScale());
        row.put("season", season(summary.getSeason()));
        row.put("subset", summary.getSubset());
        row.put("metric", summary.getMetric().getKey());
        row.put("count_before", summary.getCountBefore());
        row.put("count_after", summary.getCountAfter());
        row.put("mean", summary.getMean());
        row.put("median", summary.getMedian());
        row.put("std", summary.getStandardDeviation());
        return row;
    }

    private static Map<String, Object> toRow(final DataSufficiency sufficiency) {
        final Map<String, Object> row = Maps.newLinkedHashMap();
        row.put("station_id", sufficiency.getStationId());
        row.put("valid_days", sufficiency.getValidDays());
        row.put("years_with_data", sufficiency.getYearsWithData());
        row.put("daily_sufficient", sufficiency.isDailySufficient());
        row.put("monthly_sufficient", sufficiency.isMonthlySufficient());
        row.put("yearly_sufficient", sufficiency.isYearlySufficient());
        return row;
    }

    private static String season(final Optional<Season> season) {
        return season.map(Season::name).orElse("");
    }

    private final File _directory;

    static final String METRICS_FILE = "metrics.csv";
    static final String SKIPPED_FILE = "skipped.csv";
    static final String SUMMARY_FILE = "summary.csv";
    static final String SUFFICIENCY_FILE = "sufficiency.csv";

    private static final ImmutableList<String> METRIC_COLUMNS = ImmutableList.of(
            "station_id", "dataset", "scale", "season", "subset", "metric", "value", "sample_size");
    private static final ImmutableList<String> SKIPPED_COLUMNS = ImmutableList.of(
            "station_id", "dataset", "scale", "reason", "detail");
    private static final ImmutableList<String> SUMMARY_COLUMNS = ImmutableList.of(
            "dataset", "scale", "season", "subset", "metric", "count_before", "count_after", "mean", "median", "std");
    private static final ImmutableList<String> SUFFICIENCY_COLUMNS = ImmutableList.of(
            "station_id", "valid_days", "years_with_data", "daily_sufficient", "monthly_sufficient", "yearly_sufficient");
    private static final CsvMapper CSV_MAPPER = new CsvMapper();
    private static final Logger LOGGER = LoggerFactory.getLogger(CsvResultWriter.class);
}
