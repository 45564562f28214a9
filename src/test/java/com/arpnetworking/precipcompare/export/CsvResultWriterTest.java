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
import com.arpnetworking.hydrocore.model.MetricSummary;
import com.arpnetworking.hydrocore.model.SampleSubset;
import com.arpnetworking.hydrocore.model.Season;
import com.arpnetworking.hydrocore.model.SkipReason;
import com.arpnetworking.hydrocore.model.SkippedRow;
import com.arpnetworking.hydrocore.model.TemporalScale;
import com.arpnetworking.hydrocore.statistics.Metric;
import com.arpnetworking.precipcompare.orchestration.AnalysisResults;
import com.arpnetworking.test.TestBeanFactory;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.google.common.collect.ImmutableList;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Map;

/**
 * Tests for {@link CsvResultWriter}.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public class CsvResultWriterTest {

    @Test
    public void testWritesEveryTable() throws IOException {
        final File directory = new File(_folder.getRoot(), "nested/output");
        final AnalysisResults results = new AnalysisResults(
                ImmutableList.of(
                        TestBeanFactory.createMetricResultBuilder()
                                .setStationId("S1")
                                .setDatasetName("PRISM")
                                .setMetric(Metric.RMSE)
                                .setValue(0.5)
                                .setSampleSize(120)
                                .build(),
                        TestBeanFactory.createMetricResultBuilder()
                                .setStationId("S1")
                                .setDatasetName("PRISM")
                                .setSeason(Season.SUMMER)
                                .setMetric(Metric.NSE)
                                .setValue(Double.NaN)
                                .build()),
                ImmutableList.of(new SkippedRow.Builder()
                        .setStationId("S2")
                        .setDatasetName("PRISM")
                        .setScale(TemporalScale.YEARLY)
                        .setReason(SkipReason.INSUFFICIENT_DATA)
                        .setDetail("3 valid pairs, at least 10 required")
                        .build()),
                ImmutableList.of(new DataSufficiency.Builder()
                        .setStationId("S1")
                        .setValidDays(400)
                        .setYearsWithData(2)
                        .setDailySufficient(true)
                        .setMonthlySufficient(true)
                        .setYearlySufficient(false)
                        .build()),
                ImmutableList.of(new MetricSummary.Builder()
                        .setDatasetName("PRISM")
                        .setScale(TemporalScale.DAILY)
                        .setSubset(SampleSubset.ALL)
                        .setMetric(Metric.RMSE)
                        .setCountBefore(1)
                        .setCountAfter(1)
                        .setMean(0.5)
                        .setMedian(0.5)
                        .setStandardDeviation(Double.NaN)
                        .build()),
                false);

        final ImmutableList<File> files = new CsvResultWriter(directory).write(results);

        Assert.assertEquals(4, files.size());
        final File metricsFile = new File(directory, CsvResultWriter.METRICS_FILE);
        Assert.assertEquals(
                "station_id,dataset,scale,season,subset,metric,value,sample_size",
                Files.readAllLines(metricsFile.toPath(), StandardCharsets.UTF_8).get(0));

        final List<Map<String, String>> metrics = read(metricsFile);
        Assert.assertEquals(2, metrics.size());
        Assert.assertEquals("", metrics.get(0).get("season"));
        Assert.assertEquals("rmse", metrics.get(0).get("metric"));
        Assert.assertEquals(0.5, Double.parseDouble(metrics.get(0).get("value")), 0.0);
        Assert.assertEquals("120", metrics.get(0).get("sample_size"));
        Assert.assertEquals("SUMMER", metrics.get(1).get("season"));
        Assert.assertTrue(Double.isNaN(Double.parseDouble(metrics.get(1).get("value"))));

        final List<Map<String, String>> skipped = read(new File(directory, CsvResultWriter.SKIPPED_FILE));
        Assert.assertEquals("YEARLY", skipped.get(0).get("scale"));
        Assert.assertEquals("INSUFFICIENT_DATA", skipped.get(0).get("reason"));
        Assert.assertEquals("3 valid pairs, at least 10 required", skipped.get(0).get("detail"));

        final List<Map<String, String>> summary = read(new File(directory, CsvResultWriter.SUMMARY_FILE));
        Assert.assertEquals("1", summary.get(0).get("count_after"));
        Assert.assertEquals("", summary.get(0).get("season"));

        final List<Map<String, String>> sufficiency = read(new File(directory, CsvResultWriter.SUFFICIENCY_FILE));
        Assert.assertEquals("400", sufficiency.get(0).get("valid_days"));
        Assert.assertEquals("false", sufficiency.get(0).get("yearly_sufficient"));
    }

    @Test
    public void testEmptyResultsCreateEveryFile() throws IOException {
        final AnalysisResults results = new AnalysisResults(
                ImmutableList.of(),
                ImmutableList.of(),
                ImmutableList.of(),
                ImmutableList.of(),
                true);

        final ImmutableList<File> files = new CsvResultWriter(_folder.getRoot()).write(results);

        for (final File file : files) {
            Assert.assertTrue(file.getName(), file.isFile());
        }
        Assert.assertTrue(read(new File(_folder.getRoot(), CsvResultWriter.SKIPPED_FILE)).isEmpty());
    }

    private static List<Map<String, String>> read(final File file) throws IOException {
        try (MappingIterator<Map<String, String>> rows = new CsvMapper()
                .readerForMapOf(String.class)
                .with(CsvSchema.emptySchema().withHeader())
                .readValues(file)) {
            return rows.readAll();
        }
    }

    @Rule
    public final TemporaryFolder _folder = new TemporaryFolder();
}
