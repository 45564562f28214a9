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
package com.arpnetworking.precipcompare.sources;

import com.arpnetworking.hydrocore.exceptions.ConfigurationException;
import com.arpnetworking.hydrocore.exceptions.FetchException;
import com.arpnetworking.hydrocore.model.DateRange;
import com.arpnetworking.hydrocore.model.GriddedSeries;
import com.arpnetworking.hydrocore.model.NativeResolution;
import com.arpnetworking.hydrocore.model.Observation;
import com.arpnetworking.hydrocore.model.Station;
import com.arpnetworking.hydrocore.model.StationSeries;
import com.arpnetworking.hydrocore.model.TemporalScale;
import com.arpnetworking.hydrocore.registry.DatasetSpec;
import com.arpnetworking.test.TestBeanFactory;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Tests for {@link CsvSeriesSource}.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public class CsvSeriesSourceTest {

    @Before
    public void setUp() throws IOException {
        _griddedDirectory = _folder.newFolder("gridded");
        _groundFile = write(_folder.getRoot(), "ground.csv",
                "date,S1,S2",
                "2020-01-01,1.0,NA",
                "2020-01-02,,2.5",
                "",
                "2020-01-03,3.0,NaN");
        _source = new CsvSeriesSource(_groundFile, _griddedDirectory);
    }

    @Test
    public void testGroundSeries() throws FetchException {
        final StationSeries series = _source.fetch(station("S1"), DateRange.of(JAN_1, JAN_1.plusDays(1)));

        Assert.assertEquals(
                ImmutableList.of(Observation.of(JAN_1, 1.0), Observation.missing(JAN_1.plusDays(1))),
                series.getObservations());
        Assert.assertEquals("S1", series.getStationId());
    }

    @Test
    public void testMissingMarkers() throws FetchException {
        final StationSeries series = _source.fetch(station("S2"), DateRange.of(JAN_1, JAN_1.plusDays(2)));

        Assert.assertTrue(series.getObservations().get(0).isMissing());
        Assert.assertEquals(Optional.of(2.5), series.getObservations().get(1).getValue());
        Assert.assertTrue(series.getObservations().get(2).isMissing());
    }

    @Test(expected = FetchException.class)
    public void testUnknownStation() throws FetchException {
        _source.fetch(station("S9"), DateRange.of(JAN_1, JAN_1));
    }

    @Test(expected = FetchException.class)
    public void testMissingGriddedTable() throws FetchException {
        _source.fetch(TestBeanFactory.createDatasetSpecBuilder().setName("ABSENT").build(), station("S1"),
                DateRange.of(JAN_1, JAN_1));
    }

    @Test(expected = FetchException.class)
    public void testInvalidValue() throws IOException, FetchException {
        write(_griddedDirectory, "broken.csv",
                "date,S1",
                "2020-01-01,lots");
        _source.fetch(TestBeanFactory.createDatasetSpecBuilder().setName("BROKEN").build(), station("S1"),
                DateRange.of(JAN_1, JAN_1));
    }

    @Test
    public void testMonthlyProductIncludesFirstMonth() throws IOException, FetchException {
        write(_griddedDirectory, "terra.csv",
                "date,S1",
                "2020-01-01,31.0",
                "2020-02-01,29.0",
                "2020-03-01,12.0");
        final DatasetSpec spec = TestBeanFactory.createDatasetSpecBuilder()
                .setName("TERRA")
                .setNativeResolution(NativeResolution.MONTHLY)
                .setSupportedScales(ImmutableSet.of(TemporalScale.MONTHLY))
                .build();

        final GriddedSeries series = _source.fetch(spec, station("S1"),
                DateRange.of(LocalDate.of(2020, 1, 15), LocalDate.of(2020, 2, 20)));

        Assert.assertEquals(NativeResolution.MONTHLY, series.getNativeResolution());
        Assert.assertEquals(
                ImmutableList.of(Observation.of(JAN_1, 31.0), Observation.of(LocalDate.of(2020, 2, 1), 29.0)),
                series.getObservations());
    }

    @Test
    public void testSubDailyTimestamps() throws IOException, FetchException {
        write(_griddedDirectory, "hourly.csv",
                "time,S1",
                "2020-01-01 00:00,0.1",
                "2020-01-01T01:00,0.2",
                "2020-01-02 00:00,0.3");
        final DatasetSpec spec = TestBeanFactory.createDatasetSpecBuilder()
                .setName("HOURLY")
                .setNativeResolution(NativeResolution.HOURLY)
                .build();

        final GriddedSeries series = _source.fetch(spec, station("S1"), DateRange.of(JAN_1, JAN_1));

        Assert.assertEquals(2, series.getObservations().size());
        Assert.assertEquals(LocalDateTime.of(2020, 1, 1, 1, 0), series.getObservations().get(1).getTimestamp());
        Assert.assertEquals("HOURLY", series.getDatasetName());
    }

    @Test
    public void testLoadStations() throws IOException, ConfigurationException {
        final File file = write(_folder.getRoot(), "stations.csv",
                "station_id,latitude,longitude,elevation",
                "S1,40.5,-105.1,1520",
                "S2,39.0,-104.0,");

        final ImmutableList<Station> stations = CsvSeriesSource.loadStations(file);

        Assert.assertEquals(2, stations.size());
        Assert.assertEquals("S1", stations.get(0).getId());
        Assert.assertEquals(40.5, stations.get(0).getLatitude(), 0.0);
        Assert.assertEquals(Optional.of(1520.0), stations.get(0).getElevation());
        Assert.assertFalse(stations.get(1).getElevation().isPresent());
    }

    @Test(expected = ConfigurationException.class)
    public void testLoadStationsInvalidLatitude() throws IOException, ConfigurationException {
        final File file = write(_folder.getRoot(), "stations.csv",
                "station_id,latitude,longitude",
                "S1,95.0,-105.1");
        CsvSeriesSource.loadStations(file);
    }

    private static Station station(final String id) {
        return TestBeanFactory.createStationBuilder().setId(id).build();
    }

    private static File write(final File directory, final String name, final String... lines) throws IOException {
        final File file = new File(directory, name);
        Files.write(file.toPath(), ImmutableList.copyOf(lines), StandardCharsets.UTF_8);
        return file;
    }

    @Rule
    public final TemporaryFolder _folder = new TemporaryFolder();

    private File _griddedDirectory;
    private File _groundFile;
    private CsvSeriesSource _source;

    private static final LocalDate JAN_1 = LocalDate.of(2020, 1, 1);
}
