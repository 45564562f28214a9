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
import com.arpnetworking.hydrocore.registry.DatasetSpec;
import com.arpnetworking.precipcompare.orchestration.GriddedDataSource;
import com.arpnetworking.precipcompare.orchestration.GroundDataSource;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.primitives.Doubles;
import com.google.common.util.concurrent.UncheckedExecutionException;
import net.sf.oval.exception.ConstraintsViolatedException;

import java.io.File;
import java.io.IOException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;

/**
 * Ground and gridded series read from wide-format CSV files: a date or
 * timestamp column followed by one column per station. Gridded products are
 * read from {@code <directory>/<dataset name in lower case>.csv} and are
 * expected in the product's native units and resolution. Blank, {@code NA}
 * and {@code NaN} cells are missing values.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public final class CsvSeriesSource implements GroundDataSource, GriddedDataSource {

    /**
     * Public constructor.
     *
     * @param groundDataFile the ground observation table
     * @param griddedDataDirectory the directory of gridded tables
     */
    public CsvSeriesSource(final File groundDataFile, final File griddedDataDirectory) {
        _groundDataFile = groundDataFile;
        _griddedDataDirectory = griddedDataDirectory;
    }

    /**
     * Read a station metadata table with the columns {@code station_id},
     * {@code latitude}, {@code longitude} and, optionally, {@code elevation}.
     *
     * @param file the metadata table
     * @return the stations in file order
     * @throws ConfigurationException if the table cannot be read or a row is invalid
     */
    public static ImmutableList<Station> loadStations(final File file) throws ConfigurationException {
        final CsvSchema schema = CsvSchema.emptySchema().withHeader();
        final ImmutableList.Builder<Station> stations = ImmutableList.builder();
        try (MappingIterator<Map<String, String>> rows = CSV_MAPPER
                .readerForMapOf(String.class)
                .with(schema)
                .readValues(file)) {
            while (rows.hasNext()) {
                final Map<String, String> row = rows.next();
                final String elevation = Strings.nullToEmpty(row.get("elevation")).trim();
                stations.add(new Station.Builder()
                        .setId(Strings.nullToEmpty(row.get("station_id")).trim())
                        .setLatitude(parseCoordinate(row, "latitude"))
                        .setLongitude(parseCoordinate(row, "longitude"))
                        .setElevation(isMissing(elevation) ? null : Double.valueOf(elevation))
                        .build());
            }
        } catch (final IOException | NumberFormatException | ConstraintsViolatedException e) {
            throw new ConfigurationException(String.format("Unable to read station metadata; file=%s", file), e);
        }
        return stations.build();
    }

    @Override
    public StationSeries fetch(final Station station, final DateRange range) throws FetchException {
        final WideTable table = table(_groundDataFile);
        final double[] values = table.requireColumn(station.getId(), _groundDataFile.getName());
        final List<Observation> observations = Lists.newArrayList();
        for (int i = 0; i < values.length; ++i) {
            final LocalDateTime timestamp = table.getTimestamps().get(i);
            if (range.contains(timestamp.toLocalDate())) {
                observations.add(Observation.of(timestamp, values[i]));
            }
        }
        try {
            return new StationSeries.Builder()
                    .setStation(station)
                    .setObservations(ImmutableList.copyOf(observations))
                    .build();
        } catch (final ConstraintsViolatedException e) {
            throw new FetchException(String.format("Invalid ground series; station=%s", station.getId()), e);
        }
    }

    @Override
    public GriddedSeries fetch(final DatasetSpec spec, final Station station, final DateRange range)
            throws FetchException {
        final File file = new File(_griddedDataDirectory, spec.getName().toLowerCase(Locale.ROOT) + ".csv");
        final WideTable table = table(file);
        final double[] values = table.requireColumn(station.getId(), file.getName());
        final LocalDate first = spec.getNativeResolution() == NativeResolution.MONTHLY
                ? range.getStart().withDayOfMonth(1)
                : range.getStart();
        final List<Observation> observations = Lists.newArrayList();
        for (int i = 0; i < values.length; ++i) {
            final LocalDateTime timestamp = table.getTimestamps().get(i);
            final LocalDate date = timestamp.toLocalDate();
            if (!date.isBefore(first) && !date.isAfter(range.getEnd())) {
                observations.add(Observation.of(timestamp, values[i]));
            }
        }
        try {
            return new GriddedSeries.Builder()
                    .setDatasetName(spec.getName())
                    .setStationId(station.getId())
                    .setNativeResolution(spec.getNativeResolution())
                    .setObservations(ImmutableList.copyOf(observations))
                    .build();
        } catch (final ConstraintsViolatedException e) {
            throw new FetchException(
                    String.format("Invalid gridded series; dataset=%s, station=%s", spec.getName(), station.getId()),
                    e);
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("GroundDataFile", _groundDataFile)
                .add("GriddedDataDirectory", _griddedDataDirectory)
                .toString();
    }

    private WideTable table(final File file) throws FetchException {
        try {
            return _tables.get(file);
        } catch (final ExecutionException | UncheckedExecutionException e) {
            if (e.getCause() instanceof FetchException) {
                throw (FetchException) e.getCause();
            }
            throw new FetchException(String.format("Unable to read table; file=%s", file), e.getCause());
        }
    }

    private static WideTable readTable(final File file) throws FetchException {
        if (!file.isFile()) {
            throw new FetchException(String.format("Table not found; file=%s", file));
        }
        final ImmutableList.Builder<LocalDateTime> timestamps = ImmutableList.builder();
        final List<List<Double>> columns = Lists.newArrayList();
        final List<String> headers;
        try (MappingIterator<String[]> rows = CSV_MAPPER
                .readerFor(String[].class)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .readValues(file)) {
            if (!rows.hasNext()) {
                throw new FetchException(String.format("Empty table; file=%s", file));
            }
            final String[] header = rows.next();
            headers = Lists.newArrayListWithExpectedSize(header.length);
            for (int column = 1; column < header.length; ++column) {
                headers.add(header[column].trim());
                columns.add(Lists.newArrayList());
            }
            int line = 1;
            while (rows.hasNext()) {
                final String[] row = rows.next();
                ++line;
                if (row.length == 0 || (row.length == 1 && row[0].trim().isEmpty())) {
                    continue;
                }
                timestamps.add(parseTimestamp(row[0], file, line));
                for (int column = 1; column <= headers.size(); ++column) {
                    final String cell = column < row.length ? row[column].trim() : "";
                    columns.get(column - 1).add(parseValue(cell, file, line));
                }
            }
        } catch (final IOException e) {
            throw new FetchException(String.format("Unable to read table; file=%s", file), e);
        }

        final ImmutableMap.Builder<String, double[]> byStation = ImmutableMap.builder();
        for (int column = 0; column < headers.size(); ++column) {
            byStation.put(headers.get(column), Doubles.toArray(columns.get(column)));
        }
        final WideTable table;
        try {
            table = new WideTable(timestamps.build(), byStation.buildOrThrow());
        } catch (final IllegalArgumentException e) {
            throw new FetchException(String.format("Duplicate station column; file=%s", file), e);
        }
        LOGGER.debug()
                .setMessage("Loaded table")
                .addData("file", file)
                .addData("rows", table.getTimestamps().size())
                .addData("stations", headers.size())
                .log();
        return table;
    }

    private static LocalDateTime parseTimestamp(final String cell, final File file, final int line)
            throws FetchException {
        final String text = cell.trim();
        try {
            if (text.length() == ISO_DATE_LENGTH) {
                return LocalDate.parse(text).atStartOfDay();
            }
            return LocalDateTime.parse(text.replace(' ', 'T'));
        } catch (final DateTimeParseException e) {
            throw new FetchException(String.format("Invalid timestamp; file=%s, line=%d, value=%s", file, line, text), e);
        }
    }

    private static double parseValue(final String cell, final File file, final int line) throws FetchException {
        if (isMissing(cell)) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(cell);
        } catch (final NumberFormatException e) {
            throw new FetchException(String.format("Invalid value; file=%s, line=%d, value=%s", file, line, cell), e);
        }
    }

    private static double parseCoordinate(final Map<String, String> row, final String column) {
        final String value = row.get(column);
        if (value == null) {
            throw new NumberFormatException(String.format("Missing column %s", column));
        }
        return Double.parseDouble(value.trim());
    }

    private static boolean isMissing(final String cell) {
        return MISSING_MARKERS.contains(cell.toUpperCase(Locale.ROOT));
    }

    private final File _groundDataFile;
    private final File _griddedDataDirectory;
    private final LoadingCache<File, WideTable> _tables = CacheBuilder.newBuilder()
            .build(new CacheLoader<File, WideTable>() {
                @Override
                public WideTable load(final File file) throws FetchException {
                    return readTable(file);
                }
            });

    private static final CsvMapper CSV_MAPPER = new CsvMapper();
    private static final int ISO_DATE_LENGTH = 10;
    private static final ImmutableSet<String> MISSING_MARKERS = ImmutableSet.of("", "NA", "NAN", "NULL");
    private static final Logger LOGGER = LoggerFactory.getLogger(CsvSeriesSource.class);
}
