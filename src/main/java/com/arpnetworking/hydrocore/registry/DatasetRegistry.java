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
package com.arpnetworking.hydrocore.registry;

import com.arpnetworking.commons.jackson.databind.ObjectMapperFactory;
import com.arpnetworking.hydrocore.exceptions.ConfigurationException;
import com.arpnetworking.hydrocore.model.DateRange;
import com.arpnetworking.hydrocore.model.TemporalScale;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.fasterxml.jackson.core.type.TypeReference;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Optional;

/**
 * Lookup and validation over the catalog of gridded products. The catalog
 * is a declarative JSON table; adding a product requires no code change.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public final class DatasetRegistry {

    /**
     * Load the catalog bundled on the classpath.
     *
     * @return a new {@link DatasetRegistry}
     * @throws ConfigurationException if the catalog cannot be read or is invalid
     */
    public static DatasetRegistry fromDefaultCatalog() throws ConfigurationException {
        return fromResource(DEFAULT_CATALOG);
    }

    /**
     * Load a catalog from a classpath resource.
     *
     * @param resourceName the resource name
     * @return a new {@link DatasetRegistry}
     * @throws ConfigurationException if the catalog cannot be read or is invalid
     */
    public static DatasetRegistry fromResource(final String resourceName) throws ConfigurationException {
        try (InputStream stream = DatasetRegistry.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (stream == null) {
                throw new ConfigurationException(String.format("Dataset catalog resource not found; resource=%s", resourceName));
            }
            return new DatasetRegistry(ObjectMapperFactory.getInstance().readValue(stream, CATALOG_TYPE));
        } catch (final IOException | IllegalArgumentException e) {
            throw new ConfigurationException(String.format("Invalid dataset catalog; resource=%s", resourceName), e);
        }
    }

    /**
     * Load a catalog from a file.
     *
     * @param file the catalog file
     * @return a new {@link DatasetRegistry}
     * @throws ConfigurationException if the catalog cannot be read or is invalid
     */
    public static DatasetRegistry fromFile(final File file) throws ConfigurationException {
        try {
            return new DatasetRegistry(ObjectMapperFactory.getInstance().readValue(file, CATALOG_TYPE));
        } catch (final IOException | IllegalArgumentException e) {
            throw new ConfigurationException(String.format("Invalid dataset catalog; file=%s", file), e);
        }
    }

    /**
     * Public constructor.
     *
     * @param specs the catalog entries in catalog order; names must be unique
     */
    public DatasetRegistry(final List<DatasetSpec> specs) {
        final ImmutableMap.Builder<String, DatasetSpec> byName = ImmutableMap.builder();
        for (final DatasetSpec spec : specs) {
            byName.put(spec.getName(), spec);
        }
        // Throws IllegalArgumentException on duplicate names
        _specs = byName.buildOrThrow();
        LOGGER.debug()
                .setMessage("Dataset registry created")
                .addData("datasets", _specs.keySet())
                .log();
    }

    /**
     * Look up a dataset by name.
     *
     * @param name the dataset name
     * @return the catalog entry
     * @throws ConfigurationException if the name is unknown
     */
    public DatasetSpec spec(final String name) throws ConfigurationException {
        final DatasetSpec spec = _specs.get(name);
        if (spec == null) {
            throw new ConfigurationException(String.format(
                    "Unknown dataset; name=%s, known=%s",
                    name,
                    _specs.keySet()));
        }
        return spec;
    }

    /**
     * Check that a dataset can be compared at a scale over a window. A window
     * that only partly overlaps the valid range is accepted and later clipped.
     *
     * @param name the dataset name
     * @param scale the requested scale
     * @param window the requested window
     * @return the window clipped to the dataset's valid range
     * @throws ConfigurationException if the dataset is unknown or disabled,
     * the scale is unsupported or finer than the native resolution, or the
     * window lies entirely outside the valid range
     */
    public DateRange validate(final String name, final TemporalScale scale, final DateRange window)
            throws ConfigurationException {
        final DatasetSpec spec = spec(name);
        if (!spec.isEnabled()) {
            throw new ConfigurationException(String.format("Dataset is disabled; name=%s", name));
        }
        if (!spec.getNativeResolution().supports(scale)) {
            throw new ConfigurationException(String.format(
                    "Scale is finer than native resolution; name=%s, scale=%s, resolution=%s",
                    name,
                    scale,
                    spec.getNativeResolution()));
        }
        if (!spec.getSupportedScales().contains(scale)) {
            throw new ConfigurationException(String.format(
                    "Scale not supported; name=%s, scale=%s, supported=%s",
                    name,
                    scale,
                    spec.getSupportedScales()));
        }
        final Optional<DateRange> clipped = spec.getValidRange().intersect(window);
        if (!clipped.isPresent()) {
            throw new ConfigurationException(String.format(
                    "Window outside valid range; name=%s, window=%s, valid=%s",
                    name,
                    window,
                    spec.getValidRange()));
        }
        return clipped.get();
    }

    /**
     * The enabled datasets.
     *
     * @return enabled entries in catalog order
     */
    public ImmutableList<DatasetSpec> enabledSpecs() {
        return _specs.values().stream()
                .filter(DatasetSpec::isEnabled)
                .collect(ImmutableList.toImmutableList());
    }

    /**
     * Every dataset in the catalog.
     *
     * @return entries in catalog order
     */
    public ImmutableList<DatasetSpec> getSpecs() {
        return _specs.values().asList();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", Integer.toHexString(System.identityHashCode(this)))
                .add("Datasets", _specs.keySet())
                .toString();
    }

    private final ImmutableMap<String, DatasetSpec> _specs;

    private static final String DEFAULT_CATALOG = "datasets.json";
    private static final TypeReference<List<DatasetSpec>> CATALOG_TYPE = new TypeReference<List<DatasetSpec>>() {};
    private static final Logger LOGGER = LoggerFactory.getLogger(DatasetRegistry.class);
}
