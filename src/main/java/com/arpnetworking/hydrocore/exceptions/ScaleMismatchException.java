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
package com.arpnetworking.hydrocore.exceptions;

/**
 * Thrown when a comparison is requested at a scale finer than a product's native
 * resolution permits.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class ScaleMismatchException extends AnalysisException {

    /**
     * Public constructor.
     *
     * @param message the detail message
     */
    public ScaleMismatchException(final String message) {
        super(message);
    }

    /**
     * Public constructor.
     *
     * @param message the detail message
     * @param cause the underlying cause
     */
    public ScaleMismatchException(final String message, final Throwable cause) {
        super(message, cause);
    }

    private static final long serialVersionUID = 1948830291576602345L;
}
