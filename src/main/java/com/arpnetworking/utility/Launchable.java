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
package com.arpnetworking.utility;

/**
 * A component that is started once and stopped once.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public interface Launchable {

    /**
     * Launch the component.
     */
    void launch();

    /**
     * Shutdown the component.
     */
    void shutdown();
}
