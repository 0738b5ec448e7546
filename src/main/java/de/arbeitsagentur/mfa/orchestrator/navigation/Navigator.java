/*
 * Copyright 2026 Bundesagentur für Arbeit
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

package de.arbeitsagentur.mfa.orchestrator.navigation;

import de.arbeitsagentur.mfa.orchestrator.router.NavigationInstruction;
import java.util.Objects;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * Applies {@link NavigationInstruction}s to the {@link NavigationService}.
 *
 * <p>{@link #navigateOrUpdate} compares the target with the route currently presented: the same
 * route gets its parameters replaced, anything else is navigated to. Re-emitted SDK events
 * therefore never stack duplicate screens.
 */
public class Navigator {

    private static final Logger LOG = Logger.getLogger(Navigator.class);

    private final NavigationService navigation;

    public Navigator(NavigationService navigation) {
        this.navigation = Objects.requireNonNull(navigation, "navigation");
    }

    public void navigateOrUpdate(NavigationInstruction instruction) {
        if (!navigation.isReady()) {
            LOG.warnf("Navigation not ready, cannot navigate to %s", instruction.screen());
            return;
        }
        Optional<String> current = navigation.currentRouteName();
        if (current.isPresent() && current.get().equals(instruction.screen().routeName())) {
            LOG.debugf("Updating params of current screen %s", instruction.screen());
            navigation.setParams(instruction.params());
            return;
        }
        navigate(instruction);
    }

    public void navigate(NavigationInstruction instruction) {
        if (!navigation.isReady()) {
            LOG.warnf("Navigation not ready, cannot navigate to %s", instruction.screen());
            return;
        }
        LOG.debugf("Navigating to %s via route %s", instruction.screen(), instruction.routeName());
        navigation.navigate(instruction.routeName(), instruction.routeParams());
    }

    public void reset(String routeName) {
        if (!navigation.isReady()) {
            LOG.warnf("Navigation not ready, cannot reset to %s", routeName);
            return;
        }
        LOG.debugf("Resetting navigation to %s", routeName);
        navigation.reset(routeName);
    }
}
