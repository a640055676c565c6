package io.nosqlbench.command.forecast.subcommands;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */


import io.nosqlbench.forecast.design.Seasonality;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class CMD_forecast_fitTest {

    @Test
    public void parsesSeasonalitySpecs() {
        Seasonality weekly = CMD_forecast_fit.parseSeasonality("weekly:7:3");
        assertEquals("weekly", weekly.getName());
        assertEquals(7.0, weekly.getPeriodDays());
        assertEquals(3, weekly.getOrder());

        Seasonality monthly = CMD_forecast_fit.parseSeasonality(" monthly : 30.5 : 5 ");
        assertEquals("monthly", monthly.getName());
        assertEquals(30.5, monthly.getPeriodDays());
    }

    @Test
    public void rejectsMalformedSeasonalitySpecs() {
        assertThrows(IllegalArgumentException.class, () -> CMD_forecast_fit.parseSeasonality("weekly:7"));
        assertThrows(IllegalArgumentException.class, () -> CMD_forecast_fit.parseSeasonality("weekly:seven:3"));
        assertThrows(IllegalArgumentException.class, () -> CMD_forecast_fit.parseSeasonality("weekly:7:3:1"));
    }
}
