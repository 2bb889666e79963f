package me.golemcore.observatory.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.observatory.domain.component.MoonPhaseCalculator;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Day-resolution lunar phase from a simplified Julian day count and the mean
 * synodic month. Errors of roughly a day are expected; this is not an
 * ephemeris.
 */
@Component
public class SimplifiedMoonPhaseCalculator implements MoonPhaseCalculator {

    static final double SYNODIC_MONTH_DAYS = 29.5305882;
    private static final double DAYS_PER_YEAR = 365.25;
    private static final double DAYS_PER_MONTH = 30.6;
    private static final double REFERENCE_NEW_MOON_OFFSET = 694039.09;
    private static final int MARCH = 3;
    private static final int MONTHS_PER_YEAR = 12;

    @Override
    public double phaseAt(Instant instant) {
        LocalDate date = LocalDate.ofInstant(instant, ZoneOffset.UTC);
        int year = date.getYear();
        int month = date.getMonthValue();
        int day = date.getDayOfMonth();

        // January and February count as months 13 and 14 of the previous year
        if (month < MARCH) {
            year--;
            month += MONTHS_PER_YEAR;
        }
        month++;

        double days = Math.floor(DAYS_PER_YEAR * year) + Math.floor(DAYS_PER_MONTH * month) + day
                - REFERENCE_NEW_MOON_OFFSET;
        double cycles = days / SYNODIC_MONTH_DAYS;
        return cycles - Math.floor(cycles);
    }
}
