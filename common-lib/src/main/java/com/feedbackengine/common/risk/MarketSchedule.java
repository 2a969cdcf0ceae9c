package com.feedbackengine.common.risk;

import com.feedbackengine.common.model.AssetType;
import com.feedbackengine.common.model.MarketStatus;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Market open/closed state by asset class. Exchange holidays are not modelled.
 *
 * <pre>
 *   CRYPTO  always open; Saturday/Sunday UTC → "Weekend Low Liquidity" warning
 *   FOREX   closed Friday 17:00 → Sunday 17:00 New York time
 *           session: London 08–17 London time, New York 08–17 NY time,
 *                    both → "Overlap", neither → "Asian"
 *   STOCKS  open 09:30–16:00 New York time, Monday–Friday
 * </pre>
 */
public final class MarketSchedule {

    public static final String WEEKEND_LOW_LIQUIDITY = "Weekend Low Liquidity";

    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");
    private static final ZoneId LONDON   = ZoneId.of("Europe/London");

    private static final LocalTime FOREX_ROLLOVER = LocalTime.of(17, 0);
    private static final LocalTime CENTER_OPEN    = LocalTime.of(8, 0);
    private static final LocalTime CENTER_CLOSE   = LocalTime.of(17, 0);
    private static final LocalTime STOCKS_OPEN    = LocalTime.of(9, 30);
    private static final LocalTime STOCKS_CLOSE   = LocalTime.of(16, 0);

    private MarketSchedule() {}

    public static MarketStatus status(AssetType assetType, Instant at) {
        return switch (assetType) {
            case CRYPTO -> crypto(at);
            case FOREX  -> forex(at);
            case STOCKS -> stocks(at);
        };
    }

    private static MarketStatus crypto(Instant at) {
        DayOfWeek day = at.atZone(ZoneOffset.UTC).getDayOfWeek();
        boolean weekend = day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
        return new MarketStatus(true, "24/7", weekend ? WEEKEND_LOW_LIQUIDITY : null);
    }

    private static MarketStatus forex(Instant at) {
        ZonedDateTime ny = at.atZone(NEW_YORK);
        DayOfWeek day = ny.getDayOfWeek();
        LocalTime time = ny.toLocalTime();
        boolean closed = day == DayOfWeek.SATURDAY
            || (day == DayOfWeek.FRIDAY && !time.isBefore(FOREX_ROLLOVER))
            || (day == DayOfWeek.SUNDAY && time.isBefore(FOREX_ROLLOVER));
        if (closed) return MarketStatus.closed("Closed");

        boolean london  = withinCenterHours(at.atZone(LONDON).toLocalTime());
        boolean newYork = withinCenterHours(time);
        if (london && newYork) return MarketStatus.open("Overlap");
        if (london)            return MarketStatus.open("London");
        if (newYork)           return MarketStatus.open("New York");
        return MarketStatus.open("Asian");
    }

    private static MarketStatus stocks(Instant at) {
        ZonedDateTime ny = at.atZone(NEW_YORK);
        DayOfWeek day = ny.getDayOfWeek();
        if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) return MarketStatus.closed("Closed");
        LocalTime time = ny.toLocalTime();
        boolean open = !time.isBefore(STOCKS_OPEN) && time.isBefore(STOCKS_CLOSE);
        return open ? MarketStatus.open("New York") : MarketStatus.closed("Closed");
    }

    private static boolean withinCenterHours(LocalTime time) {
        return !time.isBefore(CENTER_OPEN) && time.isBefore(CENTER_CLOSE);
    }
}
