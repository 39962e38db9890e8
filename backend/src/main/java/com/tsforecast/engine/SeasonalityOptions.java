package com.tsforecast.engine;

import java.util.ArrayList;
import java.util.List;

/** Which seasonal components the engine should model on top of the trend. */
public record SeasonalityOptions(boolean weekly, boolean yearly, boolean daily) {

    public static SeasonalityOptions weeklyAndYearly() {
        return new SeasonalityOptions(true, true, false);
    }

    /** Component names in the order they are reported to clients. */
    public List<String> componentNames() {
        List<String> names = new ArrayList<>();
        names.add("trend");
        if (daily) {
            names.add("daily_seasonality");
        }
        if (weekly) {
            names.add("weekly_seasonality");
        }
        if (yearly) {
            names.add("yearly_seasonality");
        }
        return names;
    }
}
