package com.chicu.trafficvolume.model;

import lombok.Builder;

/**
 * Validated traffic-context input. Produced only by the validator; every field is within bounds.
 */
@Builder(toBuilder = true)
public record FeatureRecord(
        String holiday,
        double temp,
        double rain1h,
        double snow1h,
        int cloudsAll,
        String weatherMain,
        int hour,
        int dayOfWeek,
        int month,
        int isRushHour
) {

    public static final String DEFAULT_HOLIDAY = "None";
    public static final double DEFAULT_TEMP = 288.28;
    public static final int DEFAULT_CLOUDS_ALL = 40;
    public static final String DEFAULT_WEATHER_MAIN = "Clouds";
    public static final int DEFAULT_HOUR = 9;
    public static final int DEFAULT_DAY_OF_WEEK = 1;
    public static final int DEFAULT_MONTH = 10;
    public static final int DEFAULT_IS_RUSH_HOUR = 1;

    public static FeatureRecord defaults() {
        return FeatureRecord.builder()
                .holiday(DEFAULT_HOLIDAY)
                .temp(DEFAULT_TEMP)
                .rain1h(0.0)
                .snow1h(0.0)
                .cloudsAll(DEFAULT_CLOUDS_ALL)
                .weatherMain(DEFAULT_WEATHER_MAIN)
                .hour(DEFAULT_HOUR)
                .dayOfWeek(DEFAULT_DAY_OF_WEEK)
                .month(DEFAULT_MONTH)
                .isRushHour(DEFAULT_IS_RUSH_HOUR)
                .build();
    }

    public Object valueOf(FeatureField field) {
        return switch (field) {
            case HOLIDAY -> holiday;
            case TEMP -> temp;
            case RAIN_1H -> rain1h;
            case SNOW_1H -> snow1h;
            case CLOUDS_ALL -> cloudsAll;
            case WEATHER_MAIN -> weatherMain;
            case HOUR -> hour;
            case DAY_OF_WEEK -> dayOfWeek;
            case MONTH -> month;
            case IS_RUSH_HOUR -> isRushHour;
        };
    }
}
